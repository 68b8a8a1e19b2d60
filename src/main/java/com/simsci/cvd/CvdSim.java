package com.simsci.cvd;

import com.simsci.cvd.api.SimulationListener;
import com.simsci.cvd.engine.Simulation;
import com.simsci.cvd.io.ModelCompiler;
import com.simsci.cvd.io.ModelDefinition;
import com.simsci.cvd.io.ModelLoader;
import com.simsci.cvd.orchestrator.DrawRunner;
import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.util.CompositeSimulationListener;
import com.simsci.cvd.util.StepTimingListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * High-level entry point: loads and compiles a model definition, then runs
 * and aggregates draws.
 * <p>
 * Owns the executor that parallelizes a draw's simulant chunks (only created
 * when {@code simulation.threads > 1}); {@link #close()} releases it.
 * Listeners registered here are attached to every simulation it creates.
 */
public class CvdSim implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CvdSim.class);

    private final ModelCompiler.CompiledModel model;
    private final ExecutorService executor;
    private final CompositeSimulationListener listeners = new CompositeSimulationListener();

    public CvdSim(ModelCompiler.CompiledModel model) {
        this.model = model;
        int threads = model.settings().threads();
        if (threads > 1) {
            AtomicInteger id = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(threads, r -> {
                Thread t = new Thread(r, "sim-chunk-" + id.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        } else {
            this.executor = null;
        }
        log.info("Model ready: {} simulants x {} steps of {} days, {} threads", model.settings().populationSize(),
                model.settings().steps(), model.settings().stepDays(), threads);
    }

    public static CvdSim load(Path path) throws IOException {
        return fromDefinition(ModelLoader.read(path));
    }

    public static CvdSim fromJson(String json) {
        return fromDefinition(ModelLoader.parse(json));
    }

    public static CvdSim fromResource(String name) throws IOException {
        return fromDefinition(ModelLoader.readResource(name));
    }

    public static CvdSim fromDefinition(ModelDefinition def) {
        return new CvdSim(new ModelCompiler().compile(def));
    }

    public ModelCompiler.CompiledModel model() {
        return model;
    }

    /** Adds a listener to every simulation created from now on. */
    public void addListener(SimulationListener listener) {
        listeners.add(listener);
    }

    /**
     * Enables per-step timing.
     * Use the returned listener to dump statistics.
     */
    public StepTimingListener enableStepTiming() {
        StepTimingListener timing = new StepTimingListener();
        listeners.add(timing);
        return timing;
    }

    /**
     * A fresh simulation. Each has its own circuit breaker, so one failed draw
     * does not block the others.
     */
    public Simulation newSimulation() {
        Simulation sim = model.newSimulation(executor);
        sim.setListener(listeners);
        return sim;
    }

    /** Simulates and aggregates one draw under the configured artifact version. */
    public DrawOutput runDraw(String location, int draw) {
        return model.newAggregator(newSimulation())
                .computeDraw(model.orchestration().version(), location, draw);
    }

    /** Runner for batch jobs; every job gets its own simulation. */
    public DrawRunner asDrawRunner() {
        return spec -> model.newAggregator(newSimulation())
                .computeDraw(spec.version(), spec.location(), spec.drawIndex());
    }

    @Override
    public void close() {
        if (executor != null)
            executor.shutdownNow();
    }
}
