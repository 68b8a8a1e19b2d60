package com.simsci.cvd.engine;

import com.simsci.cvd.api.SimulationException;
import com.simsci.cvd.api.SimulationListener;
import com.simsci.cvd.model.CauseGraph;
import com.simsci.cvd.rate.RateResolver;
import com.simsci.cvd.risk.ExposureSampler;
import com.simsci.cvd.risk.ExposureVector;
import com.simsci.cvd.util.ErrorRateLimiter;
import com.simsci.cvd.util.RandomKeys;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one draw of a population through every cause's state machine.
 *
 * <p>
 * Each step splits the population into fixed contiguous chunks. Chunks run on
 * the supplied executor (or inline when none is given); each has its own
 * observer fork, and forks are merged in chunk order once the draw completes.
 * Chunk boundaries depend only on the configured chunk size and every random
 * number is keyed on simulant id, so the outcome is identical for any thread
 * count.
 *
 * <p>
 * Circuit breaker: when a simulant update throws, the step is abandoned, the
 * listener is told, and the simulation is marked unhealthy. Further runs fail
 * until {@link #resetHealth()} is called.
 *
 * <p>
 * Runs are cancellable: the driving thread's interrupt flag is checked at
 * every step and every {@value #INTERRUPT_CHECK_INTERVAL} simulants, and an
 * interrupted run throws {@link SimulationException} without tripping the
 * breaker. The flag is left set for the caller.
 */
public final class Simulation {
    private static final Logger log = LogManager.getLogger(Simulation.class);
    private static final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);
    static final int INTERRUPT_CHECK_INTERVAL = 1024;

    private final SimulationSettings settings;
    private final List<CauseGraph> causes;
    private final List<DiseaseStateMachine> machines;
    private final ExposureSampler sampler;
    private final RateResolver rates;
    private final ExecutorService executor;

    private volatile boolean healthy = true;
    private SimulationListener listener;

    public Simulation(SimulationSettings settings, List<DiseaseStateMachine> machines, ExposureSampler sampler,
            RateResolver rates, ExecutorService executor) {
        this.settings = settings;
        this.machines = List.copyOf(machines);
        this.sampler = sampler;
        this.rates = rates;
        this.executor = executor;
        List<CauseGraph> graphs = new ArrayList<>(machines.size());
        for (int c = 0; c < machines.size(); c++) {
            if (machines.get(c).causeIndex() != c)
                throw new IllegalArgumentException("State machine " + c + " has cause index "
                        + machines.get(c).causeIndex());
            graphs.add(machines.get(c).graph());
        }
        this.causes = List.copyOf(graphs);
    }

    public void setListener(SimulationListener listener) {
        this.listener = listener;
    }

    public SimulationSettings settings() {
        return settings;
    }

    public List<DiseaseStateMachine> machines() {
        return machines;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void resetHealth() {
        this.healthy = true;
    }

    /**
     * Runs a draw with every simulant at its observed exposure.
     *
     * @see #run(String, int, int, StepObserver)
     */
    public Population run(String location, int draw, StepObserver observer) {
        return run(location, draw, -1, observer);
    }

    /**
     * Runs a draw.
     *
     * @param location       Location, part of the random key.
     * @param draw           Draw index, part of the random key.
     * @param counterfactual Risk index held at TMREL for every simulant, or -1.
     * @param observer       Receives the merged per-step facts.
     * @return The population at the end of the draw.
     * @throws IllegalStateException if the simulation is unhealthy.
     * @throws SimulationException   if a simulant update failed, in which case the simulation is
     *                               unhealthy afterwards, or if the thread was interrupted.
     */
    public Population run(String location, int draw, int counterfactual, StepObserver observer) {
        if (!healthy)
            throw new IllegalStateException("Simulation is in unhealthy state due to previous errors. Manual reset required.");

        final SimulationListener l = this.listener;
        RandomKeys keys = new RandomKeys(settings.seed(), location, draw);
        Population pop = Population.create(settings, causes, sampler, keys);
        int n = pop.size();
        int chunkSize = settings.chunkSize();
        int chunks = (n + chunkSize - 1) / chunkSize;
        StepObserver[] forks = new StepObserver[chunks];
        for (int c = 0; c < chunks; c++)
            forks[c] = observer.fork();

        if (l != null)
            l.onDrawStart(location, draw);
        log.debug("Draw {} of {}: {} simulants, {} chunks, counterfactual risk {}", draw, location, n, chunks,
                counterfactual);

        boolean ok = false;
        try {
            double dt = settings.stepDays();
            for (int step = 0; step < settings.steps(); step++) {
                checkInterrupted(step);
                long stepStart = System.nanoTime();
                double t = step * dt;
                int transitions = runStep(pop, keys, forks, step, t, dt, counterfactual, chunkSize);
                if (l != null)
                    l.onStepEnd(step, t, transitions, System.nanoTime() - stepStart);
            }
            ok = true;
        } finally {
            if (!ok && !Thread.currentThread().isInterrupted())
                healthy = false;
            if (l != null)
                l.onDrawEnd(location, draw, ok);
        }

        for (StepObserver f : forks)
            observer.merge(f);
        return pop;
    }

    private int runStep(Population pop, RandomKeys keys, StepObserver[] forks, int step, double t, double dt,
            int counterfactual, int chunkSize) {
        int n = pop.size();
        int total = 0;
        if (executor == null || forks.length == 1) {
            for (int c = 0; c < forks.length; c++)
                total += runChunk(pop, keys, forks[c], step, t, dt, counterfactual, c * chunkSize,
                        Math.min(n, (c + 1) * chunkSize));
            return total;
        }

        List<Future<Integer>> futures = new ArrayList<>(forks.length);
        for (int c = 0; c < forks.length; c++) {
            final int chunk = c;
            Callable<Integer> task = () -> runChunk(pop, keys, forks[chunk], step, t, dt, counterfactual,
                    chunk * chunkSize, Math.min(n, (chunk + 1) * chunkSize));
            futures.add(executor.submit(task));
        }
        RuntimeException failure = null;
        for (Future<Integer> f : futures) {
            try {
                total += f.get();
            } catch (ExecutionException e) {
                if (failure == null)
                    failure = e.getCause() instanceof RuntimeException re ? re
                            : new SimulationException("Step " + step + " failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(x -> x.cancel(true));
                throw new SimulationException("Interrupted during step " + step, e);
            }
        }
        if (failure != null)
            throw failure;
        return total;
    }

    private int runChunk(Population pop, RandomKeys keys, StepObserver obs, int step, double t, double dt,
            int counterfactual, int from, int to) {
        double year = settings.startYear() + t / SimulationSettings.DAYS_PER_YEAR;
        int transitions = 0;
        for (int i = from; i < to; i++) {
            if ((i - from) % INTERRUPT_CHECK_INTERVAL == 0)
                checkInterrupted(step);
            try {
                var who = pop.demographics(i, t);
                ExposureVector x = sampler.exposures(pop.propensities(i), pop.jointGroups(i), who, year, rates);
                if (counterfactual >= 0)
                    x = x.atTmrel(counterfactual);
                Simulant s = new Simulant(i, pop.id(i), who, year, x);
                for (DiseaseStateMachine m : machines)
                    transitions += m.step(pop, s, t, dt, step, keys, obs);
            } catch (RuntimeException e) {
                errorLimiter.log("Simulant " + pop.id(i) + " failed at step " + step, e);
                SimulationListener l = listener;
                if (l != null)
                    l.onSimulantError(step, pop.id(i), e);
                throw e;
            }
        }
        return transitions;
    }

    private static void checkInterrupted(int step) {
        if (Thread.currentThread().isInterrupted())
            throw new SimulationException("Draw interrupted at step " + step);
    }
}
