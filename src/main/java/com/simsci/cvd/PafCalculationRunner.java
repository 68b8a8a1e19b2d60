package com.simsci.cvd;

import com.simsci.cvd.io.FileArtifactStore;
import com.simsci.cvd.orchestrator.ArtifactWriter;
import com.simsci.cvd.orchestrator.DrawOrchestrator;
import com.simsci.cvd.orchestrator.LocalBatchScheduler;
import com.simsci.cvd.orchestrator.LocationReport;
import com.simsci.cvd.orchestrator.OrchestrationSettings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line driver for a PAF calculation.
 *
 * <pre>
 * PafCalculationRunner run|restart|check model.json [location ...]
 * </pre>
 *
 * {@code run} submits every draw not yet stored, {@code restart} resubmits
 * only the missing draws, and {@code check} reports without submitting.
 * Complete locations are assembled and verified. Locations default to those
 * of the model's orchestration section. Exits with 1 if any location is
 * incomplete.
 */
public final class PafCalculationRunner {
    private static final Logger log = LogManager.getLogger(PafCalculationRunner.class);

    private PafCalculationRunner() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2 || !List.of("run", "restart", "check").contains(args[0])) {
            System.err.println("Usage: PafCalculationRunner run|restart|check <model.json> [location ...]");
            System.exit(2);
        }
        String mode = args[0];
        boolean complete;
        try (CvdSim sim = CvdSim.load(Path.of(args[1]))) {
            OrchestrationSettings settings = sim.model().orchestration();
            List<String> locations = args.length > 2
                    ? Arrays.asList(args).subList(2, args.length)
                    : settings.locations();
            if (locations.isEmpty()) {
                System.err.println("No locations given or configured");
                System.exit(2);
            }
            complete = execute(mode, sim, settings, locations);
        }
        System.exit(complete ? 0 : 1);
    }

    static boolean execute(String mode, CvdSim sim, OrchestrationSettings settings, List<String> locations)
            throws Exception {
        FileArtifactStore store = new FileArtifactStore(settings.outputRoot(), settings.version());
        try (ArtifactWriter writer = new ArtifactWriter(store, settings.ringBufferSize());
                LocalBatchScheduler scheduler = new LocalBatchScheduler(settings.workers(),
                        DrawOrchestrator.persisting(sim.asDrawRunner(), writer))) {
            DrawOrchestrator orchestrator = new DrawOrchestrator(settings, scheduler, store);

            if (mode.equals("run")) {
                orchestrator.run(locations);
            } else if (mode.equals("restart")) {
                for (String location : locations)
                    orchestrator.restart(location);
            }
            if (orchestrator.inFlight() > 0) {
                // Upper bound: every job hits its limit on a single worker
                long jobs = orchestrator.inFlight();
                Duration timeout = settings.limits().wallClock().multipliedBy(jobs / settings.workers() + 1);
                orchestrator.awaitCompletion(timeout);
            }

            boolean allComplete = true;
            for (String location : locations) {
                LocationReport report = orchestrator.report(location);
                log.info("{}", report);
                if (!report.failedDraws().isEmpty())
                    log.warn("{} failed draws eligible for restart: {}", location, report.failedDraws());
                if (!report.isComplete()) {
                    allComplete = false;
                    continue;
                }
                orchestrator.assemble(location);
                if (!orchestrator.verifyArtifact(location, settings.expectedPafKeys()))
                    allComplete = false;
            }
            return allComplete;
        }
    }
}
