package com.simsci.cvd;

import com.simsci.cvd.io.FileArtifactStore;
import com.simsci.cvd.io.ModelDefinition;
import com.simsci.cvd.io.ModelLoader;
import com.simsci.cvd.orchestrator.OrchestrationSettings;
import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.paf.LocationArtifact;
import com.simsci.cvd.util.StepTimingListener;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class CvdSimTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private CvdSim fixture(Path outputRoot) throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getSimulation().setPopulationSize(500);
        def.getOrchestration().setOutputRoot(outputRoot.toString());
        return CvdSim.fromDefinition(def);
    }

    @Test
    public void testRunDrawWithStepTiming() throws Exception {
        try (CvdSim sim = fixture(tmp.getRoot().toPath())) {
            StepTimingListener timing = sim.enableStepTiming();

            DrawOutput out = sim.runDraw("Alabama", 0);

            assertEquals("v1", out.version());
            assertEquals("Alabama", out.location());
            assertEquals(16, out.pafs().size());
            // Observed run plus one counterfactual run per risk, 3 steps each
            assertEquals(5, timing.drawsCompleted());
            assertEquals(15, timing.totalSteps());
        }
    }

    @Test
    public void testParallelChunksMatchSerialRun() throws Exception {
        ModelDefinition serial = ModelLoader.readResource("ihd_model.json");
        serial.getSimulation().setChunkSize(100);
        ModelDefinition parallel = ModelLoader.readResource("ihd_model.json");
        parallel.getSimulation().setChunkSize(100);
        parallel.getSimulation().setThreads(4);
        try (CvdSim a = CvdSim.fromDefinition(serial); CvdSim b = CvdSim.fromDefinition(parallel)) {
            assertEquals(a.runDraw("New York", 1).values(), b.runDraw("New York", 1).values());
        }
    }

    @Test
    public void testRunThenCheckProducesArtifacts() throws Exception {
        // 1. Setup
        Path out = tmp.newFolder("paf").toPath();
        try (CvdSim sim = fixture(out)) {
            OrchestrationSettings settings = sim.model().orchestration();
            List<String> locations = settings.locations();

            // 2. Execute
            assertTrue(PafCalculationRunner.execute("run", sim, settings, locations));

            // 3. Verify
            FileArtifactStore store = new FileArtifactStore(out, "v1");
            for (String location : locations) {
                assertEquals(3, store.completedDraws(location).size());
                LocationArtifact artifact = store.readArtifact(location).orElseThrow();
                assertEquals(3, artifact.drawCount());
                assertEquals(5, artifact.pafKeyCount());
            }
            assertTrue(Files.isDirectory(out.resolve("v1").resolve("New_York")));

            // A second pass finds nothing to do
            assertTrue(PafCalculationRunner.execute("restart", sim, settings, locations));
            assertTrue(PafCalculationRunner.execute("check", sim, settings, locations));
        }
    }

    @Test
    public void testCheckReportsIncompleteLocation() throws Exception {
        try (CvdSim sim = fixture(tmp.newFolder("empty").toPath())) {
            OrchestrationSettings settings = sim.model().orchestration();
            assertFalse(PafCalculationRunner.execute("check", sim, settings, List.of("Alabama")));
        }
    }
}
