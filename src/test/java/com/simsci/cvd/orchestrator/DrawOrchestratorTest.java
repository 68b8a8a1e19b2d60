package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.JobSpec;
import com.simsci.cvd.api.JobStatus;
import com.simsci.cvd.io.FileArtifactStore;
import com.simsci.cvd.paf.LocationArtifact;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.Assert.*;

public class DrawOrchestratorTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private FileArtifactStore store;

    @Before
    public void setUp() {
        store = new FileArtifactStore(tmp.getRoot().toPath(), "v1");
    }

    private OrchestrationSettings settings(int drawCount) {
        return OrchestratorFixtures.settings(tmp.getRoot().toPath(), drawCount, Duration.ofMinutes(1));
    }

    private void storeDraws(String location, int count, int... skip) throws Exception {
        Set<Integer> skipped = new TreeSet<>();
        for (int s : skip)
            skipped.add(s);
        for (int d = 0; d < count; d++)
            if (!skipped.contains(d))
                store.writeDraw(OrchestratorFixtures.output(new JobSpec("v1", location, d, null)));
    }

    @Test
    public void testRestartSubmitsOnlyMissingDraws() throws Exception {
        // 1. Setup: 8 of 10 draws stored
        storeDraws("Alabama", 10, 3, 7);
        OrchestratorFixtures.FakeScheduler scheduler = new OrchestratorFixtures.FakeScheduler();
        DrawOrchestrator orchestrator = new DrawOrchestrator(settings(10), scheduler, store);

        // 2. Execute
        List<String> ids = orchestrator.restart("Alabama");

        // 3. Verify
        assertEquals(2, ids.size());
        assertEquals(3, scheduler.submitted.get(ids.get(0)).drawIndex());
        assertEquals(7, scheduler.submitted.get(ids.get(1)).drawIndex());
        assertEquals(2, orchestrator.inFlight());

        // In-flight draws are not submitted twice
        assertTrue(orchestrator.restart("Alabama").isEmpty());
        assertTrue(orchestrator.run(List.of("Alabama")).isEmpty());
        assertEquals(2, scheduler.submitted.size());
    }

    @Test
    public void testRestartOfCompleteLocationIsNoOp() throws Exception {
        storeDraws("Alabama", 10);
        OrchestratorFixtures.FakeScheduler scheduler = new OrchestratorFixtures.FakeScheduler();
        DrawOrchestrator orchestrator = new DrawOrchestrator(settings(10), scheduler, store);

        assertTrue(orchestrator.restart("Alabama").isEmpty());
        assertTrue(scheduler.submitted.isEmpty());
        assertTrue(orchestrator.report("Alabama").isComplete());
    }

    @Test
    public void testFailedDrawIsReportedAndRestarted() throws Exception {
        // 1. Setup: draw 1 of 3 will fail
        OrchestratorFixtures.FakeScheduler scheduler = new OrchestratorFixtures.FakeScheduler();
        DrawOrchestrator orchestrator = new DrawOrchestrator(settings(3), scheduler, store);
        List<String> ids = orchestrator.run(List.of("Alabama", "New York"));
        assertEquals(6, ids.size());

        // 2. Execute: everything but Alabama draw 1 completes
        for (String id : ids) {
            JobSpec spec = scheduler.submitted.get(id);
            if (spec.location().equals("Alabama") && spec.drawIndex() == 1) {
                scheduler.fail(id, LocalBatchScheduler.WALL_CLOCK_EXCEEDED);
            } else {
                store.writeDraw(OrchestratorFixtures.output(spec));
                scheduler.status.put(id, JobStatus.COMPLETE);
            }
        }
        assertEquals(0, orchestrator.poll());

        // 3. Verify
        assertEquals(1, orchestrator.failures().size());
        JobFailure failure = orchestrator.failures().get(0);
        assertEquals("Alabama", failure.location());
        assertEquals(1, failure.draw());
        assertEquals(LocalBatchScheduler.WALL_CLOCK_EXCEEDED, failure.reason());

        LocationReport alabama = orchestrator.report("Alabama");
        assertFalse(alabama.isComplete());
        assertEquals(List.of(1), alabama.failedDraws());
        assertEquals(List.of(1), alabama.missingDraws());
        assertTrue(orchestrator.report("New York").isComplete());
        assertEquals(2, orchestrator.report().size());

        // 4. Restart resubmits only the failed draw
        List<String> retry = orchestrator.restart("Alabama");
        assertEquals(1, retry.size());
        assertEquals(1, scheduler.submitted.get(retry.get(0)).drawIndex());
        assertTrue(orchestrator.restart("New York").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStoreVersionMustMatch() {
        new DrawOrchestrator(settings(3), new OrchestratorFixtures.FakeScheduler(),
                new FileArtifactStore(tmp.getRoot().toPath(), "v2"));
    }

    @Test
    public void testEndToEndWithLocalScheduler() throws Exception {
        // 1. Setup: draw 2 fails on its first attempt only
        OrchestrationSettings settings = settings(4);
        Set<Integer> failedOnce = ConcurrentHashMap.newKeySet();
        DrawRunner runner = spec -> {
            if (spec.drawIndex() == 2 && failedOnce.add(spec.drawIndex()))
                throw new IllegalStateException("simulated failure");
            return OrchestratorFixtures.output(spec);
        };

        try (ArtifactWriter writer = new ArtifactWriter(store, settings.ringBufferSize());
                LocalBatchScheduler scheduler = new LocalBatchScheduler(settings.workers(),
                        DrawOrchestrator.persisting(runner, writer))) {
            DrawOrchestrator orchestrator = new DrawOrchestrator(settings, scheduler, store);

            // 2. Execute: first pass
            orchestrator.run(List.of("Alabama"));
            assertTrue(orchestrator.awaitCompletion(Duration.ofSeconds(30)));

            // 3. Verify
            LocationReport first = orchestrator.report("Alabama");
            assertEquals(3, first.completed());
            assertEquals(List.of(2), first.failedDraws());
            assertTrue(orchestrator.failures().get(0).reason().contains("simulated failure"));
            try {
                orchestrator.assemble("Alabama");
                fail("expected IllegalStateException");
            } catch (IllegalStateException expected) {
                assertTrue(expected.getMessage().contains("[2]"));
            }

            // 4. Restart completes the location
            assertEquals(1, orchestrator.restart("Alabama").size());
            assertTrue(orchestrator.awaitCompletion(Duration.ofSeconds(30)));
            assertTrue(orchestrator.report("Alabama").isComplete());

            LocationArtifact artifact = orchestrator.assemble("Alabama");
            assertEquals(4, artifact.drawCount());
            assertTrue(orchestrator.verifyArtifact("Alabama", settings.expectedPafKeys()));
            assertFalse(orchestrator.verifyArtifact("Alabama", 5));
            assertFalse(orchestrator.verifyArtifact("New York", 3));
        }
    }
}
