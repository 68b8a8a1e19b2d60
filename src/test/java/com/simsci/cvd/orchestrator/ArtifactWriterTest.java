package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.ArtifactStore;
import com.simsci.cvd.api.JobSpec;
import com.simsci.cvd.io.FileArtifactStore;
import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.paf.LocationArtifact;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ArtifactWriterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testConcurrentProducers() throws Exception {
        // 1. Setup: 4 producers, 25 draws each, ring smaller than the load
        FileArtifactStore store = new FileArtifactStore(tmp.getRoot().toPath(), "v1");
        ExecutorService producers = Executors.newFixedThreadPool(4);
        try (ArtifactWriter writer = new ArtifactWriter(store, 8)) {
            List<Future<List<CompletableFuture<Void>>>> results = new ArrayList<>();
            for (int p = 0; p < 4; p++) {
                final String location = "location_" + p;
                results.add(producers.submit(() -> {
                    List<CompletableFuture<Void>> acks = new ArrayList<>();
                    for (int d = 0; d < 25; d++)
                        acks.add(writer.write(OrchestratorFixtures.output(new JobSpec("v1", location, d, null))));
                    return acks;
                }));
            }

            // 2. Execute: wait for every acknowledgement
            for (Future<List<CompletableFuture<Void>>> r : results)
                for (CompletableFuture<Void> ack : r.get(30, TimeUnit.SECONDS))
                    ack.get(30, TimeUnit.SECONDS);

            // 3. Verify
            assertEquals(100, writer.writtenCount());
            assertEquals(0, writer.rejectedCount());
            for (int p = 0; p < 4; p++)
                assertEquals(25, store.completedDraws("location_" + p).size());
        } finally {
            producers.shutdownNow();
        }
    }

    @Test
    public void testStoreFailureReachesProducer() throws Exception {
        try (ArtifactWriter writer = new ArtifactWriter(new FailingStore(), 4)) {
            CompletableFuture<Void> ack = writer.write(
                    OrchestratorFixtures.output(new JobSpec("v1", "Alabama", 0, null)));
            try {
                ack.get(10, TimeUnit.SECONDS);
                fail("expected ExecutionException");
            } catch (ExecutionException expected) {
                assertTrue(expected.getCause() instanceof IOException);
            }
            assertEquals(1, writer.rejectedCount());

            // The writer keeps accepting after a failure
            CompletableFuture<Void> second = writer.write(
                    OrchestratorFixtures.output(new JobSpec("v1", "Alabama", 1, null)));
            try {
                second.get(10, TimeUnit.SECONDS);
                fail("expected ExecutionException");
            } catch (ExecutionException expected) {
                assertEquals(2, writer.rejectedCount());
            }
        }
    }

    private static final class FailingStore implements ArtifactStore {
        @Override
        public String version() {
            return "v1";
        }

        @Override
        public void writeDraw(DrawOutput output) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public SortedSet<Integer> completedDraws(String location) {
            return new TreeSet<>();
        }

        @Override
        public int drawCount(String location, String key) {
            return 0;
        }

        @Override
        public Optional<DrawOutput> readDraw(String location, int draw) {
            return Optional.empty();
        }

        @Override
        public LocationArtifact assemble(String location, int drawCount) {
            throw new IllegalStateException("nothing stored");
        }

        @Override
        public Optional<LocationArtifact> readArtifact(String location) {
            return Optional.empty();
        }
    }
}
