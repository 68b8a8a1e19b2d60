package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.ArtifactStore;
import com.simsci.cvd.api.BatchScheduler;
import com.simsci.cvd.api.JobSpec;
import com.simsci.cvd.api.JobStatus;
import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.paf.LocationArtifact;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;

/**
 * Drives the (location x draw) jobs of one artifact version to completion.
 *
 * <p>
 * The artifact store is the single source of truth for completion: a draw is
 * done iff its output is stored. Submission therefore skips stored draws and
 * draws whose job is still in flight, which makes {@link #run} and
 * {@link #restart} idempotent. Failed jobs are recorded as
 * {@link JobFailure}s and never stop other locations or draws.
 *
 * <p>
 * Not thread-safe; drive it from one thread.
 */
public final class DrawOrchestrator {
    private static final Logger log = LogManager.getLogger(DrawOrchestrator.class);

    private final OrchestrationSettings settings;
    private final BatchScheduler scheduler;
    private final ArtifactStore store;

    private final Map<String, JobSpec> pending = new LinkedHashMap<>();
    // location -> draw -> id of the most recent job
    private final Map<String, Map<Integer, String>> latestJob = new LinkedHashMap<>();
    private final Map<String, JobFailure> failuresByJob = new LinkedHashMap<>();

    public DrawOrchestrator(OrchestrationSettings settings, BatchScheduler scheduler, ArtifactStore store) {
        if (!settings.version().equals(store.version()))
            throw new IllegalArgumentException("Store holds version " + store.version() + ", settings ask for "
                    + settings.version());
        this.settings = settings;
        this.scheduler = scheduler;
        this.store = store;
    }

    /**
     * Job body that computes a draw and returns only once the artifact writer
     * has stored it. A draw whose job was killed while computing is dropped.
     */
    public static LocalBatchScheduler.JobBody persisting(DrawRunner runner, ArtifactWriter writer) {
        return spec -> {
            DrawOutput out = runner.run(spec);
            if (!LocalBatchScheduler.beginCommit())
                throw new InterruptedException("Draw " + spec.drawIndex() + " of " + spec.location()
                        + " cancelled before it was stored");
            try {
                writer.write(out).get();
            } catch (ExecutionException e) {
                throw e.getCause() instanceof Exception c ? c : e;
            }
        };
    }

    /** Submits every draw of the given locations that is neither stored nor in flight. */
    public List<String> run(Collection<String> locations) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String location : locations)
            ids.addAll(submitMissing(location));
        log.info("Submitted {} draw jobs for {} locations ({})", ids.size(), locations.size(), settings.version());
        return ids;
    }

    /** Re-submits the missing draws of one location; a no-op for a complete location. */
    public List<String> restart(String location) throws IOException {
        List<String> ids = submitMissing(location);
        if (ids.isEmpty())
            log.info("Restart of {}: nothing to do", location);
        else
            log.info("Restart of {}: resubmitted {} draws", location, ids.size());
        return ids;
    }

    private List<String> submitMissing(String location) throws IOException {
        SortedSet<Integer> done = store.completedDraws(location);
        Map<Integer, String> latest = latestJob.computeIfAbsent(location, k -> new HashMap<>());
        List<String> ids = new ArrayList<>();
        for (int d = 0; d < settings.drawCount(); d++) {
            if (done.contains(d))
                continue;
            String previous = latest.get(d);
            if (previous != null && pending.containsKey(previous))
                continue;
            JobSpec spec = new JobSpec(settings.version(), location, d, settings.limits());
            String id = scheduler.submit(spec);
            pending.put(id, spec);
            latest.put(d, id);
            ids.add(id);
        }
        return ids;
    }

    /**
     * Polls the scheduler once, recording finished and failed jobs.
     *
     * @return Jobs still in flight.
     */
    public int poll() {
        Iterator<Map.Entry<String, JobSpec>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            var e = it.next();
            JobStatus status = scheduler.status(e.getKey());
            if (!status.isTerminal())
                continue;
            it.remove();
            if (status == JobStatus.FAILED) {
                JobSpec spec = e.getValue();
                String reason = scheduler.failureReason(e.getKey()).orElse("unknown");
                failuresByJob.put(e.getKey(), new JobFailure(e.getKey(), spec.location(), spec.drawIndex(), reason));
                log.error("Draw {} of {} failed (job {}): {}", spec.drawIndex(), spec.location(), e.getKey(), reason);
            }
        }
        return pending.size();
    }

    /**
     * Polls at the configured interval until no job is in flight.
     *
     * @return False if jobs were still in flight when the timeout expired.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (poll() > 0) {
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Timed out with {} jobs in flight", pending.size());
                return false;
            }
            Thread.sleep(settings.pollInterval().toMillis());
        }
        return true;
    }

    public LocationReport report(String location) throws IOException {
        SortedSet<Integer> done = store.completedDraws(location);
        List<Integer> missing = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        Map<Integer, String> latest = latestJob.getOrDefault(location, Map.of());
        int completed = 0;
        for (int d = 0; d < settings.drawCount(); d++) {
            if (done.contains(d)) {
                completed++;
                continue;
            }
            missing.add(d);
            String id = latest.get(d);
            if (id != null && failuresByJob.containsKey(id))
                failed.add(d);
        }
        return new LocationReport(location, completed, settings.drawCount(), failed, missing);
    }

    /** Reports for the configured locations plus any location submitted since. */
    public List<LocationReport> report() throws IOException {
        Set<String> locations = new LinkedHashSet<>(settings.locations());
        locations.addAll(latestJob.keySet());
        List<LocationReport> out = new ArrayList<>(locations.size());
        for (String location : locations) {
            LocationReport r = report(location);
            log.info("{}", r);
            out.add(r);
        }
        return out;
    }

    /**
     * Assembles the artifact of a complete location.
     *
     * @throws IllegalStateException if draws are missing.
     */
    public LocationArtifact assemble(String location) throws IOException {
        return store.assemble(location, settings.drawCount());
    }

    /**
     * Checks an assembled artifact: every key holds exactly the configured
     * number of draws, and it carries {@code expectedKeys} distinct PAF
     * measures (skipped when {@code expectedKeys <= 0}).
     */
    public boolean verifyArtifact(String location, int expectedKeys) throws IOException {
        Optional<LocationArtifact> artifact = store.readArtifact(location);
        if (artifact.isEmpty()) {
            log.warn("{} has no assembled artifact", location);
            return false;
        }
        LocationArtifact a = artifact.get();
        if (a.drawCount() != settings.drawCount()) {
            log.warn("{} artifact has {} draws, expected {}", location, a.drawCount(), settings.drawCount());
            return false;
        }
        if (expectedKeys > 0 && a.pafKeyCount() != expectedKeys) {
            log.warn("{} artifact has {} PAF keys, expected {}", location, a.pafKeyCount(), expectedKeys);
            return false;
        }
        return true;
    }

    /** Failed jobs recorded so far, in the order they were observed. */
    public List<JobFailure> failures() {
        return List.copyOf(failuresByJob.values());
    }

    public int inFlight() {
        return pending.size();
    }
}
