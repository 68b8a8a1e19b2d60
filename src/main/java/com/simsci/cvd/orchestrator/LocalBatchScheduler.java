package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.BatchScheduler;
import com.simsci.cvd.api.JobSpec;
import com.simsci.cvd.api.JobStatus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link BatchScheduler} backed by a fixed thread pool.
 *
 * <p>
 * Every job gets a watchdog that fails it once its wall-clock limit expires,
 * the way a cluster scheduler kills an over-running job. CPU and memory
 * limits are recorded but not enforced.
 *
 * <p>
 * A killed job must leave no output. Bodies that persist results call
 * {@link #beginCommit()} first; once a job has committed, the watchdog no
 * longer fails it, and a job that was already failed is refused the commit.
 */
public final class LocalBatchScheduler implements BatchScheduler, AutoCloseable {
    private static final Logger log = LogManager.getLogger(LocalBatchScheduler.class);
    static final String WALL_CLOCK_EXCEEDED = "wall-clock limit exceeded";

    /** The work a job performs; returning normally completes it. */
    @FunctionalInterface
    public interface JobBody {
        void execute(JobSpec spec) throws Exception;
    }

    private static final class Job {
        final JobSpec spec;
        final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.PENDING);
        volatile String failureReason;
        // Guarded by the job's monitor
        Thread worker;
        boolean committed;

        Job(JobSpec spec) {
            this.spec = spec;
        }

        boolean fail(String reason) {
            JobStatus s = status.get();
            while (!s.isTerminal()) {
                if (status.compareAndSet(s, JobStatus.FAILED)) {
                    failureReason = reason;
                    return true;
                }
                s = status.get();
            }
            return false;
        }
    }

    private final JobBody body;
    private final ExecutorService pool;
    private final ScheduledExecutorService watchdog;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger();

    private static final ThreadLocal<Job> CURRENT = new ThreadLocal<>();

    public LocalBatchScheduler(int workers, JobBody body) {
        this.body = body;
        AtomicInteger threadId = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "draw-worker-" + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "draw-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String submit(JobSpec spec) {
        String id = "job-" + nextId.incrementAndGet();
        Job job = new Job(spec);
        jobs.put(id, job);
        pool.execute(() -> run(id, job));
        return id;
    }

    private void run(String id, Job job) {
        if (!job.status.compareAndSet(JobStatus.PENDING, JobStatus.RUNNING))
            return;
        // The limit counts from job start, not from submission
        long limitMillis = job.spec.limits().wallClock().toMillis();
        synchronized (job) {
            job.worker = Thread.currentThread();
        }
        ScheduledFuture<?> kill = watchdog.schedule(() -> {
            synchronized (job) {
                if (job.committed || !job.fail(WALL_CLOCK_EXCEEDED))
                    return;
                log.warn("Job {} ({}) exceeded {} ms, cancelling", id, job.spec, limitMillis);
                if (job.worker != null)
                    job.worker.interrupt();
            }
        }, limitMillis, TimeUnit.MILLISECONDS);
        CURRENT.set(job);
        try {
            body.execute(job.spec);
            job.status.compareAndSet(JobStatus.RUNNING, JobStatus.COMPLETE);
        } catch (InterruptedException e) {
            job.fail("interrupted");
        } catch (Exception e) {
            if (job.fail(e.getClass().getSimpleName() + ": " + e.getMessage()))
                log.error("Job {} ({}) failed: {}", id, job.spec, e.getMessage(), e);
        } finally {
            CURRENT.remove();
            kill.cancel(false);
            synchronized (job) {
                job.worker = null;
                // Clear an interrupt aimed at this job before the thread takes the next one
                Thread.interrupted();
            }
        }
    }

    /**
     * Claims the right to publish the current job's output. Outside a job
     * this only checks the thread's interrupt flag.
     *
     * @return false if the job was already failed or its thread interrupted;
     *         the caller must then discard its output.
     */
    public static boolean beginCommit() {
        Job job = CURRENT.get();
        if (job == null)
            return !Thread.currentThread().isInterrupted();
        synchronized (job) {
            if (job.status.get() != JobStatus.RUNNING || Thread.currentThread().isInterrupted())
                return false;
            job.committed = true;
            return true;
        }
    }

    @Override
    public JobStatus status(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null)
            throw new IllegalArgumentException("Unknown job: " + jobId);
        return job.status.get();
    }

    @Override
    public Optional<String> failureReason(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.ofNullable(job.failureReason);
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        pool.shutdownNow();
    }
}
