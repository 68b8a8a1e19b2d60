package com.simsci.cvd.api;

import java.util.Optional;

/**
 * The only view of the scheduling substrate the orchestrator needs.
 *
 * <p>
 * Implementations may run jobs on a local thread pool or hand them to a cluster
 * scheduler. Jobs are independent and order-insensitive.
 */
public interface BatchScheduler {

    /**
     * Enqueues a job.
     *
     * @return An opaque job id, unique for the lifetime of the scheduler.
     */
    String submit(JobSpec spec);

    /** Current status of a previously submitted job. */
    JobStatus status(String jobId);

    /** Human-readable failure reason for a FAILED job, if the scheduler knows one. */
    default Optional<String> failureReason(String jobId) {
        return Optional.empty();
    }
}
