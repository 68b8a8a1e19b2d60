package com.simsci.cvd.api;

/** Lifecycle of a submitted draw job, as reported by a {@link BatchScheduler}. */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
