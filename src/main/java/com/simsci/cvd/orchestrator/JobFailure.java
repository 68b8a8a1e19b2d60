package com.simsci.cvd.orchestrator;

/** A draw job that ended in {@code FAILED}. */
public record JobFailure(String jobId, String location, int draw, String reason) {
}
