package com.simsci.cvd.util;

import com.simsci.cvd.api.SimulationListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks step latency, transition throughput and simulant failures across
 * draws. Failures are counted only; the simulation logs them.
 *
 * <p>
 * Step callbacks arrive from the thread driving a draw; when several draws run
 * concurrently the statistics are updated under the instance lock.
 */
public final class StepTimingListener implements SimulationListener {
    private static final Logger log = LogManager.getLogger(StepTimingListener.class);

    private long totalSteps, totalNanos, totalTransitions;
    private long minNanos = Long.MAX_VALUE, maxNanos = Long.MIN_VALUE;
    private int drawsCompleted, drawsFailed;
    private long simulantErrors;

    @Override
    public void onDrawStart(String location, int draw) {
        log.debug("Draw {} of {} started", draw, location);
    }

    @Override
    public synchronized void onStepEnd(int step, double timeDays, int transitions, long durationNanos) {
        totalSteps++;
        totalNanos += durationNanos;
        totalTransitions += transitions;
        if (durationNanos < minNanos)
            minNanos = durationNanos;
        if (durationNanos > maxNanos)
            maxNanos = durationNanos;
    }

    @Override
    public synchronized void onSimulantError(int step, long simulantId, Throwable error) {
        simulantErrors++;
    }

    @Override
    public synchronized void onDrawEnd(String location, int draw, boolean healthy) {
        if (healthy)
            drawsCompleted++;
        else
            drawsFailed++;
    }

    public synchronized long totalSteps() {
        return totalSteps;
    }

    public synchronized long totalTransitions() {
        return totalTransitions;
    }

    public synchronized int drawsCompleted() {
        return drawsCompleted;
    }

    public synchronized int drawsFailed() {
        return drawsFailed;
    }

    public synchronized long simulantErrors() {
        return simulantErrors;
    }

    public synchronized double avgStepMillis() {
        return totalSteps > 0 ? totalNanos / 1e6 / totalSteps : 0;
    }

    public synchronized double minStepMillis() {
        return minNanos == Long.MAX_VALUE ? 0 : minNanos / 1e6;
    }

    public synchronized double maxStepMillis() {
        return maxNanos == Long.MIN_VALUE ? 0 : maxNanos / 1e6;
    }

    public synchronized void reset() {
        totalSteps = 0;
        totalNanos = 0;
        totalTransitions = 0;
        minNanos = Long.MAX_VALUE;
        maxNanos = Long.MIN_VALUE;
        drawsCompleted = 0;
        drawsFailed = 0;
        simulantErrors = 0;
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %8s | %12s | %10s | %10s | %10s\n", "Draws ok/err", "Steps", "Transitions",
                "Avg (ms)", "Min (ms)", "Max (ms)"));
        sb.append("--------------------------------------------------------------------------------\n");
        sb.append(String.format("%5d/%-6d | %8d | %12d | %10.2f | %10.2f | %10.2f\n", drawsCompleted, drawsFailed,
                totalSteps, totalTransitions, avgStepMillis(), minStepMillis(), maxStepMillis()));
        return sb.toString();
    }
}
