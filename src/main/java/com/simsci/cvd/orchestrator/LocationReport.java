package com.simsci.cvd.orchestrator;

import java.util.List;

/**
 * Completion state of one location.
 *
 * @param completed    Draws stored for the location.
 * @param expected     Configured draw count.
 * @param failedDraws  Draws whose most recent job failed.
 * @param missingDraws Draws in {@code [0, expected)} not stored.
 */
public record LocationReport(String location, int completed, int expected, List<Integer> failedDraws,
        List<Integer> missingDraws) {

    public LocationReport {
        failedDraws = List.copyOf(failedDraws);
        missingDraws = List.copyOf(missingDraws);
    }

    public boolean isComplete() {
        return missingDraws.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%s: %d/%d draws, %d failed, %d missing", location, completed, expected,
                failedDraws.size(), missingDraws.size());
    }
}
