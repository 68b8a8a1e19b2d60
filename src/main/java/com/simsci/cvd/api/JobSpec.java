package com.simsci.cvd.api;

/**
 * One unit of batch work: a single draw of a single location.
 *
 * @param version   Artifact version the job writes into.
 * @param location  Location name.
 * @param drawIndex Draw index in {@code [0, drawCount)}.
 * @param limits    Resource constraints.
 */
public record JobSpec(String version, String location, int drawIndex, ResourceLimits limits) {

    public JobSpec {
        if (drawIndex < 0)
            throw new IllegalArgumentException("drawIndex must be >= 0: " + drawIndex);
    }

    @Override
    public String toString() {
        return location + "/draw_" + drawIndex + " (" + version + ")";
    }
}
