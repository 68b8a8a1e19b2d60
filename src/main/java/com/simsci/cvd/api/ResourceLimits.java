package com.simsci.cvd.api;

import java.time.Duration;

/**
 * Resource constraints attached to every submitted draw job.
 *
 * @param cpus      CPU cores requested.
 * @param memoryGb  Memory requested, in gigabytes.
 * @param wallClock Maximum run time before the scheduler kills the job.
 */
public record ResourceLimits(int cpus, int memoryGb, Duration wallClock) {

    /** 1 core, 3 GB, 20 minutes. */
    public static final ResourceLimits DEFAULT = new ResourceLimits(1, 3, Duration.ofMinutes(20));

    public ResourceLimits {
        if (cpus <= 0)
            throw new IllegalArgumentException("cpus must be positive: " + cpus);
        if (memoryGb <= 0)
            throw new IllegalArgumentException("memoryGb must be positive: " + memoryGb);
        if (wallClock == null || wallClock.isZero() || wallClock.isNegative())
            throw new IllegalArgumentException("wallClock must be positive: " + wallClock);
    }
}
