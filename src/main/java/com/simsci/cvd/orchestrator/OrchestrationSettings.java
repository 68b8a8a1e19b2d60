package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.ResourceLimits;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Batch settings of one artifact version.
 *
 * @param version         Artifact version every job writes into.
 * @param drawCount       Draws per location; jobs cover {@code [0, drawCount)}.
 * @param locations       Locations to compute.
 * @param limits          Resource limits of each draw job.
 * @param pollInterval    Interval between scheduler status polls.
 * @param outputRoot      Root directory of the artifact store.
 * @param workers         Concurrent draw jobs on the local scheduler.
 * @param ringBufferSize  Capacity of the artifact writer's ring buffer, a power of two.
 * @param expectedPafKeys Distinct PAF measures a finished artifact must hold, 0 to skip the check.
 */
public record OrchestrationSettings(String version, int drawCount, List<String> locations, ResourceLimits limits,
        Duration pollInterval, Path outputRoot, int workers, int ringBufferSize, int expectedPafKeys) {

    public OrchestrationSettings {
        if (version == null || version.isBlank())
            throw new IllegalArgumentException("version must not be blank");
        if (drawCount <= 0)
            throw new IllegalArgumentException("drawCount must be positive: " + drawCount);
        if (workers <= 0)
            throw new IllegalArgumentException("workers must be positive: " + workers);
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2: " + ringBufferSize);
        locations = List.copyOf(locations);
        if (limits == null)
            limits = ResourceLimits.DEFAULT;
    }
}
