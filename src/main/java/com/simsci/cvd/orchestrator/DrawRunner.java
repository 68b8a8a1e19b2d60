package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.JobSpec;
import com.simsci.cvd.paf.DrawOutput;

/** Computes the output of one draw job. */
@FunctionalInterface
public interface DrawRunner {
    DrawOutput run(JobSpec spec);
}
