package com.simsci.cvd.paf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one draw of one location produces. Persisted as a single atomic
 * draw file; its presence marks the draw complete.
 */
public record DrawOutput(String version, String location, int draw, List<PafRecord> pafs,
        List<JointPafRecord> jointPafs) {

    public DrawOutput {
        pafs = List.copyOf(pafs);
        jointPafs = List.copyOf(jointPafs);
    }

    /** Artifact key to value, individual PAFs first, in record order. */
    public Map<String, Double> values() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (PafRecord p : pafs)
            out.put(p.key(), p.value());
        for (JointPafRecord j : jointPafs)
            out.put(j.key(), j.value());
        return out;
    }
}
