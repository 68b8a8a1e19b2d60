package com.simsci.cvd.paf;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assembled, versioned PAF artifact of one location: for every key, the
 * per-draw values ordered by draw index.
 */
public record LocationArtifact(String version, String location, int drawCount, Map<String, double[]> values) {

    public LocationArtifact {
        values = new TreeMap<>(values);
        for (var e : values.entrySet())
            if (e.getValue().length != drawCount)
                throw new IllegalArgumentException("Key " + e.getKey() + " has " + e.getValue().length
                        + " draws, expected " + drawCount);
    }

    /** Number of draws stored for a key, 0 if absent. */
    public int drawCount(String key) {
        double[] v = values.get(key);
        return v == null ? 0 : v.length;
    }

    /** Distinct measures (key text before the first ':'). */
    public Set<String> measures() {
        Set<String> out = new TreeSet<>();
        for (String k : values.keySet()) {
            int colon = k.indexOf(':');
            out.add(colon < 0 ? k : k.substring(0, colon));
        }
        return out;
    }

    public int pafKeyCount() {
        return measures().size();
    }
}
