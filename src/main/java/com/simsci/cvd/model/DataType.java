package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

/** How a transition's probability is derived. */
public enum DataType {
    /** Competing hazard, converted to a per-step probability. */
    RATE,
    /** Forced, deterministic exit once the source state's dwell time elapses. */
    DWELL_TIME,
    /** Fixed split applied when a simulant enters the source state. */
    PROPORTION;

    public static DataType fromString(String s) {
        if (s == null)
            throw new ConfigurationException("Transition is missing data_type");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown data_type: " + s, e);
        }
    }
}
