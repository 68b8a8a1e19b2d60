package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

/** Whether a state represents the cause itself or one of its sequelae. */
public enum CauseType {
    CAUSE,
    SEQUELA;

    public static CauseType fromString(String s) {
        if (s == null)
            return CAUSE;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown cause_type: " + s, e);
        }
    }
}
