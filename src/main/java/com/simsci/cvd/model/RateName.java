package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

/** Logical rate names a transition can bind to a data source. */
public enum RateName {
    INCIDENCE_RATE("incidence_rate"),
    TRANSITION_RATE("transition_rate"),
    REMISSION_RATE("remission_rate"),
    PROPORTION("proportion");

    private final String key;

    RateName(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isRate() {
        return this != PROPORTION;
    }

    public static RateName fromKey(String key) {
        for (RateName r : values())
            if (r.key.equalsIgnoreCase(key))
                return r;
        throw new ConfigurationException("Unknown rate name: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
