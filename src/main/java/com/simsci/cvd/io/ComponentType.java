package com.simsci.cvd.io;

import com.simsci.cvd.api.ConfigurationException;

/** Type keys of registry-built components. */
public enum ComponentType {
    NORMAL("normal", true),
    LOGNORMAL("lognormal", true),
    CATEGORICAL("categorical", true),
    BINNED("binned", true),
    LOG_LINEAR("log_linear", false),
    CATEGORICAL_RR("categorical_rr", false);

    private final String key;
    private final boolean exposure;

    ComponentType(String key, boolean exposure) {
        this.key = key;
        this.exposure = exposure;
    }

    public String key() {
        return key;
    }

    /** True for exposure models, false for relative-risk functions. */
    public boolean isExposure() {
        return exposure;
    }

    public static ComponentType fromString(String s) {
        if (s == null)
            throw new ConfigurationException("Component type missing");
        for (ComponentType t : values())
            if (t.key.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s))
                return t;
        throw new ConfigurationException("Unknown component type: " + s);
    }
}
