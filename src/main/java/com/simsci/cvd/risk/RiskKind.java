package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;

public enum RiskKind {
    CONTINUOUS,
    /** Continuous, clipped to the exposure limits. */
    TRUNCATED_CONTINUOUS,
    CATEGORICAL;

    public boolean isContinuous() {
        return this != CATEGORICAL;
    }

    public static RiskKind fromString(String s) {
        if (s == null)
            return CONTINUOUS;
        return switch (s.toLowerCase()) {
            case "continuous" -> CONTINUOUS;
            case "truncated", "truncated_continuous" -> TRUNCATED_CONTINUOUS;
            case "categorical", "dichotomous", "ordered_polytomous" -> CATEGORICAL;
            default -> throw new ConfigurationException("Unknown risk kind: " + s);
        };
    }
}
