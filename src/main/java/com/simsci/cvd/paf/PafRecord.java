package com.simsci.cvd.paf;

import com.simsci.cvd.model.Target;

/**
 * PAF of one risk on one target, in one stratification cell, for one draw.
 *
 * @param value Attributable fraction in [0, 1).
 */
public record PafRecord(String riskId, Target target, StratificationCell cell, int draw, double value) {

    public static final String MEASURE = "population_attributable_fraction";

    /** Artifact measure of a risk, e.g. {@code risk_factor.high_ldl_cholesterol.population_attributable_fraction}. */
    public static String measure(String riskId) {
        return "risk_factor." + riskId + "." + MEASURE;
    }

    /** Full artifact key: measure, target and cell. */
    public String key() {
        return measure(riskId) + ":" + target + ":" + cell;
    }
}
