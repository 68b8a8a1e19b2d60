package com.simsci.cvd.risk;

import java.util.Arrays;

/**
 * A simulant's exposures to every risk of a catalog. Categorical exposures are
 * stored as category indices.
 *
 * <p>
 * The vector also records which correlation groups were sampled jointly; the
 * risk-effect engine refuses to combine correlated effects from a vector
 * whose group members were drawn independently.
 */
public final class ExposureVector {
    private final RiskCatalog catalog;
    private final double[] values;
    private final boolean[] jointGroups;

    /** Both arrays are copied. */
    public ExposureVector(RiskCatalog catalog, double[] values, boolean[] jointGroups) {
        if (values.length != catalog.size())
            throw new IllegalArgumentException("Expected " + catalog.size() + " exposures, got " + values.length);
        if (jointGroups.length != catalog.groupCount())
            throw new IllegalArgumentException("Expected " + catalog.groupCount() + " group flags");
        this.catalog = catalog;
        this.values = values.clone();
        this.jointGroups = jointGroups.clone();
    }

    public RiskCatalog catalog() {
        return catalog;
    }

    public double value(int riskIndex) {
        return values[riskIndex];
    }

    public double value(String riskId) {
        return values[catalog.indexOf(riskId)];
    }

    /** Category label of a categorical risk. */
    public String category(String riskId) {
        int ri = catalog.indexOf(riskId);
        return catalog.risk(ri).categories().get((int) values[ri]);
    }

    public boolean isJointlySampled(int groupIndex) {
        return jointGroups[groupIndex];
    }

    /**
     * Copy with one risk set to its theoretical minimum risk exposure level
     * (its reference category, for categorical risks). Other exposures,
     * including categories binned from this risk, keep their observed values.
     *
     * @throws com.simsci.cvd.api.UnknownRiskException if the risk is unknown.
     */
    public ExposureVector atTmrel(String riskId) {
        return atTmrel(catalog.indexOf(riskId));
    }

    public ExposureVector atTmrel(int riskIndex) {
        double[] copy = values.clone();
        copy[riskIndex] = catalog.risk(riskIndex).tmrelValue();
        return new ExposureVector(catalog, copy, jointGroups);
    }

    @Override
    public String toString() {
        return "ExposureVector" + Arrays.toString(values);
    }
}
