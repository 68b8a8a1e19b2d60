package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;

/**
 * Categorical exposure derived from a continuous parent risk by thresholds.
 *
 * <p>
 * Thresholds are sorted descending; category 0 is {@code x >= t[0]}, category
 * {@code k} is {@code t[k] <= x < t[k-1]}, and the last category is everything
 * below the smallest threshold. Bins are left-closed.
 */
public final class BinnedExposure {
    private final String parentRisk;
    private final double[] thresholds;

    public BinnedExposure(String parentRisk, double[] thresholds) {
        if (thresholds.length == 0)
            throw new ConfigurationException("Binned exposure of " + parentRisk + " needs thresholds");
        for (int i = 1; i < thresholds.length; i++)
            if (!(thresholds[i] < thresholds[i - 1]))
                throw new ConfigurationException("Thresholds of " + parentRisk + " must be strictly descending");
        this.parentRisk = parentRisk;
        this.thresholds = thresholds.clone();
    }

    public String parentRisk() {
        return parentRisk;
    }

    public int categoryCount() {
        return thresholds.length + 1;
    }

    public int categorize(double parentValue) {
        for (int i = 0; i < thresholds.length; i++)
            if (parentValue >= thresholds[i])
                return i;
        return thresholds.length;
    }
}
