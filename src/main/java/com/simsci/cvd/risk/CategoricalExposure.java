package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

import java.util.List;

/**
 * Samples a category by walking the cumulative category probabilities with the
 * simulant's propensity. Probabilities are renormalized to sum to 1.
 */
public final class CategoricalExposure implements ExposureModel {
    private final DataRef[] probabilities;

    public CategoricalExposure(List<DataRef> probabilities) {
        if (probabilities.isEmpty())
            throw new ConfigurationException("Categorical exposure needs at least one category");
        this.probabilities = probabilities.toArray(new DataRef[0]);
    }

    public int categoryCount() {
        return probabilities.length;
    }

    @Override
    public double sample(double propensity, Demographics who, double year, RateResolver rates) {
        int n = probabilities.length;
        double[] p = new double[n];
        double total = 0;
        for (int i = 0; i < n; i++) {
            p[i] = rates.resolve(probabilities[i], who, year);
            if (!(p[i] >= 0))
                throw new InvalidExposureException("Negative category probability " + p[i] + " for " + who);
            total += p[i];
        }
        if (!(total > 0))
            throw new InvalidExposureException("Category probabilities sum to " + total + " for " + who);
        double target = propensity * total, cum = 0;
        for (int i = 0; i < n - 1; i++) {
            cum += p[i];
            if (target < cum)
                return i;
        }
        return n - 1;
    }
}
