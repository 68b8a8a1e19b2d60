package com.simsci.cvd.risk;

import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

import org.apache.commons.math3.distribution.NormalDistribution;

/** NORMAL(mean, sd) exposure by inverse CDF. */
public final class NormalExposure implements ExposureModel {
    static final NormalDistribution STANDARD = new NormalDistribution(null, 0, 1);

    private final DataRef mean;
    private final DataRef sd;

    public NormalExposure(DataRef mean, DataRef sd) {
        this.mean = mean;
        this.sd = sd;
    }

    public DataRef mean() {
        return mean;
    }

    public DataRef sd() {
        return sd;
    }

    @Override
    public double sample(double propensity, Demographics who, double year, RateResolver rates) {
        double mu = rates.resolve(mean, who, year);
        double sigma = rates.resolve(sd, who, year);
        if (!(sigma >= 0))
            throw new InvalidExposureException("Negative exposure sd " + sigma + " for " + who);
        return mu + sigma * STANDARD.inverseCumulativeProbability(propensity);
    }
}
