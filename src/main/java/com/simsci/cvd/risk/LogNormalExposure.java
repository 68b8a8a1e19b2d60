package com.simsci.cvd.risk;

import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

import org.apache.commons.math3.distribution.LogNormalDistribution;

/**
 * Log-normal exposure parameterized, like the input data, by the arithmetic
 * mean and standard deviation of the exposure. They are converted to the
 * distribution's scale and shape:
 * {@code shape² = ln(1 + sd²/mean²)}, {@code scale = ln(mean) - shape²/2}.
 */
public final class LogNormalExposure implements ExposureModel {
    private final DataRef mean;
    private final DataRef sd;

    public LogNormalExposure(DataRef mean, DataRef sd) {
        this.mean = mean;
        this.sd = sd;
    }

    @Override
    public double sample(double propensity, Demographics who, double year, RateResolver rates) {
        double m = rates.resolve(mean, who, year);
        double s = rates.resolve(sd, who, year);
        if (!(m > 0) || !(s > 0))
            throw new InvalidExposureException("Log-normal exposure needs positive mean and sd, got "
                    + m + ", " + s + " for " + who);
        double shape = Math.sqrt(Math.log1p(s * s / (m * m)));
        double scale = Math.log(m) - shape * shape / 2;
        return new LogNormalDistribution(null, scale, shape).inverseCumulativeProbability(propensity);
    }
}
