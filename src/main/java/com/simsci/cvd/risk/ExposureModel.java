package com.simsci.cvd.risk;

import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

/**
 * Maps a simulant's fixed propensity to an exposure value.
 *
 * <p>
 * Continuous models return the exposure itself; categorical models return the
 * index of the sampled category.
 */
@FunctionalInterface
public interface ExposureModel {

    /**
     * @param propensity Uniform in (0, 1), fixed per simulant and risk for a draw.
     * @param who        Current demographics (parameters may be age/sex specific).
     * @param year       Fractional calendar year.
     * @param rates      Table lookup for age/sex specific parameters.
     */
    double sample(double propensity, Demographics who, double year, RateResolver rates);
}
