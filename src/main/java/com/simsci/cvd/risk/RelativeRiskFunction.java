package com.simsci.cvd.risk;

import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

/**
 * Exposure-response curve of one risk on one target rate.
 * Must return exactly 1 at the risk's TMREL (or reference category).
 */
@FunctionalInterface
public interface RelativeRiskFunction {

    double relativeRisk(double exposure, RiskFactor risk, Demographics who, double year, RateResolver rates);
}
