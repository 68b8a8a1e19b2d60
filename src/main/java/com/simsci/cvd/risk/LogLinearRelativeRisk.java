package com.simsci.cvd.risk;

import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

/**
 * Continuous relative risk {@code RR = rrPerUnit ^ ((x - tmrel) / unit)}, i.e.
 * {@code exp(beta * (x - tmrel))} with {@code beta = ln(rrPerUnit) / unit}.
 *
 * <p>
 * With {@code floorAtOne} set, exposures below TMREL yield RR = 1.
 */
public final class LogLinearRelativeRisk implements RelativeRiskFunction {
    private final DataRef rrPerUnit;
    private final double unit;
    private final boolean floorAtOne;

    public LogLinearRelativeRisk(DataRef rrPerUnit, double unit, boolean floorAtOne) {
        if (!(unit > 0))
            throw new IllegalArgumentException("unit must be positive: " + unit);
        this.rrPerUnit = rrPerUnit;
        this.unit = unit;
        this.floorAtOne = floorAtOne;
    }

    @Override
    public double relativeRisk(double exposure, RiskFactor risk, Demographics who, double year, RateResolver rates) {
        double perUnit = rates.resolve(rrPerUnit, who, year);
        if (!(perUnit > 0))
            throw new InvalidExposureException("Relative risk per unit must be positive, got " + perUnit
                    + " for " + risk.id());
        double delta = (exposure - risk.tmrel()) / unit;
        if (floorAtOne && delta < 0)
            return 1.0;
        return Math.exp(Math.log(perUnit) * delta);
    }
}
