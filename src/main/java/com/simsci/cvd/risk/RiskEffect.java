package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.model.Target;

/**
 * Effect of one risk on one target rate.
 *
 * @param riskId         Exposure driving the effect.
 * @param target         Rate the effect multiplies.
 * @param relativeRisk   Exposure-response curve.
 * @param mediator       Risk through which part of this effect flows, or null.
 * @param mediatorWeight Share of the effect carried by the mediator, in [0, 1].
 */
public record RiskEffect(String riskId, Target target, RelativeRiskFunction relativeRisk,
        String mediator, double mediatorWeight) {

    public RiskEffect {
        if (mediator == null && mediatorWeight != 0)
            throw new ConfigurationException("Effect of " + riskId + " on " + target + " has a weight but no mediator");
        if (mediatorWeight < 0 || mediatorWeight > 1 || Double.isNaN(mediatorWeight))
            throw new ConfigurationException("Mediator weight of " + riskId + " on " + target
                    + " outside [0,1]: " + mediatorWeight);
        if (riskId.equals(mediator))
            throw new ConfigurationException("Risk " + riskId + " cannot mediate itself");
    }

    public static RiskEffect direct(String riskId, Target target, RelativeRiskFunction rr) {
        return new RiskEffect(riskId, target, rr, null, 0);
    }

    public boolean isMediated() {
        return mediator != null;
    }

    /** Multiplier of {@code ln RR}: the share not carried by the mediator. */
    public double logScale() {
        return 1.0 - mediatorWeight;
    }
}
