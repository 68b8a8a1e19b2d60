package com.simsci.cvd.api;

/** A risk effect or counterfactual refers to a risk factor that was never declared. */
public class UnknownRiskException extends ConfigurationException {
    private final String riskId;

    public UnknownRiskException(String riskId) {
        super("Unknown risk factor: " + riskId);
        this.riskId = riskId;
    }

    public String riskId() {
        return riskId;
    }
}
