package com.simsci.cvd.paf;

import com.simsci.cvd.api.ConfigurationException;

/** How a draw's PAFs are estimated. */
public enum PafMethod {
    /** {@code 1 - I_cf / I_obs} from simulated incidence, observed vs. risk at TMREL. */
    INCIDENCE_RATIO,
    /** {@code (mean RR - 1) / mean RR} over simulants at risk. */
    MEAN_RELATIVE_RISK;

    public static PafMethod fromString(String s) {
        if (s == null)
            return INCIDENCE_RATIO;
        return switch (s.toLowerCase()) {
            case "incidence", "incidence_ratio", "counterfactual" -> INCIDENCE_RATIO;
            case "mean_rr", "mean_relative_risk" -> MEAN_RELATIVE_RISK;
            default -> throw new ConfigurationException("Unknown PAF method: " + s);
        };
    }
}
