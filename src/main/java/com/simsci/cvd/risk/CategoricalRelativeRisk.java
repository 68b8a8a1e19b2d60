package com.simsci.cvd.risk;

import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;

import java.util.List;
import java.util.Map;

/** Per-category relative risk table; the reference category is fixed at 1. */
public final class CategoricalRelativeRisk implements RelativeRiskFunction {
    private final Map<String, DataRef> byCategory;

    public CategoricalRelativeRisk(Map<String, DataRef> byCategory) {
        this.byCategory = Map.copyOf(byCategory);
    }

    /** Categories with no RR declared, excluding the reference. */
    public List<String> missingCategories(RiskFactor risk) {
        return risk.categories().stream()
                .filter(c -> !c.equals(risk.referenceCategory()) && !byCategory.containsKey(c))
                .toList();
    }

    @Override
    public double relativeRisk(double exposure, RiskFactor risk, Demographics who, double year, RateResolver rates) {
        int ci = (int) exposure;
        if (ci < 0 || ci >= risk.categories().size() || ci != exposure)
            throw new InvalidExposureException("Unknown category index " + exposure + " for " + risk.id());
        String category = risk.categories().get(ci);
        if (category.equals(risk.referenceCategory()))
            return 1.0;
        DataRef ref = byCategory.get(category);
        if (ref == null)
            throw new InvalidExposureException("No relative risk for category " + category + " of " + risk.id());
        return rates.resolve(ref, who, year);
    }
}
