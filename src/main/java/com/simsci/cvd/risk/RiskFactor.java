package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;

import java.util.List;

/**
 * A modifiable exposure that alters disease rates.
 *
 * @param id                Risk id, e.g. {@code high_systolic_blood_pressure}.
 * @param kind              Continuous, truncated continuous or categorical.
 * @param model             Exposure model; null for binned categorical risks.
 * @param binning           Thresholds over a continuous parent; null unless binned.
 * @param floor             Lower exposure limit, or null.
 * @param ceiling           Upper exposure limit, or null.
 * @param tmrel             Theoretical minimum risk exposure level (continuous risks).
 * @param correlationGroup  Group whose members are sampled jointly, or null.
 * @param categories        Category labels (categorical risks), in sampling order.
 * @param referenceCategory Category with RR = 1 (categorical risks).
 */
public record RiskFactor(String id, RiskKind kind, ExposureModel model, BinnedExposure binning,
        Double floor, Double ceiling, double tmrel, String correlationGroup,
        List<String> categories, String referenceCategory) {

    public RiskFactor {
        if (id == null || id.isBlank())
            throw new ConfigurationException("Risk id must not be blank");
        if ((model == null) == (binning == null))
            throw new ConfigurationException("Risk " + id + " needs exactly one of an exposure model or a binning");
        categories = categories == null ? List.of() : List.copyOf(categories);
        if (kind == RiskKind.CATEGORICAL) {
            if (categories.isEmpty())
                throw new ConfigurationException("Categorical risk " + id + " declares no categories");
            if (referenceCategory == null || !categories.contains(referenceCategory))
                throw new ConfigurationException("Categorical risk " + id + " has no valid reference category");
            if (binning != null && binning.categoryCount() != categories.size())
                throw new ConfigurationException("Risk " + id + " has " + categories.size()
                        + " categories but " + binning.categoryCount() + " bins");
            if (model instanceof CategoricalExposure c && c.categoryCount() != categories.size())
                throw new ConfigurationException("Risk " + id + " has " + categories.size()
                        + " categories but " + c.categoryCount() + " probabilities");
        } else {
            if (binning != null)
                throw new ConfigurationException("Continuous risk " + id + " cannot be binned");
            if (kind == RiskKind.TRUNCATED_CONTINUOUS && floor == null && ceiling == null)
                throw new ConfigurationException("Truncated risk " + id + " declares no exposure limits");
            if (floor != null && ceiling != null && floor > ceiling)
                throw new ConfigurationException("Risk " + id + " has floor above ceiling");
        }
    }

    public boolean isCategorical() {
        return kind == RiskKind.CATEGORICAL;
    }

    public boolean isBinned() {
        return binning != null;
    }

    /** Exposure value at TMREL: the TMREL itself, or the reference category index. */
    public double tmrelValue() {
        return isCategorical() ? categories.indexOf(referenceCategory) : tmrel;
    }

    /** Applies the exposure limits of a truncated risk. */
    public double clip(double exposure) {
        if (kind != RiskKind.TRUNCATED_CONTINUOUS)
            return exposure;
        if (floor != null && exposure < floor)
            return floor;
        if (ceiling != null && exposure > ceiling)
            return ceiling;
        return exposure;
    }

    public static RiskFactor continuous(String id, ExposureModel model, double tmrel) {
        return new RiskFactor(id, RiskKind.CONTINUOUS, model, null, null, null, tmrel, null, null, null);
    }

    public static RiskFactor truncated(String id, ExposureModel model, double floor, double ceiling, double tmrel) {
        return new RiskFactor(id, RiskKind.TRUNCATED_CONTINUOUS, model, null, floor, ceiling, tmrel, null, null, null);
    }

    public static RiskFactor categorical(String id, ExposureModel model, List<String> categories, String reference) {
        return new RiskFactor(id, RiskKind.CATEGORICAL, model, null, null, null, 0, null, categories, reference);
    }

    public static RiskFactor binned(String id, BinnedExposure binning, List<String> categories, String reference) {
        return new RiskFactor(id, RiskKind.CATEGORICAL, null, binning, null, null, 0, null, categories, reference);
    }

    /** Copy of this risk assigned to a correlation group. */
    public RiskFactor inGroup(String group) {
        return new RiskFactor(id, kind, model, binning, floor, ceiling, tmrel, group, categories, referenceCategory);
    }
}
