package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Target;
import com.simsci.cvd.rate.RateResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the relative risks of a simulant's exposures to base rates.
 *
 * <p>
 * For each target the effects are compiled once into flat arrays in mediation
 * order (mediator first). The adjusted rate is
 * {@code base * exp(sum_i (1 - w_i) * ln RR_i(x_i))}: independent effects
 * multiply, a mediated effect keeps only the share not carried by its
 * mediator, and the members of a correlation group form one joint term
 * computed from the jointly sampled exposures.
 *
 * <p>
 * Stateless after construction and safe to share between worker threads.
 */
public final class RiskEffectEngine {
    private final RiskCatalog catalog;
    private final RateResolver rates;
    private final Map<Target, TargetEffects> byTarget;

    /**
     * @throws com.simsci.cvd.api.UnknownRiskException if an effect names an unknown risk.
     * @throws ConfigurationException                  on a mediation cycle or an incomplete RR table.
     */
    public RiskEffectEngine(RiskCatalog catalog, List<RiskEffect> effects, RateResolver rates) {
        this.catalog = catalog;
        this.rates = rates;

        Map<Target, List<RiskEffect>> grouped = new LinkedHashMap<>();
        for (RiskEffect e : effects) {
            catalog.indexOf(e.riskId());
            if (e.isMediated())
                catalog.indexOf(e.mediator());
            if (e.relativeRisk() instanceof CategoricalRelativeRisk c) {
                RiskFactor risk = catalog.risk(catalog.indexOf(e.riskId()));
                if (!risk.isCategorical())
                    throw new ConfigurationException("Categorical RR table on continuous risk " + risk.id());
                List<String> missing = c.missingCategories(risk);
                if (!missing.isEmpty())
                    throw new ConfigurationException("Effect of " + risk.id() + " on " + e.target()
                            + " has no RR for " + missing);
            }
            grouped.computeIfAbsent(e.target(), t -> new ArrayList<>()).add(e);
        }

        Map<Target, TargetEffects> compiled = new LinkedHashMap<>();
        for (var entry : grouped.entrySet())
            compiled.put(entry.getKey(), compile(entry.getKey(), entry.getValue()));
        this.byTarget = Collections.unmodifiableMap(compiled);
    }

    private TargetEffects compile(Target target, List<RiskEffect> effects) {
        EffectOrder.Builder b = EffectOrder.builder(target.toString());
        Map<String, RiskEffect> byRisk = new LinkedHashMap<>();
        for (RiskEffect e : effects) {
            b.addRisk(e.riskId());
            byRisk.put(e.riskId(), e);
        }
        for (RiskEffect e : effects)
            if (e.isMediated())
                b.addMediation(e.mediator(), e.riskId());
        EffectOrder order = b.build();

        int n = order.size();
        int[] riskIndex = new int[n], group = new int[n];
        RelativeRiskFunction[] fns = new RelativeRiskFunction[n];
        double[] logScale = new double[n];
        for (int i = 0; i < n; i++) {
            RiskEffect e = byRisk.get(order.risk(i));
            riskIndex[i] = catalog.indexOf(e.riskId());
            group[i] = catalog.groupOf(riskIndex[i]);
            fns[i] = e.relativeRisk();
            logScale[i] = e.logScale();
        }
        return new TargetEffects(target, order, riskIndex, group, fns, logScale);
    }

    public RiskCatalog catalog() {
        return catalog;
    }

    public Set<Target> targets() {
        return byTarget.keySet();
    }

    /** Compiled effects on a target; {@link TargetEffects#isEmpty()} if none. */
    public TargetEffects effects(Target target) {
        TargetEffects e = byTarget.get(target);
        return e != null ? e
                : new TargetEffects(target, EffectOrder.builder(target.toString()).build(),
                        new int[0], new int[0], new RelativeRiskFunction[0], new double[0]);
    }

    /** Risks acting on a target, in evaluation order. */
    public List<String> risksAffecting(Target target) {
        return effects(target).order();
    }

    /**
     * Adjusted rate for one simulant.
     *
     * @throws IllegalStateException    if a correlation group was not jointly sampled.
     * @throws InvalidExposureException if a relative risk is not positive and finite.
     */
    public double adjust(double baseRate, Target target, ExposureVector x, Demographics who, double year) {
        return baseRate * effects(target).relativeRisk(x, who, year);
    }

    /** Combined relative risk of all effects on a target. */
    public double relativeRisk(Target target, ExposureVector x, Demographics who, double year) {
        return effects(target).relativeRisk(x, who, year);
    }

    /** Mediation-scaled relative risk of one risk on a target; 1 if it has no effect there. */
    public double relativeRisk(String riskId, Target target, ExposureVector x, Demographics who, double year) {
        return effects(target).relativeRisk(catalog.indexOf(riskId), x, who, year);
    }

    /** Effects on one target, flattened in evaluation order. */
    public final class TargetEffects {
        private final Target target;
        private final EffectOrder order;
        private final int[] riskIndex;
        private final int[] group;
        private final RelativeRiskFunction[] fns;
        private final double[] logScale;

        private TargetEffects(Target target, EffectOrder order, int[] riskIndex, int[] group,
                RelativeRiskFunction[] fns, double[] logScale) {
            this.target = target;
            this.order = order;
            this.riskIndex = riskIndex;
            this.group = group;
            this.fns = fns;
            this.logScale = logScale;
        }

        public Target target() {
            return target;
        }

        public boolean isEmpty() {
            return riskIndex.length == 0;
        }

        public List<String> order() {
            return order.risks();
        }

        public double relativeRisk(ExposureVector x, Demographics who, double year) {
            int n = riskIndex.length;
            if (n == 0)
                return 1.0;
            double logSum = 0;
            for (int i = 0; i < n; i++)
                logSum += logRelativeRisk(i, x, who, year);
            return Math.exp(logSum);
        }

        double relativeRisk(int ri, ExposureVector x, Demographics who, double year) {
            for (int i = 0; i < riskIndex.length; i++)
                if (riskIndex[i] == ri)
                    return Math.exp(logRelativeRisk(i, x, who, year));
            return 1.0;
        }

        private double logRelativeRisk(int i, ExposureVector x, Demographics who, double year) {
            int ri = riskIndex[i];
            int g = group[i];
            if (g >= 0 && !x.isJointlySampled(g))
                throw new IllegalStateException("Risks of correlation group " + catalog.group(g)
                        + " were not sampled jointly");
            RiskFactor risk = catalog.risk(ri);
            double rr = fns[i].relativeRisk(x.value(ri), risk, who, year, rates);
            if (!(rr > 0) || Double.isInfinite(rr))
                throw new InvalidExposureException("Relative risk of " + risk.id() + " on " + target + " is " + rr);
            return logScale[i] * Math.log(rr);
        }
    }
}
