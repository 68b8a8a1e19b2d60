package com.simsci.cvd.paf;

import com.simsci.cvd.engine.Simulation;
import com.simsci.cvd.model.Target;
import com.simsci.cvd.risk.RiskEffectEngine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes one draw's PAF and joint PAF records for every risk-affected rate
 * target.
 *
 * <p>
 * With {@link PafMethod#INCIDENCE_RATIO} the draw's population is simulated
 * once with observed exposures and once per risk with that risk at TMREL.
 * Every run derives its random numbers from the same keys, so the runs differ
 * only through the exposure change. Per target and cell,
 * {@code PAF_i = 1 - I_cf(i) / I_obs} where {@code I} is events per
 * person-time at risk.
 *
 * <p>
 * The joint PAF is {@code 1 - prod(1 - PAF_i)}, see {@link JointPafRecord}
 * for the independence assumption it carries.
 */
public final class PafAggregator {
    private static final Logger log = LogManager.getLogger(PafAggregator.class);
    private static final double BELOW_ONE = Math.nextDown(1.0);

    private final Simulation simulation;
    private final RiskEffectEngine engine;
    private final Stratification strata;
    private final PafMethod method;
    private final TargetIndex targets;

    public PafAggregator(Simulation simulation, RiskEffectEngine engine, Stratification strata, PafMethod method) {
        this.simulation = simulation;
        this.engine = engine;
        this.strata = strata;
        this.method = method;
        List<Target> rateTargets = new ArrayList<>();
        for (Target t : engine.targets())
            if (t.rateName().isRate())
                rateTargets.add(t);
        this.targets = new TargetIndex(simulation.machines(), rateTargets);
    }

    public TargetIndex targets() {
        return targets;
    }

    /** {@code 1 - counterfactual / observed}, clamped into [0, 1); 0 when nothing was observed. */
    public static double paf(double observedRate, double counterfactualRate) {
        if (!(observedRate > 0))
            return 0;
        return clamp(1 - counterfactualRate / observedRate);
    }

    /** {@code (mean RR - 1) / mean RR}, clamped into [0, 1). */
    public static double pafFromMeanRelativeRisk(double meanRr) {
        if (!(meanRr > 0))
            return 0;
        return clamp((meanRr - 1) / meanRr);
    }

    /** {@code 1 - prod(1 - PAF_i)}. In [0, 1) and at least every {@code PAF_i} when each is in [0, 1). */
    public static double jointPaf(double... pafs) {
        double keep = 1;
        for (double p : pafs)
            keep *= 1 - p;
        return clamp(1 - keep);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v) || v < 0)
            return 0;
        return Math.min(v, BELOW_ONE);
    }

    /** Risks acting on any observed target, in first-seen evaluation order. */
    public List<String> contributingRisks() {
        Set<String> out = new LinkedHashSet<>();
        for (Target t : targets.targets())
            out.addAll(engine.risksAffecting(t));
        return new ArrayList<>(out);
    }

    /**
     * Simulates and aggregates one draw.
     *
     * @throws com.simsci.cvd.api.SimulationException if any run of the draw fails.
     */
    public DrawOutput computeDraw(String version, String location, int draw) {
        long start = System.nanoTime();
        DrawOutput out;
        if (method == PafMethod.MEAN_RELATIVE_RISK) {
            MeanRelativeRiskObserver obs = new MeanRelativeRiskObserver(targets, strata, engine);
            simulation.run(location, draw, obs);
            out = fromMeanRelativeRisk(version, location, draw, obs);
        } else {
            IncidenceObserver observed = new IncidenceObserver(targets, strata);
            simulation.run(location, draw, observed);
            Map<String, IncidenceCounts> counterfactual = new LinkedHashMap<>();
            for (String risk : contributingRisks()) {
                IncidenceObserver cf = new IncidenceObserver(targets, strata);
                simulation.run(location, draw, engine.catalog().indexOf(risk), cf);
                counterfactual.put(risk, cf.counts());
            }
            out = fromIncidence(version, location, draw, observed.counts(), counterfactual);
        }
        log.info("Draw {} of {} aggregated: {} PAFs, {} joint PAFs in {} ms", draw, location, out.pafs().size(),
                out.jointPafs().size(), (System.nanoTime() - start) / 1_000_000);
        return out;
    }

    /** Builds the records of a draw from observed and per-risk counterfactual incidence. */
    public DrawOutput fromIncidence(String version, String location, int draw, IncidenceCounts observed,
            Map<String, IncidenceCounts> counterfactual) {
        return build(version, location, draw, (slot, risk, cell) -> {
            IncidenceCounts cf = counterfactual.get(risk);
            if (cf == null)
                throw new IllegalArgumentException("No counterfactual run for " + risk);
            return paf(observed.rate(slot, cell), cf.rate(slot, cell));
        });
    }

    DrawOutput fromMeanRelativeRisk(String version, String location, int draw, MeanRelativeRiskObserver obs) {
        return build(version, location, draw,
                (slot, risk, cell) -> pafFromMeanRelativeRisk(obs.meanRelativeRisk(slot, risk, cell)));
    }

    @FunctionalInterface
    private interface CellPaf {
        double paf(int slot, String risk, int cell);
    }

    private DrawOutput build(String version, String location, int draw, CellPaf fn) {
        List<PafRecord> pafs = new ArrayList<>();
        List<JointPafRecord> joints = new ArrayList<>();
        for (int slot = 0; slot < targets.size(); slot++) {
            Target target = targets.target(slot);
            List<String> risks = engine.risksAffecting(target);
            for (int cell = 0; cell < strata.cellCount(); cell++) {
                StratificationCell sc = strata.cell(cell);
                double[] values = new double[risks.size()];
                for (int r = 0; r < values.length; r++) {
                    values[r] = fn.paf(slot, risks.get(r), cell);
                    pafs.add(new PafRecord(risks.get(r), target, sc, draw, values[r]));
                }
                joints.add(new JointPafRecord(target, sc, draw, jointPaf(values), risks));
            }
        }
        return new DrawOutput(version, location, draw, pafs, joints);
    }
}
