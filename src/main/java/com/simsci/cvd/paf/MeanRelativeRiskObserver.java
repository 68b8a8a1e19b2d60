package com.simsci.cvd.paf;

import com.simsci.cvd.engine.Simulant;
import com.simsci.cvd.engine.StepObserver;
import com.simsci.cvd.risk.RiskEffectEngine;

import java.util.List;

/**
 * Averages each risk's relative risk over the simulants at risk of every
 * observed target, per stratification cell. {@code (mean RR - 1) / mean RR} is
 * the PAF of a risk whose exposure distribution is summarized by its RR.
 */
public final class MeanRelativeRiskObserver implements StepObserver {
    private final TargetIndex targets;
    private final Stratification strata;
    private final RiskEffectEngine engine;
    private final String[][] risks;
    // [slot][risk][cell]
    private final double[][][] sumRr;
    private final long[][] count;

    public MeanRelativeRiskObserver(TargetIndex targets, Stratification strata, RiskEffectEngine engine) {
        this.targets = targets;
        this.strata = strata;
        this.engine = engine;
        this.risks = new String[targets.size()][];
        this.sumRr = new double[targets.size()][][];
        this.count = new long[targets.size()][strata.cellCount()];
        for (int t = 0; t < targets.size(); t++) {
            List<String> r = engine.risksAffecting(targets.target(t));
            risks[t] = r.toArray(new String[0]);
            sumRr[t] = new double[r.size()][strata.cellCount()];
        }
    }

    @Override
    public void atRisk(int cause, int transition, Simulant s, double dtDays) {
        int slot = targets.slot(cause, transition);
        if (slot < 0)
            return;
        int cell = strata.cellOf(s.who());
        if (cell < 0)
            return;
        count[slot][cell]++;
        for (int r = 0; r < risks[slot].length; r++)
            sumRr[slot][r][cell] += engine.relativeRisk(risks[slot][r], targets.target(slot), s.exposure(),
                    s.who(), s.year());
    }

    @Override
    public void transitioned(int cause, int transition, Simulant s) {
    }

    @Override
    public MeanRelativeRiskObserver fork() {
        return new MeanRelativeRiskObserver(targets, strata, engine);
    }

    @Override
    public void merge(StepObserver other) {
        MeanRelativeRiskObserver o = (MeanRelativeRiskObserver) other;
        for (int t = 0; t < count.length; t++) {
            for (int c = 0; c < count[t].length; c++)
                count[t][c] += o.count[t][c];
            for (int r = 0; r < sumRr[t].length; r++)
                for (int c = 0; c < sumRr[t][r].length; c++)
                    sumRr[t][r][c] += o.sumRr[t][r][c];
        }
    }

    public TargetIndex targets() {
        return targets;
    }

    public Stratification strata() {
        return strata;
    }

    /** Mean RR of a risk on a target in a cell; 1 when nobody was at risk. */
    public double meanRelativeRisk(int slot, String riskId, int cell) {
        for (int r = 0; r < risks[slot].length; r++)
            if (risks[slot][r].equals(riskId))
                return count[slot][cell] > 0 ? sumRr[slot][r][cell] / count[slot][cell] : 1.0;
        return 1.0;
    }
}
