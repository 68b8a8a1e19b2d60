package com.simsci.cvd.paf;

import com.simsci.cvd.engine.Simulant;
import com.simsci.cvd.engine.StepObserver;

/**
 * Counts events and person-time at risk per observed target and
 * stratification cell.
 */
public final class IncidenceObserver implements StepObserver {
    private final TargetIndex targets;
    private final Stratification strata;
    private final long[][] events;
    private final double[][] personTime;

    public IncidenceObserver(TargetIndex targets, Stratification strata) {
        this.targets = targets;
        this.strata = strata;
        this.events = new long[targets.size()][strata.cellCount()];
        this.personTime = new double[targets.size()][strata.cellCount()];
    }

    @Override
    public void atRisk(int cause, int transition, Simulant s, double dtDays) {
        int slot = targets.slot(cause, transition);
        if (slot < 0)
            return;
        int cell = strata.cellOf(s.who());
        if (cell >= 0)
            personTime[slot][cell] += dtDays;
    }

    @Override
    public void transitioned(int cause, int transition, Simulant s) {
        int slot = targets.slot(cause, transition);
        if (slot < 0)
            return;
        int cell = strata.cellOf(s.who());
        if (cell >= 0)
            events[slot][cell]++;
    }

    @Override
    public IncidenceObserver fork() {
        return new IncidenceObserver(targets, strata);
    }

    @Override
    public void merge(StepObserver other) {
        IncidenceObserver o = (IncidenceObserver) other;
        for (int t = 0; t < events.length; t++) {
            for (int c = 0; c < events[t].length; c++) {
                events[t][c] += o.events[t][c];
                personTime[t][c] += o.personTime[t][c];
            }
        }
    }

    /** Immutable snapshot of the totals. */
    public IncidenceCounts counts() {
        long[][] e = new long[events.length][];
        double[][] p = new double[personTime.length][];
        for (int t = 0; t < events.length; t++) {
            e[t] = events[t].clone();
            p[t] = personTime[t].clone();
        }
        return new IncidenceCounts(targets, strata, e, p);
    }
}
