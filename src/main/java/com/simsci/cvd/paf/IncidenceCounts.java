package com.simsci.cvd.paf;

/** Events and person-time (days) per observed target and stratification cell. */
public final class IncidenceCounts {
    private final TargetIndex targets;
    private final Stratification strata;
    private final long[][] events;
    private final double[][] personTime;

    IncidenceCounts(TargetIndex targets, Stratification strata, long[][] events, double[][] personTime) {
        this.targets = targets;
        this.strata = strata;
        this.events = events;
        this.personTime = personTime;
    }

    public TargetIndex targets() {
        return targets;
    }

    public Stratification strata() {
        return strata;
    }

    public long events(int slot, int cell) {
        return events[slot][cell];
    }

    public double personTime(int slot, int cell) {
        return personTime[slot][cell];
    }

    /** Events per day at risk; 0 when nobody was at risk. */
    public double rate(int slot, int cell) {
        double pt = personTime[slot][cell];
        return pt > 0 ? events[slot][cell] / pt : 0;
    }
}
