package com.simsci.cvd.engine;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.InvalidTransitionException;
import com.simsci.cvd.model.CauseGraph;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.DataType;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.State;
import com.simsci.cvd.model.Target;
import com.simsci.cvd.model.Transition;
import com.simsci.cvd.rate.RateResolver;
import com.simsci.cvd.risk.ExposureVector;
import com.simsci.cvd.risk.RiskEffectEngine;
import com.simsci.cvd.util.RandomKeys;

import java.util.Map;

/**
 * Drives the states of one cause, one simulant and one step at a time.
 *
 * <p>
 * Per step, for a simulant in state {@code s}:
 * <ol>
 * <li>If {@code s} has a dwell time, the simulant stays until
 * {@code event - entry >= dwell}, then takes the dwell-time transition. No
 * random number is used.</li>
 * <li>Otherwise the rate transitions out of {@code s} compete. With adjusted
 * rates {@code r_i} (per day), the exit probability is
 * {@code p = 1 - exp(-sum(r) * dt)} and transition {@code i} gets
 * {@code p * r_i / sum(r)}. One uniform per (simulant, cause, step) selects at
 * most one transition; the rest of the mass is "stay".</li>
 * <li>Entering a state with proportion transitions splits the simulant
 * immediately, repeatedly if the sink splits too. Split uniforms come from
 * their own stream, keyed on cause, step and split ordinal.</li>
 * </ol>
 * Every transition is stamped with the step's event time {@code t + dt}.
 */
public final class DiseaseStateMachine {
    private static final double DWELL_EPSILON = 1e-9;

    private final int causeIndex;
    private final CauseGraph graph;
    private final RateResolver rates;
    private final double rateUnitDays;
    private final Target[] targets;
    private final RiskEffectEngine.TargetEffects[] effects;
    // PAF table deflating each rate transition's base rate, null if none
    private final String[] pafTable;

    public DiseaseStateMachine(int causeIndex, CauseGraph graph, RateResolver rates, RiskEffectEngine engine,
            Map<Target, String> pafTables, double rateUnitDays) {
        this.causeIndex = causeIndex;
        this.graph = graph;
        this.rates = rates;
        this.rateUnitDays = rateUnitDays;
        int m = graph.transitionCount();
        this.targets = new Target[m];
        this.effects = new RiskEffectEngine.TargetEffects[m];
        this.pafTable = new String[m];
        for (int ti = 0; ti < m; ti++) {
            Transition t = graph.transition(ti);
            if (t.dataType() == DataType.DWELL_TIME)
                continue;
            targets[ti] = new Target(graph.cause(), t.name(), t.rateName());
            effects[ti] = engine.effects(targets[ti]);
            pafTable[ti] = pafTables.get(targets[ti]);
            rates.require(t.dataRef(), "Transition " + t.name());
            if (pafTable[ti] != null && !rates.hasTable(pafTable[ti]))
                throw new ConfigurationException("PAF table " + pafTable[ti] + " of " + targets[ti] + " not loaded");
        }
        for (int si = 0; si < graph.stateCount(); si++)
            rates.require(graph.state(si).dwellTime(), "State " + graph.state(si).id());
    }

    public int causeIndex() {
        return causeIndex;
    }

    public CauseGraph graph() {
        return graph;
    }

    /** Target of a rate or proportion transition, null for dwell-time transitions. */
    public Target target(int ti) {
        return targets[ti];
    }

    /** Exponential-hazard probability of at least one event in {@code dt} at constant {@code rate}. */
    public static double transitionProbability(double rate, double dt) {
        if (rate < 0 || dt < 0)
            throw new IllegalArgumentException("rate and dt must be non-negative");
        return -Math.expm1(-rate * dt);
    }

    /**
     * Risk-adjusted rate of a rate transition, per day.
     */
    public double adjustedDailyRate(int ti, Demographics who, double year, ExposureVector x) {
        Transition t = graph.transition(ti);
        double base = rates.resolve(t.dataRef(), who, year);
        if (pafTable[ti] != null)
            base *= 1 - rates.resolve(pafTable[ti], who, year);
        if (!(base >= 0))
            throw new ConfigurationException("Rate of " + targets[ti] + " is " + base + " for " + who);
        return base * effects[ti].relativeRisk(x, who, year) / rateUnitDays;
    }

    /**
     * Per-step probability of each outgoing rate transition of a state, indexed
     * by transition index (other entries 0).
     */
    public double[] transitionProbabilities(int si, Demographics who, double year, ExposureVector x, double dt) {
        double[] p = new double[graph.transitionCount()];
        if (graph.dwellTransition(si) >= 0)
            return p;
        double total = 0;
        for (int k = graph.outStart(si); k < graph.outEnd(si); k++) {
            int ti = graph.outAt(k);
            if (graph.transition(ti).dataType() == DataType.RATE) {
                p[ti] = adjustedDailyRate(ti, who, year, x);
                total += p[ti];
            }
        }
        if (total <= 0)
            return new double[p.length];
        double exit = transitionProbability(total, dt);
        for (int ti = 0; ti < p.length; ti++)
            p[ti] = p[ti] * exit / total;
        return p;
    }

    /**
     * Advances one simulant by one step.
     *
     * @param t    Simulation time at the start of the step, in days.
     * @param dt   Step length in days.
     * @param step Step number, part of the random key.
     * @return Number of transitions taken.
     * @throws InvalidTransitionException if a disallowed self-transition is selected.
     */
    public int step(Population pop, Simulant s, double t, double dt, int step, RandomKeys keys, StepObserver obs) {
        int i = s.index();
        int si = pop.state(causeIndex, i);
        double entry = pop.entryTime(causeIndex, i);
        double event = t + dt;

        int dwell = graph.dwellTransition(si);
        if (dwell >= 0) {
            double dwellDays = rates.durationDays(graph.state(si).dwellTime(), s.who(), s.year());
            if (event - entry < dwellDays - DWELL_EPSILON)
                return 0;
            obs.transitioned(causeIndex, dwell, s);
            return 1 + enter(pop, s, graph.sink(dwell), event, step, keys, obs);
        }

        int start = graph.outStart(si), end = graph.outEnd(si);
        int rateCount = 0;
        double total = 0;
        double[] r = new double[end - start];
        for (int k = start; k < end; k++) {
            int ti = graph.outAt(k);
            if (graph.transition(ti).dataType() != DataType.RATE)
                continue;
            obs.atRisk(causeIndex, ti, s, dt);
            r[k - start] = adjustedDailyRate(ti, s.who(), s.year(), s.exposure());
            total += r[k - start];
            rateCount++;
        }
        if (rateCount == 0 || total <= 0)
            return 0;

        double exit = transitionProbability(total, dt);
        double u = keys.uniform(RandomKeys.Stream.TRANSITION, s.id(), causeIndex, step);
        if (u >= exit)
            return 0;

        // Proportional allocation of the exit mass
        double cum = 0;
        int chosen = -1;
        for (int k = start; k < end; k++) {
            if (r[k - start] <= 0)
                continue;
            chosen = graph.outAt(k);
            cum += exit * r[k - start] / total;
            if (u < cum)
                break;
        }
        obs.transitioned(causeIndex, chosen, s);
        int sink = graph.sink(chosen);
        if (sink == si) {
            requireSelfTransition(si, chosen);
            return 1;
        }
        return 1 + enter(pop, s, sink, event, step, keys, obs);
    }

    /** Moves the simulant into a state and applies proportion splits. Returns the number of splits. */
    private int enter(Population pop, Simulant s, int si, double event, int step, RandomKeys keys,
            StepObserver obs) {
        int i = s.index();
        pop.moveTo(causeIndex, i, si, event);
        int splits = 0;
        int guard = graph.stateCount();
        while (graph.splitsOnEntry(si)) {
            if (splits == guard)
                throw new InvalidTransitionException("Proportion splits out of " + graph.state(si).id()
                        + " did not settle within " + guard + " moves");
            // splits never exceeds the state count, so (step, splits) pairs do not collide
            int ti = chooseSplit(si, s, keys.uniform(RandomKeys.Stream.SPLIT, s.id(), causeIndex,
                    (long) step * (guard + 1) + splits));
            if (ti < 0)
                break;
            obs.transitioned(causeIndex, ti, s);
            splits++;
            int sink = graph.sink(ti);
            if (sink == si) {
                requireSelfTransition(si, ti);
                break;
            }
            pop.moveTo(causeIndex, i, sink, event);
            si = sink;
        }
        return splits;
    }

    private int chooseSplit(int si, Simulant s, double u) {
        State state = graph.state(si);
        int start = graph.outStart(si), end = graph.outEnd(si);
        double[] p = new double[end - start];
        double total = 0;
        for (int k = start; k < end; k++) {
            Transition t = graph.transition(graph.outAt(k));
            if (t.dataType() != DataType.PROPORTION)
                continue;
            DataRef ref = t.dataRef();
            p[k - start] = rates.resolve(ref, s.who(), s.year());
            if (!(p[k - start] >= 0))
                throw new ConfigurationException("Proportion of " + t.name() + " is " + p[k - start]);
            total += p[k - start];
        }
        // A transient state must be left; a non-transient state keeps the residual
        double scale = state.isTransient() ? total : Math.max(total, 1.0);
        if (!(total > 0)) {
            if (state.isTransient())
                throw new InvalidTransitionException("Transient state " + state.id() + " has no outflow for "
                        + s.who());
            return -1;
        }
        double cum = 0;
        int last = -1;
        for (int k = start; k < end; k++) {
            if (p[k - start] <= 0)
                continue;
            last = graph.outAt(k);
            cum += p[k - start] / scale;
            if (u < cum)
                return last;
        }
        return state.isTransient() ? last : -1;
    }

    private void requireSelfTransition(int si, int ti) {
        if (!graph.state(si).allowSelfTransition())
            throw new InvalidTransitionException("Transition " + graph.transition(ti).name()
                    + " re-enters " + graph.state(si).id() + " which does not allow self transitions");
    }

    /** Excess mortality rate override of the simulant's current state, 0 when absent. */
    public double excessMortalityRate(int si, Demographics who, double year) {
        DataRef ref = graph.state(si).excessMortalityRate();
        return ref == null ? 0 : rates.resolve(ref, who, year);
    }

    /** Disability weight override of the simulant's current state, 0 when absent. */
    public double disabilityWeight(int si, Demographics who, double year) {
        DataRef ref = graph.state(si).disabilityWeight();
        return ref == null ? 0 : rates.resolve(ref, who, year);
    }
}
