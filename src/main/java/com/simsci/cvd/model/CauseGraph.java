package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled, index-based transition graph of one cause.
 *
 * <p>
 * States and transitions are plain integer indices into immutable tables. The
 * outgoing transitions of every state are stored in Compressed Sparse Row form:
 * <ul>
 * <li>{@code outOffset[s]} .. {@code outOffset[s+1]} (exclusive) is the range of
 * state {@code s}'s outgoing transitions in {@code outList}.</li>
 * <li>{@code outList} holds transition indices, grouped by source state.</li>
 * </ul>
 * Cycles (acute/chronic re-entry) are legal. Nothing walks the graph
 * recursively, so cycle length never matters.
 */
public final class CauseGraph {
    private final String cause;
    private final State[] states;
    private final Transition[] transitions;
    private final int[] source;
    private final int[] sink;
    private final int[] outOffset;
    private final int[] outList;
    // Index of each state's dwell-time transition, -1 if none
    private final int[] dwellTransition;
    private final boolean[] splitsOnEntry;
    private final Map<String, Integer> stateIndex;
    private final Map<String, Integer> transitionIndex;
    private final int initialState;

    private CauseGraph(String cause, State[] states, Transition[] transitions, int[] source, int[] sink,
            int[] outOffset, int[] outList, int[] dwellTransition, boolean[] splitsOnEntry,
            Map<String, Integer> stateIndex, Map<String, Integer> transitionIndex, int initialState) {
        this.cause = cause;
        this.states = states;
        this.transitions = transitions;
        this.source = source;
        this.sink = sink;
        this.outOffset = outOffset;
        this.outList = outList;
        this.dwellTransition = dwellTransition;
        this.splitsOnEntry = splitsOnEntry;
        this.stateIndex = stateIndex;
        this.transitionIndex = transitionIndex;
        this.initialState = initialState;
    }

    public String cause() {
        return cause;
    }

    public int stateCount() {
        return states.length;
    }

    public State state(int si) {
        return states[si];
    }

    public int stateIndex(String id) {
        Integer idx = stateIndex.get(id);
        if (idx == null)
            throw new ConfigurationException("Cause " + cause + " has no state " + id);
        return idx;
    }

    public int transitionCount() {
        return transitions.length;
    }

    public Transition transition(int ti) {
        return transitions[ti];
    }

    public int transitionIndex(String name) {
        Integer idx = transitionIndex.get(name);
        if (idx == null)
            throw new ConfigurationException("Cause " + cause + " has no transition " + name);
        return idx;
    }

    public int source(int ti) {
        return source[ti];
    }

    public int sink(int ti) {
        return sink[ti];
    }

    public int outStart(int si) {
        return outOffset[si];
    }

    public int outEnd(int si) {
        return outOffset[si + 1];
    }

    /** Transition index stored at a flat CSR position. */
    public int outAt(int flatIndex) {
        return outList[flatIndex];
    }

    public int outCount(int si) {
        return outOffset[si + 1] - outOffset[si];
    }

    /** Index of the state's dwell-time transition, or -1. */
    public int dwellTransition(int si) {
        return dwellTransition[si];
    }

    /** True if entering the state immediately applies a proportion split. */
    public boolean splitsOnEntry(int si) {
        return splitsOnEntry[si];
    }

    public int initialState() {
        return initialState;
    }

    /**
     * Compiles and validates a cause.
     *
     * @throws ConfigurationException on any structural error.
     */
    public static CauseGraph compile(Cause cause) {
        String name = cause.name();
        int n = cause.states().size();
        State[] states = cause.states().toArray(new State[0]);
        Map<String, Integer> stateIndex = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            if (stateIndex.put(states[i].id(), i) != null)
                throw new ConfigurationException("Cause " + name + " declares state twice: " + states[i].id());
        }

        Transition[] transitions = cause.transitions().toArray(new Transition[0]);
        int m = transitions.length;
        int[] source = new int[m], sink = new int[m];
        Map<String, Integer> transitionIndex = new HashMap<>(m * 2);
        List<List<Integer>> outgoing = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            outgoing.add(new ArrayList<>());

        int[] dwell = new int[n];
        Arrays.fill(dwell, -1);
        boolean[] splits = new boolean[n];
        double[] literalProportion = new double[n];
        boolean[] allLiteral = new boolean[n];
        Arrays.fill(allLiteral, true);

        for (int ti = 0; ti < m; ti++) {
            Transition t = transitions[ti];
            if (transitionIndex.put(t.name(), ti) != null)
                throw new ConfigurationException("Cause " + name + " declares transition twice: " + t.name());
            Integer s = stateIndex.get(t.source());
            Integer k = stateIndex.get(t.sink());
            if (s == null)
                throw new ConfigurationException("Transition " + t.name() + " has unknown source " + t.source());
            if (k == null)
                throw new ConfigurationException("Transition " + t.name() + " has unknown sink " + t.sink());
            source[ti] = s;
            sink[ti] = k;
            outgoing.get(s).add(ti);

            switch (t.dataType()) {
                case DWELL_TIME -> {
                    if (!states[s].hasDwellTime())
                        throw new ConfigurationException("Dwell-time transition " + t.name()
                                + " leaves state " + t.source() + " which has no dwell_time");
                    if (dwell[s] >= 0)
                        throw new ConfigurationException("State " + t.source() + " has more than one dwell-time transition");
                    dwell[s] = ti;
                }
                case PROPORTION -> {
                    splits[s] = true;
                    DataRef ref = t.dataRef();
                    if (ref == null)
                        throw new ConfigurationException("Proportion transition " + t.name() + " binds no proportion");
                    if (ref.isLiteral()) {
                        if (ref.literal() < 0 || ref.literal() > 1)
                            throw new ConfigurationException("Proportion of " + t.name() + " outside [0,1]: " + ref.literal());
                        literalProportion[s] += ref.literal();
                    } else {
                        allLiteral[s] = false;
                    }
                }
                case RATE -> {
                    if (t.dataRef() == null)
                        throw new ConfigurationException("Rate transition " + t.name() + " binds no data source");
                }
            }
        }

        for (int si = 0; si < n; si++) {
            State st = states[si];
            if (st.hasDwellTime() && dwell[si] < 0)
                throw new ConfigurationException("State " + st.id() + " has a dwell_time but no dwell-time transition");
            if (st.hasDwellTime() && outgoing.get(si).size() > 1)
                throw new ConfigurationException("State " + st.id() + " has a dwell_time and may only be left"
                        + " by its dwell-time transition");
            if (st.isTransient() && !splits[si])
                throw new ConfigurationException("Transient state " + st.id() + " has no proportion transitions");
            if (splits[si] && literalProportion[si] > 1 + 1e-9)
                throw new ConfigurationException("Proportions out of " + st.id() + " sum to " + literalProportion[si]);
            if (st.isTransient() && allLiteral[si] && Math.abs(literalProportion[si] - 1) > 1e-9)
                throw new ConfigurationException("Proportions out of transient state " + st.id()
                        + " must sum to 1, got " + literalProportion[si]);
        }

        Integer initial = stateIndex.get(cause.initialState());
        if (initial == null)
            throw new ConfigurationException("Cause " + name + " has no initial state " + cause.initialState());

        // Build CSR structure
        int[] offsets = new int[n + 1];
        for (int si = 0; si < n; si++)
            offsets[si + 1] = offsets[si] + outgoing.get(si).size();
        int[] flat = new int[m];
        for (int si = 0; si < n; si++) {
            List<Integer> out = outgoing.get(si);
            for (int j = 0; j < out.size(); j++)
                flat[offsets[si] + j] = out.get(j);
        }

        return new CauseGraph(name, states, transitions, source, sink, offsets, flat, dwell, splits,
                Map.copyOf(stateIndex), Map.copyOf(transitionIndex), initial);
    }
}
