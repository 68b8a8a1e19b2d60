package com.simsci.cvd.util;

import com.simsci.cvd.api.SimulationListener;

import java.util.Arrays;

/** Fans simulation callbacks out to several listeners, in registration order. */
public final class CompositeSimulationListener implements SimulationListener {
    private volatile SimulationListener[] listeners = new SimulationListener[0];

    public synchronized void add(SimulationListener listener) {
        SimulationListener[] old = listeners;
        SimulationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onDrawStart(String location, int draw) {
        for (SimulationListener l : listeners)
            l.onDrawStart(location, draw);
    }

    @Override
    public void onStepEnd(int step, double timeDays, int transitions, long durationNanos) {
        for (SimulationListener l : listeners)
            l.onStepEnd(step, timeDays, transitions, durationNanos);
    }

    @Override
    public void onSimulantError(int step, long simulantId, Throwable error) {
        for (SimulationListener l : listeners)
            l.onSimulantError(step, simulantId, error);
    }

    @Override
    public void onDrawEnd(String location, int draw, boolean healthy) {
        for (SimulationListener l : listeners)
            l.onDrawEnd(location, draw, healthy);
    }
}
