package com.simsci.cvd.api;

/**
 * Observability hooks for a running draw.
 *
 * <p>
 * Callbacks fire on the thread driving the draw, between steps, never from
 * inside the per-simulant worker tasks (except {@link #onSimulantError}, which
 * may fire from a worker). Implementations must stay cheap: anything slow here
 * slows every step of every draw.
 */
public interface SimulationListener {

    /**
     * Called once before the first step of a draw.
     *
     * @param location Location being simulated.
     * @param draw     Draw index.
     */
    void onDrawStart(String location, int draw);

    /**
     * Called after a time step has been applied to every simulant.
     *
     * @param step          Zero-based step number.
     * @param timeDays      Simulation time at the start of the step, in days.
     * @param transitions   Number of state changes made during the step.
     * @param durationNanos Wall time spent on the step.
     */
    void onStepEnd(int step, double timeDays, int transitions, long durationNanos);

    /**
     * Called when updating a simulant fails. The draw is aborted afterwards.
     *
     * @param step        Step during which the failure occurred.
     * @param simulantId  Id of the simulant being updated.
     * @param error       The failure.
     */
    void onSimulantError(int step, long simulantId, Throwable error);

    /**
     * Called once after the draw has finished or aborted.
     *
     * @param healthy false if the draw aborted on an error.
     */
    void onDrawEnd(String location, int draw, boolean healthy);
}
