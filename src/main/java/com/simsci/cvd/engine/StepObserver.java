package com.simsci.cvd.engine;

/**
 * Accumulates per-step facts while a draw runs.
 *
 * <p>
 * The simulation forks one observer per chunk of simulants and merges the
 * forks back in chunk order when the draw ends, so an observer only ever
 * sees one thread and merged totals are independent of scheduling.
 */
public interface StepObserver {

    /**
     * The simulant starts the step in the source state of a rate transition.
     *
     * @param cause      Cause index.
     * @param transition Transition index within the cause.
     * @param dtDays     Person-time contributed, in days.
     */
    void atRisk(int cause, int transition, Simulant simulant, double dtDays);

    /** The simulant took a transition during the step. */
    void transitioned(int cause, int transition, Simulant simulant);

    /** New, empty observer of the same shape. */
    StepObserver fork();

    /** Adds another fork's totals into this observer. */
    void merge(StepObserver other);

    StepObserver NONE = new StepObserver() {
        @Override
        public void atRisk(int cause, int transition, Simulant simulant, double dtDays) {
        }

        @Override
        public void transitioned(int cause, int transition, Simulant simulant) {
        }

        @Override
        public StepObserver fork() {
            return this;
        }

        @Override
        public void merge(StepObserver other) {
        }
    };
}
