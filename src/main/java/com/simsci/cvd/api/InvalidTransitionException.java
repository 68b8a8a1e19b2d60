package com.simsci.cvd.api;

/** A simulant attempted a transition its current state forbids. */
public class InvalidTransitionException extends SimulationException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
