package com.simsci.cvd.model;

import java.util.List;

/**
 * A named disease with its states and transitions, fixed at configuration load.
 *
 * @param name         Cause name.
 * @param states       Declared states, in declaration order.
 * @param transitions  Declared transitions.
 * @param initialState State every simulant starts in.
 */
public record Cause(String name, List<State> states, List<Transition> transitions, String initialState) {

    public static final String SUSCEPTIBLE = "susceptible";

    public Cause {
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
        if (initialState == null)
            initialState = SUSCEPTIBLE;
    }
}
