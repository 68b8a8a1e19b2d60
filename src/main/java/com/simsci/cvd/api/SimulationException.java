package com.simsci.cvd.api;

/**
 * Root of the simulation error taxonomy.
 *
 * <p>
 * All simulation errors are unchecked: each one aborts the draw that raised it
 * and is never retried in place. Recovery, where it exists, happens one level
 * up by re-submitting the affected draw.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
