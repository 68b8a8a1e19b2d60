package com.simsci.cvd.api;

/**
 * A data lookup fell outside the domain its table supports. Aborts the current
 * draw.
 */
public class DataRangeException extends SimulationException {

    public DataRangeException(String message) {
        super(message);
    }
}
