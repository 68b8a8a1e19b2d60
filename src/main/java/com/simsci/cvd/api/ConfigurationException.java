package com.simsci.cvd.api;

/**
 * Malformed model configuration: bad cause/transition graph, missing table,
 * invalid parameter. Fatal at load time.
 */
public class ConfigurationException extends SimulationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
