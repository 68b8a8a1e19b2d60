package com.simsci.cvd.api;

/** An exposure value lies outside its distribution's support after clipping. */
public class InvalidExposureException extends SimulationException {

    public InvalidExposureException(String message) {
        super(message);
    }
}
