package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

/**
 * A rate that risk effects act on: one transition of one cause, under one of
 * its logical rate names.
 */
public record Target(String cause, String transition, RateName rateName) {

    /** Parses {@code cause.transition.rate_name}. */
    public static Target parse(String s) {
        int last = s.lastIndexOf('.');
        int first = s.indexOf('.');
        if (first <= 0 || last <= first)
            throw new ConfigurationException("Target must be cause.transition.rate_name: " + s);
        return new Target(s.substring(0, first), s.substring(first + 1, last),
                RateName.fromKey(s.substring(last + 1)));
    }

    @Override
    public String toString() {
        return cause + "." + transition + "." + rateName.key();
    }
}
