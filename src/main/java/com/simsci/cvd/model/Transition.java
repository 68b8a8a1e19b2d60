package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * A directed edge between two states of the same cause.
 *
 * @param name        Transition name, unique within its cause.
 * @param source      Source state id.
 * @param sink        Sink state id.
 * @param dataType    How the transition probability is derived.
 * @param dataSources Logical rate name to data source. Empty for dwell-time transitions.
 */
public record Transition(String name, String source, String sink, DataType dataType,
        Map<RateName, DataRef> dataSources) {

    public Transition {
        dataSources = dataSources == null || dataSources.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(dataSources));
    }

    public static Transition rate(String name, String source, String sink, RateName rateName, DataRef ref) {
        if (!rateName.isRate())
            throw new ConfigurationException("Rate transition " + name + " cannot bind " + rateName);
        return new Transition(name, source, sink, DataType.RATE, Map.of(rateName, ref));
    }

    public static Transition dwellTime(String name, String source, String sink) {
        return new Transition(name, source, sink, DataType.DWELL_TIME, Map.of());
    }

    public static Transition proportion(String name, String source, String sink, DataRef ref) {
        return new Transition(name, source, sink, DataType.PROPORTION, Map.of(RateName.PROPORTION, ref));
    }

    /**
     * The single logical rate name this transition is driven by, or null for
     * dwell-time transitions.
     */
    public RateName rateName() {
        return switch (dataType) {
            case DWELL_TIME -> null;
            case PROPORTION -> RateName.PROPORTION;
            case RATE -> {
                RateName found = null;
                for (RateName r : dataSources.keySet()) {
                    if (r.isRate()) {
                        if (found != null)
                            throw new ConfigurationException(
                                    "Rate transition " + name + " binds more than one rate: " + dataSources.keySet());
                        found = r;
                    }
                }
                if (found == null)
                    throw new ConfigurationException("Rate transition " + name + " binds no rate");
                yield found;
            }
        };
    }

    /** Data source for {@link #rateName()}. */
    public DataRef dataRef() {
        RateName r = rateName();
        return r == null ? null : dataSources.get(r);
    }
}
