package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CauseGraphTest {

    private static final DataRef RATE = DataRef.literal(0.01);

    private static State state(String id) {
        return State.builder(id).build();
    }

    @Test
    public void testCyclicGraphCompiles() {
        // acute <-> chronic re-entry
        Cause ihd = new Cause("ischemic_heart_disease",
                List.of(state("susceptible"),
                        State.builder("acute").dwellTime(DataRef.parse("28 days")).build(),
                        state("chronic")),
                List.of(Transition.rate("incidence", "susceptible", "acute", RateName.INCIDENCE_RATE, RATE),
                        Transition.dwellTime("acute_to_chronic", "acute", "chronic"),
                        Transition.rate("reinfarction", "chronic", "acute", RateName.TRANSITION_RATE, RATE)),
                null);
        CauseGraph g = CauseGraph.compile(ihd);

        assertEquals(3, g.stateCount());
        assertEquals(0, g.initialState());
        int acute = g.stateIndex("acute"), chronic = g.stateIndex("chronic");
        assertEquals(1, g.outCount(acute));
        assertEquals(g.transitionIndex("acute_to_chronic"), g.dwellTransition(acute));
        assertEquals(chronic, g.sink(g.dwellTransition(acute)));
        assertEquals(acute, g.sink(g.outAt(g.outStart(chronic))));
        assertEquals(-1, g.dwellTransition(chronic));
    }

    @Test
    public void testProportionStateSplitsOnEntry() {
        Cause c = new Cause("stroke",
                List.of(state("susceptible"), State.builder("event").isTransient(true).build(),
                        state("ischemic"), state("hemorrhagic")),
                List.of(Transition.rate("incidence", "susceptible", "event", RateName.INCIDENCE_RATE, RATE),
                        Transition.proportion("to_ischemic", "event", "ischemic", DataRef.literal(0.8)),
                        Transition.proportion("to_hemorrhagic", "event", "hemorrhagic", DataRef.literal(0.2))),
                null);
        CauseGraph g = CauseGraph.compile(c);
        assertTrue(g.splitsOnEntry(g.stateIndex("event")));
        assertFalse(g.splitsOnEntry(g.stateIndex("susceptible")));
    }

    @Test(expected = ConfigurationException.class)
    public void testUnknownSinkRejected() {
        CauseGraph.compile(new Cause("c", List.of(state("susceptible")),
                List.of(Transition.rate("t", "susceptible", "nowhere", RateName.INCIDENCE_RATE, RATE)), null));
    }

    @Test(expected = ConfigurationException.class)
    public void testDuplicateStateRejected() {
        CauseGraph.compile(new Cause("c", List.of(state("susceptible"), state("susceptible")), List.of(), null));
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingInitialStateRejected() {
        CauseGraph.compile(new Cause("c", List.of(state("healthy")), List.of(), null));
    }

    @Test(expected = ConfigurationException.class)
    public void testDwellStateNeedsDwellTransition() {
        CauseGraph.compile(new Cause("c",
                List.of(state("susceptible"), State.builder("acute").dwellTime(DataRef.literal(28)).build()),
                List.of(Transition.rate("t", "susceptible", "acute", RateName.INCIDENCE_RATE, RATE)), null));
    }

    @Test(expected = ConfigurationException.class)
    public void testDwellStateHasOnlyItsDwellExit() {
        CauseGraph.compile(new Cause("c",
                List.of(state("susceptible"), State.builder("acute").dwellTime(DataRef.literal(28)).build()),
                List.of(Transition.rate("t", "susceptible", "acute", RateName.INCIDENCE_RATE, RATE),
                        Transition.dwellTime("back", "acute", "susceptible"),
                        Transition.rate("remit", "acute", "susceptible", RateName.REMISSION_RATE, RATE)),
                null));
    }

    @Test(expected = ConfigurationException.class)
    public void testDwellTransitionFromPlainStateRejected() {
        CauseGraph.compile(new Cause("c", List.of(state("susceptible"), state("other")),
                List.of(Transition.dwellTime("d", "susceptible", "other")), null));
    }

    @Test(expected = ConfigurationException.class)
    public void testTransientStateNeedsProportions() {
        CauseGraph.compile(new Cause("c",
                List.of(state("susceptible"), State.builder("event").isTransient(true).build()),
                List.of(Transition.rate("t", "susceptible", "event", RateName.INCIDENCE_RATE, RATE)), null));
    }

    @Test(expected = ConfigurationException.class)
    public void testTransientProportionsMustSumToOne() {
        CauseGraph.compile(new Cause("c",
                List.of(state("susceptible"), State.builder("event").isTransient(true).build(), state("a")),
                List.of(Transition.rate("t", "susceptible", "event", RateName.INCIDENCE_RATE, RATE),
                        Transition.proportion("p", "event", "a", DataRef.literal(0.6))),
                null));
    }

    @Test(expected = ConfigurationException.class)
    public void testProportionsAboveOneRejected() {
        CauseGraph.compile(new Cause("c", List.of(state("susceptible"), state("a"), state("b")),
                List.of(Transition.proportion("pa", "susceptible", "a", DataRef.literal(0.7)),
                        Transition.proportion("pb", "susceptible", "b", DataRef.literal(0.7))),
                null));
    }

    @Test
    public void testTargetParsing() {
        Target t = Target.parse("ischemic_heart_disease.susceptible_to_acute.incidence_rate");
        assertEquals("ischemic_heart_disease", t.cause());
        assertEquals("susceptible_to_acute", t.transition());
        assertEquals(RateName.INCIDENCE_RATE, t.rateName());
        assertEquals("ischemic_heart_disease.susceptible_to_acute.incidence_rate", t.toString());
    }

    @Test
    public void testDataRefParsing() {
        assertEquals(28.0, DataRef.parse("28 days").literal(), 0.0);
        assertEquals(0.5, DataRef.parse(0.5).literal(), 0.0);
        assertEquals("cause.ihd.incidence_rate", DataRef.parse("cause.ihd.incidence_rate").tableKey());
        assertNull(DataRef.parse(null));
    }
}
