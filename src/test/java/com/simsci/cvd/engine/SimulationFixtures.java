package com.simsci.cvd.engine;

import com.simsci.cvd.model.Cause;
import com.simsci.cvd.model.CauseGraph;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.RateName;
import com.simsci.cvd.model.State;
import com.simsci.cvd.model.Transition;
import com.simsci.cvd.rate.Interpolation;
import com.simsci.cvd.rate.RateResolver;
import com.simsci.cvd.rate.RateTable;
import com.simsci.cvd.risk.ExposureSampler;
import com.simsci.cvd.risk.ExposureVector;
import com.simsci.cvd.risk.RiskCatalog;
import com.simsci.cvd.risk.RiskEffectEngine;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/** Single-cause simulations without risk factors. */
final class SimulationFixtures {
    static final RiskCatalog NO_RISKS = new RiskCatalog(List.of());
    static final ExposureVector NO_EXPOSURE = new ExposureVector(NO_RISKS, new double[0], new boolean[0]);

    private SimulationFixtures() {
    }

    static RateResolver rates(RateTable... tables) {
        Map<String, RateTable> byKey = new HashMap<>();
        for (RateTable t : tables)
            byKey.put(t.key(), t);
        return new RateResolver(byKey, Interpolation.DEFAULT);
    }

    static DiseaseStateMachine machine(Cause cause, RateResolver rates, double rateUnitDays) {
        RiskEffectEngine engine = new RiskEffectEngine(NO_RISKS, List.of(), rates);
        return new DiseaseStateMachine(0, CauseGraph.compile(cause), rates, engine, Map.of(), rateUnitDays);
    }

    static Simulation simulation(Cause cause, SimulationSettings settings, RateResolver rates,
            ExecutorService executor) {
        DiseaseStateMachine m = machine(cause, rates, settings.rateUnitDays());
        return new Simulation(settings, List.of(m), new ExposureSampler(NO_RISKS, List.of()), rates, executor);
    }

    /** susceptible -> diseased at a constant rate. */
    static Cause twoState(Object rate) {
        return new Cause("ischemic_heart_disease",
                List.of(State.builder("susceptible").build(), State.builder("diseased").build()),
                List.of(Transition.rate("incidence", "susceptible", "diseased", RateName.INCIDENCE_RATE,
                        DataRef.parse(rate))),
                null);
    }

    static SimulationSettings.Builder settings(int population) {
        return SimulationSettings.builder()
                .populationSize(population)
                .ages(30, 95)
                .startYear(2021)
                .stepDays(28)
                .steps(1)
                .rateUnitDays(1)
                .seed(42);
    }
}
