package com.simsci.cvd.io;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.UnknownRiskException;
import com.simsci.cvd.model.CauseGraph;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Sex;
import com.simsci.cvd.model.Target;
import com.simsci.cvd.paf.PafMethod;
import com.simsci.cvd.risk.RiskFactor;

import org.junit.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.*;

public class ModelCompilerTest {

    private static final Target IHD = Target.parse(
            "ischemic_heart_disease.susceptible_to_acute_myocardial_infarction.incidence_rate");

    @Test
    public void testCompileFixture() throws Exception {
        // 1. Setup
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");

        // 2. Execute
        ModelCompiler.CompiledModel model = new ModelCompiler().compile(def);

        // 3. Verify
        assertEquals(2000, model.settings().populationSize());
        assertEquals(365.25, model.settings().rateUnitDays(), 0.0);
        assertEquals(1, model.causes().size());
        CauseGraph ihd = model.causes().get(0);
        assertEquals(3, ihd.stateCount());
        assertTrue(ihd.state(ihd.stateIndex("acute_myocardial_infarction")).hasDwellTime());
        assertFalse(ihd.state(ihd.stateIndex("acute_myocardial_infarction")).allowSelfTransition());

        assertEquals(4, model.catalog().size());
        assertEquals(1, model.catalog().groupCount());
        List<String> order = model.engine().risksAffecting(IHD);
        assertEquals(4, order.size());
        assertTrue(order.indexOf("high_systolic_blood_pressure") < order.indexOf("high_body_mass_index"));

        assertEquals(4, model.stratification().cellCount());
        assertEquals(PafMethod.INCIDENCE_RATIO, model.pafMethod());
        assertEquals(3, model.orchestration().drawCount());
        assertEquals(List.of("Alabama", "New York"), model.orchestration().locations());
        assertEquals(Duration.ofMinutes(5), model.orchestration().limits().wallClock());
        assertEquals(0.06, model.rates().resolve("cause.ihd.incidence_rate",
                new Demographics(Sex.MALE, 70), 2021), 0.0);
    }

    @Test
    public void testBothSexesExpand() throws Exception {
        ModelCompiler.CompiledModel model = new ModelCompiler().compile(ModelLoader.readResource("ihd_model.json"));
        for (Sex s : Sex.values())
            assertEquals(138, model.rates().resolve("risk.sbp.mean",
                    new Demographics(s, 75), 2030), 0.0);
    }

    @Test
    public void testUnknownComponentTypeRejected() throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getRisks().get("high_body_mass_index").getExposure().setType("weibull");
        try {
            new ModelCompiler().compile(def);
            fail("expected ConfigurationException");
        } catch (ConfigurationException expected) {
            assertTrue(expected.getMessage().contains("weibull"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testRelativeRiskUsedAsExposureRejected() throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getRisks().get("high_body_mass_index").getExposure().setType("log_linear");
        new ModelCompiler().compile(def);
    }

    @Test(expected = ConfigurationException.class)
    public void testUnknownTransitionTargetRejected() throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getEffects().get(0).setTarget("ischemic_heart_disease.no_such_transition.incidence_rate");
        new ModelCompiler().compile(def);
    }

    @Test(expected = ConfigurationException.class)
    public void testDwellTransitionTargetRejected() throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getEffects().get(0).setTarget(
                "ischemic_heart_disease.acute_myocardial_infarction_to_post_myocardial_infarction.incidence_rate");
        new ModelCompiler().compile(def);
    }

    @Test(expected = UnknownRiskException.class)
    public void testEffectOfUnknownRiskRejected() throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getEffects().get(0).setRisk("salt");
        new ModelCompiler().compile(def);
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingTableRejected() throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getTables().remove("cause.ihd.incidence_rate");
        new ModelCompiler().compile(def);
    }

    @Test(expected = ConfigurationException.class)
    public void testMalformedJsonRejected() {
        ModelLoader.parse("{ \"simulation\": { \"population_size\": \"many\" } }");
    }

    @Test
    public void testCustomComponentRegistration() throws Exception {
        // 1. Setup: replace the normal factory with a fixed-exposure one
        ModelCompiler compiler = new ModelCompiler();
        compiler.registry().registerRisk(ComponentType.NORMAL, (id, def, props) ->
                RiskFactor.continuous(id, (p, who, year, rates) -> def.getTmrel(), def.getTmrel()));

        // 2. Execute
        ModelCompiler.CompiledModel model = compiler.compile(ModelLoader.readResource("ihd_model.json"));

        // 3. Verify
        assertEquals(4, model.catalog().size());
    }
}
