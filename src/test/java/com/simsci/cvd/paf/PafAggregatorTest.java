package com.simsci.cvd.paf;

import com.simsci.cvd.io.ModelCompiler;
import com.simsci.cvd.io.ModelDefinition;
import com.simsci.cvd.io.ModelLoader;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Sex;
import com.simsci.cvd.model.Target;

import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.Assert.*;

public class PafAggregatorTest {

    private static final Target IHD = Target.parse(
            "ischemic_heart_disease.susceptible_to_acute_myocardial_infarction.incidence_rate");

    private static ModelCompiler.CompiledModel fixture(int population, String method) throws Exception {
        ModelDefinition def = ModelLoader.readResource("ihd_model.json");
        def.getSimulation().setPopulationSize(population);
        def.getSimulation().setPafMethod(method);
        return new ModelCompiler().compile(def);
    }

    @Test
    public void testPafFormula() {
        assertEquals(0.25, PafAggregator.paf(0.04, 0.03), 1e-12);
        assertEquals(0.0, PafAggregator.paf(0.0, 0.0), 0.0);
        assertEquals(0.0, PafAggregator.paf(0.0, 0.01), 0.0);
        // Protective exposures clamp at 0
        assertEquals(0.0, PafAggregator.paf(0.02, 0.03), 0.0);
        // Never reaches 1
        assertTrue(PafAggregator.paf(0.02, 0.0) < 1.0);
        assertEquals(1.0 / 6.0, PafAggregator.pafFromMeanRelativeRisk(1.2), 1e-12);
        assertEquals(0.0, PafAggregator.pafFromMeanRelativeRisk(0.8), 0.0);
    }

    @Test
    public void testJointPafBounds() {
        assertEquals(0.0, PafAggregator.jointPaf(), 0.0);
        assertEquals(0.3, PafAggregator.jointPaf(0.3), 1e-12);
        assertEquals(1 - 0.7 * 0.8, PafAggregator.jointPaf(0.3, 0.2), 1e-12);

        Random rnd = new Random(11);
        for (int trial = 0; trial < 1000; trial++) {
            double[] pafs = new double[1 + rnd.nextInt(5)];
            for (int i = 0; i < pafs.length; i++)
                pafs[i] = rnd.nextDouble() * 0.99;
            double joint = PafAggregator.jointPaf(pafs);
            assertTrue(joint < 1.0);
            for (double p : pafs)
                assertTrue(joint >= p);
        }
    }

    @Test
    public void testFixtureDrawRecords() throws Exception {
        // 1. Setup
        ModelCompiler.CompiledModel model = fixture(20000, "incidence_ratio");
        PafAggregator aggregator = model.newAggregator(model.newSimulation(null));

        // 2. Execute
        DrawOutput out = aggregator.computeDraw("v1", "Alabama", 0);

        // 3. Verify: 4 risks x 1 target x 4 cells, one joint PAF per cell
        assertEquals(16, out.pafs().size());
        assertEquals(4, out.jointPafs().size());
        assertEquals(4, aggregator.contributingRisks().size());
        for (PafRecord p : out.pafs()) {
            assertEquals(IHD, p.target());
            assertTrue(p.key(), p.value() >= 0 && p.value() < 1);
        }
        for (JointPafRecord j : out.jointPafs()) {
            assertTrue(j.value() < 1);
            for (PafRecord p : out.pafs())
                if (p.cell().equals(j.cell()))
                    assertTrue(j.key(), j.value() >= p.value());
        }
        assertEquals(20, out.values().size());
        assertTrue(out.values().containsKey("risk_factor.smoking.population_attributable_fraction:"
                + IHD + ":male.60_plus"));
        assertTrue(out.values().containsKey("risk_factor.joint_mediated_risks.population_attributable_fraction:"
                + IHD + ":female.30_to_59"));
    }

    @Test
    public void testDrawIsReproducible() throws Exception {
        ModelCompiler.CompiledModel model = fixture(2000, "incidence_ratio");
        Map<String, Double> first = model.newAggregator(model.newSimulation(null)).computeDraw("v1", "Alabama", 2)
                .values();
        Map<String, Double> second = model.newAggregator(model.newSimulation(null)).computeDraw("v1", "Alabama", 2)
                .values();
        assertEquals(first, second);
    }

    @Test
    public void testMeanRelativeRiskMethod() throws Exception {
        // 1. Setup: smoking RR 2 for the 20% current smokers, so mean RR is 1.2
        ModelCompiler.CompiledModel model = fixture(20000, "mean_relative_risk");

        // 2. Execute
        DrawOutput out = model.newAggregator(model.newSimulation(null)).computeDraw("v1", "New York", 0);

        // 3. Verify
        int smoking = 0;
        for (PafRecord p : out.pafs()) {
            if (!p.riskId().equals("smoking"))
                continue;
            smoking++;
            assertEquals(p.key(), 1.0 / 6.0, p.value(), 0.03);
        }
        assertEquals(4, smoking);
    }

    @Test
    public void testStratificationCells() {
        Stratification strata = new Stratification(List.of(
                new AgeGroup("60_plus", 60, 125), new AgeGroup("30_to_59", 30, 60)));
        assertEquals(4, strata.cellCount());
        assertEquals("male.30_to_59", strata.cell(0).toString());
        assertEquals("female.60_plus", strata.cell(3).toString());
        assertEquals(3, strata.cellOf(new Demographics(Sex.FEMALE, 70)));
        assertEquals(-1, strata.cellOf(new Demographics(Sex.MALE, 20)));
        assertEquals(new StratificationCell(Sex.MALE, "60_plus"),
                StratificationCell.parse("male.60_plus"));
    }
}
