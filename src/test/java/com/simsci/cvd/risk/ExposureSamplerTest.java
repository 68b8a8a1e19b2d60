package com.simsci.cvd.risk;

import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Sex;
import com.simsci.cvd.rate.Interpolation;
import com.simsci.cvd.rate.RateResolver;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ExposureSamplerTest {

    private static final Demographics WHO = new Demographics(Sex.MALE, 48);
    private static final RateResolver RATES = new RateResolver(Map.of(), Interpolation.DEFAULT);

    private static RiskFactor ldl() {
        return RiskFactor.truncated("high_ldl_cholesterol",
                new NormalExposure(DataRef.literal(3.2), DataRef.literal(0.9)), 2.0, 4.0, 1.5);
    }

    private static ExposureVector sample(RiskFactor risk, double propensity) {
        ExposureSampler sampler = new ExposureSampler(new RiskCatalog(List.of(risk)), List.of());
        return sampler.exposures(new double[] { propensity }, new boolean[0], WHO, 2021, RATES);
    }

    @Test
    public void testClipOnlyAppliesToTruncatedRisks() {
        RiskFactor truncated = ldl();
        assertEquals(2.0, truncated.clip(0.3), 0.0);
        assertEquals(4.0, truncated.clip(9.0), 0.0);
        assertEquals(3.1, truncated.clip(3.1), 0.0);

        RiskFactor plain = RiskFactor.continuous("high_systolic_blood_pressure",
                new NormalExposure(DataRef.literal(130), DataRef.literal(15)), 110);
        assertEquals(-5.0, plain.clip(-5.0), 0.0);
    }

    @Test
    public void testTruncatedExposureIsClippedNotResampled() {
        // Tail propensities land exactly on the limits
        assertEquals(2.0, sample(ldl(), 1e-6).value(0), 0.0);
        assertEquals(4.0, sample(ldl(), 1 - 1e-6).value(0), 0.0);
        // The median stays where the distribution puts it
        assertEquals(3.2, sample(ldl(), 0.5).value(0), 1e-12);

        for (double u = 0.01; u < 1; u += 0.01) {
            double x = sample(ldl(), u).value(0);
            assertTrue(x >= 2.0 && x <= 4.0);
        }
    }

    @Test(expected = InvalidExposureException.class)
    public void testNonFiniteExposureRejected() {
        RiskFactor broken = RiskFactor.continuous("high_body_mass_index",
                (u, who, year, rates) -> Double.POSITIVE_INFINITY, 22);
        sample(broken, 0.5);
    }

    @Test(expected = InvalidExposureException.class)
    public void testNaNSurvivesClippingAndIsRejected() {
        RiskFactor broken = RiskFactor.truncated("high_ldl_cholesterol",
                (u, who, year, rates) -> Double.NaN, 2.0, 4.0, 1.5);
        sample(broken, 0.5);
    }

    @Test
    public void testInfiniteExposureClippedToCeiling() {
        RiskFactor capped = RiskFactor.truncated("high_ldl_cholesterol",
                (u, who, year, rates) -> Double.POSITIVE_INFINITY, 2.0, 4.0, 1.5);
        assertEquals(4.0, sample(capped, 0.5).value(0), 0.0);
    }
}
