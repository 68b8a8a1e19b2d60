package com.simsci.cvd.rate;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.OutOfRangeException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Sex;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class RateTableTest {

    // Two age bins x two year bins, both sexes
    private static RateTable grid() {
        RateTable.Builder b = RateTable.builder("cause.ihd.incidence_rate");
        for (Sex s : Sex.values()) {
            double bump = s == Sex.FEMALE ? 0.5 : 0;
            b.addRow(s, 0, 50, 2000, 2010, 1.0 + bump);
            b.addRow(s, 0, 50, 2010, 2020, 3.0 + bump);
            b.addRow(s, 50, 100, 2000, 2010, 5.0 + bump);
            b.addRow(s, 50, 100, 2010, 2020, 7.0 + bump);
        }
        return b.build();
    }

    @Test
    public void testStepLookup() {
        RateTable t = grid();
        Interpolation step = new Interpolation(0, false);
        assertEquals(1.0, t.lookup(Sex.MALE, 20, 2005, step), 0.0);
        assertEquals(3.0, t.lookup(Sex.MALE, 20, 2010, step), 0.0);
        assertEquals(7.5, t.lookup(Sex.FEMALE, 50, 2019.9, step), 0.0);
    }

    @Test
    public void testLinearInterpolationBetweenYearMidpoints() {
        RateTable t = grid();
        Interpolation linear = new Interpolation(1, false);
        assertEquals(2.0, t.lookup(Sex.MALE, 20, 2010, linear), 1e-12);
        assertEquals(1.0, t.lookup(Sex.MALE, 20, 2003, linear), 1e-12);
        assertEquals(3.0, t.lookup(Sex.MALE, 20, 2018, linear), 1e-12);
        assertEquals(6.5, t.lookup(Sex.MALE, 70, 2012.5, linear), 1e-12);
    }

    @Test
    public void testExtrapolationClampsToBoundary() {
        RateTable t = grid();
        assertEquals(3.0, t.lookup(Sex.MALE, 20, 2035, Interpolation.DEFAULT), 0.0);
        assertEquals(1.0, t.lookup(Sex.MALE, 20, 1990, Interpolation.DEFAULT), 0.0);
        assertEquals(7.0, t.lookup(Sex.MALE, 110, 2015, Interpolation.DEFAULT), 0.0);
    }

    @Test(expected = OutOfRangeException.class)
    public void testOutOfRangeWithoutExtrapolation() {
        grid().lookup(Sex.MALE, 20, 2035, new Interpolation(0, false));
    }

    @Test(expected = OutOfRangeException.class)
    public void testGapBetweenBins() {
        RateTable t = RateTable.builder("gappy")
                .addRow(Sex.MALE, 0, 10, 2000, 2010, 1)
                .addRow(Sex.MALE, 20, 30, 2000, 2010, 2)
                .build();
        t.lookup(Sex.MALE, 15, 2005, new Interpolation(0, true));
    }

    @Test(expected = OutOfRangeException.class)
    public void testMissingSex() {
        RateTable t = RateTable.builder("male_only").addRow(Sex.MALE, 0, 100, 2000, 2050, 1).build();
        t.lookup(Sex.FEMALE, 40, 2020, Interpolation.DEFAULT);
    }

    @Test(expected = ConfigurationException.class)
    public void testIncompleteGridRejected() {
        RateTable.builder("holes")
                .addRow(Sex.MALE, 0, 50, 2000, 2010, 1)
                .addRow(Sex.MALE, 50, 100, 2010, 2020, 1)
                .build();
    }

    @Test(expected = ConfigurationException.class)
    public void testOverlappingBinsRejected() {
        RateTable.builder("overlap")
                .addRow(Sex.MALE, 0, 60, 2000, 2010, 1)
                .addRow(Sex.MALE, 50, 100, 2000, 2010, 1)
                .build();
    }

    @Test(expected = ConfigurationException.class)
    public void testNonFiniteValueRejected() {
        RateTable.builder("nan").addRow(Sex.MALE, 0, 50, 2000, 2010, Double.NaN);
    }

    @Test
    public void testResolverLiteralsAndTables() {
        RateResolver rates = new RateResolver(Map.of("cause.ihd.incidence_rate", grid()), Interpolation.DEFAULT);
        Demographics who = new Demographics(Sex.FEMALE, 30);
        assertEquals(1.5, rates.resolve("cause.ihd.incidence_rate", who, 2001), 0.0);
        assertEquals(0.25, rates.resolve(DataRef.literal(0.25), who, 2001), 0.0);
        assertEquals(28.0, rates.durationDays(DataRef.parse("28 days"), who, 2001), 0.0);
        assertTrue(rates.hasTable("cause.ihd.incidence_rate"));
    }

    @Test(expected = ConfigurationException.class)
    public void testResolverUnknownKey() {
        RateResolver rates = new RateResolver(Map.of(), Interpolation.DEFAULT);
        rates.resolve("cause.unknown.incidence_rate", new Demographics(Sex.MALE, 40), 2020);
    }

    @Test(expected = ConfigurationException.class)
    public void testNegativeDwellTimeRejected() {
        RateResolver rates = new RateResolver(Map.of(), Interpolation.DEFAULT);
        rates.durationDays(DataRef.literal(-1), new Demographics(Sex.MALE, 40), 2020);
    }
}
