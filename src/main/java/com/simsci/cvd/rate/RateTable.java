package com.simsci.cvd.rate;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.OutOfRangeException;
import com.simsci.cvd.model.Sex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable lookup table indexed by (sex, age bin, year bin).
 *
 * <p>
 * Bins are half-open {@code [start, end)}. Every sex present in the table must
 * define a value for every combination of its age bins and year bins; the
 * values are stored as a dense {@code [age][year]} grid per sex so a lookup is
 * two binary searches and an array read.
 */
public final class RateTable {
    private final String key;
    private final Map<Sex, Grid> grids;

    private RateTable(String key, Map<Sex, Grid> grids) {
        this.key = key;
        this.grids = grids;
    }

    public String key() {
        return key;
    }

    /**
     * Looks up the value for a point.
     *
     * @throws OutOfRangeException if the point is outside the table and extrapolation is off,
     *                             or the sex has no rows.
     */
    public double lookup(Sex sex, double age, double year, Interpolation interpolation) {
        Grid g = grids.get(sex);
        if (g == null)
            throw new OutOfRangeException(key, "no rows for sex " + sex.label());
        int ai = g.ages.find(age, interpolation.extrapolate(), key, "age");
        if (interpolation.order() == 0) {
            int yi = g.years.find(year, interpolation.extrapolate(), key, "year");
            return g.values[ai][yi];
        }
        // Range check only; the index itself is recomputed from the midpoints below
        g.years.find(year, interpolation.extrapolate(), key, "year");
        return g.linearInYear(ai, year);
    }

    /** Table holding the same value for every point of the given ranges. */
    public static RateTable constant(String key, double value, double ageStart, double ageEnd,
            double yearStart, double yearEnd) {
        Builder b = builder(key);
        for (Sex s : Sex.values())
            b.addRow(s, ageStart, ageEnd, yearStart, yearEnd, value);
        return b.build();
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    /** Accumulates rows and validates that the grid is complete. */
    public static final class Builder {
        private final String key;
        private final Map<Sex, List<double[]>> rows = new EnumMap<>(Sex.class);

        private Builder(String key) {
            this.key = key;
        }

        public Builder addRow(Sex sex, double ageStart, double ageEnd, double yearStart, double yearEnd, double value) {
            if (!(ageEnd > ageStart) || !(yearEnd > yearStart))
                throw new ConfigurationException("Table '" + key + "' has an empty bin: age [" + ageStart + ", "
                        + ageEnd + "), year [" + yearStart + ", " + yearEnd + ")");
            if (!Double.isFinite(value))
                throw new ConfigurationException("Table '" + key + "' has a non-finite value");
            rows.computeIfAbsent(sex, s -> new ArrayList<>())
                    .add(new double[] { ageStart, ageEnd, yearStart, yearEnd, value });
            return this;
        }

        public RateTable build() {
            if (rows.isEmpty())
                throw new ConfigurationException("Table '" + key + "' has no rows");
            Map<Sex, Grid> grids = new EnumMap<>(Sex.class);
            for (var entry : rows.entrySet())
                grids.put(entry.getKey(), buildGrid(entry.getKey(), entry.getValue()));
            return new RateTable(key, grids);
        }

        private Grid buildGrid(Sex sex, List<double[]> sexRows) {
            TreeMap<Double, Double> ageBins = new TreeMap<>(), yearBins = new TreeMap<>();
            for (double[] r : sexRows) {
                putBin(ageBins, r[0], r[1], "age");
                putBin(yearBins, r[2], r[3], "year");
            }
            Bins ages = Bins.of(ageBins, key, "age");
            Bins years = Bins.of(yearBins, key, "year");

            double[][] values = new double[ages.size()][years.size()];
            boolean[][] seen = new boolean[ages.size()][years.size()];
            for (double[] r : sexRows) {
                int ai = Arrays.binarySearch(ages.starts, r[0]);
                int yi = Arrays.binarySearch(years.starts, r[2]);
                if (seen[ai][yi])
                    throw new ConfigurationException("Table '" + key + "' has a duplicate row for "
                            + sex.label() + ", age " + r[0] + ", year " + r[2]);
                seen[ai][yi] = true;
                values[ai][yi] = r[4];
            }
            for (int ai = 0; ai < ages.size(); ai++)
                for (int yi = 0; yi < years.size(); yi++)
                    if (!seen[ai][yi])
                        throw new ConfigurationException("Table '" + key + "' is missing " + sex.label()
                                + ", age " + ages.starts[ai] + ", year " + years.starts[yi]);
            return new Grid(ages, years, values);
        }

        private void putBin(TreeMap<Double, Double> bins, double start, double end, String axis) {
            Double existing = bins.putIfAbsent(start, end);
            if (existing != null && existing != end)
                throw new ConfigurationException("Table '" + key + "' has inconsistent " + axis
                        + " bins starting at " + start);
        }
    }

    private record Grid(Bins ages, Bins years, double[][] values) {

        double linearInYear(int ai, double year) {
            double[] row = values[ai];
            int n = row.length;
            double firstMid = years.mid(0);
            if (n == 1 || year <= firstMid)
                return row[0];
            double lastMid = years.mid(n - 1);
            if (year >= lastMid)
                return row[n - 1];
            int j = 0;
            while (years.mid(j + 1) < year)
                j++;
            double x0 = years.mid(j), x1 = years.mid(j + 1);
            double w = (year - x0) / (x1 - x0);
            return row[j] + w * (row[j + 1] - row[j]);
        }
    }

    private record Bins(double[] starts, double[] ends) {

        static Bins of(TreeMap<Double, Double> bins, String key, String axis) {
            double[] starts = new double[bins.size()], ends = new double[bins.size()];
            int i = 0;
            for (var e : bins.entrySet()) {
                starts[i] = e.getKey();
                ends[i] = e.getValue();
                if (i > 0 && starts[i] < ends[i - 1])
                    throw new ConfigurationException("Table '" + key + "' has overlapping " + axis + " bins at " + starts[i]);
                i++;
            }
            return new Bins(starts, ends);
        }

        int size() {
            return starts.length;
        }

        double mid(int i) {
            return (starts[i] + ends[i]) / 2;
        }

        int find(double x, boolean extrapolate, String key, String axis) {
            int last = starts.length - 1;
            if (x < starts[0] || x >= ends[last]) {
                if (!extrapolate)
                    throw new OutOfRangeException(key, axis + " " + x + " outside [" + starts[0] + ", " + ends[last] + ")");
                return x < starts[0] ? 0 : last;
            }
            int i = Arrays.binarySearch(starts, x);
            if (i < 0)
                i = -i - 2;
            if (x >= ends[i])
                throw new OutOfRangeException(key, axis + " " + x + " falls in a gap between bins");
            return i;
        }
    }
}
