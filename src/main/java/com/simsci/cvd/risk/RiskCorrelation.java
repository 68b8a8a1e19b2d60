package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Joint propensities for the members of one correlation group (Gaussian
 * copula).
 *
 * <p>
 * For each age band the correlation matrix is factored once at load. A
 * simulant's propensities are {@code Phi(L z)} where {@code z} is a vector of
 * independent standard normals and {@code L} the lower Cholesky factor of the
 * band containing the simulant's age. Ages outside every band use the nearest
 * band.
 */
public final class RiskCorrelation {
    private final String group;
    private final List<String> members;
    private final double[] bandStart;
    private final double[] bandEnd;
    private final double[][][] lower;

    /** A correlation matrix for one age band, members in group order. */
    public record AgeBand(double ageStart, double ageEnd, double[][] matrix) {
    }

    public RiskCorrelation(String group, List<String> members, List<AgeBand> bands) {
        if (members.size() < 2)
            throw new ConfigurationException("Correlation group " + group + " needs at least two risks");
        if (bands.isEmpty())
            throw new ConfigurationException("Correlation group " + group + " declares no age bands");
        this.group = group;
        this.members = List.copyOf(members);

        List<AgeBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(AgeBand::ageStart));
        int n = sorted.size(), k = members.size();
        this.bandStart = new double[n];
        this.bandEnd = new double[n];
        this.lower = new double[n][][];
        for (int b = 0; b < n; b++) {
            AgeBand band = sorted.get(b);
            if (b > 0 && band.ageStart() < bandEnd[b - 1])
                throw new ConfigurationException("Correlation group " + group + " has overlapping age bands");
            bandStart[b] = band.ageStart();
            bandEnd[b] = band.ageEnd();
            lower[b] = factor(band, k);
        }
    }

    private double[][] factor(AgeBand band, int k) {
        double[][] m = band.matrix();
        if (m.length != k)
            throw new ConfigurationException("Correlation group " + group + " expects a " + k + "x" + k + " matrix");
        for (int i = 0; i < k; i++) {
            if (m[i].length != k)
                throw new ConfigurationException("Correlation group " + group + " has a ragged matrix");
            if (Math.abs(m[i][i] - 1) > 1e-9)
                throw new ConfigurationException("Correlation group " + group + " has diagonal " + m[i][i]);
            for (int j = 0; j < k; j++)
                if (Math.abs(m[i][j]) > 1)
                    throw new ConfigurationException("Correlation group " + group + " has |rho| > 1");
        }
        try {
            RealMatrix l = new CholeskyDecomposition(new Array2DRowRealMatrix(m)).getL();
            return l.getData();
        } catch (MathIllegalArgumentException e) {
            throw new ConfigurationException("Correlation matrix of " + group + " for ages ["
                    + band.ageStart() + ", " + band.ageEnd() + ") is not a valid correlation matrix", e);
        }
    }

    public String group() {
        return group;
    }

    public List<String> members() {
        return members;
    }

    /**
     * Propensities of the members, in group order.
     *
     * @param age Simulant age, selecting the band.
     * @param rng Provider dedicated to this simulant and group.
     */
    public double[] propensities(double age, UniformRandomProvider rng) {
        double[][] l = lower[band(age)];
        int k = l.length;
        ZigguratSampler.NormalizedGaussian gauss = ZigguratSampler.NormalizedGaussian.of(rng);
        double[] z = new double[k];
        for (int i = 0; i < k; i++)
            z[i] = gauss.sample();
        double[] u = new double[k];
        for (int i = 0; i < k; i++) {
            double x = 0;
            for (int j = 0; j <= i; j++)
                x += l[i][j] * z[j];
            u[i] = openUnit(NormalExposure.STANDARD.cumulativeProbability(x));
        }
        return u;
    }

    private int band(double age) {
        int last = bandStart.length - 1;
        if (age < bandStart[0])
            return 0;
        for (int b = 0; b <= last; b++)
            if (age < bandEnd[b])
                return b;
        return last;
    }

    // Phi saturates to 0 or 1 in the far tails; inverse CDFs need (0, 1)
    static double openUnit(double u) {
        return Math.min(Math.max(u, 0x1.0p-53), 1 - 0x1.0p-53);
    }
}
