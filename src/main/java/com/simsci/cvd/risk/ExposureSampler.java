package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.InvalidExposureException;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.rate.RateResolver;
import com.simsci.cvd.util.RandomKeys;

import java.util.List;

/**
 * Draws per-simulant propensities and turns them into exposure vectors.
 *
 * <p>
 * Propensities are drawn once per simulant and draw. Risks outside any
 * correlation group get an independent uniform; the members of a group get the
 * joint propensities of its {@link RiskCorrelation}. Exposure values are
 * re-derived from the propensities as the simulant ages.
 */
public final class ExposureSampler {
    private final RiskCatalog catalog;
    private final RiskCorrelation[] correlations;
    private final int[][] groupMembers;
    private final long[] riskSalt;
    private final long[] groupSalt;

    public ExposureSampler(RiskCatalog catalog, List<RiskCorrelation> correlationList) {
        this.catalog = catalog;
        int g = catalog.groupCount();
        this.correlations = new RiskCorrelation[g];
        this.groupMembers = new int[g][];
        this.groupSalt = new long[g];
        for (RiskCorrelation c : correlationList) {
            int gi = catalog.groupIndex(c.group());
            if (correlations[gi] != null)
                throw new ConfigurationException("Correlation group declared twice: " + c.group());
            int[] members = new int[c.members().size()];
            for (int m = 0; m < members.length; m++) {
                int ri = catalog.indexOf(c.members().get(m));
                if (catalog.groupOf(ri) != gi)
                    throw new ConfigurationException("Risk " + c.members().get(m) + " is not in group " + c.group());
                if (catalog.risk(ri).isBinned())
                    throw new ConfigurationException("Binned risk " + c.members().get(m) + " cannot be correlated");
                members[m] = ri;
            }
            correlations[gi] = c;
            groupMembers[gi] = members;
            groupSalt[gi] = c.group().hashCode();
        }
        for (int gi = 0; gi < g; gi++) {
            if (correlations[gi] == null)
                throw new ConfigurationException("Correlation group " + catalog.group(gi) + " has no matrix");
            int declared = 0;
            for (int ri = 0; ri < catalog.size(); ri++)
                if (catalog.groupOf(ri) == gi)
                    declared++;
            if (declared != groupMembers[gi].length)
                throw new ConfigurationException("Correlation group " + catalog.group(gi)
                        + " does not list all of its risks");
        }
        this.riskSalt = new long[catalog.size()];
        for (int ri = 0; ri < catalog.size(); ri++)
            riskSalt[ri] = catalog.risk(ri).id().hashCode();
    }

    public RiskCatalog catalog() {
        return catalog;
    }

    /**
     * Fills a simulant's propensities.
     *
     * @param out      One slot per risk; binned risks get NaN.
     * @param jointOut One flag per correlation group, set when the group was sampled jointly.
     */
    public void samplePropensities(RandomKeys keys, long simulantId, double age, double[] out, boolean[] jointOut) {
        for (int ri = 0; ri < catalog.size(); ri++) {
            if (catalog.risk(ri).isBinned())
                out[ri] = Double.NaN;
            else if (catalog.groupOf(ri) < 0)
                out[ri] = keys.uniform(RandomKeys.Stream.PROPENSITY, simulantId, riskSalt[ri], 0);
        }
        for (int gi = 0; gi < correlations.length; gi++) {
            double[] u = correlations[gi].propensities(age,
                    keys.provider(RandomKeys.Stream.CORRELATION, simulantId, groupSalt[gi]));
            int[] members = groupMembers[gi];
            for (int m = 0; m < members.length; m++)
                out[members[m]] = u[m];
            jointOut[gi] = true;
        }
    }

    /**
     * Exposure vector for the given propensities at the simulant's current
     * demographics.
     *
     * @throws InvalidExposureException if an exposure is not finite after clipping.
     */
    public ExposureVector exposures(double[] propensity, boolean[] joint, Demographics who, double year,
            RateResolver rates) {
        int n = catalog.size();
        double[] values = new double[n];
        for (int ri = 0; ri < n; ri++) {
            RiskFactor risk = catalog.risk(ri);
            if (risk.isBinned())
                continue;
            double v = risk.clip(risk.model().sample(propensity[ri], who, year, rates));
            if (!Double.isFinite(v))
                throw new InvalidExposureException("Exposure to " + risk.id() + " is " + v + " for " + who);
            values[ri] = v;
        }
        for (int ri = 0; ri < n; ri++) {
            int parent = catalog.parentOf(ri);
            if (parent >= 0)
                values[ri] = catalog.risk(ri).binning().categorize(values[parent]);
        }
        return new ExposureVector(catalog, values, joint);
    }
}
