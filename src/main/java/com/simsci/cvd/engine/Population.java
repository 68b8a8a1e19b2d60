package com.simsci.cvd.engine;

import com.simsci.cvd.model.CauseGraph;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Sex;
import com.simsci.cvd.risk.ExposureSampler;
import com.simsci.cvd.util.RandomKeys;

import java.util.Arrays;
import java.util.List;

/**
 * Column-oriented state of every simulant of a draw.
 *
 * <p>
 * Disease state and state entry time are kept per (cause, simulant). Worker
 * threads write disjoint simulant ranges, so no synchronization is needed
 * within a step.
 */
public final class Population {
    private final long[] ids;
    private final double[] initialAge;
    private final Sex[] sex;
    private final int[][] state;
    private final double[][] entryTime;
    private final double[][] propensity;
    private final boolean[][] joint;

    private Population(long[] ids, double[] initialAge, Sex[] sex, int[][] state, double[][] entryTime,
            double[][] propensity, boolean[][] joint) {
        this.ids = ids;
        this.initialAge = initialAge;
        this.sex = sex;
        this.state = state;
        this.entryTime = entryTime;
        this.propensity = propensity;
        this.joint = joint;
    }

    /**
     * Creates the initial population of a draw. Ages are uniform over the
     * configured range, sexes are equally likely, and every simulant starts in
     * each cause's initial state at time 0.
     */
    public static Population create(SimulationSettings settings, List<CauseGraph> causes, ExposureSampler sampler,
            RandomKeys keys) {
        int n = settings.populationSize();
        int risks = sampler.catalog().size(), groups = sampler.catalog().groupCount();
        long[] ids = new long[n];
        double[] age = new double[n];
        Sex[] sex = new Sex[n];
        double[][] prop = new double[n][risks];
        boolean[][] joint = new boolean[n][groups];
        double span = settings.ageEnd() - settings.ageStart();
        for (int i = 0; i < n; i++) {
            ids[i] = i;
            age[i] = settings.ageStart() + span * keys.uniform(RandomKeys.Stream.DEMOGRAPHY, i, 0, 0);
            sex[i] = keys.uniform(RandomKeys.Stream.DEMOGRAPHY, i, 1, 0) < 0.5 ? Sex.MALE : Sex.FEMALE;
            sampler.samplePropensities(keys, i, age[i], prop[i], joint[i]);
        }
        int[][] state = new int[causes.size()][n];
        double[][] entry = new double[causes.size()][n];
        for (int c = 0; c < causes.size(); c++)
            Arrays.fill(state[c], causes.get(c).initialState());
        return new Population(ids, age, sex, state, entry, prop, joint);
    }

    public int size() {
        return ids.length;
    }

    public long id(int i) {
        return ids[i];
    }

    public Sex sex(int i) {
        return sex[i];
    }

    /** Age in years at simulation time {@code timeDays}. */
    public double age(int i, double timeDays) {
        return initialAge[i] + timeDays / SimulationSettings.DAYS_PER_YEAR;
    }

    public Demographics demographics(int i, double timeDays) {
        return new Demographics(sex[i], age(i, timeDays));
    }

    public int state(int cause, int i) {
        return state[cause][i];
    }

    public double entryTime(int cause, int i) {
        return entryTime[cause][i];
    }

    void moveTo(int cause, int i, int newState, double newEntryTime) {
        state[cause][i] = newState;
        entryTime[cause][i] = newEntryTime;
    }

    public double[] propensities(int i) {
        return propensity[i];
    }

    public boolean[] jointGroups(int i) {
        return joint[i];
    }

    /** Snapshot of one cause's state column. */
    public int[] states(int cause) {
        return state[cause].clone();
    }

    /** Snapshot of one cause's entry-time column. */
    public double[] entryTimes(int cause) {
        return entryTime[cause].clone();
    }
}
