package com.simsci.cvd.engine;

import com.simsci.cvd.api.ConfigurationException;

/**
 * Time, population and threading settings of a simulation.
 *
 * @param populationSize Simulants per draw.
 * @param ageStart       Lower bound of initial ages, in years.
 * @param ageEnd         Upper bound (exclusive) of initial ages, in years.
 * @param startYear      Calendar year at time 0.
 * @param stepDays       Step length in days.
 * @param steps          Number of steps.
 * @param rateUnitDays   Days per rate unit; 365.25 for rates per person-year.
 * @param seed           Global random seed.
 * @param threads        Worker threads per draw.
 * @param chunkSize      Simulants per work unit; fixed so results do not depend on {@code threads}.
 */
public record SimulationSettings(int populationSize, double ageStart, double ageEnd, double startYear,
        double stepDays, int steps, double rateUnitDays, long seed, int threads, int chunkSize) {

    public static final double DAYS_PER_YEAR = 365.25;

    public SimulationSettings {
        if (populationSize <= 0)
            throw new ConfigurationException("population size must be positive: " + populationSize);
        if (!(ageEnd > ageStart) || ageStart < 0)
            throw new ConfigurationException("invalid age range [" + ageStart + ", " + ageEnd + ")");
        if (!(stepDays > 0))
            throw new ConfigurationException("step length must be positive: " + stepDays);
        if (steps <= 0)
            throw new ConfigurationException("steps must be positive: " + steps);
        if (!(rateUnitDays > 0))
            throw new ConfigurationException("rate unit must be positive: " + rateUnitDays);
        if (threads <= 0)
            threads = 1;
        if (chunkSize <= 0)
            chunkSize = 4096;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the PAF-calculation defaults: 28-day steps, rates per year. */
    public static final class Builder {
        private int populationSize = 100_000;
        private double ageStart = 7, ageEnd = 125;
        private double startYear = 2021;
        private double stepDays = 28;
        private int steps = 1;
        private double rateUnitDays = DAYS_PER_YEAR;
        private long seed;
        private int threads = 1;
        private int chunkSize = 4096;

        public Builder populationSize(int n) {
            this.populationSize = n;
            return this;
        }

        public Builder ages(double start, double end) {
            this.ageStart = start;
            this.ageEnd = end;
            return this;
        }

        public Builder startYear(double year) {
            this.startYear = year;
            return this;
        }

        public Builder stepDays(double days) {
            this.stepDays = days;
            return this;
        }

        public Builder steps(int steps) {
            this.steps = steps;
            return this;
        }

        public Builder rateUnitDays(double days) {
            this.rateUnitDays = days;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public SimulationSettings build() {
            return new SimulationSettings(populationSize, ageStart, ageEnd, startYear, stepDays, steps,
                    rateUnitDays, seed, threads, chunkSize);
        }
    }
}
