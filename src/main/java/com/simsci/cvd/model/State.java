package com.simsci.cvd.model;

/**
 * A disease state as declared in configuration.
 *
 * @param id                  State identifier, unique within its cause.
 * @param causeType           Cause or sequela.
 * @param isTransient         The simulant leaves the state within the step it enters it.
 * @param allowSelfTransition A transition back into the same state is legal.
 * @param dwellTime           Fixed sojourn in days before the forced exit, or null.
 * @param disabilityWeight    Optional disability weight override.
 * @param excessMortalityRate Optional excess mortality rate override.
 */
public record State(String id, CauseType causeType, boolean isTransient, boolean allowSelfTransition,
        DataRef dwellTime, DataRef disabilityWeight, DataRef excessMortalityRate) {

    public State {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("State id must not be blank");
        if (causeType == null)
            causeType = CauseType.CAUSE;
    }

    public boolean hasDwellTime() {
        return dwellTime != null;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** Builder with the configuration defaults (cause, non-transient, self transitions allowed). */
    public static final class Builder {
        private final String id;
        private CauseType causeType = CauseType.CAUSE;
        private boolean isTransient;
        private boolean allowSelfTransition = true;
        private DataRef dwellTime, disabilityWeight, excessMortalityRate;

        private Builder(String id) {
            this.id = id;
        }

        public Builder causeType(CauseType causeType) {
            this.causeType = causeType;
            return this;
        }

        public Builder isTransient(boolean isTransient) {
            this.isTransient = isTransient;
            return this;
        }

        public Builder allowSelfTransition(boolean allow) {
            this.allowSelfTransition = allow;
            return this;
        }

        public Builder dwellTime(DataRef dwellTime) {
            this.dwellTime = dwellTime;
            return this;
        }

        public Builder disabilityWeight(DataRef ref) {
            this.disabilityWeight = ref;
            return this;
        }

        public Builder excessMortalityRate(DataRef ref) {
            this.excessMortalityRate = ref;
            return this;
        }

        public State build() {
            return new State(id, causeType, isTransient, allowSelfTransition, dwellTime,
                    disabilityWeight, excessMortalityRate);
        }
    }
}
