package com.simsci.cvd.paf;

import com.simsci.cvd.api.ConfigurationException;

/** Half-open age interval {@code [start, end)} in years. */
public record AgeGroup(String name, double start, double end) {

    public AgeGroup {
        if (name == null || name.isBlank())
            throw new ConfigurationException("Age group needs a name");
        if (!(end > start))
            throw new ConfigurationException("Age group " + name + " is empty");
    }

    public boolean contains(double age) {
        return age >= start && age < end;
    }
}
