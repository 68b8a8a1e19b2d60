package com.simsci.cvd.model;

import com.simsci.cvd.api.ConfigurationException;

public enum Sex {
    MALE,
    FEMALE;

    public static Sex fromString(String s) {
        if (s != null) {
            for (Sex sex : values())
                if (sex.name().equalsIgnoreCase(s.trim()))
                    return sex;
        }
        throw new ConfigurationException("Unknown sex: " + s);
    }

    public String label() {
        return name().toLowerCase();
    }
}
