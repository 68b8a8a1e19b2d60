package com.simsci.cvd.paf;

import com.simsci.cvd.model.Sex;

/** One (sex, age group) cell. Rendered as {@code sex.age_group}. */
public record StratificationCell(Sex sex, String ageGroup) {

    public static StratificationCell parse(String s) {
        int dot = s.indexOf('.');
        if (dot <= 0)
            throw new IllegalArgumentException("Not a stratification cell: " + s);
        return new StratificationCell(Sex.fromString(s.substring(0, dot)), s.substring(dot + 1));
    }

    @Override
    public String toString() {
        return sex.label() + "." + ageGroup;
    }
}
