package com.simsci.cvd.paf;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.model.Sex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Demographic cells results are reported by: every sex crossed with the
 * configured age groups. Cells are numbered densely, sex-major.
 */
public final class Stratification {
    private final AgeGroup[] groups;
    private final List<StratificationCell> cells;

    public Stratification(List<AgeGroup> ageGroups) {
        if (ageGroups.isEmpty())
            throw new ConfigurationException("Stratification needs at least one age group");
        List<AgeGroup> sorted = new ArrayList<>(ageGroups);
        sorted.sort(Comparator.comparingDouble(AgeGroup::start));
        for (int i = 1; i < sorted.size(); i++)
            if (sorted.get(i).start() < sorted.get(i - 1).end())
                throw new ConfigurationException("Age groups " + sorted.get(i - 1).name() + " and "
                        + sorted.get(i).name() + " overlap");
        this.groups = sorted.toArray(new AgeGroup[0]);
        List<StratificationCell> all = new ArrayList<>();
        for (Sex sex : Sex.values())
            for (AgeGroup g : groups)
                all.add(new StratificationCell(sex, g.name()));
        this.cells = List.copyOf(all);
    }

    /** A single cell covering all ages in {@code [start, end)}, per sex. */
    public static Stratification single(double start, double end) {
        return new Stratification(List.of(new AgeGroup("all_ages", start, end)));
    }

    public int cellCount() {
        return cells.size();
    }

    public List<StratificationCell> cells() {
        return cells;
    }

    public StratificationCell cell(int index) {
        return cells.get(index);
    }

    /** Cell index of a simulant, or -1 if its age is in no group. */
    public int cellOf(Demographics who) {
        for (int g = 0; g < groups.length; g++)
            if (groups[g].contains(who.age()))
                return who.sex().ordinal() * groups.length + g;
        return -1;
    }
}
