package com.simsci.cvd.rate;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.Demographics;

import java.util.Map;

/**
 * Resolves named quantities (incidence, transition and remission rates,
 * proportions, dwell times, exposure parameters) for a simulant at a point in
 * time.
 *
 * <p>
 * Pure function of its inputs and the immutable tables, so one instance is
 * shared by all worker threads of a draw and by all draws of a location.
 */
public final class RateResolver {
    private final Map<String, RateTable> tables;
    private final Interpolation interpolation;

    public RateResolver(Map<String, RateTable> tables, Interpolation interpolation) {
        this.tables = Map.copyOf(tables);
        this.interpolation = interpolation;
    }

    public Interpolation interpolation() {
        return interpolation;
    }

    public boolean hasTable(String key) {
        return tables.containsKey(key);
    }

    /**
     * Unadjusted value of table {@code key}.
     *
     * @param key  Table key, e.g. {@code cause.acute_myocardial_infarction.incidence_rate}.
     * @param who  Demographic key.
     * @param year Fractional calendar year.
     */
    public double resolve(String key, Demographics who, double year) {
        RateTable table = tables.get(key);
        if (table == null)
            throw new ConfigurationException("No data table for key: " + key);
        return table.lookup(who.sex(), who.age(), year, interpolation);
    }

    /** Literal value, or table lookup. */
    public double resolve(DataRef ref, Demographics who, double year) {
        return ref.isLiteral() ? ref.literal() : resolve(ref.tableKey(), who, year);
    }

    /**
     * Fixed sojourn in days. Dwell times are almost always literals such as
     * {@code "28 days"}; a table key is accepted for age/sex-specific durations.
     */
    public double durationDays(DataRef ref, Demographics who, double year) {
        double days = resolve(ref, who, year);
        if (!(days >= 0))
            throw new ConfigurationException("Dwell time must be non-negative: " + ref + " -> " + days);
        return days;
    }

    /** Fails fast at load time if a referenced table is missing. */
    public void require(DataRef ref, String usedBy) {
        if (ref != null && !ref.isLiteral() && !tables.containsKey(ref.tableKey()))
            throw new ConfigurationException(usedBy + " refers to missing table " + ref.tableKey());
    }
}
