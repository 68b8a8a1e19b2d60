package com.simsci.cvd.rate;

/**
 * Table interpolation settings, shared by every lookup of a model.
 *
 * @param order       0 = step function on bins (default), 1 = linear in year between bin midpoints.
 * @param extrapolate Clamp lookups outside the table's range to the boundary bin instead of failing.
 */
public record Interpolation(int order, boolean extrapolate) {

    public static final Interpolation DEFAULT = new Interpolation(0, true);

    public Interpolation {
        if (order != 0 && order != 1)
            throw new IllegalArgumentException("Unsupported interpolation order: " + order);
    }
}
