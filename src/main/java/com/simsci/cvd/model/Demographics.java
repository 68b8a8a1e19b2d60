package com.simsci.cvd.model;

/**
 * The demographic key used for every table lookup.
 *
 * @param sex Simulant sex.
 * @param age Age in years at the lookup time.
 */
public record Demographics(Sex sex, double age) {
}
