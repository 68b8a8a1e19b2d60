package com.simsci.cvd.engine;

import com.simsci.cvd.model.Demographics;
import com.simsci.cvd.risk.ExposureVector;

/**
 * Per-step view of one simulant, shared by all causes during the step.
 *
 * @param index    Row in the population columns.
 * @param id       Stable simulant id, used for random key derivation.
 * @param who      Sex and current age.
 * @param year     Fractional calendar year at the start of the step.
 * @param exposure Exposures at the start of the step.
 */
public record Simulant(int index, long id, Demographics who, double year, ExposureVector exposure) {
}
