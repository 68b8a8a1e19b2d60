package com.simsci.cvd.paf;

import com.simsci.cvd.model.Target;

import java.util.List;

/**
 * Joint PAF of every risk acting on a target, {@code 1 - prod(1 - PAF_i)}.
 *
 * <p>
 * The product form assumes each risk's incremental effect is independent of
 * the others. Correlated exposures make this an approximation. Mediated
 * pathways are not counted twice: a mediated risk's PAF is computed from its
 * mediation-scaled relative risk, so the mediated share enters only through
 * the mediator.
 *
 * @param risks Contributing risks, in evaluation order.
 */
public record JointPafRecord(Target target, StratificationCell cell, int draw, double value, List<String> risks) {

    public static final String MEASURE = "risk_factor.joint_mediated_risks." + PafRecord.MEASURE;

    public JointPafRecord {
        risks = List.copyOf(risks);
    }

    public String key() {
        return MEASURE + ":" + target + ":" + cell;
    }
}
