package com.simsci.cvd.paf;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.engine.DiseaseStateMachine;
import com.simsci.cvd.model.DataType;
import com.simsci.cvd.model.Target;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/** Dense slots for the rate targets a draw observes, addressed by (cause, transition). */
public final class TargetIndex {
    private final List<Target> targets;
    private final int[][] slot;

    /**
     * @throws ConfigurationException if a target is not a rate transition of the machines.
     */
    public TargetIndex(List<DiseaseStateMachine> machines, Collection<Target> wanted) {
        this.slot = new int[machines.size()][];
        List<Target> found = new ArrayList<>();
        for (DiseaseStateMachine m : machines) {
            int c = m.causeIndex();
            slot[c] = new int[m.graph().transitionCount()];
            Arrays.fill(slot[c], -1);
            for (int ti = 0; ti < slot[c].length; ti++) {
                Target t = m.target(ti);
                if (t != null && wanted.contains(t)) {
                    if (m.graph().transition(ti).dataType() != DataType.RATE)
                        throw new ConfigurationException("Target " + t + " is not a rate transition");
                    slot[c][ti] = found.size();
                    found.add(t);
                }
            }
        }
        for (Target t : wanted)
            if (!found.contains(t))
                throw new ConfigurationException("Target " + t + " matches no transition");
        this.targets = List.copyOf(found);
    }

    public int size() {
        return targets.size();
    }

    public Target target(int slot) {
        return targets.get(slot);
    }

    public List<Target> targets() {
        return targets;
    }

    /** Slot of a transition, or -1 if it is not observed. */
    public int slot(int cause, int transition) {
        return slot[cause][transition];
    }
}
