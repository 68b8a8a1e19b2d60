package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.UnknownRiskException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index of the risk factors of a model and of their correlation groups.
 * Risks and groups are addressed by dense integer indices in hot loops.
 */
public final class RiskCatalog {
    private final RiskFactor[] risks;
    private final Map<String, Integer> riskIndex;
    private final String[] groups;
    private final Map<String, Integer> groupIndex;
    // Group index of each risk, -1 if uncorrelated
    private final int[] groupOf;
    // Risk index of each binned risk's parent, -1 otherwise
    private final int[] parentOf;

    public RiskCatalog(List<RiskFactor> factors) {
        int n = factors.size();
        this.risks = factors.toArray(new RiskFactor[0]);
        Map<String, Integer> idx = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            if (idx.put(risks[i].id(), i) != null)
                throw new ConfigurationException("Risk declared twice: " + risks[i].id());
        this.riskIndex = Map.copyOf(idx);

        Map<String, Integer> gIdx = new LinkedHashMap<>();
        this.groupOf = new int[n];
        this.parentOf = new int[n];
        for (int i = 0; i < n; i++) {
            RiskFactor r = risks[i];
            String g = r.correlationGroup();
            groupOf[i] = g == null ? -1 : gIdx.computeIfAbsent(g, k -> gIdx.size());
            parentOf[i] = -1;
            if (r.isBinned()) {
                int p = indexOf(r.binning().parentRisk());
                if (risks[p].isCategorical())
                    throw new ConfigurationException("Binned risk " + r.id() + " needs a continuous parent, got "
                            + risks[p].id());
                parentOf[i] = p;
            }
        }
        this.groups = new ArrayList<>(gIdx.keySet()).toArray(new String[0]);
        this.groupIndex = Map.copyOf(gIdx);
    }

    public int size() {
        return risks.length;
    }

    public RiskFactor risk(int ri) {
        return risks[ri];
    }

    public List<RiskFactor> risks() {
        return List.of(risks);
    }

    /** @throws UnknownRiskException if no such risk exists. */
    public int indexOf(String riskId) {
        Integer idx = riskIndex.get(riskId);
        if (idx == null)
            throw new UnknownRiskException(riskId);
        return idx;
    }

    public boolean contains(String riskId) {
        return riskIndex.containsKey(riskId);
    }

    public int groupCount() {
        return groups.length;
    }

    public String group(int gi) {
        return groups[gi];
    }

    public int groupIndex(String group) {
        Integer idx = groupIndex.get(group);
        if (idx == null)
            throw new ConfigurationException("Unknown correlation group: " + group);
        return idx;
    }

    /** Correlation group index of a risk, or -1. */
    public int groupOf(int ri) {
        return groupOf[ri];
    }

    /** Parent risk index of a binned risk, or -1. */
    public int parentOf(int ri) {
        return parentOf[ri];
    }
}
