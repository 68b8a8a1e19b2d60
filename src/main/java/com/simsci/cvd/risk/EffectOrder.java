package com.simsci.cvd.risk;

import com.simsci.cvd.api.ConfigurationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Evaluation order of the risks acting on one target.
 *
 * <p>
 * Mediation is a dependency: a mediator is evaluated before every risk it
 * mediates. The order is computed once at load with Kahn's algorithm over the
 * mediation edges; ties keep declaration order, so the result is
 * deterministic.
 */
public final class EffectOrder {
    private final String[] order;
    private final Map<String, Integer> position;

    private EffectOrder(String[] order, Map<String, Integer> position) {
        this.order = order;
        this.position = position;
    }

    public int size() {
        return order.length;
    }

    public String risk(int i) {
        return order[i];
    }

    public List<String> risks() {
        return List.of(order);
    }

    public int position(String riskId) {
        Integer p = position.get(riskId);
        if (p == null)
            throw new IllegalArgumentException("Risk not ordered: " + riskId);
        return p;
    }

    public static Builder builder(String target) {
        return new Builder(target);
    }

    /** Collects risks and mediation edges, then sorts them. */
    public static final class Builder {
        private final String target;
        private final List<String> risks = new ArrayList<>();
        private final Map<String, Integer> index = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        private Builder(String target) {
            this.target = target;
        }

        public Builder addRisk(String riskId) {
            if (index.containsKey(riskId))
                throw new ConfigurationException("Risk " + riskId + " has two effects on " + target);
            index.put(riskId, risks.size());
            risks.add(riskId);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** {@code mediator} is evaluated before {@code mediated}. */
        public Builder addMediation(String mediator, String mediated) {
            if (mediator.equals(mediated))
                throw new ConfigurationException("Risk " + mediator + " cannot mediate itself on " + target);
            forwardEdges.get(requireIndex(mediator)).add(requireIndex(mediated));
            return this;
        }

        private int requireIndex(String riskId) {
            Integer idx = index.get(riskId);
            if (idx == null)
                throw new ConfigurationException("Mediator " + riskId + " has no effect on " + target);
            return idx;
        }

        /**
         * @throws ConfigurationException if the mediation edges form a cycle.
         */
        public EffectOrder build() {
            int n = risks.size();
            int[] inDegree = new int[n];
            for (List<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            // Lowest declaration index first among ready risks
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            String[] ordered = new String[n];
            Map<String, Integer> pos = new HashMap<>(n * 2);
            int k = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                ordered[k] = risks.get(curr);
                pos.put(ordered[k], k);
                k++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (k != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(risks.get(i));
                throw new ConfigurationException("Mediation cycle on " + target + " among " + stuck);
            }
            return new EffectOrder(ordered, Map.copyOf(pos));
        }
    }
}
