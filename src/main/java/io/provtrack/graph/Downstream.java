package io.provtrack.graph;

import io.provtrack.model.Plan;

import java.util.List;

/**
 * Result of a downstream query: the plans to re-run, producers first, and
 * the plans that were reached but consume a deleted path.
 */
public record Downstream(List<Plan> plans, List<Plan> blocked) {
    public Downstream {
        plans = List.copyOf(plans);
        blocked = List.copyOf(blocked);
    }

    public boolean isEmpty() {
        return plans.isEmpty() && blocked.isEmpty();
    }
}
