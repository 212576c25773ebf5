package io.provtrack.graph;

import io.provtrack.ProvTrackException;

import java.util.List;

/** Every stale plan consumes a path that no longer exists, so nothing can be re-run. */
public final class BlockedByDeletedInputException extends ProvTrackException {
    private final List<String> planNames;

    public BlockedByDeletedInputException(List<String> planNames) {
        super("Plans cannot be re-run because an input was deleted: " + String.join(", ", planNames));
        this.planNames = List.copyOf(planNames);
    }

    public List<String> planNames() {
        return planNames;
    }
}
