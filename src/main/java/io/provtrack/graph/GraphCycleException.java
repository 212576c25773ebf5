package io.provtrack.graph;

import io.provtrack.ProvTrackException;

import java.util.List;

/** The plan graph contains (or would contain) a cycle. */
public final class GraphCycleException extends ProvTrackException {
    private final List<List<String>> cycles;

    public GraphCycleException(List<List<String>> cycles) {
        super("Plan graph contains a cycle: " + format(cycles));
        this.cycles = List.copyOf(cycles);
    }

    /** Each cycle as the names of its plans, in edge order. */
    public List<List<String>> cycles() {
        return cycles;
    }

    private static String format(List<List<String>> cycles) {
        StringBuilder sb = new StringBuilder();
        for (List<String> cycle : cycles) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(String.join(" -> ", cycle));
            if (!cycle.isEmpty()) {
                sb.append(" -> ").append(cycle.get(0));
            }
        }
        return sb.toString();
    }
}
