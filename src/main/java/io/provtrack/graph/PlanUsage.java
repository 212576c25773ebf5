package io.provtrack.graph;

/** A path a plan consumed at a given checksum. {@code checksum} may be null where it is irrelevant. */
public record PlanUsage(String planId, String path, String checksum) {
}
