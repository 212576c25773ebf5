package io.provtrack.workflow;

import io.provtrack.model.Plan;

import java.time.Instant;
import java.util.List;

/** What one executed step produced. */
public record StepResult(
        Plan plan,
        int exitCode,
        List<String> outputs,
        Instant startedAt,
        Instant endedAt,
        String log
) {
    public StepResult {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
}
