package io.provtrack.workflow;

import io.provtrack.model.Plan;

import java.util.List;

/** A plan queued for execution with the paths it reads and writes. */
public record PlannedStep(Plan plan, List<String> inputs, List<String> outputs) {
    public PlannedStep {
        if (plan == null) {
            throw new IllegalArgumentException("planned step needs a plan");
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public static PlannedStep of(Plan plan) {
        return new PlannedStep(
                plan,
                plan.inputs().stream().map(input -> input.consumes()).toList(),
                plan.outputs().stream().map(output -> output.produces()).toList()
        );
    }
}
