package io.provtrack.workflow;

import java.util.List;

/**
 * Runs planned steps in the given order. Implementations stop at the first
 * failing step and report it as a {@link StepExecutionException} whose
 * {@link StepExecutionException#completed()} lists the steps that succeeded
 * before it.
 */
public interface WorkflowExecutor {
    List<StepResult> execute(List<PlannedStep> steps);
}
