package io.provtrack.workflow;

import io.provtrack.ProvTrackException;

import java.util.List;

/**
 * A step failed. {@link #completed()} holds the results of the steps of the
 * same run that finished before it, oldest first.
 */
public final class StepExecutionException extends ProvTrackException {
    private final String planName;
    private final List<StepResult> completed;

    public StepExecutionException(String planName, String message) {
        this(planName, "Step " + planName + " failed: " + message, null, List.of());
    }

    public StepExecutionException(String planName, String message, Throwable cause) {
        this(planName, "Step " + planName + " failed: " + message, cause, List.of());
    }

    private StepExecutionException(String planName, String fullMessage, Throwable cause, List<StepResult> completed) {
        super(fullMessage, cause);
        this.planName = planName;
        this.completed = List.copyOf(completed);
    }

    /** The same failure, carrying the results of the steps that ran before it. */
    public StepExecutionException withCompleted(List<StepResult> results) {
        return new StepExecutionException(planName, getMessage(), this, results);
    }

    public String planName() {
        return planName;
    }

    public List<StepResult> completed() {
        return completed;
    }
}
