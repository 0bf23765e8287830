package com.tamma.orchestrator.core.model;

/**
 * Outcome of complete/fail together with the task as persisted.
 * Callers branch on {@link #outcome()} instead of catching exceptions.
 */
public record TaskResult(
    TaskOutcome outcome,
    Task task
) {
    public static TaskResult completed(Task task) {
        return new TaskResult(TaskOutcome.COMPLETED, task);
    }

    public static TaskResult retryScheduled(Task task) {
        return new TaskResult(TaskOutcome.RETRY_SCHEDULED, task);
    }

    public static TaskResult failedPermanently(Task task) {
        return new TaskResult(TaskOutcome.FAILED_PERMANENTLY, task);
    }

    public boolean isTerminal() {
        return outcome != TaskOutcome.RETRY_SCHEDULED;
    }
}
