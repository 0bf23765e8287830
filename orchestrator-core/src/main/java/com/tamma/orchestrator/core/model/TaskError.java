package com.tamma.orchestrator.core.model;

/**
 * Error reported by a worker when a task attempt fails.
 * The last error is kept on the task for escalation.
 */
public record TaskError(
    String code,
    String message
) {
    public static final String WORKER_LOST = "WORKER_LOST";

    public static TaskError of(String code, String message) {
        return new TaskError(code, message);
    }

    /**
     * Build an error from an exception raised by the worker runtime.
     */
    public static TaskError fromException(Throwable error) {
        return new TaskError(error.getClass().getSimpleName(), error.getMessage());
    }
}
