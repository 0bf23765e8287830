package com.tamma.orchestrator.core.model;

/**
 * Lifecycle states for a task.
 */
public enum TaskStatus {
    /**
     * Waiting for a worker. May carry a future scheduledAt (deferred or retry backoff).
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Claimed and being executed by exactly one worker.
     * Transitions: -> COMPLETED, FAILED, CANCELLED, PENDING (retry scheduled)
     */
    RUNNING,

    /**
     * Task completed successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Task failed with its retry budget exhausted. Terminal state.
     */
    FAILED,

    /**
     * Task was cancelled before completion. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED ||
                            target == CANCELLED || target == PENDING;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
