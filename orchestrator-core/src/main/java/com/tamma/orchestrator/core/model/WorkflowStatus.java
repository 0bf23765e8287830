package com.tamma.orchestrator.core.model;

/**
 * Lifecycle states for an autonomous development cycle.
 * Transitions follow a strict state machine.
 */
public enum WorkflowStatus {
    /**
     * Created, no step started yet.
     * Transitions: -> RUNNING
     */
    PENDING,

    /**
     * Steps are being executed.
     * Transitions: -> COMPLETED, FAILED, PAUSED
     */
    RUNNING,

    /**
     * Halted, e.g. awaiting human escalation.
     * Transitions: -> RUNNING
     */
    PAUSED,

    /**
     * All steps finished successfully.
     */
    COMPLETED,

    /**
     * The cycle failed and will not continue.
     */
    FAILED,

    /**
     * End of the record's lifecycle. Kept queryable for audit. Terminal state.
     */
    ARCHIVED;

    /**
     * Check if this state is terminal (no further transitions except archival).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ARCHIVED;
    }

    /**
     * Check if this state can transition to the target state.
     * Archival is allowed from every state except ARCHIVED itself.
     */
    public boolean canTransitionTo(WorkflowStatus target) {
        if (target == ARCHIVED) {
            return this != ARCHIVED;
        }
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == COMPLETED || target == FAILED || target == PAUSED;
            case PAUSED -> target == RUNNING;
            case COMPLETED, FAILED, ARCHIVED -> false;
        };
    }
}
