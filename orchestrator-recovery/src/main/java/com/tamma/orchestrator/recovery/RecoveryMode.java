package com.tamma.orchestrator.recovery;

/**
 * What to do at startup with a RUNNING workflow that has no live task.
 */
public enum RecoveryMode {
    /**
     * Enqueue the current step again as a fresh workflow-step task.
     */
    REQUEUE,

    /**
     * Mark the workflow FAILED for human escalation.
     */
    FAIL
}
