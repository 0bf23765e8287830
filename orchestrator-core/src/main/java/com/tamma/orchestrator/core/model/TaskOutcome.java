package com.tamma.orchestrator.core.model;

/**
 * Result of reporting the end of a task attempt.
 */
public enum TaskOutcome {
    COMPLETED,
    RETRY_SCHEDULED,
    FAILED_PERMANENTLY
}
