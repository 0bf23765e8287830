package com.tamma.orchestrator.engine.lifecycle;

/**
 * Lifecycle of the orchestrator process.
 * INITIALIZING → RUNNING → DRAINING → STOPPED, or INITIALIZING → STOPPED when startup fails.
 */
public enum OrchestratorPhase {
    INITIALIZING,
    RUNNING,
    DRAINING,
    STOPPED;

    public boolean canTransitionTo(OrchestratorPhase target) {
        return switch (this) {
            case INITIALIZING -> target == RUNNING || target == STOPPED;
            case RUNNING -> target == DRAINING;
            case DRAINING -> target == STOPPED;
            case STOPPED -> false;
        };
    }
}
