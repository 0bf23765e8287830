package com.tamma.orchestrator.core.audit;

/**
 * Audit events emitted by the component that owns the state transition.
 * Blocking events are delivered synchronously so that audit durability matches state durability.
 */
public enum AuditEventType {
    // Task lifecycle
    TASK_ENQUEUED(false),
    TASK_CLAIMED(false),
    TASK_COMPLETED(true),
    TASK_RETRY_SCHEDULED(true),
    TASK_FAILED_PERMANENTLY(true),
    TASK_CANCELLED(true),

    // Worker registration
    WORKER_REGISTERED(false),
    WORKER_UNREGISTERED(false),

    // Workflow state
    WORKFLOW_CREATED(true),
    WORKFLOW_UPDATED(true),
    WORKFLOW_DELETED(true),

    // Orchestrator lifecycle
    ORCHESTRATOR_STARTED(true),
    ORCHESTRATOR_STARTUP_FAILED(true),
    ORCHESTRATOR_STOPPED(true);

    private final boolean blocking;

    AuditEventType(boolean blocking) {
        this.blocking = blocking;
    }

    public boolean isBlocking() {
        return blocking;
    }
}
