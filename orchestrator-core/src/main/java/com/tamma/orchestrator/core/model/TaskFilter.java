package com.tamma.orchestrator.core.model;

import java.util.UUID;

/**
 * Read-side filter for listing tasks. Null fields match everything.
 */
public record TaskFilter(
    TaskStatus status,
    TaskType type,
    UUID workflowId,
    String correlationId,
    String assignedWorkerId,
    int limit
) {
    public static final int DEFAULT_LIMIT = 1000;

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null, null, DEFAULT_LIMIT);
    }

    public static TaskFilter byStatus(TaskStatus status) {
        return all().withStatus(status);
    }

    public static TaskFilter byWorkflow(UUID workflowId) {
        return all().withWorkflowId(workflowId);
    }

    public TaskFilter withStatus(TaskStatus newStatus) {
        return new TaskFilter(newStatus, type, workflowId, correlationId, assignedWorkerId, limit);
    }

    public TaskFilter withType(TaskType newType) {
        return new TaskFilter(status, newType, workflowId, correlationId, assignedWorkerId, limit);
    }

    public TaskFilter withWorkflowId(UUID newWorkflowId) {
        return new TaskFilter(status, type, newWorkflowId, correlationId, assignedWorkerId, limit);
    }

    public TaskFilter withCorrelationId(String newCorrelationId) {
        return new TaskFilter(status, type, workflowId, newCorrelationId, assignedWorkerId, limit);
    }

    public TaskFilter withAssignedWorkerId(String workerId) {
        return new TaskFilter(status, type, workflowId, correlationId, workerId, limit);
    }

    public TaskFilter withLimit(int newLimit) {
        return new TaskFilter(status, type, workflowId, correlationId, assignedWorkerId, newLimit);
    }

    /**
     * Check if a task matches this filter.
     */
    public boolean matches(Task task) {
        return (status == null || task.status() == status) &&
               (type == null || task.type() == type) &&
               (workflowId == null || workflowId.equals(task.metadata().workflowId())) &&
               (correlationId == null || correlationId.equals(task.metadata().correlationId())) &&
               (assignedWorkerId == null || assignedWorkerId.equals(task.assignedWorkerId()));
    }
}
