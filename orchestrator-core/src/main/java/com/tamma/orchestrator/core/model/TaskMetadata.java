package com.tamma.orchestrator.core.model;

import java.util.UUID;

/**
 * Correlation fields linking a task to the workflow step that produced it.
 * All fields are optional.
 */
public record TaskMetadata(
    UUID workflowId,
    Integer stepNumber,
    String correlationId
) {
    private static final TaskMetadata EMPTY = new TaskMetadata(null, null, null);

    public static TaskMetadata empty() {
        return EMPTY;
    }

    /**
     * Metadata for a step of the given workflow.
     */
    public static TaskMetadata forWorkflowStep(UUID workflowId, int stepNumber) {
        return new TaskMetadata(workflowId, stepNumber, null);
    }
}
