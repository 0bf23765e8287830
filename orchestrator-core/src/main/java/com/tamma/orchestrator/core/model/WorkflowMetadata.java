package com.tamma.orchestrator.core.model;

import java.util.List;

/**
 * Informational workflow attributes. Never used for scheduling.
 */
public record WorkflowMetadata(
    Integer priority,
    List<String> labels,
    String assignee
) {
    public WorkflowMetadata {
        labels = labels != null ? List.copyOf(labels) : List.of();
    }

    public static WorkflowMetadata empty() {
        return new WorkflowMetadata(null, List.of(), null);
    }
}
