package com.tamma.orchestrator.core.model;

/**
 * Read-side filter for listing workflow states. Null fields match everything.
 */
public record WorkflowFilter(
    WorkflowStatus status,
    String issueRef,
    String repositoryRef,
    int limit
) {
    public static final int DEFAULT_LIMIT = 1000;

    public static WorkflowFilter all() {
        return new WorkflowFilter(null, null, null, DEFAULT_LIMIT);
    }

    public static WorkflowFilter byStatus(WorkflowStatus status) {
        return new WorkflowFilter(status, null, null, DEFAULT_LIMIT);
    }

    public static WorkflowFilter byRepository(String repositoryRef) {
        return new WorkflowFilter(null, null, repositoryRef, DEFAULT_LIMIT);
    }

    public WorkflowFilter withIssueRef(String newIssueRef) {
        return new WorkflowFilter(status, newIssueRef, repositoryRef, limit);
    }

    public WorkflowFilter withLimit(int newLimit) {
        return new WorkflowFilter(status, issueRef, repositoryRef, newLimit);
    }

    /**
     * Check if a workflow state matches this filter.
     */
    public boolean matches(WorkflowState state) {
        return (status == null || state.status() == status) &&
               (issueRef == null || issueRef.equals(state.issueRef())) &&
               (repositoryRef == null || repositoryRef.equals(state.repositoryRef()));
    }
}
