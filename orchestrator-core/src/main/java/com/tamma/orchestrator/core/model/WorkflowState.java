package com.tamma.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.UUID;

/**
 * State of one autonomous development cycle.
 *
 * Primary Key: workflowId
 *
 * Invariants:
 * - currentStep never decreases through updates
 * - updatedAt is bumped on every mutation
 * - version equals the number of updates applied since creation
 * - only the state manager writes these records
 */
public record WorkflowState(
    // Primary key
    UUID workflowId,

    // External references (opaque)
    String issueRef,
    String platformRef,
    String repositoryRef,

    // Progress
    int currentStep,
    WorkflowStatus status,
    JsonNode context,
    WorkflowMetadata metadata,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt,
    Instant failedAt,

    // Optimistic locking
    long version
) {
    public WorkflowState {
        context = context != null ? context : JsonNodeFactory.instance.objectNode();
        metadata = metadata != null ? metadata : WorkflowMetadata.empty();
    }

    /**
     * Create a new workflow state in PENDING.
     */
    public static WorkflowState create(UUID workflowId, WorkflowStateDraft draft, Instant now) {
        return new WorkflowState(
            workflowId,
            draft.issueRef(),
            draft.platformRef(),
            draft.repositoryRef(),
            draft.initialStep(),
            WorkflowStatus.PENDING,
            draft.context(),
            draft.metadata(),
            now,
            now,
            null,
            null,
            null,
            0L
        );
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID workflowId;
        private String issueRef;
        private String platformRef;
        private String repositoryRef;
        private int currentStep;
        private WorkflowStatus status;
        private JsonNode context;
        private WorkflowMetadata metadata;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant failedAt;
        private long version;

        private Builder(WorkflowState state) {
            this.workflowId = state.workflowId;
            this.issueRef = state.issueRef;
            this.platformRef = state.platformRef;
            this.repositoryRef = state.repositoryRef;
            this.currentStep = state.currentStep;
            this.status = state.status;
            this.context = state.context;
            this.metadata = state.metadata;
            this.createdAt = state.createdAt;
            this.updatedAt = state.updatedAt;
            this.startedAt = state.startedAt;
            this.completedAt = state.completedAt;
            this.failedAt = state.failedAt;
            this.version = state.version;
        }

        public Builder currentStep(int currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder context(JsonNode context) {
            this.context = context;
            return this;
        }

        public Builder metadata(WorkflowMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public WorkflowState build() {
            return new WorkflowState(
                workflowId, issueRef, platformRef, repositoryRef,
                currentStep, status, context, metadata,
                createdAt, updatedAt, startedAt, completedAt, failedAt,
                version
            );
        }
    }
}
