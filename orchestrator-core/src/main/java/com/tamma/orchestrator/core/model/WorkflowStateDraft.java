package com.tamma.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Initial values for a new workflow state.
 */
public record WorkflowStateDraft(
    String issueRef,
    String platformRef,
    String repositoryRef,
    int initialStep,
    JsonNode context,
    WorkflowMetadata metadata
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String issueRef;
        private String platformRef;
        private String repositoryRef;
        private int initialStep;
        private JsonNode context;
        private WorkflowMetadata metadata = WorkflowMetadata.empty();

        public Builder issueRef(String issueRef) {
            this.issueRef = issueRef;
            return this;
        }

        public Builder platformRef(String platformRef) {
            this.platformRef = platformRef;
            return this;
        }

        public Builder repositoryRef(String repositoryRef) {
            this.repositoryRef = repositoryRef;
            return this;
        }

        public Builder initialStep(int initialStep) {
            this.initialStep = initialStep;
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

        public WorkflowStateDraft build() {
            return new WorkflowStateDraft(issueRef, platformRef, repositoryRef, initialStep, context, metadata);
        }
    }
}
