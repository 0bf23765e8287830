package com.tamma.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a workflow state. Null fields are left unchanged.
 *
 * <p>{@code context} replaces the whole context object; {@code contextEntries} are merged
 * into the existing context key by key. Setting both is rejected.</p>
 */
public record WorkflowStateUpdate(
    WorkflowStatus status,
    Integer currentStep,
    JsonNode context,
    Map<String, JsonNode> contextEntries,
    WorkflowMetadata metadata
) {
    public WorkflowStateUpdate {
        contextEntries = contextEntries != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(contextEntries))
            : Map.of();
    }

    public static WorkflowStateUpdate status(WorkflowStatus status) {
        return builder().status(status).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private WorkflowStatus status;
        private Integer currentStep;
        private JsonNode context;
        private final Map<String, JsonNode> contextEntries = new LinkedHashMap<>();
        private WorkflowMetadata metadata;

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStep(Integer currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder context(JsonNode context) {
            this.context = context;
            return this;
        }

        public Builder contextEntry(String key, JsonNode value) {
            this.contextEntries.put(key, value);
            return this;
        }

        public Builder metadata(WorkflowMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public WorkflowStateUpdate build() {
            return new WorkflowStateUpdate(status, currentStep, context, contextEntries, metadata);
        }
    }
}
