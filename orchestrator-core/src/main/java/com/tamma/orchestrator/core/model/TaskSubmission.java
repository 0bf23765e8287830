package com.tamma.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Set;

/**
 * Request to enqueue a new task. Validated by the task queue, not here,
 * so that malformed submissions surface as validation errors to the caller.
 */
public record TaskSubmission(
    TaskType type,
    Integer priority,
    JsonNode payload,
    Integer maxRetries,
    Instant scheduledAt,
    Set<String> requiredCapabilities,
    TaskMetadata metadata
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TaskType type;
        private Integer priority;
        private JsonNode payload;
        private Integer maxRetries = DEFAULT_MAX_RETRIES;
        private Instant scheduledAt;
        private Set<String> requiredCapabilities = Set.of();
        private TaskMetadata metadata = TaskMetadata.empty();

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder requiredCapabilities(Set<String> requiredCapabilities) {
            this.requiredCapabilities = requiredCapabilities;
            return this;
        }

        public Builder metadata(TaskMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public TaskSubmission build() {
            return new TaskSubmission(
                type, priority, payload, maxRetries,
                scheduledAt, requiredCapabilities, metadata
            );
        }
    }
}
