package com.tamma.orchestrator.engine.lifecycle;

import com.tamma.orchestrator.core.model.BackoffPolicy;
import com.tamma.orchestrator.core.model.Worker;
import com.tamma.orchestrator.engine.queue.TaskQueue;
import com.tamma.orchestrator.engine.storage.StorageRetryTemplate;

import java.time.Duration;

/**
 * Tunables consumed by the orchestrator and its components.
 */
public record OrchestratorSettings(
    Duration heartbeatTimeout,
    Duration drainTimeout,
    Duration drainPollInterval,
    int defaultMaxConcurrency,
    BackoffPolicy taskBackoff,
    int storageRetryAttempts,
    BackoffPolicy storageBackoff,
    int statsWindow
) {
    public OrchestratorSettings {
        if (heartbeatTimeout.isNegative() || heartbeatTimeout.isZero()) {
            throw new IllegalArgumentException("heartbeatTimeout must be positive");
        }
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }
        if (drainPollInterval.isNegative() || drainPollInterval.isZero()) {
            throw new IllegalArgumentException("drainPollInterval must be positive");
        }
        if (defaultMaxConcurrency < 1) {
            throw new IllegalArgumentException("defaultMaxConcurrency must be >= 1");
        }
        if (storageRetryAttempts < 1) {
            throw new IllegalArgumentException("storageRetryAttempts must be >= 1");
        }
        if (statsWindow < 1) {
            throw new IllegalArgumentException("statsWindow must be >= 1");
        }
    }

    public static OrchestratorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration heartbeatTimeout = Duration.ofSeconds(30);
        private Duration drainTimeout = Duration.ofSeconds(30);
        private Duration drainPollInterval = Duration.ofMillis(500);
        private int defaultMaxConcurrency = Worker.DEFAULT_MAX_CONCURRENCY;
        private BackoffPolicy taskBackoff = BackoffPolicy.taskDefault();
        private int storageRetryAttempts = StorageRetryTemplate.DEFAULT_MAX_ATTEMPTS;
        private BackoffPolicy storageBackoff = BackoffPolicy.storageDefault();
        private int statsWindow = TaskQueue.DEFAULT_STATS_WINDOW;

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder drainPollInterval(Duration drainPollInterval) {
            this.drainPollInterval = drainPollInterval;
            return this;
        }

        public Builder defaultMaxConcurrency(int defaultMaxConcurrency) {
            this.defaultMaxConcurrency = defaultMaxConcurrency;
            return this;
        }

        public Builder taskBackoff(BackoffPolicy taskBackoff) {
            this.taskBackoff = taskBackoff;
            return this;
        }

        public Builder storageRetryAttempts(int storageRetryAttempts) {
            this.storageRetryAttempts = storageRetryAttempts;
            return this;
        }

        public Builder storageBackoff(BackoffPolicy storageBackoff) {
            this.storageBackoff = storageBackoff;
            return this;
        }

        public Builder statsWindow(int statsWindow) {
            this.statsWindow = statsWindow;
            return this;
        }

        public OrchestratorSettings build() {
            return new OrchestratorSettings(
                heartbeatTimeout, drainTimeout, drainPollInterval, defaultMaxConcurrency,
                taskBackoff, storageRetryAttempts, storageBackoff, statsWindow);
        }
    }
}
