package com.tamma.orchestrator.api;

import com.tamma.orchestrator.core.model.BackoffPolicy;
import com.tamma.orchestrator.engine.lifecycle.OrchestratorSettings;
import com.tamma.orchestrator.recovery.RecoveryMode;
import com.tamma.orchestrator.recovery.StaleTaskReaper;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestrator configuration bound from {@code tamma.orchestrator.*}.
 *
 * Example:
 * <pre>
 * tamma.orchestrator:
 *   store: jdbc
 *   heartbeat-timeout: 30s
 *   drain:
 *     timeout: 30s
 *     poll-interval: 500ms
 *   recovery:
 *     mode: requeue
 * </pre>
 */
@ConfigurationProperties(prefix = "tamma.orchestrator")
public class OrchestratorProperties {

    public enum StoreType {
        JDBC,
        MEMORY
    }

    /**
     * Durable store backing tasks, workers and workflow states.
     */
    private StoreType store = StoreType.JDBC;

    /**
     * Silence after which a worker is considered stale.
     */
    private Duration heartbeatTimeout = Duration.ofSeconds(30);

    /**
     * Concurrency given to workers that register without one.
     */
    private int defaultMaxConcurrency = 1;

    /**
     * Number of recent completions averaged in queue stats.
     */
    private int statsWindow = 100;

    private Drain drain = new Drain();
    private Backoff taskBackoff = new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, 0.0);
    private StorageRetry storageRetry = new StorageRetry();
    private Reaper reaper = new Reaper();
    private Recovery recovery = new Recovery();

    /**
     * Map to the settings record consumed by the engine.
     */
    public OrchestratorSettings toSettings() {
        return OrchestratorSettings.builder()
            .heartbeatTimeout(heartbeatTimeout)
            .drainTimeout(drain.getTimeout())
            .drainPollInterval(drain.getPollInterval())
            .defaultMaxConcurrency(defaultMaxConcurrency)
            .taskBackoff(taskBackoff.toPolicy())
            .storageRetryAttempts(storageRetry.getAttempts())
            .storageBackoff(storageRetry.getBackoff().toPolicy())
            .statsWindow(statsWindow)
            .build();
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public void setHeartbeatTimeout(Duration heartbeatTimeout) {
        this.heartbeatTimeout = heartbeatTimeout;
    }

    public int getDefaultMaxConcurrency() {
        return defaultMaxConcurrency;
    }

    public void setDefaultMaxConcurrency(int defaultMaxConcurrency) {
        this.defaultMaxConcurrency = defaultMaxConcurrency;
    }

    public int getStatsWindow() {
        return statsWindow;
    }

    public void setStatsWindow(int statsWindow) {
        this.statsWindow = statsWindow;
    }

    public Drain getDrain() {
        return drain;
    }

    public void setDrain(Drain drain) {
        this.drain = drain;
    }

    public Backoff getTaskBackoff() {
        return taskBackoff;
    }

    public void setTaskBackoff(Backoff taskBackoff) {
        this.taskBackoff = taskBackoff;
    }

    public StorageRetry getStorageRetry() {
        return storageRetry;
    }

    public void setStorageRetry(StorageRetry storageRetry) {
        this.storageRetry = storageRetry;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public void setReaper(Reaper reaper) {
        this.reaper = reaper;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    // ========== Nested Groups ==========

    public static class Drain {
        /**
         * Upper bound on waiting for in-flight work during shutdown.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private Duration pollInterval = Duration.ofMillis(500);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class Backoff {
        private Duration initial;
        private Duration max;
        private double multiplier;
        private double jitter;

        public Backoff() {
            this(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0, 0.1);
        }

        public Backoff(Duration initial, Duration max, double multiplier, double jitter) {
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
            this.jitter = jitter;
        }

        BackoffPolicy toPolicy() {
            return BackoffPolicy.builder()
                .initialBackoff(initial)
                .maxBackoff(max)
                .multiplier(multiplier)
                .jitterFactor(jitter)
                .build();
        }

        public Duration getInitial() {
            return initial;
        }

        public void setInitial(Duration initial) {
            this.initial = initial;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class StorageRetry {
        /**
         * Total attempts for a storage operation, including the first.
         */
        private int attempts = 3;

        private Backoff backoff = new Backoff();

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public Backoff getBackoff() {
            return backoff;
        }

        public void setBackoff(Backoff backoff) {
            this.backoff = backoff;
        }
    }

    public static class Reaper {
        private boolean enabled = true;
        private Duration interval = StaleTaskReaper.DEFAULT_INTERVAL;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        private RecoveryMode mode = RecoveryMode.REQUEUE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public RecoveryMode getMode() {
            return mode;
        }

        public void setMode(RecoveryMode mode) {
            this.mode = mode;
        }
    }
}
