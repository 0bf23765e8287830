package com.tamma.orchestrator.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a ceiling.
 * Immutable and shared between the task queue (retry scheduling) and storage retries.
 *
 * Invariants:
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - multiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record BackoffPolicy(
    Duration initialBackoff,
    Duration maxBackoff,
    double multiplier,
    double jitterFactor
) {
    public BackoffPolicy {
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Task retry backoff: 1s, 2s, 4s ... capped at 60s, no jitter.
     */
    public static BackoffPolicy taskDefault() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, 0.0);
    }

    /**
     * Storage retry backoff: 100ms doubling up to 2s, 10% jitter.
     */
    public static BackoffPolicy storageDefault() {
        return new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0, 0.1);
    }

    /**
     * Compute the backoff duration for a given retry number.
     * 
     * @param retryNumber 1-indexed retry number
     * @return Duration to wait before the retry
     */
    public Duration computeBackoff(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be >= 1");
        }
        
        // Base backoff: initialBackoff * (multiplier ^ (retry - 1))
        double baseBackoffMs = initialBackoff.toMillis() * 
            Math.pow(multiplier, retryNumber - 1);
        
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());
        if (jitterFactor == 0.0) {
            return Duration.ofMillis((long) cappedBackoffMs);
        }
        
        // Apply jitter: backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange + 
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        
        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private double jitterFactor = 0.0;

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public BackoffPolicy build() {
            return new BackoffPolicy(initialBackoff, maxBackoff, multiplier, jitterFactor);
        }
    }
}
