package com.tamma.orchestrator.engine.storage;

import com.tamma.orchestrator.core.exception.OrchestratorException;
import com.tamma.orchestrator.core.exception.StorageException;
import com.tamma.orchestrator.core.model.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs durable store operations with a bounded retry budget for transient failures.
 *
 * <p>Domain exceptions ({@link OrchestratorException}) pass through untouched. Transient
 * failures are retried with backoff until the attempt budget is spent; anything else,
 * or a transient failure on the last attempt, surfaces as {@link StorageException}.</p>
 *
 * <p>No lock is held while sleeping between attempts.</p>
 */
public class StorageRetryTemplate {

    private static final Logger log = LoggerFactory.getLogger(StorageRetryTemplate.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final int maxAttempts;
    private final BackoffPolicy backoff;

    public StorageRetryTemplate(int maxAttempts, BackoffPolicy backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public static StorageRetryTemplate withDefaults() {
        return new StorageRetryTemplate(DEFAULT_MAX_ATTEMPTS, BackoffPolicy.storageDefault());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Execute a store operation returning a value.
     *
     * @param operation short name used in logs and in the surfaced exception
     * @param action    the store call
     * @throws StorageException if the operation failed for good; its effect is unknown
     */
    public <T> T execute(String operation, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (OrchestratorException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!TransientErrorClassifier.isTransient(e)) {
                    log.error("Storage operation {} failed with non-transient error: {}", operation, e.getMessage());
                    throw new StorageException(operation, attempt, e);
                }
                if (attempt >= maxAttempts) {
                    log.error("Storage operation {} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw new StorageException(operation, attempt, e);
                }
                Duration delay = backoff.computeBackoff(attempt);
                log.warn("Transient failure in {} (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                pause(operation, attempt, delay, e);
            }
        }
    }

    /**
     * Execute a store operation with no result.
     */
    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private void pause(String operation, int attempt, Duration delay, RuntimeException lastError) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            StorageException interrupted = new StorageException(operation, attempt, lastError);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }
}
