package com.tamma.orchestrator.engine.storage;

import com.tamma.orchestrator.core.exception.NotFoundException;
import com.tamma.orchestrator.core.exception.StorageException;
import com.tamma.orchestrator.core.exception.TransientStorageException;
import com.tamma.orchestrator.core.model.BackoffPolicy;
import com.tamma.orchestrator.core.test.FailureInjector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

public class StorageRetryTemplateTest {

    private final StorageRetryTemplate template =
        new StorageRetryTemplate(3, new BackoffPolicy(Duration.ZERO, Duration.ZERO, 1.0, 0.0));

    @Test
    @DisplayName("Transient failures within the budget are retried transparently")
    void testTransientRetried() {
        FailureInjector injector = FailureInjector.failTimes(2);

        String result = template.execute("probe", () -> {
            injector.maybeThrow(() -> new TransientStorageException("connection reset"));
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(injector.getCallCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Exhausted budget surfaces as StorageException carrying the last cause")
    void testExhausted() {
        FailureInjector injector = FailureInjector.alwaysFail();

        assertThatThrownBy(() -> template.run("probe",
                () -> injector.maybeThrow(() -> new TransientStorageException("connection reset"))))
            .isInstanceOf(StorageException.class)
            .hasCauseInstanceOf(TransientStorageException.class)
            .satisfies(e -> {
                StorageException storage = (StorageException) e;
                assertThat(storage.getOperation()).isEqualTo("probe");
                assertThat(storage.getAttempts()).isEqualTo(3);
            });
        assertThat(injector.getCallCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Non-transient failures are not retried")
    void testNonTransientNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> template.run("probe", () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("constraint violated");
            }))
            .isInstanceOf(StorageException.class)
            .satisfies(e -> assertThat(((StorageException) e).getAttempts()).isEqualTo(1));
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Domain exceptions pass through untouched")
    void testDomainExceptionPassesThrough() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> template.run("probe", () -> {
                calls.incrementAndGet();
                throw new NotFoundException("Task", "t-1");
            }))
            .isInstanceOf(NotFoundException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Interrupt during backoff stops retrying")
    void testInterruptedBackoff() {
        StorageRetryTemplate slow = new StorageRetryTemplate(3, BackoffPolicy.builder()
            .initialBackoff(Duration.ofSeconds(10))
            .maxBackoff(Duration.ofSeconds(10))
            .build());

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> slow.run("probe", () -> {
                    throw new TransientStorageException("connection reset");
                }))
                .isInstanceOf(StorageException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasAtLeastOneElementOfType(InterruptedException.class));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("At least one attempt is required")
    void testInvalidBudget() {
        assertThatThrownBy(() -> new StorageRetryTemplate(0, BackoffPolicy.storageDefault()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
