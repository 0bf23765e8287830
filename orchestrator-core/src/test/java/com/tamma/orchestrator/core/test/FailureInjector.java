package com.tamma.orchestrator.core.test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Failure injection for store and sink test doubles.
 * Fails the first N calls (or every call) and then lets calls through.
 *
 * <pre>{@code
 * FailureInjector injector = FailureInjector.failTimes(2);
 * injector.maybeThrow(() -> new TransientStorageException("connection reset"));
 * }</pre>
 */
public final class FailureInjector {

    private static final int UNLIMITED = -1;

    private final AtomicInteger remaining;
    private final AtomicBoolean disabled = new AtomicBoolean(false);
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();

    private FailureInjector(int budget) {
        this.remaining = new AtomicInteger(budget);
    }

    public static FailureInjector failTimes(int times) {
        if (times < 0) {
            throw new IllegalArgumentException("times must be >= 0");
        }
        return new FailureInjector(times);
    }

    public static FailureInjector alwaysFail() {
        return new FailureInjector(UNLIMITED);
    }

    /**
     * Let every later call through, e.g. once the outage under test is over.
     */
    public void disable() {
        disabled.set(true);
    }

    public <T extends RuntimeException> void maybeThrow(Supplier<T> exceptionSupplier) {
        calls.incrementAndGet();
        if (consumeFailure()) {
            failures.incrementAndGet();
            throw exceptionSupplier.get();
        }
    }

    public int getCallCount() {
        return calls.get();
    }

    public int getFailureCount() {
        return failures.get();
    }

    private boolean consumeFailure() {
        if (disabled.get()) {
            return false;
        }
        int before = remaining.getAndUpdate(n -> n > 0 ? n - 1 : n);
        return before == UNLIMITED || before > 0;
    }
}
