package com.tamma.orchestrator.core.time;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that never goes backwards.
 * Wraps another clock and returns the latest instant it has handed out whenever the
 * underlying clock steps back, so timestamps taken in sequence are non-decreasing.
 */
public final class MonotonicClock extends Clock {

    private final Clock delegate;
    private final AtomicReference<Instant> last;

    private MonotonicClock(Clock delegate, AtomicReference<Instant> last) {
        this.delegate = delegate;
        this.last = last;
    }

    public static MonotonicClock of(Clock delegate) {
        if (delegate instanceof MonotonicClock monotonic) {
            return monotonic;
        }
        return new MonotonicClock(delegate, new AtomicReference<>(Instant.MIN));
    }

    public static MonotonicClock systemUTC() {
        return of(Clock.systemUTC());
    }

    @Override
    public Instant instant() {
        Instant candidate = delegate.instant();
        return last.accumulateAndGet(candidate, (previous, next) -> next.isAfter(previous) ? next : previous);
    }

    @Override
    public ZoneId getZone() {
        return delegate.getZone();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MonotonicClock(delegate.withZone(zone), last);
    }
}
