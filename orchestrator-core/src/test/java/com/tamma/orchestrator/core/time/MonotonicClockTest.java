package com.tamma.orchestrator.core.time;

import com.tamma.orchestrator.core.test.TimeController;
import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.time.Instant;
import static org.junit.jupiter.api.Assertions.*;

class MonotonicClockTest {

    @Test
    void instant_shouldNeverGoBackwards() {
        TimeController time = TimeController.frozen();
        MonotonicClock clock = MonotonicClock.of(time);
        
        Instant first = clock.instant();
        time.rewind(Duration.ofSeconds(5));
        Instant second = clock.instant();
        time.advanceSeconds(10);
        Instant third = clock.instant();
        
        assertEquals(first, second);
        assertEquals(first.plusSeconds(5), third);
    }

    @Test
    void of_shouldNotWrapTwice() {
        MonotonicClock clock = MonotonicClock.systemUTC();
        
        assertSame(clock, MonotonicClock.of(clock));
    }

    @Test
    void randomIdGenerator_shouldProduceDistinctIds() {
        IdGenerator ids = IdGenerator.random();
        
        assertNotEquals(ids.nextId(), ids.nextId());
    }
}
