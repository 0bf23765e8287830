package com.tamma.orchestrator.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time queue statistics for backpressure and drain decisions.
 *
 * @param counts          number of tasks per status (every status present)
 * @param averageDuration mean claim-to-completion time over the most recent completions
 * @param sampleSize      number of completions the average was computed over
 * @param paused          whether claims are currently suspended
 */
public record TaskStats(
    Map<TaskStatus, Long> counts,
    Duration averageDuration,
    int sampleSize,
    boolean paused
) {
    public TaskStats {
        Map<TaskStatus, Long> complete = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            complete.put(status, counts.getOrDefault(status, 0L));
        }
        counts = Collections.unmodifiableMap(complete);
        averageDuration = averageDuration != null ? averageDuration : Duration.ZERO;
    }

    public long count(TaskStatus status) {
        return counts.get(status);
    }

    public long running() {
        return count(TaskStatus.RUNNING);
    }

    public long pending() {
        return count(TaskStatus.PENDING);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
