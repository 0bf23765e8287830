package com.tamma.orchestrator.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A registered executor of tasks.
 *
 * Primary Key: workerId (supplied by the registering process)
 *
 * Invariants:
 * - capabilities is never empty
 * - maxConcurrency >= 1
 * - a worker only receives tasks whose type tag and required capabilities it carries
 */
public record Worker(
    String workerId,
    Set<String> capabilities,
    int maxConcurrency,
    Set<UUID> currentTaskIds,
    Instant registeredAt,
    Instant lastHeartbeatAt
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 1;

    public Worker {
        capabilities = Set.copyOf(capabilities);
        currentTaskIds = currentTaskIds != null ? Set.copyOf(currentTaskIds) : Set.of();
    }

    /**
     * Create a newly registered worker.
     */
    public static Worker register(String workerId, Set<String> capabilities, int maxConcurrency, Instant now) {
        return new Worker(workerId, capabilities, maxConcurrency, Set.of(), now, now);
    }

    /**
     * Check if the worker has been silent for longer than the timeout.
     */
    public boolean isStaleAt(Instant now, Duration heartbeatTimeout) {
        return Duration.between(lastHeartbeatAt, now).compareTo(heartbeatTimeout) > 0;
    }

    /**
     * Check if the worker can take another task.
     */
    public boolean hasCapacity() {
        return currentTaskIds.size() < maxConcurrency;
    }

    /**
     * Check if the worker carries every requested capability.
     */
    public boolean hasCapabilities(Set<String> required) {
        return capabilities.containsAll(required);
    }

    /**
     * Create a copy refreshed by a re-registration. Current assignments are kept.
     */
    public Worker withRegistration(Set<String> newCapabilities, int newMaxConcurrency, Instant now) {
        return new Worker(workerId, newCapabilities, newMaxConcurrency, currentTaskIds, registeredAt, now);
    }

    public Worker withHeartbeat(Instant now) {
        return new Worker(workerId, capabilities, maxConcurrency, currentTaskIds, registeredAt, now);
    }

    public Worker withTaskAssigned(UUID taskId) {
        Set<UUID> tasks = new HashSet<>(currentTaskIds);
        tasks.add(taskId);
        return new Worker(workerId, capabilities, maxConcurrency, tasks, registeredAt, lastHeartbeatAt);
    }

    public Worker withTaskReleased(UUID taskId) {
        Set<UUID> tasks = new HashSet<>(currentTaskIds);
        tasks.remove(taskId);
        return new Worker(workerId, capabilities, maxConcurrency, tasks, registeredAt, lastHeartbeatAt);
    }
}
