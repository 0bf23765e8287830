package com.tamma.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A unit of schedulable work.
 *
 * Primary Key: taskId
 *
 * Invariants:
 * - assignedWorkerId set iff status == RUNNING (a cancelled running task keeps it until released)
 * - retryCount <= maxRetries
 * - claimable iff status == PENDING and (scheduledAt == null or scheduledAt <= now)
 * - createdAt <= startedAt <= completedAt / failedAt
 * - version increases by exactly one on every transition
 */
public record Task(
    // Primary key
    UUID taskId,

    // Routing
    TaskType type,
    int priority,
    Set<String> requiredCapabilities,

    // Data
    JsonNode payload,
    JsonNode result,
    TaskError lastError,

    // State
    TaskStatus status,
    int retryCount,
    int maxRetries,
    Instant scheduledAt,
    String assignedWorkerId,

    // Correlation
    TaskMetadata metadata,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant failedAt,
    Instant cancelledAt,

    // Fence for conditional writes
    long version
) {
    public Task {
        requiredCapabilities = requiredCapabilities != null ? Set.copyOf(requiredCapabilities) : Set.of();
        metadata = metadata != null ? metadata : TaskMetadata.empty();
    }

    /**
     * Create a new task in PENDING state from a validated submission.
     */
    public static Task create(UUID taskId, TaskSubmission submission, Instant now) {
        return new Task(
            taskId,
            submission.type(),
            submission.priority(),
            submission.requiredCapabilities(),
            submission.payload(),
            null,
            null,
            TaskStatus.PENDING,
            0,
            submission.maxRetries(),
            submission.scheduledAt(),
            null,
            submission.metadata(),
            now,
            null,
            null,
            null,
            null,
            0L
        );
    }

    /**
     * Check if the task can be claimed at the given time.
     */
    public boolean isClaimableAt(Instant now) {
        return status == TaskStatus.PENDING &&
               (scheduledAt == null || !scheduledAt.isAfter(now));
    }

    /**
     * Check if a worker with the given capabilities may execute this task.
     */
    public boolean isEligibleFor(Set<String> capabilities) {
        return capabilities.contains(type.tag()) && capabilities.containsAll(requiredCapabilities);
    }

    /**
     * Check if a failed attempt can be retried.
     */
    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    /**
     * Time from first claim to completion, if the task completed.
     */
    public Optional<Duration> duration() {
        if (startedAt == null || completedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, completedAt));
    }

    /**
     * Create a copy with the task claimed by a worker.
     * startedAt records the first claim only.
     */
    public Task withClaimed(String workerId, Instant now) {
        return new Task(
            taskId, type, priority, requiredCapabilities,
            payload, result, lastError,
            TaskStatus.RUNNING, retryCount, maxRetries, scheduledAt, workerId,
            metadata,
            createdAt, startedAt != null ? startedAt : now, completedAt, failedAt, cancelledAt,
            version + 1
        );
    }

    /**
     * Create a copy with the task completed successfully.
     */
    public Task withCompleted(JsonNode taskResult, Instant now) {
        return new Task(
            taskId, type, priority, requiredCapabilities,
            payload, taskResult, lastError,
            TaskStatus.COMPLETED, retryCount, maxRetries, scheduledAt, null,
            metadata,
            createdAt, startedAt, now, failedAt, cancelledAt,
            version + 1
        );
    }

    /**
     * Create a copy rescheduled for another attempt after a failure.
     */
    public Task withRetryScheduled(TaskError error, Instant retryAt) {
        return new Task(
            taskId, type, priority, requiredCapabilities,
            payload, result, error,
            TaskStatus.PENDING, retryCount + 1, maxRetries, retryAt, null,
            metadata,
            createdAt, startedAt, completedAt, failedAt, cancelledAt,
            version + 1
        );
    }

    /**
     * Create a copy with the task failed permanently.
     */
    public Task withFailed(TaskError error, Instant now) {
        return new Task(
            taskId, type, priority, requiredCapabilities,
            payload, result, error,
            TaskStatus.FAILED, retryCount, maxRetries, scheduledAt, null,
            metadata,
            createdAt, startedAt, completedAt, now, cancelledAt,
            version + 1
        );
    }

    /**
     * Create a copy with the task cancelled.
     * The assigned worker is kept so the running attempt can still be identified.
     */
    public Task withCancelled(Instant now) {
        return new Task(
            taskId, type, priority, requiredCapabilities,
            payload, result, lastError,
            TaskStatus.CANCELLED, retryCount, maxRetries, scheduledAt, assignedWorkerId,
            metadata,
            createdAt, startedAt, completedAt, failedAt, now,
            version + 1
        );
    }
}
