package com.tamma.orchestrator.engine.persistence;

import com.tamma.orchestrator.core.model.Task;
import com.tamma.orchestrator.core.model.TaskFilter;
import com.tamma.orchestrator.core.model.TaskStatus;
import com.tamma.orchestrator.core.repository.TaskRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * Claims and conditional updates run under one store lock so select-and-transition is atomic.
 * Insertion order breaks ties between tasks created at the same instant.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();
    private final Map<UUID, Long> insertionOrder = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object lock = new Object();

    @Override
    public void insert(Task task) {
        synchronized (lock) {
            if (tasks.putIfAbsent(task.taskId(), task) != null) {
                throw new IllegalStateException("Task already exists: " + task.taskId());
            }
            insertionOrder.put(task.taskId(), sequence.incrementAndGet());
        }
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<Task> claimNext(String workerId, Set<String> capabilities, Instant now) {
        synchronized (lock) {
            Optional<Task> candidate = tasks.values().stream()
                .filter(t -> t.isClaimableAt(now))
                .filter(t -> t.isEligibleFor(capabilities))
                .min(claimOrder());
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            Task claimed = candidate.get().withClaimed(workerId, now);
            tasks.put(claimed.taskId(), claimed);
            return Optional.of(claimed);
        }
    }

    @Override
    public boolean updateIfCurrent(Task task) {
        synchronized (lock) {
            Task stored = tasks.get(task.taskId());
            if (stored == null || stored.version() != task.version() - 1) {
                return false;
            }
            tasks.put(task.taskId(), task);
            return true;
        }
    }

    @Override
    public List<Task> find(TaskFilter filter) {
        return tasks.values().stream()
            .filter(filter::matches)
            .sorted(Comparator.comparing(Task::createdAt).thenComparing(this::insertionIndex))
            .limit(filter.limit())
            .collect(Collectors.toList());
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        return tasks.values().stream()
            .collect(Collectors.groupingBy(Task::status, () -> new EnumMap<>(TaskStatus.class), Collectors.counting()));
    }

    @Override
    public Optional<DurationSample> averageRecentDuration(int window) {
        List<Duration> recent = tasks.values().stream()
            .filter(t -> t.status() == TaskStatus.COMPLETED && t.duration().isPresent())
            .sorted(Comparator.comparing(Task::completedAt).reversed())
            .limit(window)
            .map(t -> t.duration().get())
            .collect(Collectors.toList());
        if (recent.isEmpty()) {
            return Optional.empty();
        }
        long totalMillis = recent.stream().mapToLong(Duration::toMillis).sum();
        return Optional.of(new DurationSample(Duration.ofMillis(totalMillis / recent.size()), recent.size()));
    }

    private Comparator<Task> claimOrder() {
        return Comparator.comparingInt(Task::priority).reversed()
            .thenComparing(Task::createdAt)
            .thenComparing(this::insertionIndex);
    }

    private long insertionIndex(Task task) {
        return insertionOrder.getOrDefault(task.taskId(), Long.MAX_VALUE);
    }
}
