package com.tamma.orchestrator.core.repository;

import com.tamma.orchestrator.core.model.Task;
import com.tamma.orchestrator.core.model.TaskFilter;
import com.tamma.orchestrator.core.model.TaskStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repository for Task persistence.
 * Claims and transitions are conditional writes so that concurrent callers,
 * in this process or another, never both win the same task.
 */
public interface TaskRepository {

    /**
     * Insert a new task.
     * 
     * @param task The task to insert
     */
    void insert(Task task);

    /**
     * Find a task by ID.
     * 
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(UUID taskId);

    /**
     * Atomically select the best claimable task for a worker and mark it RUNNING.
     * Candidates are PENDING, due at {@code now}, and eligible for {@code capabilities};
     * the winner is the highest priority, then the oldest.
     * 
     * @param workerId The claiming worker
     * @param capabilities The worker's capability tags
     * @param now Current time
     * @return The claimed task, or empty if nothing is eligible
     */
    Optional<Task> claimNext(String workerId, Set<String> capabilities, Instant now);

    /**
     * Write a transitioned task if the stored version is still {@code task.version() - 1}.
     * 
     * @param task The task with its new state and incremented version
     * @return true if written, false if the task changed concurrently
     */
    boolean updateIfCurrent(Task task);

    /**
     * Find tasks matching a filter, oldest first.
     * 
     * @param filter The filter
     * @return Matching tasks
     */
    List<Task> find(TaskFilter filter);

    /**
     * Count tasks per status.
     * 
     * @return Count per status (absent statuses have no tasks)
     */
    Map<TaskStatus, Long> countByStatus();

    /**
     * Mean claim-to-completion duration of the most recently completed tasks.
     * 
     * @param window Maximum number of completions to average over
     * @return The average and the number of samples, empty if nothing completed
     */
    Optional<DurationSample> averageRecentDuration(int window);

    /**
     * Average over a window of completed tasks.
     */
    record DurationSample(Duration average, int sampleSize) {
    }
}
