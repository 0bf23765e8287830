package com.tamma.orchestrator.engine.support;

import com.tamma.orchestrator.core.exception.TransientStorageException;
import com.tamma.orchestrator.core.model.Task;
import com.tamma.orchestrator.core.model.TaskFilter;
import com.tamma.orchestrator.core.model.TaskStatus;
import com.tamma.orchestrator.core.repository.TaskRepository;
import com.tamma.orchestrator.core.test.FailureInjector;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Task repository that raises transient storage failures before delegating.
 */
public class FlakyTaskRepository implements TaskRepository {

    private final TaskRepository delegate;
    private final FailureInjector injector;

    public FlakyTaskRepository(TaskRepository delegate, FailureInjector injector) {
        this.delegate = delegate;
        this.injector = injector;
    }

    private void maybeFail(String operation) {
        injector.maybeThrow(() -> new TransientStorageException("connection reset during " + operation));
    }

    @Override
    public void insert(Task task) {
        maybeFail("insert");
        delegate.insert(task);
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        maybeFail("findById");
        return delegate.findById(taskId);
    }

    @Override
    public Optional<Task> claimNext(String workerId, Set<String> capabilities, Instant now) {
        maybeFail("claimNext");
        return delegate.claimNext(workerId, capabilities, now);
    }

    @Override
    public boolean updateIfCurrent(Task task) {
        maybeFail("updateIfCurrent");
        return delegate.updateIfCurrent(task);
    }

    @Override
    public List<Task> find(TaskFilter filter) {
        maybeFail("find");
        return delegate.find(filter);
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        maybeFail("countByStatus");
        return delegate.countByStatus();
    }

    @Override
    public Optional<DurationSample> averageRecentDuration(int window) {
        maybeFail("averageRecentDuration");
        return delegate.averageRecentDuration(window);
    }
}
