package com.tamma.orchestrator.engine.persistence;

import com.tamma.orchestrator.core.exception.OptimisticLockException;
import com.tamma.orchestrator.core.model.WorkflowFilter;
import com.tamma.orchestrator.core.model.WorkflowState;
import com.tamma.orchestrator.core.model.WorkflowStateHistoryEntry;
import com.tamma.orchestrator.core.model.WorkflowStatus;
import com.tamma.orchestrator.core.repository.WorkflowStateRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowStateRepository.
 * State write and history append happen under one lock.
 */
public class InMemoryWorkflowStateRepository implements WorkflowStateRepository {

    private final Map<UUID, WorkflowState> states = new ConcurrentHashMap<>();
    private final Map<UUID, List<WorkflowStateHistoryEntry>> history = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    @Override
    public void insert(WorkflowState state) {
        if (states.putIfAbsent(state.workflowId(), state) != null) {
            throw new IllegalStateException("Workflow state already exists: " + state.workflowId());
        }
    }

    @Override
    public void update(WorkflowState state, WorkflowStateHistoryEntry entry) {
        synchronized (lock) {
            WorkflowState stored = states.get(state.workflowId());
            long expectedVersion = state.version() - 1;
            if (stored == null || stored.version() != expectedVersion) {
                throw new OptimisticLockException("WorkflowState", state.workflowId().toString(), expectedVersion);
            }
            states.put(state.workflowId(), state);
            history.computeIfAbsent(state.workflowId(), id -> new ArrayList<>()).add(entry);
        }
    }

    @Override
    public Optional<WorkflowState> findById(UUID workflowId) {
        return Optional.ofNullable(states.get(workflowId));
    }

    @Override
    public List<WorkflowState> find(WorkflowFilter filter) {
        return states.values().stream()
            .filter(filter::matches)
            .sorted(Comparator.comparing(WorkflowState::createdAt))
            .limit(filter.limit())
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(UUID workflowId) {
        synchronized (lock) {
            return states.remove(workflowId) != null;
        }
    }

    @Override
    public List<WorkflowStateHistoryEntry> findHistory(UUID workflowId) {
        synchronized (lock) {
            List<WorkflowStateHistoryEntry> entries = history.getOrDefault(workflowId, List.of());
            List<WorkflowStateHistoryEntry> ordered = new ArrayList<>(entries);
            ordered.sort(Comparator.comparingLong(WorkflowStateHistoryEntry::sequence));
            return ordered;
        }
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        return states.values().stream()
            .collect(Collectors.groupingBy(WorkflowState::status,
                () -> new EnumMap<>(WorkflowStatus.class), Collectors.counting()));
    }
}
