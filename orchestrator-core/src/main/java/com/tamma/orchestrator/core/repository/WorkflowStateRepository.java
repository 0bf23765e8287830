package com.tamma.orchestrator.core.repository;

import com.tamma.orchestrator.core.model.WorkflowFilter;
import com.tamma.orchestrator.core.model.WorkflowState;
import com.tamma.orchestrator.core.model.WorkflowStateHistoryEntry;
import com.tamma.orchestrator.core.model.WorkflowStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow states and their append-only update history.
 * Supports optimistic locking via version numbers.
 */
public interface WorkflowStateRepository {

    /**
     * Insert a new workflow state.
     * 
     * @param state The workflow state to insert
     */
    void insert(WorkflowState state);

    /**
     * Write an updated state and its history entry atomically.
     * Both are written or neither is.
     * 
     * @param state The updated state, with version incremented by one
     * @param entry The history entry describing the update
     * @throws com.tamma.orchestrator.core.exception.OptimisticLockException if the stored version is not {@code state.version() - 1}
     */
    void update(WorkflowState state, WorkflowStateHistoryEntry entry);

    Optional<WorkflowState> findById(UUID workflowId);

    /**
     * Find workflow states matching a filter, oldest first.
     */
    List<WorkflowState> find(WorkflowFilter filter);

    /**
     * Hard delete a workflow state. History entries are kept.
     * 
     * @return true if the state existed
     */
    boolean delete(UUID workflowId);

    /**
     * History entries for a workflow in sequence order.
     */
    List<WorkflowStateHistoryEntry> findHistory(UUID workflowId);

    Map<WorkflowStatus, Long> countByStatus();
}
