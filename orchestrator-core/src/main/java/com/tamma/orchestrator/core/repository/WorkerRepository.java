package com.tamma.orchestrator.core.repository;

import com.tamma.orchestrator.core.model.Worker;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repository for Worker registrations.
 */
public interface WorkerRepository {

    /**
     * Register a worker, or refresh an existing registration.
     * Re-registration replaces capabilities and concurrency, refreshes the heartbeat
     * and keeps current task assignments.
     * 
     * @return The stored worker
     */
    Worker upsert(String workerId, Set<String> capabilities, int maxConcurrency, Instant now);

    Optional<Worker> findById(String workerId);

    List<Worker> findAll();

    /**
     * Remove a registration.
     * 
     * @return true if the worker existed
     */
    boolean delete(String workerId);

    /**
     * Set lastHeartbeatAt.
     * 
     * @return true if the worker exists
     */
    boolean touchHeartbeat(String workerId, Instant now);

    /**
     * Record a task as assigned to the worker.
     * 
     * @return true if the worker exists
     */
    boolean addTask(String workerId, UUID taskId);

    /**
     * Take one assignment slot for a claim in progress. The check against maxConcurrency
     * and the insert happen as one atomic step, so concurrent claims cannot overshoot.
     * Reserving an id the worker already holds succeeds without taking another slot.
     * 
     * @return true if the worker exists and had a free slot
     */
    boolean reserveSlot(String workerId, UUID reservationId);

    /**
     * Swap one assignment for another without freeing the slot in between.
     * 
     * @return true if the worker exists
     */
    boolean replaceTask(String workerId, UUID oldId, UUID newId);

    /**
     * Remove a task from the worker's assignments.
     * 
     * @return true if the worker exists
     */
    boolean removeTask(String workerId, UUID taskId);

    long count();
}
