package com.tamma.orchestrator.engine.persistence;

import com.tamma.orchestrator.core.model.Worker;
import com.tamma.orchestrator.core.repository.WorkerRepository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkerRepository.
 * Each mutation is a single atomic compute on the worker's entry.
 */
public class InMemoryWorkerRepository implements WorkerRepository {

    private final Map<String, Worker> workers = new ConcurrentHashMap<>();

    @Override
    public Worker upsert(String workerId, Set<String> capabilities, int maxConcurrency, Instant now) {
        return workers.compute(workerId, (id, existing) -> existing == null
            ? Worker.register(id, capabilities, maxConcurrency, now)
            : existing.withRegistration(capabilities, maxConcurrency, now));
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    @Override
    public List<Worker> findAll() {
        List<Worker> all = new ArrayList<>(workers.values());
        all.sort(Comparator.comparing(Worker::registeredAt).thenComparing(Worker::workerId));
        return all;
    }

    @Override
    public boolean delete(String workerId) {
        return workers.remove(workerId) != null;
    }

    @Override
    public boolean touchHeartbeat(String workerId, Instant now) {
        return workers.computeIfPresent(workerId, (id, w) -> w.withHeartbeat(now)) != null;
    }

    @Override
    public boolean addTask(String workerId, UUID taskId) {
        return workers.computeIfPresent(workerId, (id, w) -> w.withTaskAssigned(taskId)) != null;
    }

    @Override
    public boolean reserveSlot(String workerId, UUID reservationId) {
        boolean[] reserved = new boolean[1];
        workers.computeIfPresent(workerId, (id, w) -> {
            if (w.currentTaskIds().contains(reservationId)) {
                reserved[0] = true;
                return w;
            }
            if (!w.hasCapacity()) {
                return w;
            }
            reserved[0] = true;
            return w.withTaskAssigned(reservationId);
        });
        return reserved[0];
    }

    @Override
    public boolean replaceTask(String workerId, UUID oldId, UUID newId) {
        return workers.computeIfPresent(workerId,
            (id, w) -> w.withTaskReleased(oldId).withTaskAssigned(newId)) != null;
    }

    @Override
    public boolean removeTask(String workerId, UUID taskId) {
        return workers.computeIfPresent(workerId, (id, w) -> w.withTaskReleased(taskId)) != null;
    }

    @Override
    public long count() {
        return workers.size();
    }
}
