package com.tamma.orchestrator.engine.persistence;

import com.tamma.orchestrator.core.repository.DurableStore;
import com.tamma.orchestrator.core.repository.TaskRepository;
import com.tamma.orchestrator.core.repository.WorkerRepository;
import com.tamma.orchestrator.core.repository.WorkflowStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Durable store kept in process memory. Contents live as long as the instance.
 * For single-process deployments and testing.
 */
public class InMemoryDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDurableStore.class);

    private final InMemoryTaskRepository tasks = new InMemoryTaskRepository();
    private final InMemoryWorkerRepository workers = new InMemoryWorkerRepository();
    private final InMemoryWorkflowStateRepository workflowStates = new InMemoryWorkflowStateRepository();
    private final AtomicBoolean open = new AtomicBoolean(false);

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public void open() {
        if (open.compareAndSet(false, true)) {
            log.info("Opened in-memory durable store");
        }
    }

    @Override
    public boolean isReachable() {
        return open.get();
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public TaskRepository tasks() {
        return tasks;
    }

    @Override
    public WorkerRepository workers() {
        return workers;
    }

    @Override
    public WorkflowStateRepository workflowStates() {
        return workflowStates;
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            log.info("Closed in-memory durable store");
        }
    }
}
