package com.tamma.orchestrator.core.repository;

/**
 * Durable store shared by the task queue, worker pool and state manager.
 * Each component owns one logical collection and never touches another's.
 */
public interface DurableStore extends AutoCloseable {

    /**
     * Short name for logs and health details.
     */
    String name();

    /**
     * Open the connection. Fails if the store cannot be reached.
     */
    void open();

    /**
     * Check the store answers a trivial query.
     */
    boolean isReachable();

    boolean isOpen();

    TaskRepository tasks();

    WorkerRepository workers();

    WorkflowStateRepository workflowStates();

    /**
     * Release the connection. Idempotent.
     */
    @Override
    void close();
}
