package com.tamma.orchestrator.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures logs carry the task, workflow and worker they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, workflowId, workerId, attempt)) {
 *     log.info("Task claimed"); // includes taskId, workflowId, workerId, attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String WORKER_ID = "workerId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for task-level operations.
     * The attempt is the 1-indexed execution attempt (retryCount + 1).
     */
    public static LoggingContext forTask(UUID taskId, UUID workflowId, String workerId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        put(TASK_ID, taskId);
        put(WORKFLOW_ID, workflowId);
        put(WORKER_ID, workerId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for workflow state operations.
     */
    public static LoggingContext forWorkflow(UUID workflowId) {
        LoggingContext ctx = new LoggingContext();
        put(WORKFLOW_ID, workflowId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for worker operations.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        put(WORKER_ID, workerId);
        ensureTraceId();
        return ctx;
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void put(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(WORKFLOW_ID);
        MDC.remove(WORKER_ID);
        MDC.remove(ATTEMPT);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
