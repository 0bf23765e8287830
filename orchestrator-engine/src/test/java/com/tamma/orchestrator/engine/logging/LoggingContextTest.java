package com.tamma.orchestrator.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

public class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    @DisplayName("Task context populates the MDC and close keeps only the trace id")
    void testTaskContext() {
        UUID taskId = UUID.randomUUID();
        UUID workflowId = UUID.randomUUID();

        try (var ctx = LoggingContext.forTask(taskId, workflowId, "w1", 2)) {
            assertThat(LoggingContext.getTaskId()).isEqualTo(taskId.toString());
            assertThat(MDC.get(LoggingContext.WORKFLOW_ID)).isEqualTo(workflowId.toString());
            assertThat(MDC.get(LoggingContext.WORKER_ID)).isEqualTo("w1");
            assertThat(MDC.get(LoggingContext.ATTEMPT)).isEqualTo("2");
        }

        assertThat(LoggingContext.getTaskId()).isNull();
        assertThat(MDC.get(LoggingContext.WORKER_ID)).isNull();
        assertThat(LoggingContext.getTraceId()).isNotNull();
    }

    @Test
    @DisplayName("Trace id is reused across nested contexts")
    void testTraceIdReused() {
        String traceId;
        try (var ctx = LoggingContext.forWorker("w1")) {
            traceId = LoggingContext.getTraceId();
        }
        try (var ctx = LoggingContext.forWorkflow(UUID.randomUUID())) {
            assertThat(LoggingContext.getTraceId()).isEqualTo(traceId);
        }
    }

    @Test
    @DisplayName("Absent values are not written")
    void testNullValuesSkipped() {
        try (var ctx = LoggingContext.forTask(UUID.randomUUID(), null, null, 1)) {
            assertThat(MDC.get(LoggingContext.WORKFLOW_ID)).isNull();
            assertThat(MDC.get(LoggingContext.WORKER_ID)).isNull();
        }
    }
}
