package com.tamma.orchestrator.engine.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.tamma.orchestrator.core.audit.AuditEvent;
import com.tamma.orchestrator.core.audit.AuditEventSink;
import com.tamma.orchestrator.core.audit.AuditEventType;
import com.tamma.orchestrator.core.exception.AuditException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point for audit emission, called by the component that owns the transition.
 *
 * <p>Blocking event types are delivered on the caller's thread; a sink failure is raised as
 * {@link AuditException}. Other events are handed to one daemon thread and a sink failure is
 * only logged.</p>
 */
public class AuditEmitter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditEmitter.class);
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final AuditEventSink sink;
    private final Clock clock;
    private final ExecutorService asyncExecutor;

    public AuditEmitter(AuditEventSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
        this.asyncExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "audit-emitter");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void emit(AuditEventType type, Map<String, String> tags) {
        emit(type, tags, JsonNodeFactory.instance.objectNode());
    }

    public void emit(AuditEventType type, Map<String, String> tags, JsonNode payload) {
        AuditEvent event = new AuditEvent(type, clock.instant(), tags, payload);
        if (type.isBlocking()) {
            deliver(event);
        } else {
            deliverAsync(event);
        }
    }

    private void deliver(AuditEvent event) {
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            log.error("Failed to emit audit event {}: {}", event.type(), e.getMessage());
            throw new AuditException(event.type().name(), e);
        }
    }

    private void deliverAsync(AuditEvent event) {
        try {
            asyncExecutor.execute(() -> {
                try {
                    sink.emit(event);
                } catch (RuntimeException e) {
                    log.warn("Dropped audit event {}: {}", event.type(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dropped audit event {} after emitter was closed", event.type());
        }
    }

    /**
     * Flush pending asynchronous events and stop the delivery thread.
     */
    @Override
    public void close() {
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Audit emitter did not flush within {}s", CLOSE_TIMEOUT_SECONDS);
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            asyncExecutor.shutdownNow();
        }
    }
}
