package com.tamma.orchestrator.engine.audit;

import com.tamma.orchestrator.core.audit.AuditEvent;
import com.tamma.orchestrator.core.audit.AuditEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Writes audit events to the dedicated {@code tamma.audit} logger.
 * Event tags are placed in the MDC for the duration of the log call so
 * structured appenders can index them.
 */
public class Slf4jAuditEventSink implements AuditEventSink {

    public static final String LOGGER_NAME = "tamma.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void emit(AuditEvent event) {
        for (Map.Entry<String, String> tag : event.tags().entrySet()) {
            MDC.put(tag.getKey(), tag.getValue());
        }
        try {
            audit.info("{} at {} {}", event.type(), event.occurredAt(), event.payload());
        } finally {
            for (String key : event.tags().keySet()) {
                MDC.remove(key);
            }
        }
    }
}
