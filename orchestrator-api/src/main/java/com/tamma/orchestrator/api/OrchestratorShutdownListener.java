package com.tamma.orchestrator.api;

import com.tamma.orchestrator.engine.lifecycle.Orchestrator;
import com.tamma.orchestrator.engine.lifecycle.ShutdownReport;
import com.tamma.orchestrator.recovery.StaleTaskReaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drains the orchestrator as soon as the application context starts closing,
 * before the data source and other infrastructure beans are destroyed.
 *
 * On shutdown:
 * 1. Stops the stale task reaper
 * 2. Runs the orchestrator shutdown protocol (pause, drain, close)
 * 3. Logs the drain outcome
 */
@Component
public class OrchestratorShutdownListener {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorShutdownListener.class);

    private final Orchestrator orchestrator;
    private final ObjectProvider<StaleTaskReaper> reaper;

    public OrchestratorShutdownListener(Orchestrator orchestrator, ObjectProvider<StaleTaskReaper> reaper) {
        this.orchestrator = orchestrator;
        this.reaper = reaper;
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        log.info("Application context closing, shutting down orchestrator");
        reaper.ifAvailable(StaleTaskReaper::stop);

        if (!orchestrator.shutdown()) {
            log.debug("Orchestrator already shut down (phase {})", orchestrator.phase());
            return;
        }
        orchestrator.lastShutdownReport()
            .filter(ShutdownReport::drainTimedOut)
            .ifPresent(report -> log.warn("Orchestrator stopped with work still in flight: {}", report));
    }
}
