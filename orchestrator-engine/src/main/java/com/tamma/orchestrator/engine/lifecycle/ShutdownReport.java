package com.tamma.orchestrator.engine.lifecycle;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of a shutdown.
 *
 * @param drainTimedOut     true if running work remained when the drain deadline passed
 * @param drainDuration     time spent waiting for running work
 * @param runningTaskIds    tasks still RUNNING when the drain ended
 * @param activeWorkflowIds workflows still active when the drain ended
 */
public record ShutdownReport(
    boolean drainTimedOut,
    Duration drainDuration,
    List<UUID> runningTaskIds,
    Set<UUID> activeWorkflowIds
) {
    public ShutdownReport {
        runningTaskIds = List.copyOf(runningTaskIds);
        activeWorkflowIds = Set.copyOf(activeWorkflowIds);
    }

    public boolean isClean() {
        return !drainTimedOut;
    }
}
