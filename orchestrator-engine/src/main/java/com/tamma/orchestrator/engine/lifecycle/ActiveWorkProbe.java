package com.tamma.orchestrator.engine.lifecycle;

import java.util.Set;
import java.util.UUID;

/**
 * Reports workflows still being driven by the workflow engine.
 * Shutdown waits for this to reach zero alongside running tasks.
 */
@FunctionalInterface
public interface ActiveWorkProbe {

    Set<UUID> activeWorkflowIds();

    static ActiveWorkProbe none() {
        return Set::of;
    }
}
