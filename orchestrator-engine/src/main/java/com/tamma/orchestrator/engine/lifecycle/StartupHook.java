package com.tamma.orchestrator.engine.lifecycle;

/**
 * Runs once the orchestrator is RUNNING, e.g. restart recovery of in-flight workflows.
 * A failing hook is logged and does not stop the orchestrator.
 */
@FunctionalInterface
public interface StartupHook {

    void afterStartup(Orchestrator orchestrator);
}
