package com.tamma.orchestrator.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of schedulable work. A worker must carry the type's tag in its capabilities
 * to receive a task of that type.
 */
public enum TaskType {
    /**
     * One step of an autonomous development cycle.
     */
    WORKFLOW_STEP("workflow-step"),

    /**
     * Build, test or security gate executed against a change.
     */
    QUALITY_GATE("quality-gate"),

    /**
     * Branch, commit, push or pull-request operation against a Git platform.
     */
    GIT_OPERATION("git-operation");

    private final String tag;

    TaskType(String tag) {
        this.tag = tag;
    }

    /**
     * The capability tag a worker must advertise to execute this type.
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolve a type from its capability tag.
     */
    public static Optional<TaskType> fromTag(String tag) {
        return Arrays.stream(values())
            .filter(type -> type.tag.equals(tag))
            .findFirst();
    }
}
