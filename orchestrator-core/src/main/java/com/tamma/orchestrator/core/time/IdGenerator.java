package com.tamma.orchestrator.core.time;

import java.util.UUID;

/**
 * Source of unique identifiers for tasks, workflow states and history entries.
 */
@FunctionalInterface
public interface IdGenerator {

    UUID nextId();

    /**
     * Random (version 4) UUIDs.
     */
    static IdGenerator random() {
        return UUID::randomUUID;
    }
}
