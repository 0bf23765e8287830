package com.tamma.orchestrator.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only record of one workflow state update.
 *
 * Primary Key: entryId
 * Index: (workflowId, sequence)
 *
 * Invariants:
 * - sequence equals the workflow version produced by the update, contiguous from 1
 * - previousValues and newValues are keyed by exactly the changedFields
 * - entries are never modified or deleted
 */
public record WorkflowStateHistoryEntry(
    UUID entryId,
    UUID workflowId,
    long sequence,
    Instant changedAt,
    Set<String> changedFields,
    Map<String, JsonNode> previousValues,
    Map<String, JsonNode> newValues
) {
    public WorkflowStateHistoryEntry {
        changedFields = Collections.unmodifiableSet(new LinkedHashSet<>(changedFields));
        previousValues = Collections.unmodifiableMap(new LinkedHashMap<>(previousValues));
        newValues = Collections.unmodifiableMap(new LinkedHashMap<>(newValues));
    }
}
