package com.tamma.orchestrator.engine.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tamma.orchestrator.core.model.WorkflowMetadata;
import com.tamma.orchestrator.core.model.WorkflowState;
import com.tamma.orchestrator.core.model.WorkflowStateHistoryEntry;
import com.tamma.orchestrator.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.*;

/**
 * JSON encoding of the mutable workflow state fields recorded in history entries,
 * and replay of history in either direction.
 *
 * <p>updatedAt and version are not recorded as fields; replay restores them from the
 * entry's changedAt and sequence.</p>
 */
public final class WorkflowStateFields {

    public static final String STATUS = "status";
    public static final String CURRENT_STEP = "currentStep";
    public static final String CONTEXT = "context";
    public static final String METADATA = "metadata";
    public static final String STARTED_AT = "startedAt";
    public static final String COMPLETED_AT = "completedAt";
    public static final String FAILED_AT = "failedAt";

    public static final List<String> TRACKED = List.of(
        STATUS, CURRENT_STEP, CONTEXT, METADATA, STARTED_AT, COMPLETED_AT, FAILED_AT);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowStateFields() {
    }

    /**
     * Encode every tracked field of a state, in {@link #TRACKED} order.
     */
    public static Map<String, JsonNode> encode(WorkflowState state) {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        values.put(STATUS, TextNode.valueOf(state.status().name()));
        values.put(CURRENT_STEP, IntNode.valueOf(state.currentStep()));
        values.put(CONTEXT, state.context().deepCopy());
        values.put(METADATA, MAPPER.valueToTree(state.metadata()));
        values.put(STARTED_AT, encodeInstant(state.startedAt()));
        values.put(COMPLETED_AT, encodeInstant(state.completedAt()));
        values.put(FAILED_AT, encodeInstant(state.failedAt()));
        return values;
    }

    /**
     * Build the history entry describing the change from {@code before} to {@code after}.
     * Only fields whose encoded value differs are recorded.
     */
    public static WorkflowStateHistoryEntry diff(UUID entryId, WorkflowState before, WorkflowState after) {
        Map<String, JsonNode> previous = encode(before);
        Map<String, JsonNode> next = encode(after);
        Set<String> changed = new LinkedHashSet<>();
        Map<String, JsonNode> previousValues = new LinkedHashMap<>();
        Map<String, JsonNode> newValues = new LinkedHashMap<>();
        for (String field : TRACKED) {
            if (!previous.get(field).equals(next.get(field))) {
                changed.add(field);
                previousValues.put(field, previous.get(field));
                newValues.put(field, next.get(field));
            }
        }
        return new WorkflowStateHistoryEntry(
            entryId, after.workflowId(), after.version(), after.updatedAt(),
            changed, previousValues, newValues);
    }

    /**
     * Reconstruct the current state by applying entries forward from the initial state.
     */
    public static WorkflowState replay(WorkflowState initial, List<WorkflowStateHistoryEntry> entries) {
        WorkflowState state = initial;
        for (WorkflowStateHistoryEntry entry : entries) {
            state = apply(state, entry.newValues())
                .updatedAt(entry.changedAt())
                .version(entry.sequence())
                .build();
        }
        return state;
    }

    /**
     * Reconstruct the initial state by undoing entries backward from the current state.
     */
    public static WorkflowState rewind(WorkflowState current, List<WorkflowStateHistoryEntry> entries) {
        WorkflowState state = current;
        for (int i = entries.size() - 1; i >= 0; i--) {
            WorkflowStateHistoryEntry entry = entries.get(i);
            Instant previousUpdate = i > 0 ? entries.get(i - 1).changedAt() : current.createdAt();
            state = apply(state, entry.previousValues())
                .updatedAt(previousUpdate)
                .version(entry.sequence() - 1)
                .build();
        }
        return state;
    }

    private static WorkflowState.Builder apply(WorkflowState state, Map<String, JsonNode> values) {
        WorkflowState.Builder builder = state.toBuilder();
        values.forEach((field, value) -> {
            switch (field) {
                case STATUS -> builder.status(WorkflowStatus.valueOf(value.asText()));
                case CURRENT_STEP -> builder.currentStep(value.asInt());
                case CONTEXT -> builder.context(value.deepCopy());
                case METADATA -> builder.metadata(decodeMetadata(value));
                case STARTED_AT -> builder.startedAt(decodeInstant(value));
                case COMPLETED_AT -> builder.completedAt(decodeInstant(value));
                case FAILED_AT -> builder.failedAt(decodeInstant(value));
                default -> throw new IllegalArgumentException("Unknown workflow state field: " + field);
            }
        });
        return builder;
    }

    private static JsonNode encodeInstant(Instant instant) {
        return instant != null ? TextNode.valueOf(instant.toString()) : NullNode.getInstance();
    }

    private static Instant decodeInstant(JsonNode value) {
        return value == null || value.isNull() ? null : Instant.parse(value.asText());
    }

    private static WorkflowMetadata decodeMetadata(JsonNode value) {
        try {
            return MAPPER.treeToValue(value, WorkflowMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workflow metadata in history: " + value, e);
        }
    }
}
