package com.tamma.orchestrator.engine.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tamma.orchestrator.core.audit.AuditEventType;
import com.tamma.orchestrator.core.exception.InvalidStateException;
import com.tamma.orchestrator.core.exception.NotFoundException;
import com.tamma.orchestrator.core.exception.OptimisticLockException;
import com.tamma.orchestrator.core.exception.ValidationException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.repository.WorkflowStateRepository;
import com.tamma.orchestrator.core.time.IdGenerator;
import com.tamma.orchestrator.engine.audit.AuditEmitter;
import com.tamma.orchestrator.engine.health.ComponentHealth;
import com.tamma.orchestrator.engine.logging.LoggingContext;
import com.tamma.orchestrator.engine.storage.StorageRetryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Sole writer of workflow states.
 *
 * <p>Every update is validated against the current record, written together with exactly one
 * history entry, and fenced on the version that was read. Version conflicts are re-read and
 * retried a bounded number of times.</p>
 *
 * <p>Makes no resumption decisions; restart recovery belongs to the orchestrator.</p>
 */
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    public static final String COMPONENT = "stateManager";

    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final WorkflowStateRepository states;
    private final StorageRetryTemplate storage;
    private final AuditEmitter audit;
    private final Clock clock;
    private final IdGenerator ids;

    public StateManager(
            WorkflowStateRepository states,
            StorageRetryTemplate storage,
            AuditEmitter audit,
            Clock clock,
            IdGenerator ids) {
        this.states = states;
        this.storage = storage;
        this.audit = audit;
        this.clock = clock;
        this.ids = ids;
    }

    // ========== Create ==========

    public UUID createWorkflowState(WorkflowStateDraft draft) {
        if (draft == null) {
            throw new ValidationException("workflow state draft is required");
        }
        if (draft.initialStep() < 0) {
            throw new ValidationException("initialStep", "must be >= 0");
        }
        requireObject(draft.context());

        WorkflowState state = WorkflowState.create(ids.nextId(), draft, clock.instant());
        storage.run("workflow.insert", () -> states.insert(state));

        try (var ctx = LoggingContext.forWorkflow(state.workflowId())) {
            log.info("Created workflow state {} for issue {}", state.workflowId(), state.issueRef());
        }
        ObjectNode payload = JsonNodeFactory.instance.objectNode()
            .put("currentStep", state.currentStep());
        putIfPresent(payload, "issueRef", state.issueRef());
        putIfPresent(payload, "repositoryRef", state.repositoryRef());
        audit.emit(AuditEventType.WORKFLOW_CREATED, tags(state.workflowId()), payload);
        return state.workflowId();
    }

    // ========== Update ==========

    /**
     * Apply a partial update and append one history entry atomically.
     *
     * @throws NotFoundException if the workflow is unknown
     * @throws InvalidStateException if the status transition is not allowed
     * @throws ValidationException if currentStep would decrease or the update is malformed
     * @throws OptimisticLockException if concurrent writers kept winning
     */
    public WorkflowState updateWorkflowState(UUID workflowId, WorkflowStateUpdate update) {
        if (update == null) {
            throw new ValidationException("workflow state update is required");
        }
        if (update.status() == WorkflowStatus.ARCHIVED) {
            throw new InvalidStateException("Workflows are archived with archiveWorkflowState, not updated to ARCHIVED");
        }
        return applyUpdate(workflowId, update);
    }

    /**
     * Mark a workflow ARCHIVED through the normal update path. Archiving an archived workflow
     * returns it unchanged.
     */
    public WorkflowState archiveWorkflowState(UUID workflowId) {
        WorkflowState current = getWorkflowState(workflowId);
        if (current.status() == WorkflowStatus.ARCHIVED) {
            return current;
        }
        return applyUpdate(workflowId, WorkflowStateUpdate.status(WorkflowStatus.ARCHIVED));
    }

    private WorkflowState applyUpdate(UUID workflowId, WorkflowStateUpdate update) {
        if (update.context() != null && !update.contextEntries().isEmpty()) {
            throw new ValidationException("context", "cannot replace and merge context in one update");
        }
        requireObject(update.context());

        OptimisticLockException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            WorkflowState current = getWorkflowState(workflowId);
            WorkflowState next = apply(current, update, clock.instant());
            WorkflowStateHistoryEntry entry = WorkflowStateFields.diff(ids.nextId(), current, next);
            try {
                storage.run("workflow.update", () -> states.update(next, entry));
            } catch (OptimisticLockException e) {
                lastConflict = e;
                log.debug("Workflow {} changed concurrently (attempt {}), re-reading", workflowId, attempt);
                continue;
            }

            try (var ctx = LoggingContext.forWorkflow(workflowId)) {
                log.info("Updated workflow {} to version {}: {}", workflowId, next.version(), entry.changedFields());
            }
            ObjectNode payload = JsonNodeFactory.instance.objectNode()
                .put("version", next.version())
                .put("status", next.status().name())
                .put("currentStep", next.currentStep());
            entry.changedFields().forEach(payload.putArray("changedFields")::add);
            audit.emit(AuditEventType.WORKFLOW_UPDATED, tags(workflowId), payload);
            return next;
        }
        throw lastConflict;
    }

    private WorkflowState apply(WorkflowState current, WorkflowStateUpdate update, Instant now) {
        WorkflowState.Builder builder = current.toBuilder();

        WorkflowStatus status = update.status();
        if (status != null && status != current.status()) {
            if (!current.status().canTransitionTo(status)) {
                throw new InvalidStateException("WorkflowState", current.status().name(), status.name());
            }
            builder.status(status);
            if (status == WorkflowStatus.RUNNING && current.startedAt() == null) {
                builder.startedAt(now);
            }
            if (status == WorkflowStatus.COMPLETED && current.completedAt() == null) {
                builder.completedAt(now);
            }
            if (status == WorkflowStatus.FAILED && current.failedAt() == null) {
                builder.failedAt(now);
            }
        }

        if (update.currentStep() != null) {
            if (update.currentStep() < current.currentStep()) {
                throw new ValidationException("currentStep", String.format(
                    "cannot move back from %d to %d", current.currentStep(), update.currentStep()));
            }
            builder.currentStep(update.currentStep());
        }

        if (update.context() != null) {
            builder.context(update.context().deepCopy());
        } else if (!update.contextEntries().isEmpty()) {
            ObjectNode merged = ((ObjectNode) current.context()).deepCopy();
            update.contextEntries().forEach(merged::set);
            builder.context(merged);
        }

        if (update.metadata() != null) {
            builder.metadata(update.metadata());
        }

        return builder
            .updatedAt(now)
            .version(current.version() + 1)
            .build();
    }

    // ========== Delete ==========

    /**
     * Hard delete. History entries are kept.
     *
     * @throws NotFoundException if the workflow is unknown
     */
    public void deleteWorkflowState(UUID workflowId) {
        boolean deleted = storage.execute("workflow.delete", () -> states.delete(workflowId));
        if (!deleted) {
            throw new NotFoundException("WorkflowState", workflowId.toString());
        }
        log.warn("Deleted workflow state {}", workflowId);
        audit.emit(AuditEventType.WORKFLOW_DELETED, tags(workflowId));
    }

    // ========== Reads ==========

    public WorkflowState getWorkflowState(UUID workflowId) {
        return storage.execute("workflow.find", () -> states.findById(workflowId))
            .orElseThrow(() -> new NotFoundException("WorkflowState", workflowId.toString()));
    }

    public List<WorkflowState> listWorkflowStates(WorkflowFilter filter) {
        return storage.execute("workflow.list", () -> states.find(filter != null ? filter : WorkflowFilter.all()));
    }

    /**
     * History in chronological order. Still available after a hard delete.
     *
     * @throws NotFoundException if the workflow never existed
     */
    public List<WorkflowStateHistoryEntry> getWorkflowHistory(UUID workflowId) {
        List<WorkflowStateHistoryEntry> history = storage.execute("workflow.history", () -> states.findHistory(workflowId));
        if (history.isEmpty() && storage.execute("workflow.find", () -> states.findById(workflowId)).isEmpty()) {
            throw new NotFoundException("WorkflowState", workflowId.toString());
        }
        return history;
    }

    public Map<WorkflowStatus, Long> countByStatus() {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowStatus status : WorkflowStatus.values()) {
            counts.put(status, 0L);
        }
        counts.putAll(storage.execute("workflow.countByStatus", states::countByStatus));
        return counts;
    }

    public ComponentHealth health() {
        try {
            Map<WorkflowStatus, Long> counts = states.countByStatus();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("running", counts.getOrDefault(WorkflowStatus.RUNNING, 0L));
            details.put("paused", counts.getOrDefault(WorkflowStatus.PAUSED, 0L));
            return ComponentHealth.healthy(COMPONENT, details);
        } catch (RuntimeException e) {
            return ComponentHealth.unhealthy(COMPONENT, e);
        }
    }

    // ========== Helper Methods ==========

    private static void requireObject(JsonNode context) {
        if (context != null && !context.isObject()) {
            throw new ValidationException("context", "must be a JSON object");
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static Map<String, String> tags(UUID workflowId) {
        return Map.of("workflowId", workflowId.toString());
    }
}
