package com.tamma.orchestrator.recovery;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tamma.orchestrator.core.exception.InvalidStateException;
import com.tamma.orchestrator.core.exception.ValidationException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.engine.lifecycle.Orchestrator;
import com.tamma.orchestrator.engine.lifecycle.StartupHook;
import com.tamma.orchestrator.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Restart recovery for workflows that were RUNNING when the previous process stopped.
 *
 * For each RUNNING workflow:
 * - a pending or running task exists: leave it, work resumes through the queue
 * - otherwise REQUEUE: enqueue the current step as a fresh workflow-step task
 * - otherwise FAIL: mark the workflow FAILED
 */
public class WorkflowRecoveryService implements StartupHook {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRecoveryService.class);

    private static final int DEFAULT_STEP_PRIORITY = 0;

    private final RecoveryMode mode;
    private volatile RecoveryReport lastReport;

    public WorkflowRecoveryService(RecoveryMode mode) {
        this.mode = mode;
    }

    public RecoveryMode getMode() {
        return mode;
    }

    public RecoveryReport getLastReport() {
        return lastReport;
    }

    @Override
    public void afterStartup(Orchestrator orchestrator) {
        recover(orchestrator);
    }

    /**
     * Run one recovery pass over all RUNNING workflows.
     */
    public RecoveryReport recover(Orchestrator orchestrator) {
        List<WorkflowState> running = orchestrator.listWorkflows(
            WorkflowFilter.byStatus(WorkflowStatus.RUNNING).withLimit(Integer.MAX_VALUE));
        log.info("Recovering {} running workflow(s) in {} mode", running.size(), mode);

        List<UUID> resumed = new ArrayList<>();
        List<UUID> requeued = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();
        List<UUID> errors = new ArrayList<>();

        for (WorkflowState workflow : running) {
            UUID workflowId = workflow.workflowId();
            try (var ctx = LoggingContext.forWorkflow(workflowId)) {
                if (hasLiveTask(orchestrator, workflowId)) {
                    log.info("Workflow {} has live work at step {}, resuming", workflowId, workflow.currentStep());
                    resumed.add(workflowId);
                } else if (mode == RecoveryMode.REQUEUE) {
                    UUID taskId = orchestrator.enqueue(stepTask(workflow));
                    log.info("Requeued step {} of workflow {} as task {}", workflow.currentStep(), workflowId, taskId);
                    requeued.add(workflowId);
                } else {
                    orchestrator.updateWorkflow(workflowId, WorkflowStateUpdate.builder()
                        .status(WorkflowStatus.FAILED)
                        .contextEntry("recoveryFailure", JsonNodeFactory.instance.textNode(
                            "no live task for step " + workflow.currentStep() + " after restart"))
                        .build());
                    log.warn("Failed workflow {} with no live task after restart", workflowId);
                    failed.add(workflowId);
                }
            } catch (InvalidStateException | ValidationException e) {
                // changed by someone else since the listing
                log.warn("Could not recover workflow {}: {}", workflowId, e.getMessage());
                errors.add(workflowId);
            }
        }

        RecoveryReport report = new RecoveryReport(resumed, requeued, failed, errors);
        lastReport = report;
        log.info("Workflow recovery done: {} resumed, {} requeued, {} failed, {} errors",
            resumed.size(), requeued.size(), failed.size(), errors.size());
        return report;
    }

    private static boolean hasLiveTask(Orchestrator orchestrator, UUID workflowId) {
        TaskFilter byWorkflow = TaskFilter.byWorkflow(workflowId).withLimit(1);
        return !orchestrator.listTasks(byWorkflow.withStatus(TaskStatus.PENDING)).isEmpty()
            || !orchestrator.listTasks(byWorkflow.withStatus(TaskStatus.RUNNING)).isEmpty();
    }

    private static TaskSubmission stepTask(WorkflowState workflow) {
        Integer priority = workflow.metadata().priority();
        ObjectNode payload = JsonNodeFactory.instance.objectNode()
            .put("workflowId", workflow.workflowId().toString())
            .put("step", workflow.currentStep())
            .put("recovered", true);
        return TaskSubmission.builder()
            .type(TaskType.WORKFLOW_STEP)
            .priority(priority != null ? priority : DEFAULT_STEP_PRIORITY)
            .payload(payload)
            .metadata(TaskMetadata.forWorkflowStep(workflow.workflowId(), workflow.currentStep()))
            .build();
    }
}
