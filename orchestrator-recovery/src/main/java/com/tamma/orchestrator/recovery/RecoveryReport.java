package com.tamma.orchestrator.recovery;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one restart recovery pass, by workflow id.
 *
 * @param resumed  workflows that still had a pending or running task
 * @param requeued workflows whose current step was enqueued again
 * @param failed   workflows marked FAILED
 * @param errors   workflows that could not be recovered
 */
public record RecoveryReport(
    List<UUID> resumed,
    List<UUID> requeued,
    List<UUID> failed,
    List<UUID> errors
) {
    public RecoveryReport {
        resumed = List.copyOf(resumed);
        requeued = List.copyOf(requeued);
        failed = List.copyOf(failed);
        errors = List.copyOf(errors);
    }

    public int total() {
        return resumed.size() + requeued.size() + failed.size() + errors.size();
    }
}
