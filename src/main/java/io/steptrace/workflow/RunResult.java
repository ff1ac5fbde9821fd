package io.steptrace.workflow;

import io.steptrace.model.RunStatus;

/**
 * Terminal outcome of a run. {@code failure} holds the executor or storage error that ended the
 * run, if any.
 */
public record RunResult(
        String runId,
        String traceId,
        RunStatus status,
        Object output,
        String errorMessage,
        Throwable failure
) {
    public boolean completed() {
        return status == RunStatus.COMPLETED;
    }
}
