package io.steptrace.model;

public record WorkflowStats(
        String workflowId,
        long totalRuns,
        long completedRuns,
        long failedRuns,
        long cancelledRuns,
        double averageDurationMs,
        String lastStartTime
) {
}
