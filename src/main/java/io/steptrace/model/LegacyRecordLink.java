package io.steptrace.model;

public record LegacyRecordLink(
        String legacyId,
        String workflowRunId,
        String workflowStepId
) {
}
