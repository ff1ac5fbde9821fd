package io.steptrace.model;

public record StepView(
        String id,
        String runId,
        int stepIndex,
        String stepType,
        String stepName,
        String stepId,
        String status,
        String startTime,
        String endTime,
        String inputJson,
        String outputJson,
        String errorMessage,
        String executorRef,
        Integer parallelIndex,
        String parentStepId,
        String metadataJson
) {
}
