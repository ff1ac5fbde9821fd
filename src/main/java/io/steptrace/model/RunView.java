package io.steptrace.model;

public record RunView(
        String id,
        String name,
        String workflowId,
        String status,
        String startTime,
        String endTime,
        String inputJson,
        String outputJson,
        String userId,
        String conversationId,
        String metadataJson
) {
}
