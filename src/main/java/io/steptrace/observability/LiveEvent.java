package io.steptrace.observability;

import io.steptrace.model.EventLevel;

import java.util.Map;

/**
 * One entry of the live feed. {@code executionId} names the execution that produced the event and
 * {@code parentExecutionId} the execution that launched it, when nested.
 */
public record LiveEvent(
        String id,
        String timestamp,
        EventLevel level,
        String type,
        String name,
        String message,
        String executionId,
        String parentExecutionId,
        String workflowId,
        String conversationId,
        String traceId,
        String emitterId,
        String emitterName,
        Map<String, Object> data
) {
    public LiveEvent {
        level = level == null ? EventLevel.INFO : level;
        data = data == null ? Map.of() : data;
    }
}
