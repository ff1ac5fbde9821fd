package io.steptrace.workflow;

import io.steptrace.model.TimelineEvent;

/**
 * A timeline event as written by the runner, with the owning run's correlation attributes.
 */
public record RunEvent(
        TimelineEvent event,
        String workflowId,
        String conversationId,
        String parentRunId
) {
}
