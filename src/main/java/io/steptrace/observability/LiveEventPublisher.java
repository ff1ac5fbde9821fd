package io.steptrace.observability;

import io.steptrace.model.EventLevel;
import io.steptrace.model.TimelineEvent;
import io.steptrace.workflow.RunEvent;
import io.steptrace.workflow.RunListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns persisted timeline events into live events on a hub. Span opens become
 * {@code run.start}/{@code step.start}, closes become {@code run.end}/{@code step.end}.
 */
public final class LiveEventPublisher implements RunListener {
    private final LiveBroadcastHub hub;

    public LiveEventPublisher(LiveBroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void onEvent(RunEvent runEvent) {
        hub.publish(toLiveEvent(runEvent));
    }

    static LiveEvent toLiveEvent(RunEvent runEvent) {
        TimelineEvent event = runEvent.event();
        boolean closed = event.endTime() != null;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("eventId", event.eventId());
        data.put("parentEventId", event.parentEventId());
        data.put("status", event.status());
        data.put("sequence", event.sequence());
        if (event.outputJson() != null) {
            data.put("output", event.outputJson());
        }
        String message = event.statusMessage() != null ? event.statusMessage() : event.status();
        return new LiveEvent(
                TraceIds.newRecordId(),
                closed ? event.endTime() : event.startTime(),
                EventLevel.fromString(event.level()),
                event.kind() + (closed ? ".end" : ".start"),
                event.name(),
                message,
                event.runId(),
                runEvent.parentRunId(),
                runEvent.workflowId(),
                runEvent.conversationId(),
                event.traceId(),
                null,
                null,
                data
        );
    }
}
