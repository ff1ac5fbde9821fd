package io.steptrace.forward;

import io.steptrace.model.EventLevel;
import io.steptrace.observability.LiveBroadcastHub;
import io.steptrace.observability.LiveEvent;
import io.steptrace.observability.TraceIds;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Sink that publishes forwarded events on the live hub, attributed to their emitter.
 */
public final class LiveHubSink implements EventSink {
    private final LiveBroadcastHub hub;

    public LiveHubSink(LiveBroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public CompletionStage<Void> deliver(StreamEvent event) {
        hub.publish(toLiveEvent(event));
        return CompletableFuture.completedFuture(null);
    }

    static LiveEvent toLiveEvent(StreamEvent event) {
        EventLevel level;
        try {
            level = EventLevel.fromString(event.level());
        } catch (IllegalArgumentException e) {
            level = EventLevel.INFO;
        }
        String executionId = event.executionId() == null ? event.emitterId() : event.executionId();
        return new LiveEvent(
                TraceIds.newRecordId(),
                event.timestamp(),
                level,
                event.type(),
                event.emitterName(),
                event.emitterName() + " " + event.type(),
                executionId,
                event.parentExecutionId(),
                null,
                null,
                null,
                event.emitterId(),
                event.emitterName(),
                event.data()
        );
    }
}
