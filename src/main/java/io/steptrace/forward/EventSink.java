package io.steptrace.forward;

import java.util.concurrent.CompletionStage;

/**
 * Destination of forwarded events. Delivery may complete asynchronously; a failed stage is
 * handled by the forwarder.
 */
@FunctionalInterface
public interface EventSink {
    CompletionStage<Void> deliver(StreamEvent event);
}
