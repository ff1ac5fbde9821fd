package io.steptrace.observability;

import java.io.IOException;

/**
 * Transport side of a live subscriber. The hub never buffers for a connection: when
 * {@link #isReady()} is false the frame is dropped for that subscriber.
 */
public interface SubscriberConnection {
    String id();

    boolean isReady();

    void send(String frame) throws IOException;

    void close();
}
