package io.steptrace.cli;

import io.steptrace.observability.SubscriberConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-sent events stream held open by a console request thread. The connection is ready while
 * it is open and no other frame is being written.
 */
final class SseConnection implements SubscriberConnection {
    static final String EVENT_NAME = "live";

    private static final Logger log = LoggerFactory.getLogger(SseConnection.class);

    private final String id;
    private final OutputStream out;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicBoolean writing = new AtomicBoolean(false);
    private final CountDownLatch closed = new CountDownLatch(1);

    SseConnection(String id, OutputStream out) {
        this.id = id;
        this.out = out;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isReady() {
        return open.get() && !writing.get();
    }

    @Override
    public void send(String frame) throws IOException {
        String data = frame.replace("\r", " ").replace("\n", " ");
        write("event: " + EVENT_NAME + "\ndata: " + data + "\n\n");
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            closed.countDown();
        }
    }

    boolean isOpen() {
        return open.get();
    }

    /**
     * Blocks the request thread until the connection closes, writing a comment line every
     * {@code heartbeatMs} to detect a client that went away.
     */
    void holdOpen(long heartbeatMs) {
        try {
            while (open.get()) {
                if (closed.await(Math.max(100L, heartbeatMs), TimeUnit.MILLISECONDS)) {
                    break;
                }
                try {
                    write(": ping\n\n");
                } catch (IOException e) {
                    log.debug("Subscriber {} went away: {}", id, e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        }
    }

    private void write(String text) throws IOException {
        if (!open.get()) {
            throw new IOException("connection closed: " + id);
        }
        synchronized (out) {
            writing.set(true);
            try {
                out.write(text.getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                close();
                throw e;
            } finally {
                writing.set(false);
            }
        }
    }
}
