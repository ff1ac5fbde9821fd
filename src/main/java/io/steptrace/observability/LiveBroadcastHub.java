package io.steptrace.observability;

import io.steptrace.config.EngineSettings;
import io.steptrace.util.Jsons;
import io.steptrace.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans a bounded ring of recent live events out to filtered subscribers.
 *
 * <p>A subscriber first gets one {@code initial} frame with the most recent matching events, then
 * one {@code update} frame per matching event. Frames for a connection that is not ready are
 * dropped, not queued; completeness comes from the history store.
 */
public final class LiveBroadcastHub implements AutoCloseable {
    public static final String INITIAL = "initial";
    public static final String UPDATE = "update";

    private static final Logger log = LoggerFactory.getLogger(LiveBroadcastHub.class);

    private final int capacity;
    private final int backlogLimit;
    private final ArrayDeque<LiveEvent> ring;
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Object deliveryLock = new Object();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile ExecutorService dispatcher;

    public LiveBroadcastHub(EngineSettings settings) {
        this(settings.backlogCapacity(), settings.backlogLimit());
    }

    public LiveBroadcastHub(int capacity, int backlogLimit) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.backlogLimit = Math.max(0, Math.min(backlogLimit, capacity));
        this.ring = new ArrayDeque<>(capacity);
    }

    public synchronized void start() {
        if (dispatcher != null) {
            return;
        }
        dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "steptrace-live-hub");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Live broadcast hub started: capacity={} backlogLimit={}", capacity, backlogLimit);
    }

    /**
     * Stops delivery and disconnects every subscriber. The ring keeps its contents.
     */
    public synchronized void stop() {
        ExecutorService current = dispatcher;
        dispatcher = null;
        if (current != null) {
            current.shutdown();
            try {
                if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                    current.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                current.shutdownNow();
            }
        }
        for (String id : new ArrayList<>(subscribers.keySet())) {
            disconnect(id);
        }
        log.info("Live broadcast hub stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return dispatcher != null;
    }

    /**
     * Appends to the ring and schedules delivery. Returns immediately; delivery happens on the hub
     * thread. Before {@link #start()} events are only retained.
     */
    public void publish(LiveEvent event) {
        if (event == null) {
            return;
        }
        synchronized (ring) {
            if (ring.size() == capacity) {
                ring.pollFirst();
            }
            ring.addLast(event);
        }
        published.incrementAndGet();
        ExecutorService current = dispatcher;
        if (current == null) {
            return;
        }
        try {
            current.execute(() -> broadcast(event));
        } catch (RejectedExecutionException e) {
            log.debug("Hub stopping; event {} retained but not delivered", event.id());
        }
    }

    /**
     * Registers a subscriber and sends its {@code initial} snapshot. A subscriber already holding
     * the same id is replaced and its connection closed.
     *
     * @return false when the snapshot could not be sent and the connection was dropped
     */
    public boolean subscribe(SubscriberConnection connection, LiveFilter filter) {
        LiveFilter effective = filter == null ? LiveFilter.all() : filter;
        Subscriber subscriber = new Subscriber(connection, effective);
        synchronized (deliveryLock) {
            Subscriber previous = subscribers.put(connection.id(), subscriber);
            if (previous != null && previous.connection != connection) {
                log.debug("Subscriber {} reconnected; closing previous connection", connection.id());
                closeConnection(previous);
            }
            List<LiveEvent> snapshot = recent(effective);
            try {
                connection.send(frame(INITIAL, snapshot));
            } catch (IOException | RuntimeException e) {
                log.debug("Initial snapshot to {} failed: {}", connection.id(), e.getMessage());
                disconnect(connection);
                return false;
            }
        }
        log.debug("Subscriber connected: id={} total={}", connection.id(), subscribers.size());
        return true;
    }

    /**
     * Replaces a subscriber's filter for events published from now on.
     */
    public boolean updateFilter(String connectionId, LiveFilter filter) {
        Subscriber subscriber = subscribers.get(connectionId);
        if (subscriber == null) {
            return false;
        }
        subscriber.filter = filter == null ? LiveFilter.all() : filter;
        log.debug("Subscriber filter updated: id={}", connectionId);
        return true;
    }

    /**
     * Removes a subscriber. Safe to call more than once.
     */
    public boolean disconnect(String connectionId) {
        if (connectionId == null) {
            return false;
        }
        Subscriber removed = subscribers.remove(connectionId);
        if (removed == null) {
            return false;
        }
        closeConnection(removed);
        log.debug("Subscriber disconnected: id={} remaining={}", connectionId, subscribers.size());
        return true;
    }

    /**
     * Removes the subscriber only while {@code connection} is the one registered under its id, so
     * a stale connection cannot evict the subscriber that replaced it.
     */
    public boolean disconnect(SubscriberConnection connection) {
        if (connection == null) {
            return false;
        }
        Subscriber current = subscribers.get(connection.id());
        if (current == null || current.connection != connection || !subscribers.remove(connection.id(), current)) {
            return false;
        }
        closeConnection(current);
        log.debug("Subscriber disconnected: id={} remaining={}", connection.id(), subscribers.size());
        return true;
    }

    private static void closeConnection(Subscriber subscriber) {
        try {
            subscriber.connection.close();
        } catch (RuntimeException e) {
            log.debug("Closing subscriber {} failed: {}", subscriber.connection.id(), e.getMessage());
        }
    }

    /**
     * Most recent retained events matching {@code filter}, oldest first. The count is the filter's
     * limit when set, otherwise the configured backlog limit.
     */
    public List<LiveEvent> recent(LiveFilter filter) {
        LiveFilter effective = filter == null ? LiveFilter.all() : filter;
        int max = effective.limit() == null ? backlogLimit : Math.min(effective.limit(), capacity);
        List<LiveEvent> out = new ArrayList<>();
        if (max <= 0) {
            return out;
        }
        synchronized (ring) {
            Iterator<LiveEvent> it = ring.descendingIterator();
            while (it.hasNext() && out.size() < max) {
                LiveEvent event = it.next();
                if (effective.matches(event)) {
                    out.add(event);
                }
            }
        }
        Collections.reverse(out);
        return out;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public long publishedCount() {
        return published.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Blocks until events published so far have been offered to subscribers.
     */
    public boolean awaitDelivery(long timeoutMs) {
        ExecutorService current = dispatcher;
        if (current == null) {
            return true;
        }
        try {
            current.submit(() -> { }).get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            return false;
        }
    }

    private void broadcast(LiveEvent event) {
        String frame = null;
        synchronized (deliveryLock) {
            for (Subscriber subscriber : subscribers.values()) {
                if (subscribers.get(subscriber.connection.id()) != subscriber) {
                    continue;
                }
                if (!subscriber.filter.matches(event)) {
                    continue;
                }
                if (!subscriber.connection.isReady()) {
                    dropped.incrementAndGet();
                    continue;
                }
                if (frame == null) {
                    frame = frame(UPDATE, List.of(event));
                }
                try {
                    subscriber.connection.send(frame);
                } catch (IOException | RuntimeException e) {
                    log.debug("Delivery to {} failed: {}", subscriber.connection.id(), e.getMessage());
                    disconnect(subscriber.connection);
                }
            }
        }
    }

    private static String frame(String type, List<LiveEvent> events) {
        return Jsons.toCompactJson(new HubMessage(type, events, Timestamps.now()));
    }

    public record HubMessage(String type, List<LiveEvent> events, String timestamp) {
    }

    private static final class Subscriber {
        private final SubscriberConnection connection;
        private volatile LiveFilter filter;

        private Subscriber(SubscriberConnection connection, LiveFilter filter) {
            this.connection = connection;
            this.filter = filter;
        }
    }
}
