package io.steptrace.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.steptrace.forward.EventForwarder;
import io.steptrace.forward.StreamEvent;
import io.steptrace.model.RunDetail;
import io.steptrace.observability.LiveBroadcastHub;
import io.steptrace.observability.LiveFilter;
import io.steptrace.observability.TraceIds;
import io.steptrace.storage.HistoryStore;
import io.steptrace.storage.HistoryStoreException;
import io.steptrace.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP console over the history store and the live hub.
 *
 * <ul>
 *   <li>{@code GET /events/live}: live subscription as server-sent events</li>
 *   <li>{@code POST /api/live/filter}: replace a subscriber's filter</li>
 *   <li>{@code POST /api/forward}: ingest an event of another process through the forwarder</li>
 *   <li>{@code GET /api/runs}, {@code /api/run}, {@code /api/events}, {@code /api/stats}: history</li>
 * </ul>
 */
public final class ConsoleServer implements AutoCloseable {
    public static final long DEFAULT_HEARTBEAT_MS = 15_000L;
    private static final int MAX_RUN_LIMIT = 1_000;

    private static final Logger log = LoggerFactory.getLogger(ConsoleServer.class);

    private final HistoryStore store;
    private final LiveBroadcastHub hub;
    private final EventForwarder forwarder;
    private final long heartbeatMs;
    private HttpServer server;
    private ExecutorService executor;

    public ConsoleServer(HistoryStore store, LiveBroadcastHub hub, EventForwarder forwarder) {
        this(store, hub, forwarder, DEFAULT_HEARTBEAT_MS);
    }

    public ConsoleServer(HistoryStore store, LiveBroadcastHub hub, EventForwarder forwarder, long heartbeatMs) {
        this.store = store;
        this.hub = hub;
        this.forwarder = forwarder;
        this.heartbeatMs = heartbeatMs;
    }

    /**
     * @param port bind port, 0 for an ephemeral one
     * @return the bound port
     */
    public synchronized int start(int port) throws IOException {
        if (server != null) {
            return server.getAddress().getPort();
        }
        HttpServer created = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
        created.createContext("/events/live", guarded(this::handleLive));
        created.createContext("/api/live/filter", guarded(this::handleFilterUpdate));
        created.createContext("/api/forward", guarded(this::handleForward));
        created.createContext("/api/runs", guarded(this::handleRuns));
        created.createContext("/api/run", guarded(this::handleRun));
        created.createContext("/api/events", guarded(this::handleEvents));
        created.createContext("/api/stats", guarded(this::handleStats));
        executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "steptrace-console");
            thread.setDaemon(true);
            return thread;
        });
        created.setExecutor(executor);
        created.start();
        server = created;
        int bound = created.getAddress().getPort();
        log.info("Console listening on http://127.0.0.1:{}/", bound);
        return bound;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(0);
        server = null;
        executor.shutdownNow();
        executor = null;
        log.info("Console stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void handleLive(HttpExchange exchange) throws IOException {
        Map<String, String> q = HttpSupport.parseParams(exchange);
        LiveFilter filter = LiveFilter.fromParams(q);
        String subscriberId = HttpSupport.trimToNull(q.get("subscriberId"));
        if (subscriberId == null) {
            subscriberId = TraceIds.newRecordId();
        }
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("X-Subscriber-Id", subscriberId);
        exchange.sendResponseHeaders(200, 0);
        SseConnection connection = new SseConnection(subscriberId, exchange.getResponseBody());
        try {
            if (hub.subscribe(connection, filter)) {
                connection.holdOpen(heartbeatMs);
            }
        } finally {
            hub.disconnect(connection);
            exchange.close();
        }
    }

    private void handleFilterUpdate(HttpExchange exchange) throws IOException {
        if (!requirePost(exchange)) return;
        Map<String, String> q = HttpSupport.parseParams(exchange);
        String subscriberId = HttpSupport.trimToNull(q.get("subscriberId"));
        if (subscriberId == null) {
            HttpSupport.writeError(exchange, 400, "subscriberId is required");
            return;
        }
        LiveFilter filter = LiveFilter.fromParams(q);
        if (!hub.updateFilter(subscriberId, filter)) {
            HttpSupport.writeError(exchange, 404, "subscriber not found: " + subscriberId);
            return;
        }
        HttpSupport.writeJson(exchange, Map.of("subscriberId", subscriberId, "updated", true), 200);
    }

    private void handleForward(HttpExchange exchange) throws IOException {
        if (!requirePost(exchange)) return;
        String body = HttpSupport.readBody(exchange);
        StreamEvent event;
        try {
            event = Jsons.mapper().readValue(body, StreamEvent.class);
        } catch (JsonProcessingException e) {
            HttpSupport.writeError(exchange, 400, "invalid event: " + e.getOriginalMessage());
            return;
        }
        boolean forwarded = forwarder.forward(event).join();
        HttpSupport.writeJson(exchange, Map.of("forwarded", forwarded), 202);
    }

    private void handleRuns(HttpExchange exchange) throws IOException {
        Map<String, String> q = HttpSupport.parseParams(exchange);
        String workflowId = HttpSupport.trimToNull(q.get("workflowId"));
        if (workflowId == null) {
            HttpSupport.writeJson(exchange, Map.of("workflowIds", store.listWorkflowIds()), 200);
            return;
        }
        int limit = HttpSupport.clamp(HttpSupport.parseIntOrDefault(q.get("limit"), 50), 1, MAX_RUN_LIMIT);
        HttpSupport.writeJson(exchange, store.listRuns(workflowId, limit), 200);
    }

    private void handleRun(HttpExchange exchange) throws IOException {
        Map<String, String> q = HttpSupport.parseParams(exchange);
        String runId = HttpSupport.trimToNull(q.get("runId"));
        if (runId == null) {
            HttpSupport.writeError(exchange, 400, "runId is required");
            return;
        }
        Optional<RunDetail> detail = store.getRunDetail(runId);
        if (detail.isEmpty()) {
            HttpSupport.writeError(exchange, 404, "run not found: " + runId);
            return;
        }
        HttpSupport.writeJson(exchange, detail.get(), 200);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        Map<String, String> q = HttpSupport.parseParams(exchange);
        String runId = HttpSupport.trimToNull(q.get("runId"));
        String traceId = HttpSupport.trimToNull(q.get("traceId"));
        if (runId != null) {
            HttpSupport.writeJson(exchange, store.listEvents(runId), 200);
        } else if (traceId != null) {
            HttpSupport.writeJson(exchange, store.listEventsByTrace(traceId), 200);
        } else {
            HttpSupport.writeError(exchange, 400, "runId or traceId is required");
        }
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        Map<String, String> q = HttpSupport.parseParams(exchange);
        String workflowId = HttpSupport.trimToNull(q.get("workflowId"));
        if (workflowId == null) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("subscribers", hub.subscriberCount());
            out.put("published", hub.publishedCount());
            out.put("dropped", hub.droppedCount());
            HttpSupport.writeJson(exchange, out, 200);
            return;
        }
        HttpSupport.writeJson(exchange, store.workflowStats(workflowId), 200);
    }

    private static boolean requirePost(HttpExchange exchange) throws IOException {
        if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", "POST");
        HttpSupport.writeError(exchange, 405, "POST required");
        return false;
    }

    private static HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (IllegalArgumentException e) {
                HttpSupport.writeError(exchange, 400, e.getMessage());
            } catch (HistoryStoreException e) {
                log.error("Console request {} failed", exchange.getRequestURI(), e);
                HttpSupport.writeError(exchange, 500, e.getMessage());
            } finally {
                exchange.close();
            }
        };
    }
}
