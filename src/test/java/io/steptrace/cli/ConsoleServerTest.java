package io.steptrace.cli;

import io.steptrace.config.StepTraceConfig;
import io.steptrace.forward.EventForwarder;
import io.steptrace.forward.LiveHubSink;
import io.steptrace.model.EventLevel;
import io.steptrace.model.RunStatus;
import io.steptrace.observability.LiveBroadcastHub;
import io.steptrace.observability.LiveEvent;
import io.steptrace.storage.Database;
import io.steptrace.storage.HistoryStore;
import io.steptrace.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class ConsoleServerTest {
    private static final String TS = "2024-05-01T10:00:00.000Z";

    @Test
    void liveStreamStartsWithBacklogAndReceivesForwardedEvents() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-console-live-");
        LiveBroadcastHub hub = new LiveBroadcastHub(100, 10);
        hub.start();
        hub.publish(new LiveEvent("old", TS, EventLevel.INFO, "run.start", "demo", null,
                "run-1", null, "wf", null, null, null, null, Map.of()));
        try (ConsoleServer console = new ConsoleServer(newStore(root), hub,
                new EventForwarder(new LiveHubSink(hub), Set.of("text-delta"), true), 200L)) {
            int port = console.start(0);
            HttpClient client = HttpClient.newHttpClient();
            HttpResponse<Stream<String>> live = client.send(HttpRequest.newBuilder(
                            URI.create("http://127.0.0.1:" + port + "/events/live?subscriberId=s1&executionId=run-1"))
                    .timeout(Duration.ofSeconds(10)).GET().build(),
                    HttpResponse.BodyHandlers.ofLines());
            Assertions.assertEquals(200, live.statusCode());
            Assertions.assertEquals("s1", live.headers().firstValue("X-Subscriber-Id").orElse(null));

            try (Stream<String> lines = live.body()) {
                Iterator<String> it = lines.iterator();
                Map<String, Object> initial = nextFrame(it);
                Assertions.assertEquals(LiveBroadcastHub.INITIAL, initial.get("type"));
                Assertions.assertEquals(1, ((List<?>) initial.get("events")).size());

                String body = Jsons.toCompactJson(Map.of(
                        "type", "tool-call",
                        "data", Map.of("toolName", "search"),
                        "timestamp", TS,
                        "emitterId", "agent-7",
                        "emitterName", "Researcher",
                        "parentExecutionId", "run-1"));
                HttpResponse<String> forwarded = client.send(HttpRequest.newBuilder(
                                URI.create("http://127.0.0.1:" + port + "/api/forward"))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body)).build(),
                        HttpResponse.BodyHandlers.ofString());
                Assertions.assertEquals(202, forwarded.statusCode());
                Assertions.assertEquals(Boolean.TRUE, Jsons.toMap(forwarded.body()).get("forwarded"));

                Map<String, Object> update = nextFrame(it);
                Assertions.assertEquals(LiveBroadcastHub.UPDATE, update.get("type"));
                Map<?, ?> event = (Map<?, ?>) ((List<?>) update.get("events")).get(0);
                Assertions.assertEquals("agent-7", event.get("executionId"));
                Assertions.assertEquals("Researcher: search", ((Map<?, ?>) event.get("data")).get("toolName"));
            }
        } finally {
            hub.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void historyEndpointsAndErrors() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-console-api-");
        LiveBroadcastHub hub = new LiveBroadcastHub(100, 10);
        try {
            HistoryStore store = newStore(root);
            store.createRun(new HistoryStore.NewRun("run-1", "demo", "wf", TS, null, null, null, null));
            store.finishRun("run-1", RunStatus.COMPLETED, "2024-05-01T10:00:02.000Z", null);
            try (ConsoleServer console = new ConsoleServer(store, hub, new EventForwarder(null, Set.of(), true))) {
                int port = console.start(0);
                HttpClient client = HttpClient.newHttpClient();

                HttpResponse<String> ids = get(client, port, "/api/runs");
                Assertions.assertEquals(200, ids.statusCode());
                Assertions.assertEquals(List.of("wf"), Jsons.toMap(ids.body()).get("workflowIds"));

                HttpResponse<String> run = get(client, port, "/api/run?runId=run-1");
                Assertions.assertEquals(200, run.statusCode());
                Assertions.assertEquals("completed", ((Map<?, ?>) Jsons.toMap(run.body()).get("run")).get("status"));

                HttpResponse<String> stats = get(client, port, "/api/stats?workflowId=wf");
                Assertions.assertEquals(1, Jsons.toMap(stats.body()).get("completedRuns"));

                Assertions.assertEquals(404, get(client, port, "/api/run?runId=missing").statusCode());
                Assertions.assertEquals(400, get(client, port, "/api/run").statusCode());
                Assertions.assertEquals(400, get(client, port, "/api/events").statusCode());
                Assertions.assertEquals(400, get(client, port, "/events/live?level=loud").statusCode());
                Assertions.assertEquals(405, get(client, port, "/api/forward").statusCode());

                HttpResponse<String> filter = client.send(HttpRequest.newBuilder(
                                URI.create("http://127.0.0.1:" + port + "/api/live/filter"))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString("{\"subscriberId\":\"ghost\"}")).build(),
                        HttpResponse.BodyHandlers.ofString());
                Assertions.assertEquals(404, filter.statusCode());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static Map<String, Object> nextFrame(Iterator<String> lines) {
        while (lines.hasNext()) {
            String line = lines.next();
            if (line.startsWith("data: ")) {
                return Jsons.toMap(line.substring("data: ".length()));
            }
        }
        throw new AssertionError("stream ended before a frame arrived");
    }

    private static HttpResponse<String> get(HttpClient client, int port, String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static HistoryStore newStore(Path root) {
        Database db = new Database(StepTraceConfig.fromRoot(root.toString()));
        db.init();
        return new HistoryStore(db);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
