package io.steptrace.cli;

import io.steptrace.config.StepTraceConfig;
import io.steptrace.forward.EventForwarder;
import io.steptrace.forward.LiveHubSink;
import io.steptrace.model.RunDetail;
import io.steptrace.observability.LiveBroadcastHub;
import io.steptrace.storage.Database;
import io.steptrace.storage.HistoryStore;
import io.steptrace.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "steptrace",
        mixinStandardHelpOptions = true,
        description = "Workflow execution history and live trace console",
        subcommands = {
                StepTraceCommand.InitCommand.class,
                StepTraceCommand.ResetCommand.class,
                StepTraceCommand.RunsCommand.class,
                StepTraceCommand.RunCommand.class,
                StepTraceCommand.EventsCommand.class,
                StepTraceCommand.StatsCommand.class,
                StepTraceCommand.PruneCommand.class,
                StepTraceCommand.ServeCommand.class
        }
)
public final class StepTraceCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = StepTraceConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | reset | runs | run | events | stats | prune | serve");
    }

    StepTraceConfig config() {
        return StepTraceConfig.fromRoot(root);
    }

    Database database() {
        Database database = new Database(config());
        database.init();
        return database;
    }

    HistoryStore store() {
        return new HistoryStore(database());
    }

    @Command(name = "init", description = "Create the history schema and upgrade the legacy table")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Override
        public Integer call() {
            StepTraceConfig config = parent.config();
            Database database = new Database(config);
            database.init();
            System.out.println("Initialized steptrace at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "reset", description = "Drop and recreate the history tables")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Option(names = {"--yes"}, description = "Confirm deletion of all recorded history")
        boolean yes;

        @Override
        public Integer call() {
            if (!yes) {
                System.err.println("reset deletes all runs, steps and events; pass --yes to confirm");
                return 2;
            }
            Database database = parent.database();
            database.resetSchema();
            System.out.println("History schema reset");
            return 0;
        }
    }

    @Command(name = "runs", description = "List runs of a workflow, or workflow ids when none is given")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Option(names = {"--workflow-id"}, description = "Workflow id")
        String workflowId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max runs")
        int limit;

        @Override
        public Integer call() {
            HistoryStore store = parent.store();
            if (workflowId == null || workflowId.isBlank()) {
                System.out.println(Jsons.toJson(store.listWorkflowIds()));
            } else {
                System.out.println(Jsons.toJson(store.listRuns(workflowId, limit)));
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Show a run with its steps and events")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            Optional<RunDetail> detail = parent.store().getRunDetail(runId);
            if (detail.isEmpty()) {
                System.err.println("Run not found: " + runId);
                return 1;
            }
            System.out.println(Jsons.toJson(detail.get()));
            return 0;
        }
    }

    @Command(name = "events", description = "List timeline events of a run or of a whole trace")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Option(names = {"--run-id"}, description = "Run id")
        String runId;

        @Option(names = {"--trace-id"}, description = "Trace id, spanning nested runs")
        String traceId;

        @Override
        public Integer call() {
            HistoryStore store = parent.store();
            if (runId != null && !runId.isBlank()) {
                System.out.println(Jsons.toJson(store.listEvents(runId)));
                return 0;
            }
            if (traceId != null && !traceId.isBlank()) {
                System.out.println(Jsons.toJson(store.listEventsByTrace(traceId)));
                return 0;
            }
            System.err.println("--run-id or --trace-id is required");
            return 2;
        }
    }

    @Command(name = "stats", description = "Run counts and average duration of a workflow")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Option(names = {"--workflow-id"}, required = true, description = "Workflow id")
        String workflowId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.store().workflowStats(workflowId)));
            return 0;
        }
    }

    @Command(name = "prune", description = "Keep the newest runs of a workflow and delete the rest")
    static final class PruneCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Option(names = {"--workflow-id"}, required = true, description = "Workflow id")
        String workflowId;

        @Option(names = {"--keep"}, defaultValue = "100", description = "Runs to keep")
        int keep;

        @Override
        public Integer call() {
            int removed = parent.store().pruneRuns(workflowId, keep);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("workflowId", workflowId);
            out.put("kept", Math.max(0, keep));
            out.put("removed", removed);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the HTTP console with the live event feed")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        StepTraceCommand parent;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--heartbeat-ms"}, defaultValue = "15000", description = "Live stream heartbeat interval")
        long heartbeatMs;

        @Override
        public Integer call() throws Exception {
            StepTraceConfig config = parent.config();
            Database database = new Database(config);
            database.init();
            HistoryStore store = new HistoryStore(database);
            LiveBroadcastHub hub = new LiveBroadcastHub(config.settings());
            hub.start();
            EventForwarder forwarder = new EventForwarder(new LiveHubSink(hub), config.settings());
            ConsoleServer console = new ConsoleServer(store, hub, forwarder, heartbeatMs);
            int bound = console.start(port);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                console.stop();
                hub.stop();
            }, "steptrace-shutdown-hook"));
            System.out.println("Console listening on http://127.0.0.1:" + bound + "/");
            Thread.currentThread().join();
            return 0;
        }
    }
}
