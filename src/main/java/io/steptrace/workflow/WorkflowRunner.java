package io.steptrace.workflow;

import io.steptrace.config.EngineSettings;
import io.steptrace.model.EventKind;
import io.steptrace.model.EventLevel;
import io.steptrace.model.RunStatus;
import io.steptrace.model.StepStatus;
import io.steptrace.model.TimelineEvent;
import io.steptrace.observability.TraceIds;
import io.steptrace.storage.HistoryStore;
import io.steptrace.storage.HistoryStoreException;
import io.steptrace.util.Jsons;
import io.steptrace.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a step chain to completion, failure or cancellation, writing every run, step and span
 * transition through to the {@link HistoryStore} before moving on.
 *
 * <p>Steps run on the caller's thread. Branches of a parallel group run on a bounded pool and are
 * joined before the chain continues; the joining thread runs any branch the pool has not picked up
 * yet, so groups nested through {@link StepContext#runChild} cannot starve the pool. Listeners are
 * notified on a separate thread and never hold up step progress.
 */
public final class WorkflowRunner implements AutoCloseable {
    public static final String CANCELLED_PREFIX = "cancelled";

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final HistoryStore store;
    private final ExecutorService branchPool;
    private final ExecutorService notifier;
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();

    public WorkflowRunner(HistoryStore store, EngineSettings settings) {
        this(store, settings.parallelism());
    }

    public WorkflowRunner(HistoryStore store, int parallelism) {
        this.store = store;
        this.branchPool = Executors.newFixedThreadPool(Math.max(1, parallelism), namedDaemon("steptrace-branch"));
        this.notifier = Executors.newSingleThreadExecutor(namedDaemon("steptrace-notify"));
    }

    public void addListener(RunListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(RunListener listener) {
        listeners.remove(listener);
    }

    public RunResult run(List<StepDefinition> steps, Object input) {
        return run(steps, input, RunOptions.defaults());
    }

    /**
     * Executes {@code steps} in order against {@code input}. Executor failures and cancellation are
     * reported through the returned result, never thrown.
     *
     * @throws IllegalArgumentException when the chain is malformed
     */
    public RunResult run(List<StepDefinition> steps, Object input, RunOptions options) {
        validate(steps);
        RunOptions opts = options == null ? RunOptions.defaults() : options;
        String runId = TraceIds.newRecordId();
        String traceId = isBlank(opts.traceId()) ? TraceIds.newTraceId() : opts.traceId();
        String workflowId = isBlank(opts.workflowId())
                ? (isBlank(opts.name()) ? "workflow" : opts.name())
                : opts.workflowId();
        String name = isBlank(opts.name()) ? workflowId : opts.name();
        RunState run = new RunState(runId, traceId, workflowId, name, opts, input);
        try {
            return execute(run, steps, input);
        } catch (HistoryStoreException e) {
            return abandon(run, steps, e);
        }
    }

    private RunResult execute(RunState run, List<StepDefinition> steps, Object input) {
        String start = Timestamps.now();
        RunOptions opts = run.options;
        store.createRun(new HistoryStore.NewRun(
                run.runId,
                run.name,
                run.workflowId,
                start,
                json(input),
                opts.userId(),
                opts.conversationId(),
                opts.metadata().isEmpty() ? null : json(opts.metadata())
        ));
        run.runSpan = openSpan(run, run.name, EventKind.RUN, opts.parentEventId(), json(input), start, null);
        log.info("Run started: runId={} workflowId={} steps={} traceId={}", run.runId, run.workflowId, steps.size(), run.traceId);

        Object data = input;
        int index = 0;
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition def = steps.get(i);
            run.cursor = i;
            run.cursorIndex = index;
            StepOutcome outcome = def.isParallel()
                    ? runGroup(run, def, index, data)
                    : runLeaf(run, TraceIds.newRecordId(), def, index, data, null, null, run.runSpan.eventId());
            index += def.recordCount();
            if (outcome.state() != StepOutcome.State.COMPLETED) {
                skipRemaining(run, steps, i + 1, index, outcome.endTime());
                RunStatus status = outcome.state() == StepOutcome.State.CANCELLED ? RunStatus.CANCELLED : RunStatus.ERROR;
                return finish(run, status, data, outcome.message(), outcome.failure(), outcome.endTime());
            }
            data = outcome.output();
            run.data = data;
            store.recordRunProgress(run.runId, json(data));
        }
        return finish(run, RunStatus.COMPLETED, data, null, null, Timestamps.now());
    }

    private StepOutcome runLeaf(
            RunState run,
            String recordId,
            StepDefinition def,
            int index,
            Object input,
            Integer parallelIndex,
            String parentRecordId,
            String parentSpanId
    ) {
        String start = Timestamps.now();
        String inputJson = json(input);
        store.startStep(new HistoryStore.NewStep(
                recordId, run.runId, index, def.type().wireValue(), def.name(), def.id(),
                start, inputJson, parallelIndex, parentRecordId, null
        ));
        run.openSteps.add(recordId);
        Span span = openSpan(run, def.name(), EventKind.STEP, parentSpanId, inputJson, start,
                spanMetadata(def, index, parallelIndex));
        run.stepSpans.put(recordId, span);
        log.debug("Step started: runId={} stepId={} index={}", run.runId, def.id(), index);

        CancellationToken token = run.options.cancellationToken();
        if (token.isCancelled()) {
            return cancelStep(run, recordId, span, token.reason(), null, null);
        }
        StepContext context = new StepContext(this, run.runId, run.traceId, def.id(), recordId, span.eventId(),
                input, run.outputs, run.options);
        Object output;
        String metadataJson = null;
        try {
            if (def.type() == StepType.CONDITIONAL) {
                boolean met = def.condition().test(input);
                metadataJson = json(Map.of("conditionMet", met));
                output = met ? await(def.executor().execute(context)) : input;
            } else {
                output = await(def.executor().execute(context));
            }
        } catch (CancellationException e) {
            String reason = token.isCancelled() ? token.reason() : messageOf(e);
            return cancelStep(run, recordId, span, reason, e, context.executorRef());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelStep(run, recordId, span, "interrupted", e, context.executorRef());
        } catch (Throwable e) {
            if (token.isCancelled()) {
                return cancelStep(run, recordId, span, token.reason(), e, context.executorRef());
            }
            return failStep(run, recordId, span, def.id(), e, context.executorRef());
        }

        String end = Timestamps.now();
        String outputJson = json(output);
        store.finishStep(recordId, new HistoryStore.StepFinish(
                StepStatus.COMPLETED, end, outputJson, null, context.executorRef(), metadataJson));
        run.closed(recordId);
        closeSpan(run, span, end, StepStatus.COMPLETED.wireValue(), EventLevel.INFO, outputJson, null);
        run.putOutput(def.id(), output);
        log.debug("Step completed: runId={} stepId={}", run.runId, def.id());
        return StepOutcome.completed(output, end);
    }

    private StepOutcome runGroup(RunState run, StepDefinition def, int index, Object input) {
        String groupRecordId = TraceIds.newRecordId();
        String start = Timestamps.now();
        String inputJson = json(input);
        List<StepDefinition> branches = def.branches();
        store.startStep(new HistoryStore.NewStep(
                groupRecordId, run.runId, index, def.type().wireValue(), def.name(), def.id(),
                start, inputJson, null, null, json(Map.of("branches", branches.size()))
        ));
        run.openSteps.add(groupRecordId);
        Span groupSpan = openSpan(run, def.name(), EventKind.STEP, run.runSpan.eventId(), inputJson, start,
                spanMetadata(def, index, null));
        run.stepSpans.put(groupRecordId, groupSpan);

        CancellationToken token = run.options.cancellationToken();
        if (token.isCancelled()) {
            StepOutcome cancelled = cancelStep(run, groupRecordId, groupSpan, token.reason(), null, null);
            skipBranches(run, def, index, groupRecordId, cancelled.endTime());
            return cancelled;
        }

        List<String> branchRecordIds = new ArrayList<>(branches.size());
        List<FutureTask<StepOutcome>> tasks = new ArrayList<>(branches.size());
        for (int b = 0; b < branches.size(); b++) {
            StepDefinition branch = branches.get(b);
            String branchRecordId = TraceIds.newRecordId();
            int branchIndex = index + 1 + b;
            Integer parallelIndex = b;
            FutureTask<StepOutcome> task = new FutureTask<>(() -> runLeaf(run, branchRecordId, branch, branchIndex,
                    input, parallelIndex, groupRecordId, groupSpan.eventId()));
            branchRecordIds.add(branchRecordId);
            tasks.add(task);
            try {
                branchPool.execute(task);
            } catch (RejectedExecutionException e) {
                log.debug("Branch pool closed; branch {} of run {} runs on the caller", branch.id(), run.runId);
            }
        }
        // a task already started or finished elsewhere makes run() a no-op
        for (FutureTask<StepOutcome> task : tasks) {
            task.run();
        }

        List<StepOutcome> outcomes = new ArrayList<>(branches.size());
        HistoryStoreException storageFailure = null;
        for (int b = 0; b < tasks.size(); b++) {
            try {
                outcomes.add(tasks.get(b).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof HistoryStoreException) {
                    if (storageFailure == null) {
                        storageFailure = (HistoryStoreException) cause;
                    }
                    outcomes.add(null);
                } else {
                    String end = Timestamps.now();
                    closeOrphanedStep(run, branchRecordIds.get(b), messageOf(cause), end);
                    outcomes.add(StepOutcome.failed(messageOf(cause), cause, end));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(StepOutcome.cancelled(CANCELLED_PREFIX + ": interrupted", e, Timestamps.now()));
            }
        }
        if (storageFailure != null) {
            throw storageFailure;
        }

        for (int b = 0; b < outcomes.size(); b++) {
            StepOutcome outcome = outcomes.get(b);
            if (outcome.state() == StepOutcome.State.FAILED) {
                String message = "branch " + branches.get(b).id() + " failed: " + outcome.message();
                String end = Timestamps.now();
                store.finishStep(groupRecordId, new HistoryStore.StepFinish(StepStatus.ERROR, end, null, message, null, null));
                run.closed(groupRecordId);
                closeSpan(run, groupSpan, end, StepStatus.ERROR.wireValue(), EventLevel.ERROR, null, message);
                log.warn("Parallel group failed: runId={} stepId={} error={}", run.runId, def.id(), message);
                return StepOutcome.failed(message, outcome.failure(), end);
            }
        }
        for (StepOutcome outcome : outcomes) {
            if (outcome.state() == StepOutcome.State.CANCELLED) {
                String reason = token.isCancelled() ? token.reason() : "branch cancelled";
                return cancelStep(run, groupRecordId, groupSpan, reason, outcome.failure(), null);
            }
        }

        List<Object> aggregate = new ArrayList<>(outcomes.size());
        for (StepOutcome outcome : outcomes) {
            aggregate.add(outcome.output());
        }
        String end = Timestamps.now();
        String outputJson = json(aggregate);
        store.finishStep(groupRecordId, new HistoryStore.StepFinish(StepStatus.COMPLETED, end, outputJson, null, null, null));
        run.closed(groupRecordId);
        closeSpan(run, groupSpan, end, StepStatus.COMPLETED.wireValue(), EventLevel.INFO, outputJson, null);
        run.putOutput(def.id(), aggregate);
        return StepOutcome.completed(aggregate, end);
    }

    private StepOutcome failStep(RunState run, String recordId, Span span, String stepId, Throwable error, String executorRef) {
        String message = messageOf(error);
        String end = Timestamps.now();
        store.finishStep(recordId, new HistoryStore.StepFinish(StepStatus.ERROR, end, null, message, executorRef, null));
        run.closed(recordId);
        closeSpan(run, span, end, StepStatus.ERROR.wireValue(), EventLevel.ERROR, null, message);
        log.warn("Step failed: runId={} stepId={} error={}", run.runId, stepId, message);
        return StepOutcome.failed(message, error, end);
    }

    private StepOutcome cancelStep(RunState run, String recordId, Span span, String reason, Throwable cause, String executorRef) {
        String message = CANCELLED_PREFIX + ": " + (isBlank(reason) ? "cancelled" : reason);
        String end = Timestamps.now();
        store.finishStep(recordId, new HistoryStore.StepFinish(StepStatus.ERROR, end, null, message, executorRef, null));
        run.closed(recordId);
        closeSpan(run, span, end, RunStatus.CANCELLED.wireValue(), EventLevel.WARN, null, message);
        log.info("Step cancelled: runId={} {}", run.runId, message);
        return StepOutcome.cancelled(message, cause, end);
    }

    /**
     * Closes a branch record left open by a failure outside its executor, such as an error thrown
     * while recording the outcome.
     */
    private void closeOrphanedStep(RunState run, String recordId, String message, String end) {
        if (!run.openSteps.contains(recordId)) {
            return;
        }
        store.finishStep(recordId, new HistoryStore.StepFinish(StepStatus.ERROR, end, null, message, null, null));
        Span span = run.stepSpans.get(recordId);
        run.closed(recordId);
        if (span != null) {
            closeSpan(run, span, end, StepStatus.ERROR.wireValue(), EventLevel.ERROR, null, message);
        }
    }

    private void skipRemaining(RunState run, List<StepDefinition> steps, int from, int firstIndex, String endTime) {
        int index = firstIndex;
        for (int i = from; i < steps.size(); i++) {
            StepDefinition def = steps.get(i);
            String recordId = recordSkipped(run, def, index, null, null, endTime);
            if (def.isParallel()) {
                skipBranches(run, def, index, recordId, endTime);
            }
            index += def.recordCount();
            run.skipCursor = i + 1;
            run.skipIndex = index;
        }
        if (from < steps.size()) {
            log.debug("Skipped {} step(s) of run {}", steps.size() - from, run.runId);
        }
    }

    private void skipBranches(RunState run, StepDefinition group, int groupIndex, String groupRecordId, String endTime) {
        List<StepDefinition> branches = group.branches();
        for (int b = 0; b < branches.size(); b++) {
            recordSkipped(run, branches.get(b), groupIndex + 1 + b, b, groupRecordId, endTime);
        }
    }

    private String recordSkipped(RunState run, StepDefinition def, int index, Integer parallelIndex, String parentRecordId, String endTime) {
        String recordId = TraceIds.newRecordId();
        store.recordSkippedStep(new HistoryStore.NewStep(
                recordId, run.runId, index, def.type().wireValue(), def.name(), def.id(),
                endTime, null, parallelIndex, parentRecordId, null
        ), endTime);
        return recordId;
    }

    private RunResult finish(RunState run, RunStatus status, Object data, String message, Throwable failure, String endTime) {
        String outputJson = json(data);
        EventLevel level = switch (status) {
            case ERROR -> EventLevel.ERROR;
            case CANCELLED -> EventLevel.WARN;
            default -> EventLevel.INFO;
        };
        closeSpan(run, run.runSpan, endTime, status.wireValue(), level, outputJson, message);
        store.finishRun(run.runId, status, endTime, status == RunStatus.COMPLETED ? outputJson : null);
        log.info("Run finished: runId={} workflowId={} status={}", run.runId, run.workflowId, status.wireValue());
        return new RunResult(run.runId, run.traceId, status, data, message, failure);
    }

    /**
     * Persistence failed mid-run. Close whatever is still open, skip what never started and mark
     * the run as error, each as a single attempt.
     */
    private RunResult abandon(RunState run, List<StepDefinition> steps, HistoryStoreException failure) {
        log.error("Persistence failed during run {}; marking it as error", run.runId, failure);
        String end = Timestamps.now();
        String message = "storage failure: " + failure.getMessage();
        for (String recordId : new ArrayList<>(run.openSteps)) {
            try {
                store.finishStep(recordId, new HistoryStore.StepFinish(StepStatus.ERROR, end, null, message, null, null));
                Span span = run.stepSpans.get(recordId);
                if (span != null) {
                    store.closeEvent(run.runId, span.eventId(), new HistoryStore.EventClose(
                            end, StepStatus.ERROR.wireValue(), EventLevel.ERROR.name(), null, message, null));
                }
            } catch (HistoryStoreException e) {
                log.warn("Best-effort close of step {} failed: {}", recordId, e.getMessage());
            }
        }
        if (run.cursor >= 0) {
            // resume where an interrupted skip pass stopped
            int from = run.skipCursor >= 0 ? run.skipCursor : run.cursor + 1;
            int firstIndex = run.skipCursor >= 0
                    ? run.skipIndex
                    : run.cursorIndex + steps.get(run.cursor).recordCount();
            try {
                skipRemaining(run, steps, from, firstIndex, end);
            } catch (HistoryStoreException e) {
                log.warn("Best-effort skip of remaining steps of run {} failed: {}", run.runId, e.getMessage());
            }
        }
        if (run.runSpan != null) {
            try {
                store.closeEvent(run.runId, run.runSpan.eventId(), new HistoryStore.EventClose(
                        end, RunStatus.ERROR.wireValue(), EventLevel.ERROR.name(), null, message, null));
            } catch (HistoryStoreException e) {
                log.warn("Best-effort close of run span {} failed: {}", run.runId, e.getMessage());
            }
        }
        try {
            store.finishRun(run.runId, RunStatus.ERROR, end, null);
        } catch (HistoryStoreException e) {
            log.warn("Best-effort terminal write of run {} failed: {}", run.runId, e.getMessage());
        }
        return new RunResult(run.runId, run.traceId, RunStatus.ERROR, run.data, message, failure);
    }

    private Span openSpan(RunState run, String name, EventKind kind, String parentEventId, String inputJson,
                          String startTime, String metadataJson) {
        Span span = new Span(TraceIds.newRecordId(), TraceIds.newSpanId(), name, kind, startTime, inputJson,
                metadataJson, parentEventId, run.sequence.getAndIncrement());
        store.openEvent(new HistoryStore.NewEvent(
                span.recordId(), run.runId, span.eventId(), name, kind.wireValue(), startTime, null,
                "running", EventLevel.INFO.name(), inputJson, null, null, metadataJson, run.traceId,
                parentEventId, span.sequence()
        ));
        notifyListeners(run, span.toEvent(run, null, "running", EventLevel.INFO, null, null));
        return span;
    }

    private void closeSpan(RunState run, Span span, String endTime, String status, EventLevel level,
                           String outputJson, String message) {
        store.closeEvent(run.runId, span.eventId(), new HistoryStore.EventClose(
                endTime, status, level.name(), outputJson, message, null));
        notifyListeners(run, span.toEvent(run, endTime, status, level, outputJson, message));
    }

    private void notifyListeners(RunState run, TimelineEvent event) {
        if (listeners.isEmpty()) {
            return;
        }
        RunEvent runEvent = new RunEvent(event, run.workflowId, run.options.conversationId(), run.options.parentRunId());
        for (RunListener listener : listeners) {
            try {
                notifier.execute(() -> {
                    try {
                        listener.onEvent(runEvent);
                    } catch (RuntimeException e) {
                        log.warn("Run listener failed for event {}: {}", event.eventId(), e.getMessage());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Runner closed; event {} not delivered to listeners", event.eventId());
            }
        }
    }

    /**
     * Blocks until every listener notification queued so far has been delivered.
     */
    public boolean awaitNotifications(long timeoutMs) {
        try {
            notifier.submit(() -> { }).get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            return false;
        }
    }

    @Override
    public void close() {
        branchPool.shutdown();
        notifier.shutdown();
        try {
            if (!branchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                branchPool.shutdownNow();
            }
            if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
                notifier.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            branchPool.shutdownNow();
            notifier.shutdownNow();
        }
    }

    private static Object await(Object value) throws Exception {
        if (!(value instanceof CompletionStage)) {
            return value;
        }
        CompletionStage<?> stage = (CompletionStage<?>) value;
        try {
            return stage.toCompletableFuture().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private static void validate(List<StepDefinition> steps) {
        if (steps == null) {
            throw new IllegalArgumentException("steps cannot be null");
        }
        Set<String> ids = new HashSet<>();
        for (StepDefinition step : steps) {
            if (step == null) {
                throw new IllegalArgumentException("steps cannot contain null");
            }
            if (!ids.add(step.id())) {
                throw new IllegalArgumentException("duplicate step id: " + step.id());
            }
            for (StepDefinition branch : step.branches()) {
                if (!ids.add(branch.id())) {
                    throw new IllegalArgumentException("duplicate step id: " + branch.id());
                }
            }
        }
    }

    private static String spanMetadata(StepDefinition def, int index, Integer parallelIndex) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("stepId", def.id());
        meta.put("stepType", def.type().wireValue());
        meta.put("stepIndex", index);
        if (parallelIndex != null) {
            meta.put("parallelIndex", parallelIndex);
        }
        return json(meta);
    }

    private static String json(Object value) {
        try {
            return Jsons.toCompactJson(value);
        } catch (RuntimeException e) {
            return Jsons.toCompactJson(String.valueOf(value));
        }
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunState {
        private final String runId;
        private final String traceId;
        private final String workflowId;
        private final String name;
        private final RunOptions options;
        private final AtomicLong sequence = new AtomicLong();
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private final Set<String> openSteps = ConcurrentHashMap.newKeySet();
        private final Map<String, Span> stepSpans = new ConcurrentHashMap<>();
        private volatile Span runSpan;
        private volatile Object data;
        private volatile int cursor = -1;
        private volatile int cursorIndex;
        private volatile int skipCursor = -1;
        private volatile int skipIndex;

        private RunState(String runId, String traceId, String workflowId, String name, RunOptions options, Object input) {
            this.runId = runId;
            this.traceId = traceId;
            this.workflowId = workflowId;
            this.name = name;
            this.options = options;
            this.data = input;
        }

        private void closed(String recordId) {
            openSteps.remove(recordId);
            stepSpans.remove(recordId);
        }

        private void putOutput(String stepId, Object output) {
            synchronized (outputs) {
                outputs.put(stepId, output);
            }
        }
    }

    private record Span(
            String recordId,
            String eventId,
            String name,
            EventKind kind,
            String startTime,
            String inputJson,
            String metadataJson,
            String parentEventId,
            long sequence
    ) {
        TimelineEvent toEvent(RunState run, String endTime, String status, EventLevel level, String outputJson, String message) {
            return new TimelineEvent(recordId, run.runId, eventId, name, kind.wireValue(), startTime, endTime, status,
                    level.name(), inputJson, outputJson, message, metadataJson, run.traceId, parentEventId, sequence);
        }
    }

    private record StepOutcome(State state, Object output, String message, Throwable failure, String endTime) {
        enum State { COMPLETED, FAILED, CANCELLED }

        static StepOutcome completed(Object output, String endTime) {
            return new StepOutcome(State.COMPLETED, output, null, null, endTime);
        }

        static StepOutcome failed(String message, Throwable failure, String endTime) {
            return new StepOutcome(State.FAILED, null, message, failure, endTime);
        }

        static StepOutcome cancelled(String message, Throwable failure, String endTime) {
            return new StepOutcome(State.CANCELLED, null, message, failure, endTime);
        }
    }
}
