package io.steptrace.workflow;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.steptrace.config.StepTraceConfig;
import io.steptrace.model.RunStatus;
import io.steptrace.model.RunView;
import io.steptrace.model.StepView;
import io.steptrace.model.TimelineEvent;
import io.steptrace.storage.Database;
import io.steptrace.storage.HistoryStore;
import io.steptrace.storage.HistoryStoreException;
import io.steptrace.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;
import java.util.stream.Stream;

final class WorkflowRunnerTest {

    @Test
    void failingMiddleStepSkipsTheRest() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-chain-fail-");
        HistoryStore store = newStore(root);
        AtomicBoolean thirdCalled = new AtomicBoolean(false);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("load", ctx -> ((Integer) ctx.data()) + 1),
                    StepDefinition.func("transform", ctx -> {
                        throw new IllegalStateException("boom");
                    }),
                    StepDefinition.func("save", ctx -> {
                        thirdCalled.set(true);
                        return ctx.data();
                    })
            ), 1);

            Assertions.assertEquals(RunStatus.ERROR, result.status());
            Assertions.assertEquals("boom", result.errorMessage());
            Assertions.assertTrue(result.failure() instanceof IllegalStateException);
            Assertions.assertEquals(2, result.output());
            Assertions.assertFalse(thirdCalled.get());

            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(List.of("completed", "error", "skipped"), statuses(steps));
            Assertions.assertEquals("boom", steps.get(1).errorMessage());
            Assertions.assertNotNull(steps.get(2).endTime());

            RunView run = store.getRun(result.runId()).orElseThrow();
            Assertions.assertEquals("error", run.status());
            Assertions.assertEquals(steps.get(1).endTime(), run.endTime());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void completedChainRecordsOutputsAndSpans() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-chain-ok-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("double", ctx -> ((Integer) ctx.data()) * 2),
                    StepDefinition.func("sum", ctx -> ((Integer) ctx.getStepData("double")) + ((Integer) ctx.data()))
            ), 5, RunOptions.builder()
                    .name("math")
                    .workflowId("math-wf")
                    .userId("user-1")
                    .conversationId("conv-1")
                    .putMetadata("source", "test")
                    .build());

            Assertions.assertTrue(result.completed());
            Assertions.assertEquals(20, result.output());
            Assertions.assertNull(result.errorMessage());

            RunView run = store.getRun(result.runId()).orElseThrow();
            Assertions.assertEquals("completed", run.status());
            Assertions.assertEquals("math-wf", run.workflowId());
            Assertions.assertEquals("math", run.name());
            Assertions.assertEquals("conv-1", run.conversationId());
            Assertions.assertEquals("20", run.outputJson());
            Assertions.assertEquals("test", Jsons.toMap(run.metadataJson()).get("source"));
            Assertions.assertNotNull(run.endTime());

            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(List.of(0, 1), steps.stream().map(StepView::stepIndex).toList());
            Assertions.assertEquals("10", steps.get(0).outputJson());
            Assertions.assertEquals("5", steps.get(0).inputJson());

            List<TimelineEvent> events = store.listEvents(result.runId());
            Assertions.assertEquals(3, events.size());
            Assertions.assertEquals(List.of(0L, 1L, 2L), events.stream().map(TimelineEvent::sequence).toList());
            TimelineEvent runSpan = events.get(0);
            Assertions.assertEquals("run", runSpan.kind());
            Assertions.assertEquals("completed", runSpan.status());
            for (TimelineEvent stepSpan : events.subList(1, 3)) {
                Assertions.assertEquals("step", stepSpan.kind());
                Assertions.assertEquals(runSpan.eventId(), stepSpan.parentEventId());
                Assertions.assertEquals(result.traceId(), stepSpan.traceId());
                Assertions.assertNotNull(stepSpan.endTime());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingBranchFailsGroupAndRun() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-fanout-fail-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 4)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("prepare", StepContext::data),
                    StepDefinition.parallel("fanout",
                            StepDefinition.func("branch-a", ctx -> "a"),
                            StepDefinition.func("branch-b", ctx -> {
                                throw new IllegalArgumentException("bad branch");
                            })),
                    StepDefinition.func("after", StepContext::data)
            ), "input");

            Assertions.assertEquals(RunStatus.ERROR, result.status());
            Assertions.assertEquals("branch branch-b failed: bad branch", result.errorMessage());

            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(5, steps.size());
            StepView group = byStepId(steps, "fanout");
            StepView a = byStepId(steps, "branch-a");
            StepView b = byStepId(steps, "branch-b");
            Assertions.assertEquals("error", group.status());
            Assertions.assertEquals("parallel-all", group.stepType());
            Assertions.assertEquals(1, group.stepIndex());
            Assertions.assertEquals("completed", a.status());
            Assertions.assertEquals(Integer.valueOf(0), a.parallelIndex());
            Assertions.assertEquals(group.id(), a.parentStepId());
            Assertions.assertEquals("error", b.status());
            Assertions.assertEquals("bad branch", b.errorMessage());
            Assertions.assertEquals(Integer.valueOf(1), b.parallelIndex());
            Assertions.assertEquals("skipped", byStepId(steps, "after").status());
            Assertions.assertEquals(4, byStepId(steps, "after").stepIndex());
            Assertions.assertEquals("error", store.getRun(result.runId()).orElseThrow().status());

            TimelineEvent groupSpan = spanNamed(store.listEvents(result.runId()), "fanout");
            TimelineEvent branchSpan = spanNamed(store.listEvents(result.runId()), "branch-a");
            Assertions.assertEquals(groupSpan.eventId(), branchSpan.parentEventId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void parallelGroupOutputIsOrderedBranchOutputs() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-fanout-ok-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 4)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.parallel("fanout",
                            StepDefinition.func("slow", ctx -> {
                                Thread.sleep(50L);
                                return ctx.data() + "-slow";
                            }),
                            StepDefinition.func("fast", ctx -> ctx.data() + "-fast")),
                    StepDefinition.func("collect", ctx -> List.of(ctx.getStepData("fanout"), ctx.getStepData("fast")))
            ), "x");

            Assertions.assertTrue(result.completed());
            Assertions.assertEquals(List.of(List.of("x-slow", "x-fast"), "x-fast"), result.output());
            StepView group = byStepId(store.listSteps(result.runId()), "fanout");
            Assertions.assertEquals("[\"x-slow\",\"x-fast\"]", group.outputJson());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancellationAtStepBoundaryCancelsRun() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-cancel-");
        HistoryStore store = newStore(root);
        CancellationToken token = new CancellationToken();
        AtomicBoolean secondCalled = new AtomicBoolean(false);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("first", ctx -> {
                        token.cancel("user stop");
                        return "done";
                    }),
                    StepDefinition.func("second", ctx -> {
                        secondCalled.set(true);
                        return "never";
                    }),
                    StepDefinition.func("third", StepContext::data)
            ), null, RunOptions.builder().cancellationToken(token).build());

            Assertions.assertEquals(RunStatus.CANCELLED, result.status());
            Assertions.assertEquals("cancelled: user stop", result.errorMessage());
            Assertions.assertFalse(secondCalled.get());

            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(List.of("completed", "error", "skipped"), statuses(steps));
            Assertions.assertTrue(steps.get(1).errorMessage().startsWith(WorkflowRunner.CANCELLED_PREFIX));
            RunView run = store.getRun(result.runId()).orElseThrow();
            Assertions.assertEquals("cancelled", run.status());
            Assertions.assertNotNull(run.endTime());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void asyncExecutorsAreAwaited() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-async-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult ok = runner.run(List.of(
                    StepDefinition.func("fetch", ctx -> CompletableFuture.supplyAsync(() -> "async-value")),
                    StepDefinition.func("echo", ctx -> ctx.data() + "!")
            ), null);
            Assertions.assertTrue(ok.completed());
            Assertions.assertEquals("async-value!", ok.output());

            RunResult failed = runner.run(List.of(
                    StepDefinition.func("fetch", ctx -> CompletableFuture.supplyAsync(() -> {
                        throw new IllegalStateException("remote down");
                    }))
            ), null);
            Assertions.assertEquals(RunStatus.ERROR, failed.status());
            Assertions.assertTrue(failed.errorMessage().contains("remote down"));

            RunResult cancelled = runner.run(List.of(
                    StepDefinition.func("fetch", ctx -> {
                        CompletableFuture<Object> future = new CompletableFuture<>();
                        future.completeExceptionally(new CancellationException("stopped by executor"));
                        return future;
                    })
            ), null);
            Assertions.assertEquals(RunStatus.CANCELLED, cancelled.status());
            Assertions.assertEquals("cancelled: stopped by executor", cancelled.errorMessage());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void falseConditionPassesInputThrough() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-when-");
        HistoryStore store = newStore(root);
        AtomicBoolean called = new AtomicBoolean(false);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.when("only-big", data -> ((Integer) data) > 100, ctx -> {
                        called.set(true);
                        return 0;
                    })
            ), 7);

            Assertions.assertTrue(result.completed());
            Assertions.assertEquals(7, result.output());
            Assertions.assertFalse(called.get());
            StepView step = store.listSteps(result.runId()).get(0);
            Assertions.assertEquals("completed", step.status());
            Assertions.assertEquals("conditional", step.stepType());
            Assertions.assertEquals(Boolean.FALSE, Jsons.toMap(step.metadataJson()).get("conditionMet"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nestedRunSharesTraceAndLinksToLaunchingStep() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-nested-");
        HistoryStore store = newStore(root);
        List<RunResult> children = new CopyOnWriteArrayList<>();
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult parent = runner.run(List.of(
                    StepDefinition.agent("delegate", ctx -> {
                        RunResult child = ctx.runChild("researcher",
                                List.of(StepDefinition.func("inner", inner -> "found " + inner.data())), ctx.data());
                        children.add(child);
                        return child.output();
                    })
            ), "topic", RunOptions.builder().workflowId("outer").build());

            Assertions.assertTrue(parent.completed());
            Assertions.assertEquals("found topic", parent.output());
            RunResult child = children.get(0);
            Assertions.assertEquals(parent.traceId(), child.traceId());

            StepView delegate = store.listSteps(parent.runId()).get(0);
            Assertions.assertEquals("agent", delegate.stepType());
            Assertions.assertEquals(child.runId(), delegate.executorRef());

            TimelineEvent launchingSpan = spanNamed(store.listEvents(parent.runId()), "delegate");
            TimelineEvent childRunSpan = store.listEvents(child.runId()).get(0);
            Assertions.assertEquals("run", childRunSpan.kind());
            Assertions.assertEquals(launchingSpan.eventId(), childRunSpan.parentEventId());

            List<TimelineEvent> trace = store.listEventsByTrace(parent.traceId());
            Assertions.assertEquals(4, trace.size());
            Assertions.assertEquals("outer", store.getRun(child.runId()).orElseThrow().workflowId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listenersReceiveEveryPersistedSpanTransition() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-listener-");
        HistoryStore store = newStore(root);
        List<RunEvent> received = new CopyOnWriteArrayList<>();
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            runner.addListener(received::add);
            runner.addListener(event -> {
                throw new IllegalStateException("listener bug");
            });
            RunResult result = runner.run(List.of(StepDefinition.func("only", StepContext::data)), "v",
                    RunOptions.builder().workflowId("wf-l").conversationId("conv-9").build());
            Assertions.assertTrue(runner.awaitNotifications(5_000L));

            Assertions.assertEquals(4, received.size());
            Assertions.assertEquals("run", received.get(0).event().kind());
            Assertions.assertNull(received.get(0).event().endTime());
            Assertions.assertEquals("run", received.get(3).event().kind());
            Assertions.assertEquals("completed", received.get(3).event().status());
            for (RunEvent event : received) {
                Assertions.assertEquals(result.runId(), event.event().runId());
                Assertions.assertEquals("wf-l", event.workflowId());
                Assertions.assertEquals("conv-9", event.conversationId());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storageFailureMidRunStillEndsRunAsError() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-storage-fail-");
        HistoryStore store = newStore(root);
        Database database = store.database();
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("sabotage", ctx -> {
                        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                            st.execute("DROP TABLE " + database.stepsTable());
                        }
                        return "ok";
                    }),
                    StepDefinition.func("next", StepContext::data)
            ), "in");

            Assertions.assertEquals(RunStatus.ERROR, result.status());
            Assertions.assertTrue(result.failure() instanceof HistoryStoreException);
            Assertions.assertTrue(result.errorMessage().startsWith("storage failure"));
            RunView run = store.getRun(result.runId()).orElseThrow();
            Assertions.assertEquals("error", run.status());
            Assertions.assertNotNull(run.endTime());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void randomChainsKeepRunAndStepInvariants() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-property-");
        HistoryStore store = newStore(root);
        Random random = new Random(42L);
        try (WorkflowRunner runner = new WorkflowRunner(store, 3)) {
            for (int iteration = 0; iteration < 25; iteration++) {
                List<StepDefinition> steps = new ArrayList<>();
                int count = 1 + random.nextInt(5);
                int records = 0;
                for (int i = 0; i < count; i++) {
                    String id = "s" + iteration + "-" + i;
                    if (random.nextInt(4) == 0) {
                        steps.add(StepDefinition.parallel(id,
                                leaf(id + "-a", random.nextInt(5) == 0),
                                leaf(id + "-b", random.nextInt(5) == 0)));
                        records += 3;
                    } else {
                        steps.add(leaf(id, random.nextInt(5) == 0));
                        records += 1;
                    }
                }

                RunResult result = runner.run(steps, iteration);
                RunView run = store.getRun(result.runId()).orElseThrow();
                Assertions.assertNotEquals("running", run.status());
                Assertions.assertNotNull(run.endTime());

                List<StepView> recorded = store.listSteps(result.runId());
                Assertions.assertEquals(IntStream.range(0, records).boxed().toList(),
                        recorded.stream().map(StepView::stepIndex).toList());
                int firstError = Integer.MAX_VALUE;
                for (StepView step : recorded) {
                    Assertions.assertNotEquals("running", step.status());
                    if ("error".equals(step.status())) {
                        firstError = Math.min(firstError, step.stepIndex());
                    }
                    if ("skipped".equals(step.status())) {
                        Assertions.assertTrue(step.stepIndex() > firstError, "skipped before any error");
                    }
                }
                Assertions.assertEquals(firstError == Integer.MAX_VALUE ? "completed" : "error", run.status());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedChainsAreRejected() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-invalid-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 1)) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> runner.run(List.of(
                    StepDefinition.func("same", StepContext::data),
                    StepDefinition.func("same", StepContext::data)), null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runner.run(List.of(
                    StepDefinition.func("a", StepContext::data),
                    StepDefinition.parallel("group", StepDefinition.func("a", StepContext::data))), null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> StepDefinition.parallel("empty"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> StepDefinition.parallel("outer",
                    StepDefinition.parallel("inner", StepDefinition.func("x", StepContext::data))));
            Assertions.assertThrows(IllegalArgumentException.class, () -> StepDefinition.func(" ", StepContext::data));
            Assertions.assertTrue(store.listWorkflowIds().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void executorThrowingErrorStillEndsRunAsError() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-executor-error-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = Assertions.assertDoesNotThrow(() -> runner.run(List.of(
                    StepDefinition.func("a", ctx -> {
                        throw new AssertionError("bad");
                    }),
                    StepDefinition.func("b", StepContext::data)
            ), 1));

            Assertions.assertEquals(RunStatus.ERROR, result.status());
            Assertions.assertEquals("bad", result.errorMessage());
            Assertions.assertTrue(result.failure() instanceof AssertionError);
            RunView run = store.getRun(result.runId()).orElseThrow();
            Assertions.assertEquals("error", run.status());
            Assertions.assertNotNull(run.endTime());
            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(List.of("error", "skipped"), statuses(steps));
            Assertions.assertEquals("bad", steps.get(0).errorMessage());

            RunResult async = runner.run(List.of(
                    StepDefinition.func("later", ctx -> CompletableFuture.failedFuture(new StackOverflowError("deep")))
            ), null);
            Assertions.assertEquals(RunStatus.ERROR, async.status());
            Assertions.assertEquals("deep", async.errorMessage());
            Assertions.assertNotNull(store.getRun(async.runId()).orElseThrow().endTime());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void branchThrowingErrorClosesItsOwnRecord() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-branch-error-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.parallel("fanout",
                            StepDefinition.func("A", ctx -> "a"),
                            StepDefinition.func("B", ctx -> {
                                throw new AssertionError("branch broke");
                            }))
            ), null);

            Assertions.assertEquals(RunStatus.ERROR, result.status());
            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals("error", byStepId(steps, "fanout").status());
            Assertions.assertEquals("completed", byStepId(steps, "A").status());
            StepView broken = byStepId(steps, "B");
            Assertions.assertEquals("error", broken.status());
            Assertions.assertEquals("branch broke", broken.errorMessage());
            Assertions.assertNotNull(broken.endTime());
            for (StepView step : steps) {
                Assertions.assertNotNull(step.endTime(), step.stepId());
            }
            for (TimelineEvent event : store.listEvents(result.runId())) {
                Assertions.assertNotNull(event.endTime(), event.name());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nestedGroupsInsideBranchesFinishOnSingleThreadPool() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-nested-pool-");
        HistoryStore store = newStore(root);
        try (WorkflowRunner runner = new WorkflowRunner(store, 1)) {
            RunResult result = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(20), () -> runner.run(List.of(
                    StepDefinition.parallel("top", nestedLevel(3), StepDefinition.func("other", ctx -> "o"))
            ), "in"));

            Assertions.assertEquals(RunStatus.COMPLETED, result.status());
            Assertions.assertEquals(List.of(List.of(List.of(List.of("leaf", "s"), "s"), "s"), "o"), result.output());
            List<TimelineEvent> trace = store.listEventsByTrace(result.traceId());
            Assertions.assertTrue(trace.stream().allMatch(e -> "completed".equals(e.status())));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelledTokenSkipsParallelGroupBeforeBranchesStart() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-cancel-group-");
        HistoryStore store = newStore(root);
        CancellationToken token = new CancellationToken();
        List<String> invoked = new CopyOnWriteArrayList<>();
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("first", ctx -> {
                        token.cancel("operator abort");
                        return "done";
                    }),
                    StepDefinition.parallel("fanout",
                            StepDefinition.func("a", ctx -> invoked.add("a")),
                            StepDefinition.func("b", ctx -> invoked.add("b"))),
                    StepDefinition.func("after", ctx -> invoked.add("after"))
            ), null, RunOptions.builder().cancellationToken(token).build());

            Assertions.assertEquals(RunStatus.CANCELLED, result.status());
            Assertions.assertTrue(invoked.isEmpty());
            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(List.of("completed", "error", "skipped", "skipped", "skipped"), statuses(steps));
            Assertions.assertEquals("cancelled: operator abort", byStepId(steps, "fanout").errorMessage());
            Assertions.assertEquals(byStepId(steps, "fanout").id(), byStepId(steps, "a").parentStepId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void branchesStartingAfterCancellationNeverRunTheirExecutor() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-cancel-branch-");
        HistoryStore store = newStore(root);
        CancellationToken token = new CancellationToken();
        List<String> invoked = new CopyOnWriteArrayList<>();
        try (WorkflowRunner runner = new WorkflowRunner(store, 1)) {
            List<StepDefinition> branches = new ArrayList<>();
            branches.add(StepDefinition.func("stopper", ctx -> {
                invoked.add("stopper");
                token.cancel("enough");
                return "stopped";
            }));
            for (int b = 0; b < 4; b++) {
                String id = "late-" + b;
                branches.add(StepDefinition.func(id, ctx -> invoked.add(id)));
            }
            RunResult result = runner.run(List.of(
                    StepDefinition.parallel("fanout", branches),
                    StepDefinition.func("after", ctx -> invoked.add("after"))
            ), null, RunOptions.builder().cancellationToken(token).build());

            Assertions.assertEquals(RunStatus.CANCELLED, result.status());
            Assertions.assertFalse(invoked.contains("after"));
            List<StepView> steps = store.listSteps(result.runId());
            for (int b = 0; b < 4; b++) {
                StepView late = byStepId(steps, "late-" + b);
                if (invoked.contains("late-" + b)) {
                    Assertions.assertEquals("completed", late.status());
                } else {
                    Assertions.assertEquals("error", late.status());
                    Assertions.assertTrue(late.errorMessage().startsWith(WorkflowRunner.CANCELLED_PREFIX));
                }
                Assertions.assertNotNull(late.endTime());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storageFailureWhileFinishingDoesNotSkipStepsTwice() throws Exception {
        Path root = Files.createTempDirectory("steptrace-test-finish-fail-");
        HistoryStore store = newStore(root);
        Database database = store.database();
        Logger runnerLog = (Logger) LoggerFactory.getLogger(WorkflowRunner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        runnerLog.addAppender(appender);
        try (WorkflowRunner runner = new WorkflowRunner(store, 2)) {
            RunResult result = runner.run(List.of(
                    StepDefinition.func("sabotage", ctx -> {
                        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                            st.execute("DROP TABLE " + database.runsTable());
                        }
                        throw new IllegalStateException("after drop");
                    }),
                    StepDefinition.func("second", StepContext::data),
                    StepDefinition.func("third", StepContext::data)
            ), "in");

            Assertions.assertEquals(RunStatus.ERROR, result.status());
            Assertions.assertTrue(result.failure() instanceof HistoryStoreException);
            List<StepView> steps = store.listSteps(result.runId());
            Assertions.assertEquals(List.of("error", "skipped", "skipped"), statuses(steps));
            Assertions.assertTrue(appender.list.stream()
                    .noneMatch(e -> e.getFormattedMessage().startsWith("Best-effort skip")));
        } finally {
            runnerLog.detachAppender(appender);
            deleteRecursively(root);
        }
    }

    private static StepDefinition nestedLevel(int depth) {
        if (depth == 0) {
            return StepDefinition.func("level-0", ctx -> "leaf");
        }
        return StepDefinition.func("level-" + depth, ctx -> ctx.runChild("child-" + depth, List.of(
                StepDefinition.parallel("group-" + depth, nestedLevel(depth - 1), StepDefinition.func("sib-" + depth, c -> "s"))
        ), ctx.data()).output());
    }

    private static StepDefinition leaf(String id, boolean fails) {
        return StepDefinition.func(id, ctx -> {
            if (fails) {
                throw new IllegalStateException("induced failure in " + id);
            }
            return Map.of("step", id);
        });
    }

    private static HistoryStore newStore(Path root) {
        Database db = new Database(StepTraceConfig.fromRoot(root.toString()));
        db.init();
        return new HistoryStore(db);
    }

    private static List<String> statuses(List<StepView> steps) {
        return steps.stream().map(StepView::status).toList();
    }

    private static StepView byStepId(List<StepView> steps, String stepId) {
        return steps.stream().filter(s -> stepId.equals(s.stepId())).findFirst().orElseThrow();
    }

    private static TimelineEvent spanNamed(List<TimelineEvent> events, String name) {
        return events.stream().filter(e -> name.equals(e.name())).findFirst().orElseThrow();
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
