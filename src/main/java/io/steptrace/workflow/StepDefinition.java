package io.steptrace.workflow;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * One entry of a step chain. Leaf steps carry an executor; a parallel group carries its branches,
 * which run concurrently against the same input.
 */
public final class StepDefinition {
    private final String id;
    private final String name;
    private final StepType type;
    private final StepExecutor executor;
    private final Predicate<Object> condition;
    private final List<StepDefinition> branches;

    private StepDefinition(
            String id,
            String name,
            StepType type,
            StepExecutor executor,
            Predicate<Object> condition,
            List<StepDefinition> branches
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("step id cannot be empty");
        }
        this.id = id.trim();
        this.name = name == null || name.isBlank() ? this.id : name.trim();
        this.type = type;
        this.executor = executor;
        this.condition = condition;
        this.branches = branches;
    }

    public static StepDefinition func(String id, StepExecutor executor) {
        return new StepDefinition(id, null, StepType.FUNC, requireExecutor(id, executor), null, List.of());
    }

    /**
     * A step that delegates to a nested execution and reports its handle through
     * {@link StepContext#setExecutorRef(String)} or {@link StepContext#runChild}.
     */
    public static StepDefinition agent(String id, StepExecutor executor) {
        return new StepDefinition(id, null, StepType.AGENT, requireExecutor(id, executor), null, List.of());
    }

    /**
     * Runs {@code executor} only when {@code condition} accepts the accumulated data; otherwise the
     * step completes with its input passed through.
     */
    public static StepDefinition when(String id, Predicate<Object> condition, StepExecutor executor) {
        Objects.requireNonNull(condition, "condition");
        return new StepDefinition(id, null, StepType.CONDITIONAL, requireExecutor(id, executor), condition, List.of());
    }

    public static StepDefinition parallel(String id, StepDefinition... branches) {
        return parallel(id, branches == null ? List.of() : List.of(branches));
    }

    public static StepDefinition parallel(String id, List<StepDefinition> branches) {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("parallel group " + id + " needs at least one branch");
        }
        Set<String> seen = new HashSet<>();
        for (StepDefinition branch : branches) {
            Objects.requireNonNull(branch, "branch");
            if (branch.isParallel()) {
                throw new IllegalArgumentException("parallel group " + id + " cannot nest group " + branch.id());
            }
            if (!seen.add(branch.id())) {
                throw new IllegalArgumentException("duplicate branch id in group " + id + ": " + branch.id());
            }
        }
        return new StepDefinition(id, null, StepType.PARALLEL_ALL, null, null, List.copyOf(branches));
    }

    public StepDefinition named(String displayName) {
        return new StepDefinition(id, displayName, type, executor, condition, branches);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public StepType type() {
        return type;
    }

    public StepExecutor executor() {
        return executor;
    }

    public Predicate<Object> condition() {
        return condition;
    }

    public List<StepDefinition> branches() {
        return branches;
    }

    public boolean isParallel() {
        return type == StepType.PARALLEL_ALL;
    }

    /**
     * Number of step records this definition produces: one, or one for the group plus one per
     * branch.
     */
    int recordCount() {
        return isParallel() ? 1 + branches.size() : 1;
    }

    private static StepExecutor requireExecutor(String id, StepExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("step " + id + " needs an executor");
        }
        return executor;
    }
}
