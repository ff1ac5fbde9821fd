package io.steptrace.workflow;

import java.util.List;
import java.util.Map;

/**
 * What an executor sees while its step runs: the accumulated data, earlier step outputs by step
 * id, and the run's correlation handles.
 */
public final class StepContext {
    private final WorkflowRunner runner;
    private final String runId;
    private final String traceId;
    private final String stepId;
    private final String stepRecordId;
    private final String spanId;
    private final Object data;
    private final Map<String, Object> stepOutputs;
    private final RunOptions runOptions;
    private volatile String executorRef;

    StepContext(
            WorkflowRunner runner,
            String runId,
            String traceId,
            String stepId,
            String stepRecordId,
            String spanId,
            Object data,
            Map<String, Object> stepOutputs,
            RunOptions runOptions
    ) {
        this.runner = runner;
        this.runId = runId;
        this.traceId = traceId;
        this.stepId = stepId;
        this.stepRecordId = stepRecordId;
        this.spanId = spanId;
        this.data = data;
        this.stepOutputs = stepOutputs;
        this.runOptions = runOptions;
    }

    public Object data() {
        return data;
    }

    /**
     * Output recorded by an earlier step of the same run, or {@code null} when that step has not
     * completed. A parallel group's output is the list of its branch outputs.
     */
    public Object getStepData(String id) {
        synchronized (stepOutputs) {
            return stepOutputs.get(id);
        }
    }

    public String runId() {
        return runId;
    }

    public String traceId() {
        return traceId;
    }

    public String stepId() {
        return stepId;
    }

    public String stepRecordId() {
        return stepRecordId;
    }

    public String spanId() {
        return spanId;
    }

    public CancellationToken cancellationToken() {
        return runOptions.cancellationToken();
    }

    public boolean isCancelled() {
        return runOptions.cancellationToken().isCancelled();
    }

    /**
     * Handle of the delegate execution behind this step, stored as the step record's executor
     * reference.
     */
    public void setExecutorRef(String ref) {
        this.executorRef = ref;
    }

    public String executorRef() {
        return executorRef;
    }

    /**
     * Options for a nested run launched from this step: same trace, same cancellation token, and
     * a parent span pointing at this step.
     */
    public RunOptions childRunOptions(String name) {
        return RunOptions.builder()
                .name(name)
                .workflowId(runOptions.workflowId())
                .userId(runOptions.userId())
                .conversationId(runOptions.conversationId())
                .cancellationToken(runOptions.cancellationToken())
                .traceId(traceId)
                .parentRunId(runId)
                .parentEventId(spanId)
                .build();
    }

    /**
     * Runs a nested chain under this step and records the nested run id as the executor
     * reference.
     */
    public RunResult runChild(String name, List<StepDefinition> steps, Object input) {
        RunResult result = runner.run(steps, input, childRunOptions(name));
        setExecutorRef(result.runId());
        return result;
    }
}
