package io.steptrace.workflow;

/**
 * Work performed by one step. The returned value becomes the step's output and the input of the
 * next step. Returning a {@link java.util.concurrent.CompletionStage} makes the step asynchronous;
 * the runner waits for the stage before moving on.
 */
@FunctionalInterface
public interface StepExecutor {
    Object execute(StepContext context) throws Exception;
}
