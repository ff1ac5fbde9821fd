package io.steptrace.workflow;

/**
 * Receives every timeline event after it has been persisted. Callbacks run on the runner's
 * notification thread, never on the thread executing the steps.
 */
@FunctionalInterface
public interface RunListener {
    void onEvent(RunEvent event);
}
