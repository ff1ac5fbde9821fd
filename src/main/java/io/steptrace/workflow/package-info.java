/**
 * Step-chain orchestration.
 *
 * <p>{@link io.steptrace.workflow.WorkflowRunner} runs a chain of step definitions in order,
 * fanning parallel groups out to a worker pool, and writes every state change through to the
 * history store before continuing.
 */
package io.steptrace.workflow;
