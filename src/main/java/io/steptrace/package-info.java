/**
 * StepTrace source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.steptrace.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.steptrace.workflow.WorkflowRunner} executes step chains and records them as they run.</li>
 *   <li>{@code io.steptrace.storage.HistoryStore} is the authoritative record of runs, steps and timeline events.</li>
 *   <li>{@code io.steptrace.observability.LiveBroadcastHub} fans recent events out to live subscribers.</li>
 * </ul>
 */
package io.steptrace;
