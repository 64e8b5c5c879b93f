package com.ryuqq.kernelmonitor.core.spi;

import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;

/**
 * Receiver of an execution host's lifecycle hooks.
 *
 * <p>The host guarantees the following calling contract:</p>
 * <ul>
 *   <li>All hooks are invoked on the single execution thread</li>
 *   <li>{@code onPreExecute} strictly precedes the matching {@code onPostExecute}</li>
 *   <li>Hook calls of two executions never interleave</li>
 *   <li>{@code onPostExecute} is invoked on success and on failure</li>
 * </ul>
 *
 * <p><strong>Hook order for one execution unit:</strong></p>
 * <pre>
 * onPreRunCell(source)        (optional, hosts with a run-cell phase)
 * onPreExecute(cellId, source)
 *   ... user code runs ...
 * onPostExecute(outcome)
 * onPostRunCell(count)        (optional)
 * </pre>
 *
 * <p>Implementations must not throw: observation must never block the observed code.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionLifecycleListener {

    /**
     * Invoked immediately before a unit of code begins running.
     *
     * @param cellId opaque external identifier of the unit (may be null when unknown)
     * @param source source text about to run (may be null or empty)
     */
    void onPreExecute(String cellId, String source);

    /**
     * Invoked immediately after a unit of code finishes, successfully or not.
     *
     * @param outcome how the unit ended
     */
    void onPostExecute(ExecutionOutcome outcome);

    /**
     * Invoked before the run-cell phase that wraps {@link #onPreExecute}.
     *
     * @param source source text about to run (may be null)
     */
    default void onPreRunCell(String source) {
        // no-op
    }

    /**
     * Invoked after the run-cell phase that wraps {@link #onPostExecute}.
     *
     * @param executionCount host-side execution counter of the finished unit
     */
    default void onPostRunCell(long executionCount) {
        // no-op
    }
}
