/**
 * Execution outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome} - Sealed interface (permits Succeeded, Failed)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.core.outcome.Succeeded} - unit finished without an error</li>
 *   <li>{@link com.ryuqq.kernelmonitor.core.outcome.Failed} - unit raised an error (error kind attached)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.core.outcome;
