/**
 * Timeout timer state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.core.statemachine.TimerPhase} - per-execution timer phases (enum)</li>
 *   <li>{@link com.ryuqq.kernelmonitor.core.statemachine.PhaseTransition} - transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * ARMED → WARNED → TIMED_OUT → INTERRUPTED
 * ARMED → TIMED_OUT (warning phase disabled)
 * any non-terminal phase → DISARMED (execution finished)
 *
 * Forbidden:
 * - DISARMED → * (terminal phase)
 * - Backward transitions (e.g., TIMED_OUT → WARNED)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TimerPhase phase = TimerPhase.ARMED;
 * phase = PhaseTransition.transition(phase, TimerPhase.WARNED);
 * phase = PhaseTransition.transition(phase, TimerPhase.DISARMED);
 *
 * // This will throw IllegalStateException
 * PhaseTransition.validate(phase, TimerPhase.TIMED_OUT);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.core.statemachine;
