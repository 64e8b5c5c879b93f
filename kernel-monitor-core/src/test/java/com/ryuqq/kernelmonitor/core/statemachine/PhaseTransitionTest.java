package com.ryuqq.kernelmonitor.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.kernelmonitor.core.statemachine.TimerPhase.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PhaseTransition 테스트.
 *
 * <ul>
 *   <li>ARMED → WARNED → TIMED_OUT → INTERRUPTED 정상 흐름</li>
 *   <li>경고 생략 시 ARMED → TIMED_OUT</li>
 *   <li>모든 비종료 상태에서 DISARMED 허용</li>
 *   <li>DISARMED 이후 모든 전이 거부</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PhaseTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_FullEscalation_Succeeds() {
        // Given
        TimerPhase phase = ARMED;

        // When
        phase = PhaseTransition.transition(phase, WARNED);
        phase = PhaseTransition.transition(phase, TIMED_OUT);
        phase = PhaseTransition.transition(phase, INTERRUPTED);

        // Then
        assertEquals(INTERRUPTED, phase);
        assertFalse(phase.isTerminal());
    }

    @Test
    void validate_ArmedToTimedOut_SucceedsWhenWarningSkipped() {
        // When & Then
        assertDoesNotThrow(() -> PhaseTransition.validate(ARMED, TIMED_OUT));
    }

    @ParameterizedTest
    @EnumSource(value = TimerPhase.class, names = {"ARMED", "WARNED", "TIMED_OUT", "INTERRUPTED"})
    void isAllowed_AnyLivePhaseToDisarmed_ReturnsTrue(TimerPhase from) {
        // When & Then
        assertTrue(PhaseTransition.isAllowed(from, DISARMED));
    }

    // ========== 불법 전이 테스트 ==========

    @ParameterizedTest
    @EnumSource(TimerPhase.class)
    void isAllowed_FromDisarmed_AlwaysFalse(TimerPhase to) {
        // When & Then
        assertFalse(PhaseTransition.isAllowed(DISARMED, to));
    }

    @Test
    void validate_FromDisarmed_ThrowsTerminalMessage() {
        // When
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PhaseTransition.validate(DISARMED, WARNED)
        );

        // Then
        assertTrue(exception.getMessage().contains("terminal phase"));
    }

    @Test
    void validate_WarnedToWarned_ThrowsException() {
        // When
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PhaseTransition.validate(WARNED, WARNED)
        );

        // Then
        assertTrue(exception.getMessage().contains("Invalid phase transition"));
    }

    @Test
    void isAllowed_TimedOutToWarned_ReturnsFalse() {
        // When & Then
        assertFalse(PhaseTransition.isAllowed(TIMED_OUT, WARNED));
        assertFalse(PhaseTransition.isAllowed(TIMED_OUT, TIMED_OUT));
    }

    @Test
    void isAllowed_ArmedToInterrupted_ReturnsFalse() {
        // When & Then
        assertFalse(PhaseTransition.isAllowed(ARMED, INTERRUPTED));
        assertFalse(PhaseTransition.isAllowed(WARNED, INTERRUPTED));
    }

    @Test
    void isAllowed_InterruptedToTimedOut_ReturnsFalse() {
        // When & Then
        assertFalse(PhaseTransition.isAllowed(INTERRUPTED, TIMED_OUT));
    }

    @Test
    void isAllowed_NullPhase_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> PhaseTransition.isAllowed(null, ARMED));
        assertThrows(IllegalArgumentException.class, () -> PhaseTransition.isAllowed(ARMED, null));
    }

    // ========== TimerPhase ==========

    @Test
    void isTerminal_OnlyDisarmed() {
        // When & Then
        for (TimerPhase phase : TimerPhase.values()) {
            assertEquals(phase == DISARMED, phase.isTerminal(), phase.name());
        }
    }
}
