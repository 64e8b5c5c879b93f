package com.ryuqq.kernelmonitor.core.statemachine;

/**
 * 타이머 단계 전이 검증 및 실행.
 *
 * <p>이 클래스는 {@link TimerPhase} 전이가 허용된 규칙을 따르는지 검증합니다.
 * 동기화는 하지 않으며, 호출자가 실행 단위의 락 안에서 호출해야 합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ARMED → WARNED, TIMED_OUT, DISARMED</li>
 *   <li>WARNED → TIMED_OUT, DISARMED</li>
 *   <li>TIMED_OUT → INTERRUPTED, DISARMED</li>
 *   <li>INTERRUPTED → DISARMED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(TimerPhase from, TimerPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            return false;
        }
        if (to == TimerPhase.DISARMED) {
            return true;
        }
        return switch (from) {
            case ARMED -> to == TimerPhase.WARNED || to == TimerPhase.TIMED_OUT;
            case WARNED -> to == TimerPhase.TIMED_OUT;
            case TIMED_OUT -> to == TimerPhase.INTERRUPTED;
            case INTERRUPTED, DISARMED -> false; // DISARMED 전이는 위에서 처리
        };
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TimerPhase from, TimerPhase to) {
        if (isAllowed(from, to)) {
            return;
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }
        throw new IllegalStateException(
            String.format("Invalid phase transition: %s → %s", from, to)
        );
    }

    /**
     * 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TimerPhase transition(TimerPhase current, TimerPhase next) {
        validate(current, next);
        return next;
    }
}
