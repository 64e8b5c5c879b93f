package com.ryuqq.kernelmonitor.core.statemachine;

/**
 * 실행 하나에 대한 타임아웃 타이머의 단계.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>ARMED → WARNED (경고 임계값 도달)</li>
 *   <li>ARMED → TIMED_OUT (경고 단계가 비활성화된 경우)</li>
 *   <li>WARNED → TIMED_OUT (타임아웃 임계값 도달)</li>
 *   <li>TIMED_OUT → INTERRUPTED (자동 인터럽트 요청)</li>
 *   <li>종료 상태가 아닌 모든 상태 → DISARMED (실행 종료)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ARMED ──► WARNED ──► TIMED_OUT ──► INTERRUPTED
 *   │  └──────────────────►│               │
 *   │          │           │               │
 *   └──────────┴───────────┴───────────────┴──► DISARMED (종료)
 *
 * 금지된 전이:
 * - DISARMED → * ❌
 * - WARNED → ARMED ❌
 * - INTERRUPTED → TIMED_OUT ❌
 * - ARMED → INTERRUPTED ❌ (TIMED_OUT을 거쳐야 함)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TimerPhase {

    /**
     * 두 데드라인이 예약된 상태.
     */
    ARMED,

    /**
     * 경고가 발행된 상태.
     */
    WARNED,

    /**
     * 타임아웃이 발생한 상태.
     */
    TIMED_OUT,

    /**
     * 인터럽트가 요청된 상태.
     */
    INTERRUPTED,

    /**
     * 해제됨 (종료).
     */
    DISARMED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DISARMED인 경우 true
     */
    public boolean isTerminal() {
        return this == DISARMED;
    }
}
