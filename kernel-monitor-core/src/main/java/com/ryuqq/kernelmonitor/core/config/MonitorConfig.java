package com.ryuqq.kernelmonitor.core.config;

/**
 * 실행 모니터 설정 스냅샷 (불변 record).
 *
 * <p>프로세스 시작 시 한 번 로드되어 모니터에 전달됩니다. 모니터는 이 값을
 * 읽기만 하며, 유효하지 않은 조합은 이 record를 만드는 시점에 거부됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 타임아웃 모니터링 사용 여부 (기본 false)</li>
 *   <li>warningThresholdSeconds: 경고 임계값 (기본 240초 = 4분, 0 이하이면 경고 단계 생략)</li>
 *   <li>timeoutThresholdSeconds: 타임아웃 임계값 (기본 300초 = 5분)</li>
 *   <li>autoInterruptEnabled: 타임아웃 시 자동 인터럽트 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>임계값은 유한한 값이어야 함</li>
 *   <li>timeoutThresholdSeconds는 음수 불가, 모니터링 사용 시 양수</li>
 *   <li>경고 단계 사용 시 warningThresholdSeconds &lt; timeoutThresholdSeconds</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param enabled 타임아웃 모니터링 사용 여부
 * @param warningThresholdSeconds 경고 임계값 (초)
 * @param timeoutThresholdSeconds 타임아웃 임계값 (초)
 * @param autoInterruptEnabled 자동 인터럽트 여부
 */
public record MonitorConfig(
    boolean enabled,
    double warningThresholdSeconds,
    double timeoutThresholdSeconds,
    boolean autoInterruptEnabled
) {

    public static final double DEFAULT_WARNING_THRESHOLD_SECONDS = 240;
    public static final double DEFAULT_TIMEOUT_THRESHOLD_SECONDS = 300;

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enabled=false, warning=240s, timeout=300s, autoInterrupt=false</p>
     */
    public MonitorConfig() {
        this(false, DEFAULT_WARNING_THRESHOLD_SECONDS, DEFAULT_TIMEOUT_THRESHOLD_SECONDS, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MonitorConfig {
        if (!Double.isFinite(warningThresholdSeconds)) {
            throw new IllegalArgumentException(
                "warningThresholdSeconds must be finite (current: " + warningThresholdSeconds + ")"
            );
        }
        if (!Double.isFinite(timeoutThresholdSeconds) || timeoutThresholdSeconds < 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdSeconds must be finite and non-negative (current: " + timeoutThresholdSeconds + ")"
            );
        }
        if (enabled && timeoutThresholdSeconds <= 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdSeconds must be positive when monitoring is enabled (current: "
                    + timeoutThresholdSeconds + ")"
            );
        }
        if (warningThresholdSeconds > 0 && warningThresholdSeconds >= timeoutThresholdSeconds) {
            throw new IllegalArgumentException(
                "warningThresholdSeconds must be less than timeoutThresholdSeconds (warning: "
                    + warningThresholdSeconds + ", timeout: " + timeoutThresholdSeconds + ")"
            );
        }
    }

    /**
     * 모니터링 비활성화 설정.
     *
     * @return enabled=false인 기본 설정
     */
    public static MonitorConfig disabled() {
        return new MonitorConfig();
    }

    /**
     * 모니터링 활성화 설정.
     *
     * @param warningThresholdSeconds 경고 임계값 (초)
     * @param timeoutThresholdSeconds 타임아웃 임계값 (초)
     * @param autoInterruptEnabled 자동 인터럽트 여부
     * @return enabled=true인 설정
     */
    public static MonitorConfig enabled(double warningThresholdSeconds, double timeoutThresholdSeconds,
                                        boolean autoInterruptEnabled) {
        return new MonitorConfig(true, warningThresholdSeconds, timeoutThresholdSeconds, autoInterruptEnabled);
    }

    /**
     * 경고 단계 사용 여부.
     *
     * @return warningThresholdSeconds가 양수이면 true
     */
    public boolean warningEnabled() {
        return warningThresholdSeconds > 0;
    }

    public long warningThresholdNanos() {
        return toNanos(warningThresholdSeconds);
    }

    public long timeoutThresholdNanos() {
        return toNanos(timeoutThresholdSeconds);
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     */
    public MonitorConfig withEnabled(boolean enabled) {
        return new MonitorConfig(enabled, warningThresholdSeconds, timeoutThresholdSeconds, autoInterruptEnabled);
    }

    /**
     * 두 임계값을 변경한 새 인스턴스 생성.
     *
     * <p>두 값은 서로 검증되므로 함께 변경합니다.</p>
     */
    public MonitorConfig withThresholds(double warningThresholdSeconds, double timeoutThresholdSeconds) {
        return new MonitorConfig(enabled, warningThresholdSeconds, timeoutThresholdSeconds, autoInterruptEnabled);
    }

    /**
     * autoInterruptEnabled만 변경한 새 인스턴스 생성.
     */
    public MonitorConfig withAutoInterruptEnabled(boolean autoInterruptEnabled) {
        return new MonitorConfig(enabled, warningThresholdSeconds, timeoutThresholdSeconds, autoInterruptEnabled);
    }

    private static long toNanos(double seconds) {
        if (seconds <= 0) {
            return 0L;
        }
        return Math.round(seconds * NANOS_PER_SECOND);
    }
}
