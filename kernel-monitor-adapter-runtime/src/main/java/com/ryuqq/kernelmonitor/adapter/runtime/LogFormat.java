package com.ryuqq.kernelmonitor.adapter.runtime;

import java.util.Locale;

/**
 * 로그 라인용 숫자 포맷 헬퍼.
 *
 * <p>로그 포맷은 외부 수집기가 파싱하므로 기본 Locale과 무관하게 {@link Locale#ROOT}를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class LogFormat {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    // Utility class - prevent instantiation
    private LogFormat() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * EXEC_END 용 (소수 둘째 자리).
     */
    static String duration(double seconds) {
        return String.format(Locale.ROOT, "%.2f", seconds);
    }

    /**
     * LONG_EXECUTION / TIMEOUT_INTERRUPT 용 (소수 첫째 자리).
     */
    static String elapsed(double seconds) {
        return String.format(Locale.ROOT, "%.1f", seconds);
    }

    static double toSeconds(long nanos) {
        return Math.max(0L, nanos) / NANOS_PER_SECOND;
    }
}
