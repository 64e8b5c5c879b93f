package com.ryuqq.kernelmonitor.core.model;

/**
 * 장기 실행 알림.
 *
 * <p>타임아웃 모니터가 경고 임계값 또는 타임아웃 임계값을 넘긴 실행을 발견했을 때
 * 프레젠테이션 채널로 전달하는 최선 노력(best-effort) 알림입니다. 실행 자체에는
 * 영향을 주지 않습니다.</p>
 *
 * @param executionCount 대상 실행 순번
 * @param kind 알림 종류
 * @param elapsedSeconds 알림 시점까지의 경과 시간 (초)
 * @param thresholdSeconds 넘긴 임계값 (초)
 * @param codePreview 소스 미리보기
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionNotice(
    long executionCount,
    Kind kind,
    double elapsedSeconds,
    double thresholdSeconds,
    String codePreview
) {

    /**
     * 알림 종류.
     */
    public enum Kind {
        /** 경고 임계값 초과. */
        WARNING,
        /** 타임아웃 임계값 초과. */
        TIMEOUT
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 경과 시간이 음수인 경우
     */
    public ExecutionNotice {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (elapsedSeconds < 0 || Double.isNaN(elapsedSeconds)) {
            throw new IllegalArgumentException("elapsedSeconds must be non-negative (current: " + elapsedSeconds + ")");
        }
        if (codePreview == null) {
            codePreview = SourcePreview.EMPTY;
        }
    }

    /**
     * 경고 알림 생성.
     */
    public static ExecutionNotice warning(long executionCount, double elapsedSeconds, double thresholdSeconds,
                                          String codePreview) {
        return new ExecutionNotice(executionCount, Kind.WARNING, elapsedSeconds, thresholdSeconds, codePreview);
    }

    /**
     * 타임아웃 알림 생성.
     */
    public static ExecutionNotice timeout(long executionCount, double elapsedSeconds, double thresholdSeconds,
                                          String codePreview) {
        return new ExecutionNotice(executionCount, Kind.TIMEOUT, elapsedSeconds, thresholdSeconds, codePreview);
    }
}
