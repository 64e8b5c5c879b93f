package com.ryuqq.kernelmonitor.application.publisher;

/**
 * 프레젠테이션 채널 content type 상수.
 *
 * <p>뷰어 측 상수와 같은 값을 유지해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MetadataContentTypes {

    /**
     * 실행 종료 메타데이터.
     */
    public static final String EXECUTION_METADATA = "application/vnd.deepnote.execution-metadata+json";

    /**
     * 장기 실행 경고/타임아웃 알림.
     */
    public static final String EXECUTION_NOTICE = "application/vnd.deepnote.execution-notice+json";

    // Utility class - prevent instantiation
    private MetadataContentTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
