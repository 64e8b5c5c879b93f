package com.ryuqq.kernelmonitor.adapter.runtime.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.kernelmonitor.core.model.ExecutionNotice;

import java.util.Locale;

/**
 * 장기 실행 경고/타임아웃 알림 페이로드.
 *
 * @param executionCount   실행 sequence number
 * @param kind             "warning" 또는 "timeout"
 * @param elapsedSeconds   발화 시점 경과 시간 (초)
 * @param thresholdSeconds 넘어선 임계값 (초)
 * @param codePreview      소스 미리보기
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionNoticePayload(
    @JsonProperty("execution_count")   long executionCount,
    @JsonProperty("kind")              String kind,
    @JsonProperty("elapsed_seconds")   double elapsedSeconds,
    @JsonProperty("threshold_seconds") double thresholdSeconds,
    @JsonProperty("code_preview")      String codePreview
) {

    public static ExecutionNoticePayload from(ExecutionNotice notice) {
        return new ExecutionNoticePayload(
            notice.executionCount(),
            notice.kind().name().toLowerCase(Locale.ROOT),
            notice.elapsedSeconds(),
            notice.thresholdSeconds(),
            notice.codePreview()
        );
    }
}
