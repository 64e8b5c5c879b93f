package com.ryuqq.kernelmonitor.adapter.runtime.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;

/**
 * 실행 종료 메타데이터 페이로드.
 *
 * <p>{@code error_kind}는 실패한 실행에만 포함됩니다.</p>
 *
 * @param executionCount  실행 sequence number
 * @param durationSeconds 실행 시간 (초)
 * @param success         성공 여부
 * @param errorKind       실패 종류, 성공이면 null
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionMetadataPayload(
    @JsonProperty("execution_count")  long executionCount,
    @JsonProperty("duration_seconds") double durationSeconds,
    @JsonProperty("success")          boolean success,
    @JsonProperty("error_kind")       String errorKind
) {

    public static ExecutionMetadataPayload from(ExecutionRecord record) {
        return new ExecutionMetadataPayload(
            record.sequenceNumber(),
            record.durationSeconds(),
            record.success(),
            record.errorKindOrNull()
        );
    }
}
