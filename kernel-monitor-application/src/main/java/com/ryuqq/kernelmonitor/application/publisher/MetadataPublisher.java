package com.ryuqq.kernelmonitor.application.publisher;

import com.ryuqq.kernelmonitor.core.model.ExecutionNotice;
import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;

/**
 * 실행 메타데이터 발행자.
 *
 * <p>봉인된 {@link ExecutionRecord}를 구조화된 페이로드로 변환하여 프레젠테이션 채널에
 * 전달합니다. 다운스트림 뷰어는 고정된 content type으로 일반 출력과 구분합니다.</p>
 *
 * <p><strong>발행 페이로드:</strong></p>
 * <pre>
 * {@value MetadataContentTypes#EXECUTION_METADATA}
 *   { "execution_count": 3, "duration_seconds": 1.25, "success": false, "error_kind": "ValueError" }
 *
 * {@value MetadataContentTypes#EXECUTION_NOTICE}
 *   { "execution_count": 3, "kind": "warning", "elapsed_seconds": 240.0,
 *     "threshold_seconds": 240.0, "code_preview": "train(model)" }
 * </pre>
 *
 * <p><strong>오류 처리:</strong> 구현체는 어떤 실패(채널 종료, 직렬화 오류)도 호출자에게
 * 전파하지 않아야 합니다. 실패는 한 번 로그로 남기고 무시합니다. 모니터링 실패가
 * 사용자 코드를 실패시켜서는 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetadataPublisher {

    /**
     * 실행 메타데이터 발행.
     *
     * @param record 봉인된 실행 레코드
     */
    void publish(ExecutionRecord record);

    /**
     * 장기 실행 알림 발행 (최선 노력).
     *
     * <p>타이머 스레드에서 호출됩니다.</p>
     *
     * @param notice 경고 또는 타임아웃 알림
     */
    void publishNotice(ExecutionNotice notice);
}
