package com.ryuqq.kernelmonitor.adapter.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.kernelmonitor.adapter.runtime.payload.ExecutionMetadataPayload;
import com.ryuqq.kernelmonitor.adapter.runtime.payload.ExecutionNoticePayload;
import com.ryuqq.kernelmonitor.application.publisher.MetadataContentTypes;
import com.ryuqq.kernelmonitor.application.publisher.MetadataPublisher;
import com.ryuqq.kernelmonitor.core.model.ExecutionNotice;
import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;
import com.ryuqq.kernelmonitor.core.spi.MetadataSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson 기반 {@link MetadataPublisher} 구현체.
 *
 * <p>레코드와 알림을 snake_case JSON으로 직렬화해 {@link MetadataSink}에 전달합니다.
 * 직렬화 실패, 채널 종료 등 모든 실패는 ERROR로 기록하고 삼킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonMetadataPublisher implements MetadataPublisher {

    private final MetadataSink sink;
    private final ObjectMapper objectMapper;
    private final Logger log;

    /**
     * 생성자 (기본 ObjectMapper, 기본 Logger).
     *
     * @param sink 프레젠테이션 채널
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public JsonMetadataPublisher(MetadataSink sink) {
        this(sink, new ObjectMapper(), LoggerFactory.getLogger(JsonMetadataPublisher.class));
    }

    /**
     * 생성자.
     *
     * @param sink 프레젠테이션 채널
     * @param objectMapper JSON 직렬화기
     * @param log 로그 출력 대상
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JsonMetadataPublisher(MetadataSink sink, ObjectMapper objectMapper, Logger log) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.sink = sink;
        this.objectMapper = objectMapper;
        this.log = log;
    }

    @Override
    public void publish(ExecutionRecord record) {
        if (record == null) {
            return;
        }
        send(MetadataContentTypes.EXECUTION_METADATA, ExecutionMetadataPayload.from(record),
            record.sequenceNumber());
    }

    @Override
    public void publishNotice(ExecutionNotice notice) {
        if (notice == null) {
            return;
        }
        send(MetadataContentTypes.EXECUTION_NOTICE, ExecutionNoticePayload.from(notice),
            notice.executionCount());
    }

    private void send(String contentType, Object payload, long executionCount) {
        try {
            sink.publish(contentType, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for count={}", contentType, executionCount, e);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for count={}", contentType, executionCount, e);
        }
    }
}
