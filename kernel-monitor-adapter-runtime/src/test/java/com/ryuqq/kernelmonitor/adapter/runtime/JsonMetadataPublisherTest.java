package com.ryuqq.kernelmonitor.adapter.runtime;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.kernelmonitor.application.publisher.MetadataContentTypes;
import com.ryuqq.kernelmonitor.core.model.ExecutionNotice;
import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;
import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;
import com.ryuqq.kernelmonitor.core.outcome.Failed;
import com.ryuqq.kernelmonitor.core.spi.MetadataSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * JsonMetadataPublisher 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JsonMetadataPublisherTest {

    private static final long SECOND = 1_000_000_000L;

    @Mock
    private MetadataSink sink;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LogCapture logs;
    private JsonMetadataPublisher publisher;

    @BeforeEach
    void setUp() {
        logs = new LogCapture();
        publisher = new JsonMetadataPublisher(sink, objectMapper, logs.logger());
    }

    @AfterEach
    void tearDown() {
        logs.close();
    }

    @Test
    void publish_성공_레코드는_error_kind_없이_직렬화() throws Exception {
        // given
        ExecutionRecord record = ExecutionRecord.open(3, "c", "x", 0L).seal(2 * SECOND, ExecutionOutcome.success());

        // when
        publisher.publish(record);

        // then
        JsonNode json = captureJson(MetadataContentTypes.EXECUTION_METADATA);
        assertThat(json.get("execution_count").asLong()).isEqualTo(3);
        assertThat(json.get("duration_seconds").asDouble()).isEqualTo(2.0);
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.has("error_kind")).isFalse();
    }

    @Test
    void publish_실패_레코드는_error_kind_포함() throws Exception {
        // given
        ExecutionRecord record = ExecutionRecord.open(4, "c", "x", 0L).seal(SECOND / 2, Failed.of("KeyError"));

        // when
        publisher.publish(record);

        // then
        JsonNode json = captureJson(MetadataContentTypes.EXECUTION_METADATA);
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("error_kind").asText()).isEqualTo("KeyError");
        assertThat(json.get("duration_seconds").asDouble()).isEqualTo(0.5);
    }

    @Test
    void publishNotice_kind는_소문자() throws Exception {
        // when
        publisher.publishNotice(ExecutionNotice.timeout(7, 301.5, 300, "loop()"));

        // then
        JsonNode json = captureJson(MetadataContentTypes.EXECUTION_NOTICE);
        assertThat(json.get("execution_count").asLong()).isEqualTo(7);
        assertThat(json.get("kind").asText()).isEqualTo("timeout");
        assertThat(json.get("elapsed_seconds").asDouble()).isEqualTo(301.5);
        assertThat(json.get("threshold_seconds").asDouble()).isEqualTo(300.0);
        assertThat(json.get("code_preview").asText()).isEqualTo("loop()");
    }

    @Test
    void publish_채널이_닫혀도_예외를_전파하지_않음() {
        // given
        doThrow(new IllegalStateException("closed")).when(sink).publish(anyString(), anyString());
        ExecutionRecord record = ExecutionRecord.open(1, "c", "x", 0L).seal(0L, ExecutionOutcome.success());

        // when / then
        assertThatCode(() -> publisher.publish(record)).doesNotThrowAnyException();
        assertThat(logs.lines(Level.ERROR))
            .containsExactly("Failed to publish " + MetadataContentTypes.EXECUTION_METADATA + " for count=1");
    }

    @Test
    void publish_null은_무시() {
        // when
        publisher.publish(null);
        publisher.publishNotice(null);

        // then
        verifyNoInteractions(sink);
    }

    private JsonNode captureJson(String contentType) throws Exception {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(sink).publish(eq(contentType), captor.capture());
        return objectMapper.readTree(captor.getValue());
    }
}
