package com.ryuqq.kernelmonitor.adapter.runtime;

import com.ryuqq.kernelmonitor.application.publisher.MetadataPublisher;
import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;
import com.ryuqq.kernelmonitor.core.model.SourcePreview;
import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * 실행 추적기.
 *
 * <p>실행 단위마다 {@link ExecutionRecord}를 만들고 시작/종료를 로그로 남긴 뒤,
 * 봉인된 레코드를 {@link MetadataPublisher}에 넘깁니다.</p>
 *
 * <p><strong>로그 포맷:</strong></p>
 * <pre>
 * EXEC_START | count=3 | cell_id=5f2a1c | preview=df = load()\nprint(df)
 * EXEC_END | count=3 | duration=1.25s | success=false | error=ValueError
 * </pre>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>훅은 호스트의 단일 실행 스레드에서만 호출됨</li>
 *   <li>{@code current}는 다른 스레드에서 읽을 수 있도록 volatile</li>
 * </ul>
 *
 * <p><strong>오류 처리:</strong> 관찰 경로의 어떤 오류도 호출자에게 전파하지 않습니다.
 * 내부 오류는 ERROR로 한 번 기록되고, 사용자 코드 실행은 영향을 받지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionTracker {

    static final int RUN_PREVIEW_LENGTH = 30;

    private final MetadataPublisher publisher;
    private final LongSupplier clock;
    private final Logger log;
    private final AtomicLong sequence = new AtomicLong();

    private volatile ExecutionRecord current;

    /**
     * 생성자 (System.nanoTime 시계, 기본 Logger).
     *
     * @param publisher 메타데이터 발행자
     * @throws IllegalArgumentException publisher가 null인 경우
     */
    public ExecutionTracker(MetadataPublisher publisher) {
        this(publisher, System::nanoTime, LoggerFactory.getLogger(ExecutionTracker.class));
    }

    /**
     * 생성자.
     *
     * @param publisher 메타데이터 발행자
     * @param clock 단조 증가 나노초 시계
     * @param log 로그 출력 대상
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExecutionTracker(MetadataPublisher publisher, LongSupplier clock, Logger log) {
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.publisher = publisher;
        this.clock = clock;
        this.log = log;
    }

    /**
     * 실행 시작 처리.
     *
     * <p>다음 sequence number를 할당하고 열린 레코드를 만든 뒤 EXEC_START를 기록합니다.</p>
     *
     * @param cellId 외부 셀 식별자 (null이면 소스 해시로 대체)
     * @param source 실행할 소스 (null 허용)
     * @return 열린 레코드, 내부 오류 시 null
     */
    public ExecutionRecord onPreExecute(String cellId, String source) {
        try {
            ExecutionRecord previous = current;
            if (previous != null) {
                log.warn("EXEC_START received while count={} is still open, discarding it",
                    previous.sequenceNumber());
            }

            long sequenceNumber = sequence.incrementAndGet();
            String resolvedCellId = resolveCellId(cellId, source);
            String preview = SourcePreview.of(source, SourcePreview.RECORD_LENGTH);
            ExecutionRecord record = ExecutionRecord.open(sequenceNumber, resolvedCellId, preview, clock.getAsLong());
            current = record;

            log.info("EXEC_START | count={} | cell_id={} | preview={}",
                sequenceNumber, resolvedCellId, SourcePreview.forLog(preview, SourcePreview.LOG_LENGTH));
            return record;

        } catch (RuntimeException e) {
            current = null;
            log.error("Failed to track execution start", e);
            return null;
        }
    }

    /**
     * 실행 종료 처리.
     *
     * <p>매칭되는 시작이 없으면 WARN을 남기고 sequence 0의 합성 레코드를 만들어
     * EXEC_END만 기록합니다. 합성 레코드는 발행하지 않습니다.</p>
     *
     * @param outcome 실행 결과 (null이면 성공으로 간주)
     * @return 봉인된 레코드, 내부 오류 시 null
     */
    public ExecutionRecord onPostExecute(ExecutionOutcome outcome) {
        ExecutionOutcome result = outcome != null ? outcome : ExecutionOutcome.success();
        try {
            ExecutionRecord open = current;
            current = null;
            long now = clock.getAsLong();

            if (open == null) {
                log.warn("EXEC_END called without matching EXEC_START");
                ExecutionRecord synthetic = ExecutionRecord.synthetic(now, result);
                logEnd(synthetic);
                return synthetic;
            }

            ExecutionRecord sealed = open.seal(now, result);
            logEnd(sealed);
            publisher.publish(sealed);
            return sealed;

        } catch (RuntimeException e) {
            log.error("Failed to track execution end", e);
            return null;
        }
    }

    /**
     * run-cell 시작 (pre-execute 이전).
     *
     * @param source 실행할 소스
     */
    public void onPreRunCell(String source) {
        if (log.isDebugEnabled()) {
            log.debug("PRE_RUN | preview={}", SourcePreview.forLog(source, RUN_PREVIEW_LENGTH));
        }
    }

    /**
     * run-cell 종료 (post-execute 이후).
     *
     * @param executionCount 호스트의 실행 카운트
     */
    public void onPostRunCell(long executionCount) {
        log.debug("POST_RUN | exec_count={}", executionCount);
    }

    /**
     * 현재 열린 레코드 조회.
     *
     * @return 열린 레코드, 없으면 null
     */
    public ExecutionRecord current() {
        return current;
    }

    /**
     * 지금까지 할당된 마지막 sequence number.
     *
     * @return 마지막 sequence number (아직 없으면 0)
     */
    public long lastSequenceNumber() {
        return sequence.get();
    }

    private void logEnd(ExecutionRecord record) {
        String errorKind = record.errorKindOrNull();
        log.info("EXEC_END | count={} | duration={}s | success={}{}",
            record.sequenceNumber(),
            LogFormat.duration(record.durationSeconds()),
            record.success(),
            errorKind != null ? " | error=" + errorKind : "");
    }

    static String resolveCellId(String cellId, String source) {
        if (cellId != null && !cellId.isBlank()) {
            return cellId;
        }
        if (source == null || source.isEmpty()) {
            return "0";
        }
        return Integer.toHexString(source.hashCode());
    }
}
