package com.ryuqq.kernelmonitor.core.model;

import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;

/**
 * 실행 단위 하나의 기록.
 *
 * <p>pre-execute 시점에 열린(open) 레코드로 생성되고, post-execute 시점에
 * {@link #seal(long, ExecutionOutcome)}으로 봉인된 새 인스턴스가 만들어집니다.
 * 봉인 이후에는 변경되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>sequenceNumber:</strong> 프로세스 수명 동안 단조 증가하는 번호 (1부터 시작, 0은 합성 레코드)</li>
 *   <li><strong>cellId:</strong> 외부 식별자 (불투명 값)</li>
 *   <li><strong>sourcePreview:</strong> 앞 {@value SourcePreview#RECORD_LENGTH}자 미리보기</li>
 *   <li><strong>startNanos / endNanos:</strong> 단조 시계 값 (System.nanoTime 기준)</li>
 *   <li><strong>outcome:</strong> 열린 레코드는 null</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code endNanos >= startNanos} (봉인 시 역전된 시계는 0으로 보정)</li>
 *   <li>{@code success() == false} ⇔ {@code errorKindOrNull() != null}</li>
 * </ul>
 *
 * @param sequenceNumber 실행 순번
 * @param cellId 셀 식별자
 * @param sourcePreview 소스 미리보기
 * @param startNanos 시작 시각 (단조 시계)
 * @param endNanos 종료 시각 (열린 레코드는 startNanos와 같음)
 * @param outcome 실행 결과 (열린 레코드는 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionRecord(
    long sequenceNumber,
    String cellId,
    String sourcePreview,
    long startNanos,
    long endNanos,
    ExecutionOutcome outcome
) {

    /**
     * 합성 레코드의 순번 (pre-execute 없이 post-execute가 호출된 경우).
     */
    public static final long SYNTHETIC_SEQUENCE = 0L;

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 순번이 음수이거나, 필수 필드가 null이거나, 종료 시각이 시작 시각보다 앞선 경우
     */
    public ExecutionRecord {
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be non-negative (current: " + sequenceNumber + ")");
        }
        if (cellId == null) {
            throw new IllegalArgumentException("cellId cannot be null");
        }
        if (sourcePreview == null) {
            throw new IllegalArgumentException("sourcePreview cannot be null");
        }
        if (endNanos < startNanos) {
            throw new IllegalArgumentException(
                "endNanos must not precede startNanos (start: " + startNanos + ", end: " + endNanos + ")");
        }
    }

    /**
     * 열린 레코드 생성 (pre-execute).
     *
     * @param sequenceNumber 실행 순번
     * @param cellId 셀 식별자
     * @param sourcePreview 소스 미리보기
     * @param startNanos 시작 시각
     * @return outcome이 없는 ExecutionRecord
     */
    public static ExecutionRecord open(long sequenceNumber, String cellId, String sourcePreview, long startNanos) {
        return new ExecutionRecord(sequenceNumber, cellId, sourcePreview, startNanos, startNanos, null);
    }

    /**
     * 합성 레코드 생성.
     *
     * <p>pre-execute 없이 post-execute가 호출된 경우의 최선 노력(best-effort) 레코드입니다.
     * 순번은 {@link #SYNTHETIC_SEQUENCE}, 실행 시간은 0입니다.</p>
     *
     * @param nowNanos 현재 시각
     * @param outcome 실행 결과
     * @return 봉인된 합성 레코드
     */
    public static ExecutionRecord synthetic(long nowNanos, ExecutionOutcome outcome) {
        return open(SYNTHETIC_SEQUENCE, "unknown", SourcePreview.EMPTY, nowNanos).seal(nowNanos, outcome);
    }

    /**
     * 레코드 봉인 (post-execute).
     *
     * @param nowNanos 종료 시각 (시작보다 앞서면 시작 시각으로 보정)
     * @param result 실행 결과
     * @return 봉인된 새 ExecutionRecord
     * @throws IllegalArgumentException result가 null인 경우
     * @throws IllegalStateException 이미 봉인된 경우
     */
    public ExecutionRecord seal(long nowNanos, ExecutionOutcome result) {
        if (result == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (isSealed()) {
            throw new IllegalStateException("ExecutionRecord already sealed (count: " + sequenceNumber + ")");
        }
        return new ExecutionRecord(sequenceNumber, cellId, sourcePreview, startNanos,
            Math.max(nowNanos, startNanos), result);
    }

    /**
     * 봉인 여부.
     *
     * @return post-execute 처리가 끝났으면 true
     */
    public boolean isSealed() {
        return outcome != null;
    }

    /**
     * 합성 레코드 여부.
     *
     * @return 순번이 {@link #SYNTHETIC_SEQUENCE}이면 true
     */
    public boolean isSynthetic() {
        return sequenceNumber == SYNTHETIC_SEQUENCE;
    }

    /**
     * 실행 시간 (나노초).
     *
     * @return endNanos - startNanos (항상 0 이상)
     */
    public long durationNanos() {
        return endNanos - startNanos;
    }

    /**
     * 실행 시간 (초).
     *
     * @return 0 이상의 유한한 값
     */
    public double durationSeconds() {
        return durationNanos() / NANOS_PER_SECOND;
    }

    /**
     * 성공 여부.
     *
     * @return 봉인되었고 성공이면 true
     */
    public boolean success() {
        return outcome != null && outcome.isSuccess();
    }

    /**
     * 오류 종류.
     *
     * @return 실패한 경우 오류 종류, 그 외 null
     */
    public String errorKindOrNull() {
        return outcome == null ? null : outcome.errorKindOrNull();
    }
}
