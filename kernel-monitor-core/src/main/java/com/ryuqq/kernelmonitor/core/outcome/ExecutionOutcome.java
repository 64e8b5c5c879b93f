package com.ryuqq.kernelmonitor.core.outcome;

/**
 * 실행 단위(셀) 하나의 종료 결과.
 *
 * <p>ExecutionOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 예외 없이 종료됨</li>
 *   <li>{@link Failed}: 예외로 종료됨 (errorKind 포함)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> {@code isSuccess() == false} 이면 그리고 그때만
 * {@link #errorKindOrNull()}이 non-null입니다. Sealed interface로 정의되어
 * 다른 구현이 이 불변식을 깨뜨릴 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ExecutionOutcome permits Succeeded, Failed {

    /**
     * 성공 결과 조회.
     *
     * @return Succeeded 인스턴스
     */
    static ExecutionOutcome success() {
        return Succeeded.INSTANCE;
    }

    /**
     * 실패 결과 생성.
     *
     * @param errorKind 오류 종류 (예: ValueError, Interrupted)
     * @return Failed 인스턴스
     * @throws IllegalArgumentException errorKind가 null이거나 빈 문자열인 경우
     */
    static ExecutionOutcome failure(String errorKind) {
        return Failed.of(errorKind);
    }

    /**
     * 성공 여부.
     *
     * @return 성공이면 true
     */
    default boolean isSuccess() {
        return this instanceof Succeeded;
    }

    /**
     * 오류 종류 조회.
     *
     * @return 실패 시 오류 종류, 성공 시 null
     */
    default String errorKindOrNull() {
        if (this instanceof Failed failed) {
            return failed.errorKind();
        }
        return null;
    }
}
