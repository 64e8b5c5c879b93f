package com.ryuqq.kernelmonitor.core.outcome;

/**
 * 예외로 종료된 실행.
 *
 * <p>errorKind는 실행 중 발생한 예외의 종류 이름입니다 (예: {@code ValueError},
 * {@code IllegalStateException}). 협력적 인터럽트로 중단된 실행은
 * {@link #INTERRUPTED}를 사용하며, 사용자가 직접 중단한 경우와 구분되지 않습니다.</p>
 *
 * @param errorKind 오류 종류 (null 또는 빈 문자열 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(String errorKind) implements ExecutionOutcome {

    /**
     * 인터럽트로 중단된 실행의 오류 종류.
     */
    public static final String INTERRUPTED = "Interrupted";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorKind가 null이거나 빈 문자열인 경우
     */
    public Failed {
        if (errorKind == null || errorKind.isBlank()) {
            throw new IllegalArgumentException("errorKind cannot be null or blank");
        }
    }

    /**
     * Failed 생성.
     *
     * @param errorKind 오류 종류
     * @return Failed 인스턴스
     * @throws IllegalArgumentException errorKind가 null이거나 빈 문자열인 경우
     */
    public static Failed of(String errorKind) {
        return new Failed(errorKind);
    }

    /**
     * 인터럽트로 중단된 실행.
     *
     * @return errorKind가 {@value #INTERRUPTED}인 Failed
     */
    public static Failed interrupted() {
        return new Failed(INTERRUPTED);
    }

    /**
     * 예외 타입으로부터 Failed 생성.
     *
     * @param error 실행 중 발생한 예외
     * @return 예외의 단순 클래스 이름을 errorKind로 가진 Failed
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Failed from(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        String name = error.getClass().getSimpleName();
        // 익명 클래스는 simple name이 비어 있음
        return new Failed(name.isEmpty() ? error.getClass().getName() : name);
    }
}
