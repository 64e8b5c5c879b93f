package com.ryuqq.kernelmonitor.core.outcome;

/**
 * 예외 없이 종료된 실행.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Succeeded() implements ExecutionOutcome {

    static final Succeeded INSTANCE = new Succeeded();
}
