package com.ryuqq.kernelmonitor.adapter.runtime;

import com.ryuqq.kernelmonitor.core.statemachine.PhaseTransition;
import com.ryuqq.kernelmonitor.core.statemachine.TimerPhase;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 실행 하나의 타이머 상태.
 *
 * <p>모든 전이는 이 상태 고유의 lock 안에서 수행됩니다. 프로세스 전역 lock은 없습니다.
 * lock은 재진입 가능하므로 TIMED_OUT 효과 안에서 INTERRUPTED로 이어서 전이할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TimerState {

    private final long sequenceNumber;
    private final long startNanos;
    private final long warningDeadlineNanos;
    private final long timeoutDeadlineNanos;
    private final String codePreview;
    private final ReentrantLock lock = new ReentrantLock();

    private TimerPhase phase = TimerPhase.ARMED;
    private ScheduledFuture<?> warningFuture;
    private ScheduledFuture<?> timeoutFuture;

    TimerState(long sequenceNumber, long startNanos, long warningDeadlineNanos, long timeoutDeadlineNanos,
               String codePreview) {
        this.sequenceNumber = sequenceNumber;
        this.startNanos = startNanos;
        this.warningDeadlineNanos = warningDeadlineNanos;
        this.timeoutDeadlineNanos = timeoutDeadlineNanos;
        this.codePreview = codePreview;
    }

    /**
     * 허용된 전이라면 phase를 바꾸고 effect를 lock 안에서 실행.
     *
     * @param next 다음 phase
     * @param effect 전이 직후 실행할 효과 (null 허용)
     * @return 전이가 일어났으면 true, DISARMED 등으로 거부되면 false
     */
    boolean advance(TimerPhase next, Runnable effect) {
        lock.lock();
        try {
            if (!PhaseTransition.isAllowed(phase, next)) {
                return false;
            }
            phase = PhaseTransition.transition(phase, next);
            if (effect != null) {
                effect.run();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * DISARMED로 전이하고 대기 중인 future를 취소 (진행 중인 콜백은 기다리지 않음).
     *
     * @return 이번 호출로 disarm 되었으면 true, 이미 DISARMED였으면 false
     */
    boolean disarm() {
        lock.lock();
        try {
            if (phase.isTerminal()) {
                return false;
            }
            phase = PhaseTransition.transition(phase, TimerPhase.DISARMED);
            cancelFutures();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 스케줄된 future 연결. 이미 disarm 되었다면 즉시 취소.
     */
    void attach(ScheduledFuture<?> warning, ScheduledFuture<?> timeout) {
        lock.lock();
        try {
            this.warningFuture = warning;
            this.timeoutFuture = timeout;
            if (phase.isTerminal()) {
                cancelFutures();
            }
        } finally {
            lock.unlock();
        }
    }

    TimerPhase phase() {
        lock.lock();
        try {
            return phase;
        } finally {
            lock.unlock();
        }
    }

    long sequenceNumber() {
        return sequenceNumber;
    }

    long startNanos() {
        return startNanos;
    }

    long warningDeadlineNanos() {
        return warningDeadlineNanos;
    }

    long timeoutDeadlineNanos() {
        return timeoutDeadlineNanos;
    }

    String codePreview() {
        return codePreview;
    }

    private void cancelFutures() {
        if (warningFuture != null) {
            warningFuture.cancel(false);
        }
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
        }
    }
}
