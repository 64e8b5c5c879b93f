package com.ryuqq.kernelmonitor.adapter.runtime;

import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;
import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;
import com.ryuqq.kernelmonitor.core.spi.ExecutionLifecycleListener;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 호스트에 등록되는 단일 리스너.
 *
 * <p>추적기와 타임아웃 모니터를 고정된 순서로 호출합니다:</p>
 * <pre>
 * pre-execute : tracker.onPreExecute → timeoutMonitor.onPreExecute(record)
 * post-execute: timeoutMonitor.onPostExecute → tracker.onPostExecute
 * </pre>
 *
 * <p>따라서 로그 순서는 항상
 * {@code EXEC_START → [LONG_EXECUTION] → [TIMEOUT_INTERRUPT] → EXEC_END} 입니다.</p>
 *
 * <p><strong>분리:</strong> {@link #detachWhenIdle(Runnable)} 이후 새 실행은 추적하지 않습니다.
 * 열린 실행이 있으면 분리 동작은 그 실행의 post-execute 처리(EXEC_END 기록, 발행)가
 * 끝난 뒤 실행 스레드에서 수행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionLifecycleMonitor implements ExecutionLifecycleListener {

    private final ExecutionTracker tracker;
    private final TimeoutMonitor timeoutMonitor;

    /**
     * closing, pendingDetach, 훅 처리 구간을 보호.
     */
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private boolean closing;
    private Runnable pendingDetach;

    /**
     * 생성자.
     *
     * @param tracker 실행 추적기
     * @param timeoutMonitor 타임아웃 모니터 (null이면 추적만 수행)
     * @throws IllegalArgumentException tracker가 null인 경우
     */
    public ExecutionLifecycleMonitor(ExecutionTracker tracker, TimeoutMonitor timeoutMonitor) {
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        this.tracker = tracker;
        this.timeoutMonitor = timeoutMonitor;
    }

    @Override
    public void onPreExecute(String cellId, String source) {
        lifecycleLock.lock();
        try {
            if (closing) {
                return;
            }
            ExecutionRecord record = tracker.onPreExecute(cellId, source);
            if (timeoutMonitor != null) {
                timeoutMonitor.onPreExecute(record);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void onPostExecute(ExecutionOutcome outcome) {
        Runnable detach;
        lifecycleLock.lock();
        try {
            if (closing && tracker.current() == null) {
                // 분리 이후 시작된 실행
                return;
            }
            if (timeoutMonitor != null) {
                timeoutMonitor.onPostExecute();
            }
            tracker.onPostExecute(outcome);
            detach = pendingDetach;
            pendingDetach = null;
        } finally {
            lifecycleLock.unlock();
        }
        if (detach != null) {
            detach.run();
        }
    }

    /**
     * 새 실행 추적을 멈추고, 열린 실행이 끝나면 분리 동작을 수행.
     *
     * <p>열린 실행이 없으면 호출 스레드에서 즉시 수행합니다.</p>
     *
     * @param detach 리스너 등록 해제와 자원 정리
     * @throws IllegalArgumentException detach가 null인 경우
     */
    public void detachWhenIdle(Runnable detach) {
        if (detach == null) {
            throw new IllegalArgumentException("detach cannot be null");
        }
        lifecycleLock.lock();
        try {
            closing = true;
            if (tracker.current() != null) {
                pendingDetach = detach;
                return;
            }
        } finally {
            lifecycleLock.unlock();
        }
        detach.run();
    }

    /**
     * 분리 동작이 열린 실행의 종료를 기다리는지 여부.
     *
     * @return 보류 중이면 true
     */
    public boolean isDetachPending() {
        lifecycleLock.lock();
        try {
            return pendingDetach != null;
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void onPreRunCell(String source) {
        if (!isClosing()) {
            tracker.onPreRunCell(source);
        }
    }

    @Override
    public void onPostRunCell(long executionCount) {
        if (!isClosing()) {
            tracker.onPostRunCell(executionCount);
        }
    }

    private boolean isClosing() {
        lifecycleLock.lock();
        try {
            return closing;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public ExecutionTracker tracker() {
        return tracker;
    }

    public TimeoutMonitor timeoutMonitor() {
        return timeoutMonitor;
    }
}
