package com.ryuqq.kernelmonitor.adapter.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * sequence number로 색인된 {@link TimerState} 저장소.
 *
 * <p>스케줄된 콜백은 상태 객체 대신 sequence number만 캡처하고, 발화 시점에
 * 이 레지스트리에서 상태를 다시 조회합니다. 조회 결과가 없으면 실행은 이미 끝난 것입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TimerRegistry {

    static final long NONE = 0L;

    private final Map<Long, TimerState> states = new ConcurrentHashMap<>();
    private final AtomicLong activeSequence = new AtomicLong(NONE);

    /**
     * 상태 등록 후 활성 실행으로 지정.
     */
    void register(TimerState state) {
        states.put(state.sequenceNumber(), state);
        activeSequence.set(state.sequenceNumber());
    }

    TimerState find(long sequenceNumber) {
        return states.get(sequenceNumber);
    }

    /**
     * 활성 실행의 상태.
     *
     * @return 활성 상태, 없으면 null
     */
    TimerState active() {
        long sequenceNumber = activeSequence.get();
        return sequenceNumber == NONE ? null : states.get(sequenceNumber);
    }

    long activeSequence() {
        return activeSequence.get();
    }

    /**
     * 상태 제거. 활성 실행이 이 상태일 때만 활성 지정을 해제합니다.
     */
    void remove(TimerState state) {
        states.remove(state.sequenceNumber(), state);
        activeSequence.compareAndSet(state.sequenceNumber(), NONE);
    }

    int size() {
        return states.size();
    }
}
