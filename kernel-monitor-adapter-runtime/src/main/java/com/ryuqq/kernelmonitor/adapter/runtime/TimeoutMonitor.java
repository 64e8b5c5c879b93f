package com.ryuqq.kernelmonitor.adapter.runtime;

import com.ryuqq.kernelmonitor.application.publisher.MetadataPublisher;
import com.ryuqq.kernelmonitor.core.config.MonitorConfig;
import com.ryuqq.kernelmonitor.core.model.ExecutionNotice;
import com.ryuqq.kernelmonitor.core.model.ExecutionRecord;
import com.ryuqq.kernelmonitor.core.model.SourcePreview;
import com.ryuqq.kernelmonitor.core.spi.ExecutionHost;
import com.ryuqq.kernelmonitor.core.statemachine.TimerPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 장기 실행 감지 및 타임아웃 모니터.
 *
 * <p>실행마다 두 개의 독립된 deadline(경고, 타임아웃)을 실행 스레드와 무관한
 * {@link ScheduledExecutorService}에 예약합니다.</p>
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * onPreExecute  → ARMED (경고/타임아웃 콜백 예약)
 * 경고 deadline → WARNED     : LONG_EXECUTION 로그 + 알림
 * 타임아웃      → TIMED_OUT  : TIMEOUT_INTERRUPT 로그 + 알림
 *              → INTERRUPTED: (auto interrupt 설정 시) 호스트에 인터럽트 요청
 * onPostExecute → DISARMED   (모든 상태에서, 대기 중인 콜백 취소)
 * </pre>
 *
 * <p><strong>경합 규칙:</strong></p>
 * <ul>
 *   <li>콜백은 sequence number만 캡처하고 발화 시 {@link TimerRegistry}에서 상태를 조회</li>
 *   <li>상태 전이와 그 효과는 실행별 lock 안에서 수행되어, DISARMED 이후에는 어떤 효과도 없음</li>
 *   <li>인터럽트 직전 대상 sequence number가 여전히 활성 실행인지 검증, 아니면 억제</li>
 * </ul>
 *
 * <p><strong>Fail open:</strong> 예약 실패(RejectedExecutionException 등) 시 경고를 남기고
 * 해당 실행은 감시 없이 진행합니다. 인터럽트 실패는 ERROR로 기록하고 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimeoutMonitor {

    static final String TIMER_THREAD_NAME = "kernel-monitor-timer";

    private final MonitorConfig config;
    private final ExecutionHost host;
    private final MetadataPublisher publisher;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final LongSupplier clock;
    private final Logger log;
    private final TimerRegistry registry = new TimerRegistry();

    /**
     * 생성자 (전용 daemon 타이머 스레드 사용).
     *
     * <p>모니터링이 비활성이면 타이머 스레드를 만들지 않습니다.</p>
     *
     * @param config 모니터 설정
     * @param host 인터럽트를 전달할 호스트
     * @param publisher 알림 발행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TimeoutMonitor(MonitorConfig config, ExecutionHost host, MetadataPublisher publisher) {
        this(config, host, publisher,
            config != null && config.enabled() ? newDaemonScheduler() : null, true,
            System::nanoTime, LoggerFactory.getLogger(TimeoutMonitor.class));
    }

    /**
     * 생성자 (외부 스케줄러 주입, 종료는 호출자 책임).
     *
     * @param config 모니터 설정
     * @param host 인터럽트를 전달할 호스트
     * @param publisher 알림 발행자
     * @param scheduler deadline 콜백을 실행할 스케줄러
     * @param clock 단조 증가 나노초 시계
     * @param log 로그 출력 대상
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TimeoutMonitor(MonitorConfig config, ExecutionHost host, MetadataPublisher publisher,
                          ScheduledExecutorService scheduler, LongSupplier clock, Logger log) {
        this(config, host, publisher, scheduler, false, clock, log);
    }

    TimeoutMonitor(MonitorConfig config, ExecutionHost host, MetadataPublisher publisher,
                   ScheduledExecutorService scheduler, boolean ownsScheduler,
                   LongSupplier clock, Logger log) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (scheduler == null && config.enabled()) {
            throw new IllegalArgumentException("scheduler cannot be null when monitoring is enabled");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.config = config;
        this.host = host;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock = clock;
        this.log = log;
    }

    /**
     * 실행 시작: 타이머 상태 생성 및 deadline 콜백 예약.
     *
     * <p>비활성이거나 record가 null(추적기 내부 오류)이면 아무 것도 하지 않습니다.</p>
     *
     * @param record 추적기가 연 실행 레코드
     */
    public void onPreExecute(ExecutionRecord record) {
        if (!config.enabled() || record == null) {
            return;
        }

        TimerState leftover = registry.active();
        if (leftover != null) {
            log.warn("Timer for count={} still armed at next execution start, disarming",
                leftover.sequenceNumber());
            leftover.disarm();
            registry.remove(leftover);
        }

        long sequenceNumber = record.sequenceNumber();
        long start = record.startNanos();
        TimerState state = new TimerState(sequenceNumber, start,
            config.warningEnabled() ? start + config.warningThresholdNanos() : 0L,
            start + config.timeoutThresholdNanos(),
            SourcePreview.of(record.sourcePreview(), SourcePreview.LOG_LENGTH));

        ScheduledFuture<?> warning = null;
        try {
            registry.register(state);
            long now = clock.getAsLong();
            if (config.warningEnabled()) {
                warning = scheduler.schedule(() -> onWarningDeadline(sequenceNumber),
                    delay(state.warningDeadlineNanos(), now), TimeUnit.NANOSECONDS);
            }
            ScheduledFuture<?> timeout = scheduler.schedule(() -> onTimeoutDeadline(sequenceNumber),
                delay(state.timeoutDeadlineNanos(), now), TimeUnit.NANOSECONDS);
            state.attach(warning, timeout);

            log.debug("Timeout monitoring started: count={}, warning={}s, timeout={}s, auto_interrupt={}",
                sequenceNumber, config.warningThresholdSeconds(), config.timeoutThresholdSeconds(),
                config.autoInterruptEnabled());

        } catch (RuntimeException e) {
            log.warn("Timeout monitoring degraded: count={} runs unmonitored", sequenceNumber, e);
            state.disarm();
            state.attach(warning, null);
            registry.remove(state);
        }
    }

    /**
     * 실행 종료: 활성 타이머를 DISARMED로 전이하고 제거.
     *
     * <p>진행 중인 콜백의 짧은 임계 구역만 기다리며, 콜백 완료를 join 하지 않습니다.</p>
     */
    public void onPostExecute() {
        if (!config.enabled()) {
            return;
        }
        try {
            TimerState state = registry.active();
            if (state == null) {
                return;
            }
            state.disarm();
            registry.remove(state);
        } catch (RuntimeException e) {
            log.error("Failed to disarm execution timer", e);
        }
    }

    /**
     * 소유한 타이머 스레드 종료.
     *
     * <p>외부에서 주입된 스케줄러는 종료하지 않습니다. 활성 타이머는 disarm 됩니다.</p>
     */
    public void shutdown() {
        TimerState state = registry.active();
        if (state != null) {
            state.disarm();
            registry.remove(state);
        }
        if (ownsScheduler && scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    TimerRegistry registry() {
        return registry;
    }

    void onWarningDeadline(long sequenceNumber) {
        try {
            TimerState state = registry.find(sequenceNumber);
            if (state == null) {
                return;
            }
            state.advance(TimerPhase.WARNED, () -> {
                double elapsed = elapsedSeconds(state);
                double threshold = config.warningThresholdSeconds();
                log.warn("LONG_EXECUTION | count={} | elapsed={}s | threshold={}s",
                    sequenceNumber, LogFormat.elapsed(elapsed), LogFormat.elapsed(threshold));
                publisher.publishNotice(
                    ExecutionNotice.warning(sequenceNumber, elapsed, threshold, state.codePreview()));
            });
        } catch (RuntimeException e) {
            log.error("Warning callback failed for count={}", sequenceNumber, e);
        }
    }

    void onTimeoutDeadline(long sequenceNumber) {
        try {
            TimerState state = registry.find(sequenceNumber);
            if (state == null) {
                return;
            }
            state.advance(TimerPhase.TIMED_OUT, () -> {
                double elapsed = elapsedSeconds(state);
                boolean interrupt = config.autoInterruptEnabled();
                log.error("TIMEOUT_INTERRUPT | count={} | elapsed={}s | action={}",
                    sequenceNumber, LogFormat.elapsed(elapsed), interrupt ? "interrupt" : "none");
                publisher.publishNotice(ExecutionNotice.timeout(
                    sequenceNumber, elapsed, config.timeoutThresholdSeconds(), state.codePreview()));
                if (interrupt) {
                    state.advance(TimerPhase.INTERRUPTED, () -> deliverInterrupt(sequenceNumber));
                }
            });
        } catch (RuntimeException e) {
            log.error("Timeout callback failed for count={}", sequenceNumber, e);
        }
    }

    /**
     * 인터럽트 전달 (상태 lock 안에서 호출됨).
     */
    private void deliverInterrupt(long sequenceNumber) {
        long active = registry.activeSequence();
        if (active != sequenceNumber) {
            log.warn("Interrupt suppressed: count={} is no longer the active execution (active={})",
                sequenceNumber, active);
            return;
        }
        try {
            if (!host.interruptCurrentExecution()) {
                log.warn("Interrupt not delivered for count={}: no execution running", sequenceNumber);
            }
        } catch (RuntimeException e) {
            log.error("Failed to interrupt execution count={}", sequenceNumber, e);
        }
    }

    private double elapsedSeconds(TimerState state) {
        return LogFormat.toSeconds(clock.getAsLong() - state.startNanos());
    }

    private static long delay(long deadline, long now) {
        return Math.max(0L, deadline - now);
    }

    static ScheduledExecutorService newDaemonScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, TIMER_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
