package com.ryuqq.kernelmonitor.adapter.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.kernelmonitor.application.monitor.MonitoringInstallation;
import com.ryuqq.kernelmonitor.application.publisher.MetadataPublisher;
import com.ryuqq.kernelmonitor.core.config.MonitorConfig;
import com.ryuqq.kernelmonitor.core.spi.ExecutionHost;
import com.ryuqq.kernelmonitor.core.spi.MetadataSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 모니터링 설치 진입점.
 *
 * <p>발행자, 추적기, (설정 시) 타임아웃 모니터, 복합 리스너를 조립해 호스트에 등록합니다.</p>
 *
 * <p><strong>Fail open:</strong></p>
 * <ul>
 *   <li>호스트가 null이면 WARN 후 비활성 설치 반환</li>
 *   <li>조립 중 오류는 ERROR 후 비활성 설치 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionMonitoring {

    // Utility class - prevent instantiation
    private ExecutionMonitoring() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모니터링 설치.
     *
     * @param host 실행 호스트 (null이면 설치 생략)
     * @param config 모니터 설정 (null이면 기본값)
     * @param sink 프레젠테이션 채널
     * @return 설치 핸들 (실패 시에도 null이 아닌 비활성 핸들)
     */
    public static MonitoringInstallation install(ExecutionHost host, MonitorConfig config, MetadataSink sink) {
        return install(host, config, sink, LoggerFactory.getLogger(ExecutionMonitoring.class));
    }

    /**
     * 모니터링 설치 (로그 대상 지정).
     *
     * <p>지정한 Logger는 추적기, 타임아웃 모니터, 발행자 모두에 주입됩니다.</p>
     *
     * @param host 실행 호스트 (null이면 설치 생략)
     * @param config 모니터 설정 (null이면 기본값)
     * @param sink 프레젠테이션 채널
     * @param log 로그 출력 대상
     * @return 설치 핸들 (실패 시에도 null이 아닌 비활성 핸들)
     */
    public static MonitoringInstallation install(ExecutionHost host, MonitorConfig config, MetadataSink sink,
                                                 Logger log) {
        Logger logger = log != null ? log : LoggerFactory.getLogger(ExecutionMonitoring.class);
        if (host == null) {
            logger.warn("Execution host not available, skipping execution tracking setup");
            return NoOpInstallation.INSTANCE;
        }

        MonitorConfig resolved = config != null ? config : new MonitorConfig();
        TimeoutMonitor timeoutMonitor = null;
        try {
            MetadataPublisher publisher = new JsonMetadataPublisher(
                sink, new ObjectMapper(), logger);
            ExecutionTracker tracker = new ExecutionTracker(publisher, System::nanoTime, logger);

            if (resolved.enabled()) {
                timeoutMonitor = new TimeoutMonitor(resolved, host, publisher,
                    TimeoutMonitor.newDaemonScheduler(), true, System::nanoTime, logger);
            }

            ExecutionLifecycleMonitor listener = new ExecutionLifecycleMonitor(tracker, timeoutMonitor);
            host.register(listener);

            logger.info("Execution tracking initialized");
            if (timeoutMonitor != null) {
                logger.info("Execution timeout monitor initialized: warning={}s, timeout={}s, auto_interrupt={}",
                    resolved.warningThresholdSeconds(), resolved.timeoutThresholdSeconds(),
                    resolved.autoInterruptEnabled());
            }
            return new ActiveInstallation(host, listener, logger);

        } catch (RuntimeException e) {
            if (timeoutMonitor != null) {
                timeoutMonitor.shutdown();
            }
            logger.error("Failed to set up execution tracking", e);
            return NoOpInstallation.INSTANCE;
        }
    }

    /**
     * 등록된 리스너를 가진 설치.
     *
     * <p>close 시 이미 EXEC_START가 기록된 실행은 EXEC_END와 메타데이터 발행까지 마친 뒤
     * 리스너가 분리됩니다.</p>
     */
    private static final class ActiveInstallation implements MonitoringInstallation {

        private final ExecutionHost host;
        private final ExecutionLifecycleMonitor listener;
        private final Logger log;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private ActiveInstallation(ExecutionHost host, ExecutionLifecycleMonitor listener, Logger log) {
            this.host = host;
            this.listener = listener;
            this.log = log;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public boolean isTimeoutMonitoringActive() {
            return active.get() && listener.timeoutMonitor() != null;
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            listener.detachWhenIdle(this::detach);
            if (listener.isDetachPending()) {
                log.info("Execution tracking removal deferred until the running execution ends");
            }
        }

        /**
         * 실행 중인 셀이 있으면 그 셀의 post-execute 처리 뒤 실행 스레드에서 호출됩니다.
         */
        private void detach() {
            try {
                host.unregister(listener);
            } catch (RuntimeException e) {
                log.error("Failed to unregister execution tracking listener", e);
            }
            if (listener.timeoutMonitor() != null) {
                listener.timeoutMonitor().shutdown();
            }
            log.info("Execution tracking removed");
        }
    }

    /**
     * 호스트가 없거나 설치에 실패한 경우의 비활성 설치.
     */
    private enum NoOpInstallation implements MonitoringInstallation {
        INSTANCE;

        @Override
        public boolean isActive() {
            return false;
        }

        @Override
        public boolean isTimeoutMonitoringActive() {
            return false;
        }

        @Override
        public void close() {
            // no-op
        }
    }
}
