package com.ryuqq.kernelmonitor.adapter.runtime;

import ch.qos.logback.classic.Level;
import com.ryuqq.kernelmonitor.application.monitor.MonitoringInstallation;
import com.ryuqq.kernelmonitor.core.config.MonitorConfig;
import com.ryuqq.kernelmonitor.core.spi.ExecutionHost;
import com.ryuqq.kernelmonitor.core.spi.ExecutionLifecycleListener;
import com.ryuqq.kernelmonitor.core.spi.MetadataSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ExecutionMonitoring 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ExecutionMonitoringTest {

    @Mock
    private ExecutionHost host;

    @Mock
    private MetadataSink sink;

    private LogCapture logs;
    private MonitoringInstallation installation;

    @BeforeEach
    void setUp() {
        logs = new LogCapture();
    }

    @AfterEach
    void tearDown() {
        if (installation != null) {
            installation.close();
        }
        logs.close();
    }

    @Test
    void install_호스트가_없으면_경고_후_비활성_설치() {
        // when
        installation = ExecutionMonitoring.install(null, new MonitorConfig(), sink, logs.logger());

        // then
        assertThat(installation.isActive()).isFalse();
        assertThat(installation.isTimeoutMonitoringActive()).isFalse();
        assertThat(logs.lines(Level.WARN))
            .containsExactly("Execution host not available, skipping execution tracking setup");
    }

    @Test
    void install_조립_실패시_ERROR_후_비활성_설치() {
        // when: sink 누락
        installation = ExecutionMonitoring.install(host, new MonitorConfig(), null, logs.logger());

        // then
        assertThat(installation.isActive()).isFalse();
        assertThat(logs.lines(Level.ERROR)).containsExactly("Failed to set up execution tracking");
        verify(host, never()).register(any());
    }

    @Test
    void install_호스트_등록_실패도_비활성_설치() {
        // given
        doThrow(new IllegalStateException("shell gone")).when(host).register(any());

        // when
        installation = ExecutionMonitoring.install(host, MonitorConfig.enabled(5, 10, true), sink, logs.logger());

        // then
        assertThat(installation.isActive()).isFalse();
        assertThat(logs.lines(Level.ERROR)).containsExactly("Failed to set up execution tracking");
    }

    @Test
    void install_기본_설정은_추적만_활성() {
        // when
        installation = ExecutionMonitoring.install(host, null, sink, logs.logger());

        // then
        assertThat(installation.isActive()).isTrue();
        assertThat(installation.isTimeoutMonitoringActive()).isFalse();
        verify(host).register(any(ExecutionLifecycleMonitor.class));
        assertThat(logs.lines(Level.INFO)).containsExactly("Execution tracking initialized");
    }

    @Test
    void install_타임아웃_설정시_모니터_초기화_기록() {
        // when
        installation = ExecutionMonitoring.install(host, MonitorConfig.enabled(240, 300, true), sink, logs.logger());

        // then
        assertThat(installation.isTimeoutMonitoringActive()).isTrue();
        assertThat(logs.lines(Level.INFO)).containsExactly(
            "Execution tracking initialized",
            "Execution timeout monitor initialized: warning=240.0s, timeout=300.0s, auto_interrupt=true");
    }

    @Test
    void close_등록_해제는_한번만_수행() {
        // given
        installation = ExecutionMonitoring.install(host, MonitorConfig.enabled(5, 10, false), sink, logs.logger());
        ArgumentCaptor<ExecutionLifecycleListener> captor = ArgumentCaptor.forClass(ExecutionLifecycleListener.class);
        verify(host).register(captor.capture());

        // when
        installation.close();
        installation.close();

        // then
        verify(host, times(1)).unregister(captor.getValue());
        assertThat(installation.isActive()).isFalse();
        assertThat(installation.isTimeoutMonitoringActive()).isFalse();
        assertThat(logs.lines(Level.INFO)).containsOnlyOnce("Execution tracking removed");
    }
}
