package com.ryuqq.kernelmonitor.application.monitor;

/**
 * 호스트에 설치된 실행 모니터링 핸들.
 *
 * <p>설치 시 호스트에 리스너가 등록되고, {@link #close()} 시 리스너 등록 해제와
 * 타이머 자원 정리가 수행됩니다. 호스트가 없거나 설치에 실패한 경우에도 null 대신
 * 비활성 핸들({@code isActive() == false})이 반환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (MonitoringInstallation installation = ExecutionMonitoring.install(host, config, sink)) {
 *     if (!installation.isActive()) {
 *         // 모니터링 없이 계속 진행 (fail open)
 *     }
 *     host.execute(...);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MonitoringInstallation extends AutoCloseable {

    /**
     * 설치 활성 여부.
     *
     * @return 리스너가 호스트에 등록되어 있으면 true
     */
    boolean isActive();

    /**
     * 타임아웃 모니터링 활성 여부.
     *
     * @return 설정이 타임아웃 모니터링을 켰고 설치가 활성 상태이면 true
     */
    boolean isTimeoutMonitoringActive();

    /**
     * 리스너 등록 해제 및 자원 정리. 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();
}
