package com.ryuqq.kernelmonitor.core.config;

/**
 * 호스트 메시지 전송 계층의 진단 로깅 플래그 (불변 record).
 *
 * <p>타임아웃 모니터 설정과 독립적으로 켜고 끌 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param debugTransportLogging 이벤트 디스패치 진단 로그 출력 여부
 * @param logTransportMessages 전달되는 메시지 내용 로그 출력 여부
 */
public record HostDiagnostics(boolean debugTransportLogging, boolean logTransportMessages) {

    /**
     * 모든 진단 로깅 비활성화.
     *
     * @return 두 플래그가 false인 HostDiagnostics
     */
    public static HostDiagnostics none() {
        return new HostDiagnostics(false, false);
    }
}
