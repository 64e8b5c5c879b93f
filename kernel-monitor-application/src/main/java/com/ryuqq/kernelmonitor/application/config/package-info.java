/**
 * 모니터 설정 로딩.
 *
 * <p>환경 변수와 클래스패스 properties 리소스에서 {@code MonitorConfig}와
 * {@code HostDiagnostics}를 읽어 검증된 스냅샷으로 만듭니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.kernelmonitor.application.config;
