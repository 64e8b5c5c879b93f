/**
 * 모니터링 설치 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.kernelmonitor.application.monitor;
