/**
 * 실행 모니터 런타임.
 *
 * <p>호스트 훅을 받아 실행을 추적하고, 메타데이터를 발행하고, 장기 실행을 감시하는 구현체들입니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.adapter.runtime.ExecutionTracker} - EXEC_START / EXEC_END 추적</li>
 *   <li>{@link com.ryuqq.kernelmonitor.adapter.runtime.JsonMetadataPublisher} - JSON 메타데이터 발행</li>
 *   <li>{@link com.ryuqq.kernelmonitor.adapter.runtime.TimeoutMonitor} - 경고/타임아웃 deadline 감시</li>
 *   <li>{@link com.ryuqq.kernelmonitor.adapter.runtime.ExecutionLifecycleMonitor} - 호스트에 등록되는 복합 리스너</li>
 *   <li>{@link com.ryuqq.kernelmonitor.adapter.runtime.ExecutionMonitoring} - 설치 진입점</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.adapter.runtime;
