/**
 * Kernel Monitor Application Layer - 실행 메타데이터 발행 포트.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.application.publisher.MetadataPublisher} - 레코드/알림 발행자</li>
 *   <li>{@link com.ryuqq.kernelmonitor.application.publisher.MetadataContentTypes} - 프레젠테이션 채널 content type</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> JSON 구현체는 adapter-runtime 모듈에 위치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.kernelmonitor.application.publisher;
