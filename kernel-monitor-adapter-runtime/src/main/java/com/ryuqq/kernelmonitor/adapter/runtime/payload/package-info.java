/**
 * 프레젠테이션 채널로 나가는 JSON 페이로드 레코드.
 *
 * <p>필드 이름은 뷰어와의 계약이므로 snake_case로 고정됩니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.adapter.runtime.payload;
