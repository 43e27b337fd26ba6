/**
 * 도메인 모델 패키지.
 *
 * <p>Operation 식별자, 긴급도, 취소 토큰을 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
