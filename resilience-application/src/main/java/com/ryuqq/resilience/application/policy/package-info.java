/**
 * 재시도 정책 선택.
 *
 * <p>긴급도 등급별 기본 정책, Operation별 개별 정책, 이름 있는 전략을 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.policy;
