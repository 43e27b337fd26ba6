/**
 * 최종 오류 계층과 기본 분류에 쓰이는 오류 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.exception;
