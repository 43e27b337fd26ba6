/**
 * 불변 설정 record 패키지.
 *
 * <p>모든 설정은 생성 시점에 검증되며, 위반 시 {@link java.lang.IllegalArgumentException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.config;
