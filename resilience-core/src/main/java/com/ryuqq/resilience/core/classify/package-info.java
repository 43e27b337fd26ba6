/**
 * 시도 실패 분류.
 *
 * <p>기본 정책은 허용 목록(default-deny)이며, 거부 목록이 항상 우선합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.classify;
