/**
 * 보호된 호출의 최종 결과 모델.
 *
 * <p>{@link com.ryuqq.resilience.core.outcome.RetryOutcome}은
 * {@link com.ryuqq.resilience.core.outcome.Ok} 또는
 * {@link com.ryuqq.resilience.core.outcome.Fail}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.outcome;
