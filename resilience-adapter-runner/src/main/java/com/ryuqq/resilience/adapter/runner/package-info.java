/**
 * 재시도 루프 실행과 기본 ResilienceManager 구현.
 *
 * <p>BackoffCalculator, AttemptInvoker, RetryExecutor, DefaultResilienceManager로 구성되며
 * Circuit Breaker와 메트릭은 adapter-inmemory 구현을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
