/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>Circuit Breaker 확장점을 정의합니다. RetryExecutor는 매 시도 직전에
 * {@link com.ryuqq.resilience.core.protection.CircuitBreaker#tryAcquire()}로 통과 여부를 확인하고,
 * 시도 결과를 분류하여 기록합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 * <pre>
 * 1. CancellationToken → 취소/deadline 확인
 * 2. CircuitBreaker    → OPEN 상태 시 즉시 실패
 * 3. AttemptTimeout    → 시도당 타임아웃 적용
 * 4. Operation         → 실제 작업 실행
 * 5. Classifier        → 실패 분류 후 CircuitBreaker 기록
 * </pre>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@code noop.NoOpCircuitBreaker}: 항상 허용, 상태 추적 없음</li>
 *   <li>{@code adapter-inmemory}의 {@code InMemoryCircuitBreaker}: 프로세스 로컬 상태 머신</li>
 * </ul>
 *
 * <p>프로세스 간 Circuit 상태 공유는 지원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.noop
 */
package com.ryuqq.resilience.core.protection;
