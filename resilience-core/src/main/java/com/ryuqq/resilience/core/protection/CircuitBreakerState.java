package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 의존 대상의 연속 실패를 추적하고,
 * 임계값 도달 시 요청을 차단하여 이미 실패 중인 대상의 부하를 줄입니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과 후 다음 호출)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold 도달 → CLOSED
 *   └─► probe 실패 1회 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며, 연속 실패 수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>대상 Operation을 호출하지 않고 즉시 실패합니다.
     * openTimeout이 경과하면 다음 호출이 HALF_OPEN으로 전이시킵니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (제한된 probe 요청만 통과).
     *
     * <p>halfOpenMaxRequests 개의 동시 probe만 허용하고, 초과 요청은 OPEN과 동일하게 거부합니다.</p>
     */
    HALF_OPEN
}
