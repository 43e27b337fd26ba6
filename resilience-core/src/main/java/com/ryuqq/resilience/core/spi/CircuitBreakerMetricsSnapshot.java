package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.util.Map;

/**
 * Circuit Breaker 요청 메트릭의 불변 스냅샷.
 *
 * @param operationId 대상 Operation
 * @param totalRequests 전체 요청 수 (차단 포함)
 * @param successfulRequests 성공 수
 * @param failedRequests Circuit 실패로 집계된 수
 * @param ignoredRequests 상태에 반영되지 않은 수
 * @param rejectedRequests 차단된 수
 * @param transitions 전이 대상 상태별 전이 횟수
 * @param currentState Listener로 마지막에 통보받은 상태 (통보 전에는 CLOSED).
 *                     실시간 상태는 {@code CircuitBreaker#snapshot()}으로 조회합니다
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerMetricsSnapshot(
    OperationId operationId,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long ignoredRequests,
    long rejectedRequests,
    Map<CircuitBreakerState, Long> transitions,
    CircuitBreakerState currentState
) {

    public CircuitBreakerMetricsSnapshot {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        transitions = transitions == null ? Map.of() : Map.copyOf(transitions);
        if (currentState == null) {
            currentState = CircuitBreakerState.CLOSED;
        }
    }

    /**
     * 특정 상태로의 전이 횟수.
     *
     * @param state 전이 대상 상태
     * @return 전이 횟수
     */
    public long transitionsTo(CircuitBreakerState state) {
        return transitions.getOrDefault(state, 0L);
    }
}
