package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Instant;

/**
 * Circuit Breaker 상태의 불변 스냅샷.
 *
 * <p>내부 락을 노출하지 않도록 조회 시점의 값을 복사해 반환합니다.</p>
 *
 * @param operationId 대상 Operation
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses HALF_OPEN 연속 성공 수
 * @param halfOpenInflight 진행 중인 probe 수
 * @param lastTransitionTime 마지막 상태 전이 시각 (전이가 없었으면 null)
 * @param lastOpenedAt 마지막 OPEN 전이 시각 (OPEN된 적이 없으면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    OperationId operationId,
    CircuitBreakerState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    int halfOpenInflight,
    Instant lastTransitionTime,
    Instant lastOpenedAt
) {

    public CircuitBreakerSnapshot {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }
}
