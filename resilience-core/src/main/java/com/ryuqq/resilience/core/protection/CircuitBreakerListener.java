package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Instant;

/**
 * Circuit Breaker 상태 전이 통지.
 *
 * <p>Circuit Breaker 구현체는 내부 락을 해제한 뒤 이 리스너를 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    /**
     * 상태 전이 발생.
     *
     * @param operationId 대상 Operation
     * @param from 이전 상태
     * @param to 새 상태
     * @param at 전이 시각
     */
    void onStateTransition(OperationId operationId, CircuitBreakerState from, CircuitBreakerState to, Instant at);

    /**
     * 아무것도 하지 않는 리스너.
     *
     * @return NoOp 리스너
     */
    static CircuitBreakerListener noop() {
        return (operationId, from, to, at) -> {
            // NoOp
        };
    }
}
