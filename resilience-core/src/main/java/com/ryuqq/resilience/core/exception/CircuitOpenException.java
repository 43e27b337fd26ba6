package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit Breaker가 요청을 차단한 경우의 최종 오류.
 *
 * <p>이 예외가 발생한 시도에서는 대상 Operation이 호출되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ResilienceException {

    private final Instant openedAt;

    public CircuitOpenException(OperationId operationId, Instant openedAt, int attempts, Duration elapsed) {
        super("Circuit breaker is OPEN for " + operationId.getValue() + " (opened at " + openedAt + ")",
            null, operationId, attempts, elapsed);
        this.openedAt = openedAt;
    }

    /**
     * Circuit이 마지막으로 OPEN된 시각.
     *
     * @return OPEN 시각 (OPEN된 적이 없으면 null)
     */
    public Instant getOpenedAt() {
        return openedAt;
    }

    @Override
    public TerminalKind kind() {
        return TerminalKind.CIRCUIT_OPEN;
    }
}
