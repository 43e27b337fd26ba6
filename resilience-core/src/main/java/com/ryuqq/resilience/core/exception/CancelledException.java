package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Duration;

/**
 * 호출자 취소 또는 deadline 경과로 중단된 경우의 최종 오류.
 *
 * <p>실패로 집계되지 않으며 Circuit Breaker 상태에도 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CancelledException extends ResilienceException {

    public CancelledException(OperationId operationId, int attempts, Duration elapsed) {
        this(operationId, null, attempts, elapsed);
    }

    public CancelledException(OperationId operationId, Throwable cause, int attempts, Duration elapsed) {
        super("Execution cancelled for " + operationId.getValue() + " after " + attempts + " attempts",
            cause, operationId, attempts, elapsed);
    }

    @Override
    public TerminalKind kind() {
        return TerminalKind.CANCELLED;
    }
}
