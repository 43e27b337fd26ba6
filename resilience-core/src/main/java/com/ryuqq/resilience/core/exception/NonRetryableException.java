package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Duration;

/**
 * 재시도 불가로 분류된 오류의 최종 오류.
 *
 * <p>excludedErrors에 해당하거나 retryableErrors에 없는 오류가 발생하면
 * 추가 시도 없이 즉시 이 예외로 종료됩니다. Circuit Breaker 카운터에는 반영되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NonRetryableException extends ResilienceException {

    public NonRetryableException(OperationId operationId, Throwable cause, int attempts, Duration elapsed) {
        super("Non-retryable failure for " + operationId.getValue() + " on attempt " + attempts + ": " + cause,
            cause, operationId, attempts, elapsed);
    }

    @Override
    public TerminalKind kind() {
        return TerminalKind.NON_RETRYABLE;
    }
}
