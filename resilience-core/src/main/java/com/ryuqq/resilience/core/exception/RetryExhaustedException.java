package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Duration;

/**
 * 허용된 시도 횟수를 모두 사용한 경우의 최종 오류.
 *
 * <p>마지막 시도의 원인 예외를 {@link #getLastError()}로 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends ResilienceException {

    public RetryExhaustedException(OperationId operationId, Throwable lastError, int attempts, Duration elapsed) {
        super("Retries exhausted for " + operationId.getValue() + " after " + attempts + " attempts ("
                + elapsed.toMillis() + "ms): " + lastError,
            lastError, operationId, attempts, elapsed);
    }

    /**
     * 마지막 시도에서 발생한 오류.
     *
     * @return 원인 예외
     */
    public Throwable getLastError() {
        return getCause();
    }

    @Override
    public TerminalKind kind() {
        return TerminalKind.EXHAUSTED;
    }
}
