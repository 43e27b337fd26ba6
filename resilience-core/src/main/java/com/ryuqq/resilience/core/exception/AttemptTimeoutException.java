package com.ryuqq.resilience.core.exception;

import java.time.Duration;

/**
 * 단일 시도가 attemptTimeout을 초과한 경우.
 *
 * <p>전체 deadline과는 별개이며, 기본 설정에서 재시도 가능한 오류로 분류됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AttemptTimeoutException extends TransientFailureException {

    private final Duration timeout;

    public AttemptTimeoutException(Duration timeout) {
        super("Attempt timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
