package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.exception.ResilienceException;
import com.ryuqq.resilience.core.exception.TerminalKind;

import java.time.Duration;

/**
 * 최종 실패 결과.
 *
 * <p>시도 횟수와 경과 시간은 최종 오류가 보관합니다.</p>
 *
 * @param error 최종 오류
 * @param <T> 결과 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(ResilienceException error) implements RetryOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Fail {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    /**
     * 최종 상태 종류.
     *
     * @return EXHAUSTED, NON_RETRYABLE, CIRCUIT_OPEN, CANCELLED 중 하나
     */
    public TerminalKind kind() {
        return error.kind();
    }

    @Override
    public int attempts() {
        return error.getAttempts();
    }

    @Override
    public Duration elapsed() {
        return error.getElapsed();
    }

    @Override
    public T getOrThrow() {
        throw error;
    }
}
