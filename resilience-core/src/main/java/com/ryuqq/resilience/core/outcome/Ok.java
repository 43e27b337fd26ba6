package com.ryuqq.resilience.core.outcome;

import java.time.Duration;

/**
 * 성공 결과.
 *
 * @param value Operation 반환 값 (null 허용)
 * @param attempts 성공까지 시도 횟수 (1 이상)
 * @param elapsed 경과 시간
 * @param <T> 결과 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(
    T value,
    int attempts,
    Duration elapsed
) implements RetryOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Ok {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be non-negative (current: " + elapsed + ")");
        }
        // value는 null 허용
    }

    @Override
    public T getOrThrow() {
        return value;
    }
}
