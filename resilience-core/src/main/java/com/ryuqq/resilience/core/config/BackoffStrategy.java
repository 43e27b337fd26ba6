package com.ryuqq.resilience.core.config;

/**
 * 백오프 전략.
 *
 * <p><strong>시도 n (1부터 시작) 이후 대기 시간:</strong></p>
 * <pre>
 * CONSTANT    : initialDelay
 * LINEAR      : initialDelay * n
 * EXPONENTIAL : initialDelay * backoffBase^(n-1)
 * </pre>
 *
 * <p>모든 전략의 결과는 maxDelay로 상한이 적용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    /**
     * 고정 간격.
     */
    CONSTANT,

    /**
     * 선형 증가.
     */
    LINEAR,

    /**
     * 지수 증가.
     */
    EXPONENTIAL
}
