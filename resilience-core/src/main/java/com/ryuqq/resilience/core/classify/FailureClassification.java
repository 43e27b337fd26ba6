package com.ryuqq.resilience.core.classify;

/**
 * 시도 실패의 분류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureClassification {

    /**
     * 일시적 실패. 재시도 대상이며 Circuit Breaker 실패로 집계됩니다.
     */
    TRANSIENT,

    /**
     * 재시도 불가 (유효성 검증, 권한, 비즈니스 규칙, 미등록 오류 타입).
     * 첫 발생 시 즉시 종료되며 Circuit Breaker에 반영되지 않습니다.
     */
    NON_RETRYABLE;

    /**
     * 재시도 대상인지 확인.
     *
     * @return TRANSIENT인 경우 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
