package com.ryuqq.resilience.core.spi;

/**
 * 구조화 이벤트의 결과 구분.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventOutcome {

    /** 시도 성공. */
    ATTEMPT_SUCCEEDED,

    /** 시도 실패 (분류 전). */
    ATTEMPT_FAILED,

    /** 백오프 후 재시도 예정. */
    RETRY_SCHEDULED,

    /** 시도 횟수 소진. */
    EXHAUSTED,

    /** 재시도 불가 오류로 종료. */
    NON_RETRYABLE,

    /** Circuit OPEN으로 차단. */
    CIRCUIT_OPEN,

    /** 취소 또는 deadline 경과. */
    CANCELLED;

    /**
     * 재시도 루프를 종료시키는 결과인지 확인.
     *
     * @return 최종 결과이면 true
     */
    public boolean isTerminal() {
        return this == EXHAUSTED || this == NON_RETRYABLE || this == CIRCUIT_OPEN || this == CANCELLED;
    }
}
