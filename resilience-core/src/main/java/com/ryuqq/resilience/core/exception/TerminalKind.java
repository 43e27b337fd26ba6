package com.ryuqq.resilience.core.exception;

/**
 * 재시도 루프를 종료시킨 최종 상태의 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TerminalKind {

    /**
     * 허용된 시도 횟수를 모두 소진.
     */
    EXHAUSTED,

    /**
     * 재시도 불가능한 오류 (유효성 검증, 권한, 비즈니스 규칙 등).
     */
    NON_RETRYABLE,

    /**
     * Circuit Breaker OPEN으로 즉시 실패. 대상 Operation은 호출되지 않음.
     */
    CIRCUIT_OPEN,

    /**
     * 호출자 취소 또는 deadline 경과.
     */
    CANCELLED
}
