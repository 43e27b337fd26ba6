package com.ryuqq.resilience.core.spi;

/**
 * Circuit Breaker를 거친 요청 한 건의 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BreakerCallResult {

    /**
     * 통과 후 성공.
     */
    SUCCESS,

    /**
     * 통과 후 재시도 대상 실패 (Circuit 실패로 집계됨).
     */
    FAILURE,

    /**
     * 통과 후 재시도 불가 오류 또는 취소 (Circuit 상태에 반영되지 않음).
     */
    IGNORED,

    /**
     * Circuit이 요청을 차단함.
     */
    REJECTED
}
