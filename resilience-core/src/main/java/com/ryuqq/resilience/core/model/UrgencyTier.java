package com.ryuqq.resilience.core.model;

/**
 * 긴급도 등급.
 *
 * <p>호출자가 선언한 긴급도(1~5)를 재시도 정책 선택 단위로 묶은 것입니다.</p>
 *
 * <pre>
 * 1, 2 → ROUTINE
 * 3, 4 → CRITICAL
 * 5    → EMERGENCY
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum UrgencyTier {

    /**
     * 일반 작업 (긴급도 1~2).
     *
     * <p>대량 호출이 많으므로 Jitter로 재시도 시점을 분산합니다.</p>
     */
    ROUTINE,

    /**
     * 중요 작업 (긴급도 3~4).
     */
    CRITICAL,

    /**
     * 응급 작업 (긴급도 5).
     *
     * <p>재시도 간격의 예측 가능성이 중요하므로 Jitter를 사용하지 않습니다.</p>
     */
    EMERGENCY
}
