package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.spi.CircuitBreakerMetricsSnapshot;

import java.time.Instant;

/**
 * 관리 화면용 Circuit Breaker 상태 요약.
 *
 * <p>Breaker 자체의 스냅샷과 메트릭 스냅샷을 합친 불변 값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param operationId Operation 식별자
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses 연속 성공 수 (HALF_OPEN)
 * @param halfOpenInflight HALF_OPEN 진행 중 probe 수
 * @param lastTransitionTime 마지막 상태 전이 시각 (전이 이력이 없으면 null)
 * @param totalRequests 전체 요청 수
 * @param successfulRequests 성공 요청 수
 * @param failedRequests 실패 요청 수
 * @param rejectedRequests OPEN으로 거부된 요청 수
 */
public record CircuitBreakerStatus(
    String operationId,
    CircuitBreakerState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    int halfOpenInflight,
    Instant lastTransitionTime,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long rejectedRequests
) {

    /**
     * 스냅샷 조합.
     *
     * @param snapshot Breaker 스냅샷
     * @param metrics 메트릭 스냅샷 (null이면 0으로 채움)
     * @return 상태 요약
     */
    public static CircuitBreakerStatus of(CircuitBreakerSnapshot snapshot, CircuitBreakerMetricsSnapshot metrics) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        long total = metrics == null ? 0L : metrics.totalRequests();
        long successful = metrics == null ? 0L : metrics.successfulRequests();
        long failed = metrics == null ? 0L : metrics.failedRequests();
        long rejected = metrics == null ? 0L : metrics.rejectedRequests();
        return new CircuitBreakerStatus(
            snapshot.operationId().getValue(),
            snapshot.state(),
            snapshot.consecutiveFailures(),
            snapshot.consecutiveSuccesses(),
            snapshot.halfOpenInflight(),
            snapshot.lastTransitionTime(),
            total, successful, failed, rejected
        );
    }

    /**
     * 요청 차단 상태 여부.
     *
     * @return OPEN이면 true
     */
    public boolean isOpen() {
        return state == CircuitBreakerState.OPEN;
    }
}
