package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Duration;

/**
 * Operation 메트릭의 불변 스냅샷.
 *
 * @param operationId 대상 Operation
 * @param attempts 전체 시도 수
 * @param successes 성공한 시도 수
 * @param failures 실패한 시도 수 (재시도 대상 + 재시도 불가)
 * @param retriesObserved 관측된 재시도 대기 횟수
 * @param totalRetryTime 누적 재시도 대기 시간
 * @param lastError 마지막 오류 요약 (없으면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationMetricsSnapshot(
    OperationId operationId,
    long attempts,
    long successes,
    long failures,
    long retriesObserved,
    Duration totalRetryTime,
    String lastError
) {

    public OperationMetricsSnapshot {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (totalRetryTime == null) {
            totalRetryTime = Duration.ZERO;
        }
    }

    /**
     * 평균 재시도 대기 시간 (누적 평균).
     *
     * @return totalRetryTime / retriesObserved, 관측된 재시도가 없으면 ZERO
     */
    public Duration averageRetryWait() {
        if (retriesObserved == 0) {
            return Duration.ZERO;
        }
        return totalRetryTime.dividedBy(retriesObserved);
    }
}
