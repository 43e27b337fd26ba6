package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreakerListener;

import java.time.Duration;
import java.util.Map;

/**
 * 메트릭 수집 SPI.
 *
 * <p>RetryExecutor가 매 시도 후, Circuit Breaker가 상태 전이 시 호출합니다.
 * 구현체는 Operation별로 독립적인 동기화를 사용해야 하며, 전역 락을 사용해서는 안 됩니다.</p>
 *
 * <p>조회 메서드는 내부 상태의 복사본을 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetricsCollector extends CircuitBreakerListener {

    /**
     * 시도 성공 기록 (시도 수와 성공 수 증가).
     *
     * @param operationId 대상 Operation
     */
    void recordSuccess(OperationId operationId);

    /**
     * 시도 실패 기록 (시도 수와 실패 수 증가, 마지막 오류 갱신).
     *
     * @param operationId 대상 Operation
     * @param error 발생한 오류
     */
    void recordFailure(OperationId operationId, Throwable error);

    /**
     * 재시도 대기 시간 기록.
     *
     * @param operationId 대상 Operation
     * @param wait 실제 대기한 시간
     */
    void recordRetryWait(OperationId operationId, Duration wait);

    /**
     * Circuit Breaker를 거친 요청 결과 기록.
     *
     * @param operationId 대상 Operation
     * @param result 요청 결과
     */
    void recordBreakerCall(OperationId operationId, BreakerCallResult result);

    /**
     * Operation별 메트릭 스냅샷.
     *
     * @return OperationId → 스냅샷 (복사본)
     */
    Map<OperationId, OperationMetricsSnapshot> operationSnapshots();

    /**
     * Circuit Breaker별 메트릭 스냅샷.
     *
     * @return OperationId → 스냅샷 (복사본)
     */
    Map<OperationId, CircuitBreakerMetricsSnapshot> breakerSnapshots();

    /**
     * 모든 메트릭 초기화.
     *
     * <p>카운터와 전이 횟수는 0이 되지만, Breaker 자체는 초기화되지 않으므로
     * 마지막으로 통보받은 Breaker 상태는 유지합니다.</p>
     */
    void reset();
}
