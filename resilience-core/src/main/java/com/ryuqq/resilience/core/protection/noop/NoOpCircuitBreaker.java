package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.Permit;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 차단 없이 재시도만 적용하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 허용</li>
 *   <li>recordSuccess() / recordFailure() / releasePermit(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final OperationId operationId;

    public NoOpCircuitBreaker(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        this.operationId = operationId;
    }

    @Override
    public OperationId operationId() {
        return operationId;
    }

    @Override
    public Permit tryAcquire() {
        return Permit.unrestricted();
    }

    @Override
    public void recordSuccess(Permit permit) {
        // NoOp
    }

    @Override
    public void recordFailure(Permit permit, Throwable throwable) {
        // NoOp
    }

    @Override
    public void releasePermit(Permit permit) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(operationId, CircuitBreakerState.CLOSED, 0, 0, 0, null, null);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
