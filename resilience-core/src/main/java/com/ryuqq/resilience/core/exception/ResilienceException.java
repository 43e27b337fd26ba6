package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.model.OperationId;

import java.time.Duration;

/**
 * 재시도 루프의 최종 오류 (unchecked).
 *
 * <p>중간 시도의 실패는 RetryExecutor 내부에서 흡수되며, 호출자에게는
 * 최종 상태만 이 예외의 하위 타입으로 전달됩니다.</p>
 *
 * <ul>
 *   <li>{@link RetryExhaustedException}: 시도 횟수 소진</li>
 *   <li>{@link NonRetryableException}: 재시도 불가 오류</li>
 *   <li>{@link CircuitOpenException}: Circuit Breaker 차단</li>
 *   <li>{@link CancelledException}: 호출자 취소</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ResilienceException extends RuntimeException {

    private final OperationId operationId;
    private final int attempts;
    private final Duration elapsed;

    protected ResilienceException(String message, Throwable cause,
                                  OperationId operationId, int attempts, Duration elapsed) {
        super(message, cause);
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        this.operationId = operationId;
        this.attempts = attempts;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /**
     * 최종 상태 종류.
     *
     * @return 종류
     */
    public abstract TerminalKind kind();

    public OperationId getOperationId() {
        return operationId;
    }

    /**
     * 실제로 Operation을 호출한 횟수.
     *
     * @return 시도 횟수 (Circuit OPEN 또는 첫 시도 전 취소 시 0)
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * 첫 시도부터 종료까지 경과 시간 (백오프 대기 포함).
     *
     * @return 경과 시간
     */
    public Duration getElapsed() {
        return elapsed;
    }
}
