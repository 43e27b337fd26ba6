package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.Urgency;

import java.time.Duration;
import java.time.Instant;

/**
 * 구조화 이벤트.
 *
 * <p>시도마다, 재시도마다, 최종 결과마다 한 건씩 발행됩니다.</p>
 *
 * @param operationId 대상 Operation
 * @param urgency 호출 긴급도 (명시적 설정/전략으로 호출한 경우 null)
 * @param attempt 시도 번호 (첫 시도 전 종료 시 0)
 * @param outcome 결과 구분
 * @param delay RETRY_SCHEDULED의 대기 시간 (그 외 ZERO)
 * @param error 관련 오류 (없으면 null)
 * @param timestamp 발생 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResilienceEvent(
    OperationId operationId,
    Urgency urgency,
    int attempt,
    EventOutcome outcome,
    Duration delay,
    Throwable error,
    Instant timestamp
) {

    public ResilienceEvent {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        if (delay == null) {
            delay = Duration.ZERO;
        }
    }
}
