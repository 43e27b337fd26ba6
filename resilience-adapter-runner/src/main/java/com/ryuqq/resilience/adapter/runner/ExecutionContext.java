package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.CancellationToken;
import com.ryuqq.resilience.core.model.Urgency;

/**
 * 한 번의 재시도 루프 실행에 필요한 호출자 정보.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param token 취소 토큰
 * @param urgency 긴급도 (이벤트 기록용, null 허용)
 */
public record ExecutionContext(CancellationToken token, Urgency urgency) {

    public ExecutionContext {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
    }

    /**
     * 긴급도 없는 컨텍스트.
     *
     * @param token 취소 토큰
     * @return ExecutionContext
     */
    public static ExecutionContext of(CancellationToken token) {
        return new ExecutionContext(token, null);
    }

    /**
     * 긴급도를 포함한 컨텍스트.
     *
     * @param token 취소 토큰
     * @param urgency 긴급도
     * @return ExecutionContext
     */
    public static ExecutionContext of(CancellationToken token, Urgency urgency) {
        return new ExecutionContext(token, urgency);
    }
}
