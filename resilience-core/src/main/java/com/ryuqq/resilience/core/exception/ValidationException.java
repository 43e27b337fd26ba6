package com.ryuqq.resilience.core.exception;

/**
 * 입력 유효성 검증 실패.
 *
 * <p>기본 excludedErrors에 포함되어 재시도되지 않으며,
 * Circuit Breaker 실패로도 집계되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
