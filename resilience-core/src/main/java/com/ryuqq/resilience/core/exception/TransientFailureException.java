package com.ryuqq.resilience.core.exception;

/**
 * 일시적 실패 (네트워크, 타임아웃, 일시적 서비스 불가 등).
 *
 * <p>기본 retryableErrors에 포함됩니다. 외부 연동 코드가 재시도 대상임을
 * 명시하고 싶을 때 이 예외로 감싸서 던지면 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransientFailureException extends RuntimeException {

    public TransientFailureException(String message) {
        super(message);
    }

    public TransientFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
