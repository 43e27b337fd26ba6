package com.ryuqq.resilience.core.exception;

/**
 * 권한 없음.
 *
 * <p>기본 excludedErrors에 포함됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
