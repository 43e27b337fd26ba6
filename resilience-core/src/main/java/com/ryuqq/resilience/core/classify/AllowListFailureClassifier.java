package com.ryuqq.resilience.core.classify;

import com.ryuqq.resilience.core.config.RetryConfig;

import java.lang.reflect.InvocationTargetException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 허용 목록(retryableErrors) + 거부 목록(excludedErrors) 기반 분류기.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ol>
 *   <li>{@link ExecutionException}, {@link CompletionException},
 *       {@link InvocationTargetException} 래퍼는 원인 예외로 풀어서 판단</li>
 *   <li>excludedErrors의 타입(하위 타입 포함)이면 NON_RETRYABLE (우선 적용)</li>
 *   <li>retryableErrors의 타입(하위 타입 포함)이면 TRANSIENT</li>
 *   <li>그 외 미등록 타입은 NON_RETRYABLE (default-deny)</li>
 * </ol>
 *
 * <p>미등록 오류를 재시도하지 않는 이유는 멱등하지 않은 호출이나 보안 관련 실패를
 * 반복 호출하는 것을 막기 위함입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AllowListFailureClassifier implements FailureClassifier {

    static final AllowListFailureClassifier INSTANCE = new AllowListFailureClassifier();

    private static final int MAX_UNWRAP_DEPTH = 8;

    @Override
    public FailureClassification classify(Throwable throwable, RetryConfig config) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        Throwable error = unwrap(throwable);

        if (matchesAny(error, config.excludedErrors())) {
            return FailureClassification.NON_RETRYABLE;
        }
        if (matchesAny(error, config.retryableErrors())) {
            return FailureClassification.TRANSIENT;
        }
        return FailureClassification.NON_RETRYABLE;
    }

    /**
     * 비동기 실행 래퍼 예외를 원인 예외로 풀기.
     *
     * @param throwable 예외
     * @return 래퍼가 아닌 가장 바깥 예외
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (isWrapper(current) && current.getCause() != null && depth < MAX_UNWRAP_DEPTH) {
            current = current.getCause();
            depth++;
        }
        return current;
    }

    private static boolean isWrapper(Throwable throwable) {
        return throwable instanceof ExecutionException
            || throwable instanceof CompletionException
            || throwable instanceof InvocationTargetException;
    }

    private static boolean matchesAny(Throwable error, Set<Class<? extends Throwable>> types) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
