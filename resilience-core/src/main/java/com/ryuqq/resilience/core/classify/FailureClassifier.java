package com.ryuqq.resilience.core.classify;

import com.ryuqq.resilience.core.config.RetryConfig;

/**
 * 시도 중 발생한 예외를 재시도 가능/불가로 분류합니다.
 *
 * <p>구현체는 같은 입력에 대해 항상 같은 결과를 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * 예외 분류.
     *
     * @param throwable 시도 중 발생한 예외
     * @param config 해당 호출에 적용된 재시도 설정
     * @return 분류 결과
     */
    FailureClassification classify(Throwable throwable, RetryConfig config);

    /**
     * 허용 목록 + 거부 목록 기반 기본 분류기.
     *
     * @return {@link AllowListFailureClassifier}
     */
    static FailureClassifier allowList() {
        return AllowListFailureClassifier.INSTANCE;
    }
}
