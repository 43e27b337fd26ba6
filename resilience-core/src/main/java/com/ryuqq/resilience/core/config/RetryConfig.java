package com.ryuqq.resilience.core.config;

import com.ryuqq.resilience.core.exception.AttemptTimeoutException;
import com.ryuqq.resilience.core.exception.PermissionDeniedException;
import com.ryuqq.resilience.core.exception.TransientFailureException;
import com.ryuqq.resilience.core.exception.ValidationException;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * 재시도 정책 설정 (불변 record).
 *
 * <p>생성 시점에 불변식을 검증하며, 위반 시 {@link IllegalArgumentException}을 던집니다.
 * 한 번 생성된 설정은 변경되지 않으며, 여러 호출에서 공유해도 안전합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수 (첫 시도 포함, 1 이상)</li>
 *   <li>initialDelay: 첫 재시도 전 대기 시간</li>
 *   <li>maxDelay: 대기 시간 상한 (initialDelay 이상, {@link #MAX_DURATION} 이하)</li>
 *   <li>backoffBase: EXPONENTIAL 전략의 밑 (1.0 이상)</li>
 *   <li>backoffStrategy: CONSTANT / LINEAR / EXPONENTIAL</li>
 *   <li>jitterEnabled: 대기 시간에 [0.5, 1.5] 무작위 계수 적용 여부</li>
 *   <li>retryableErrors: 재시도 대상 오류 타입 (허용 목록, 하위 타입 포함)</li>
 *   <li>excludedErrors: 재시도 제외 오류 타입 (거부 목록, 허용 목록보다 우선)</li>
 *   <li>attemptTimeout: 시도당 타임아웃 ({@link Duration#ZERO}는 비활성, {@link #MAX_DURATION} 이하)</li>
 * </ul>
 *
 * <p><strong>분류 정책:</strong> 허용 목록에 없는 오류는 재시도하지 않습니다 (default-deny).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param initialDelay 초기 대기 시간 (0 이상)
 * @param maxDelay 최대 대기 시간 (initialDelay 이상)
 * @param backoffBase 지수 백오프 밑 (1.0 이상)
 * @param backoffStrategy 백오프 전략
 * @param jitterEnabled Jitter 적용 여부
 * @param retryableErrors 재시도 허용 오류 타입
 * @param excludedErrors 재시도 제외 오류 타입
 * @param attemptTimeout 시도당 타임아웃 (0 이상)
 */
public record RetryConfig(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    double backoffBase,
    BackoffStrategy backoffStrategy,
    boolean jitterEnabled,
    Set<Class<? extends Throwable>> retryableErrors,
    Set<Class<? extends Throwable>> excludedErrors,
    Duration attemptTimeout
) {

    /**
     * 대기 시간과 타임아웃의 상한 (나노초 long 범위, 약 292년).
     */
    public static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);

    /**
     * 기본 재시도 허용 오류 타입.
     */
    public static final Set<Class<? extends Throwable>> DEFAULT_RETRYABLE_ERRORS = Set.of(
        IOException.class,
        TimeoutException.class,
        TransientFailureException.class,
        AttemptTimeoutException.class
    );

    /**
     * 기본 재시도 제외 오류 타입.
     */
    public static final Set<Class<? extends Throwable>> DEFAULT_EXCLUDED_ERRORS = Set.of(
        ValidationException.class,
        PermissionDeniedException.class,
        IllegalArgumentException.class,
        SecurityException.class
    );

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, initialDelay=1s, maxDelay=30s, backoffBase=2.0,
     * EXPONENTIAL, jitter=true, 기본 허용/제외 목록, attemptTimeout 비활성</p>
     */
    public RetryConfig() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, BackoffStrategy.EXPONENTIAL, true,
            DEFAULT_RETRYABLE_ERRORS, DEFAULT_EXCLUDED_ERRORS, Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException(
                "initialDelay must be non-negative (current: " + initialDelay + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= initialDelay (initial: " + initialDelay + ", max: " + maxDelay + ")"
            );
        }
        if (maxDelay.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException(
                "maxDelay must be <= " + MAX_DURATION + " (current: " + maxDelay + ")"
            );
        }
        if (Double.isNaN(backoffBase) || Double.isInfinite(backoffBase) || backoffBase < 1.0) {
            throw new IllegalArgumentException(
                "backoffBase must be >= 1.0 (current: " + backoffBase + ")"
            );
        }
        if (backoffStrategy == null) {
            throw new IllegalArgumentException("backoffStrategy cannot be null");
        }
        if (retryableErrors == null) {
            throw new IllegalArgumentException("retryableErrors cannot be null");
        }
        if (excludedErrors == null) {
            throw new IllegalArgumentException("excludedErrors cannot be null");
        }
        if (attemptTimeout == null || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "attemptTimeout must be non-negative (current: " + attemptTimeout + ")"
            );
        }
        if (attemptTimeout.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException(
                "attemptTimeout must be <= " + MAX_DURATION + " (current: " + attemptTimeout + ")"
            );
        }
        retryableErrors = Set.copyOf(retryableErrors);
        excludedErrors = Set.copyOf(excludedErrors);
    }

    /**
     * 새 Builder 생성 (기본값으로 초기화).
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 현재 설정값으로 초기화된 Builder 생성.
     *
     * @return Builder
     */
    public Builder toBuilder() {
        return new Builder()
            .maxAttempts(maxAttempts)
            .initialDelay(initialDelay)
            .maxDelay(maxDelay)
            .backoffBase(backoffBase)
            .backoffStrategy(backoffStrategy)
            .jitterEnabled(jitterEnabled)
            .retryableErrors(retryableErrors)
            .excludedErrors(excludedErrors)
            .attemptTimeout(attemptTimeout);
    }

    /**
     * 시도당 타임아웃 사용 여부.
     *
     * @return attemptTimeout이 0보다 크면 true
     */
    public boolean hasAttemptTimeout() {
        return !attemptTimeout.isZero();
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return toBuilder().maxAttempts(maxAttempts).build();
    }

    /**
     * jitterEnabled만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withJitterEnabled(boolean jitterEnabled) {
        return toBuilder().jitterEnabled(jitterEnabled).build();
    }

    /**
     * attemptTimeout만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withAttemptTimeout(Duration attemptTimeout) {
        return toBuilder().attemptTimeout(attemptTimeout).build();
    }

    /**
     * RetryConfig Builder.
     *
     * <p>{@link #build()} 시점에 record의 compact constructor가 검증을 수행합니다.</p>
     */
    public static final class Builder {

        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffBase = 2.0;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private boolean jitterEnabled = true;
        private Set<Class<? extends Throwable>> retryableErrors = new LinkedHashSet<>(DEFAULT_RETRYABLE_ERRORS);
        private Set<Class<? extends Throwable>> excludedErrors = new LinkedHashSet<>(DEFAULT_EXCLUDED_ERRORS);
        private Duration attemptTimeout = Duration.ZERO;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffBase(double backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public Builder jitterEnabled(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
            return this;
        }

        /**
         * 재시도 허용 목록 전체 교체.
         */
        public Builder retryableErrors(Set<Class<? extends Throwable>> retryableErrors) {
            this.retryableErrors = new LinkedHashSet<>(retryableErrors);
            return this;
        }

        /**
         * 재시도 허용 목록에 타입 추가.
         */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... errorTypes) {
            this.retryableErrors.addAll(Arrays.asList(errorTypes));
            return this;
        }

        /**
         * 재시도 제외 목록 전체 교체.
         */
        public Builder excludedErrors(Set<Class<? extends Throwable>> excludedErrors) {
            this.excludedErrors = new LinkedHashSet<>(excludedErrors);
            return this;
        }

        /**
         * 재시도 제외 목록에 타입 추가.
         */
        @SafeVarargs
        public final Builder ignoreOn(Class<? extends Throwable>... errorTypes) {
            this.excludedErrors.addAll(Arrays.asList(errorTypes));
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        /**
         * RetryConfig 생성.
         *
         * @return 검증된 RetryConfig
         * @throws IllegalArgumentException 파라미터 검증 실패 시
         */
        public RetryConfig build() {
            return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffBase, backoffStrategy,
                jitterEnabled, retryableErrors, excludedErrors, attemptTimeout);
        }
    }
}
