package com.ryuqq.resilience.core.config;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: CLOSED → OPEN 전이에 필요한 연속 실패 수 (기본 5)</li>
 *   <li>successThreshold: HALF_OPEN → CLOSED 전이에 필요한 연속 성공 수 (기본 2)</li>
 *   <li>openTimeout: OPEN 유지 시간, 경과 후 다음 호출이 HALF_OPEN 진입 (기본 60초)</li>
 *   <li>halfOpenMaxRequests: HALF_OPEN에서 동시에 허용되는 probe 수 (기본 1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param successThreshold 연속 성공 임계값 (1 이상)
 * @param openTimeout OPEN 유지 시간 (양수, {@link RetryConfig#MAX_DURATION} 이하)
 * @param halfOpenMaxRequests HALF_OPEN 동시 probe 한도 (1 이상)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    Duration openTimeout,
    int halfOpenMaxRequests
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, successThreshold=2, openTimeout=60s, halfOpenMaxRequests=1</p>
     */
    public CircuitBreakerConfig() {
        this(5, 2, Duration.ofSeconds(60), 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException(
                "openTimeout must be positive (current: " + openTimeout + ")"
            );
        }
        if (openTimeout.compareTo(RetryConfig.MAX_DURATION) > 0) {
            throw new IllegalArgumentException(
                "openTimeout must be <= " + RetryConfig.MAX_DURATION + " (current: " + openTimeout + ")"
            );
        }
        if (halfOpenMaxRequests < 1) {
            throw new IllegalArgumentException(
                "halfOpenMaxRequests must be positive (current: " + halfOpenMaxRequests + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     *
     * @param failureThreshold 새 연속 실패 임계값
     * @return 새 CircuitBreakerConfig 인스턴스
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout, halfOpenMaxRequests);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     *
     * @param successThreshold 새 연속 성공 임계값
     * @return 새 CircuitBreakerConfig 인스턴스
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout, halfOpenMaxRequests);
    }

    /**
     * openTimeout만 변경한 새 인스턴스 생성.
     *
     * @param openTimeout 새 OPEN 유지 시간
     * @return 새 CircuitBreakerConfig 인스턴스
     */
    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout, halfOpenMaxRequests);
    }

    /**
     * halfOpenMaxRequests만 변경한 새 인스턴스 생성.
     *
     * @param halfOpenMaxRequests 새 HALF_OPEN 동시 probe 한도
     * @return 새 CircuitBreakerConfig 인스턴스
     */
    public CircuitBreakerConfig withHalfOpenMaxRequests(int halfOpenMaxRequests) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout, halfOpenMaxRequests);
    }
}
