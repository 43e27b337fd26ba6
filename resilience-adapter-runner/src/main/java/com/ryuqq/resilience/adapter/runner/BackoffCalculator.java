package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.config.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 대기 시간 계산기.
 *
 * <p>RetryConfig의 백오프 전략으로 기본 대기 시간을 구하고, maxDelay로 상한을 적용한 뒤
 * Jitter를 곱해 여러 호출자의 재시도가 같은 시점에 몰리지 않도록 분산합니다.</p>
 *
 * <p><strong>알고리즘 (attempt는 1부터 시작):</strong></p>
 * <pre>
 * raw   = CONSTANT    : initialDelay
 *         LINEAR      : initialDelay * attempt
 *         EXPONENTIAL : initialDelay * backoffBase^(attempt-1)
 * delay = min(raw, maxDelay)
 * delay = min(delay * random[0.5, 1.5), maxDelay)   (jitterEnabled인 경우)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=1s, base=2.0, maxDelay=30s, jitter off):</strong></p>
 * <ul>
 *   <li>attempt=1: 1s</li>
 *   <li>attempt=2: 2s</li>
 *   <li>attempt=3: 4s</li>
 *   <li>attempt=10: 512s → 30s (maxDelay)</li>
 * </ul>
 *
 * <p>계산은 double로 수행한 뒤 상한을 적용하므로 큰 attempt에서도 overflow가 발생하지 않습니다.
 * 상태가 없으므로 여러 스레드에서 공유해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final double JITTER_MIN = 0.5;

    private final DoubleSupplier random;

    /**
     * ThreadLocalRandom 기반으로 생성.
     */
    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 소스를 지정하여 생성.
     *
     * @param random [0.0, 1.0) 범위 값을 반환하는 난수 소스
     * @throws IllegalArgumentException random이 null인 경우
     */
    public BackoffCalculator(DoubleSupplier random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    /**
     * attempt번째 시도 실패 후 대기 시간 계산.
     *
     * @param attempt 실패한 시도 번호 (1부터 시작)
     * @param config 재시도 설정
     * @return 0 이상 maxDelay 이하의 대기 시간
     * @throws IllegalArgumentException attempt가 양수가 아니거나 config가 null인 경우
     */
    public Duration computeDelay(int attempt, RetryConfig config) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        double initialNanos = config.initialDelay().toNanos();
        double maxNanos = config.maxDelay().toNanos();

        // 1. 전략별 기본 대기 시간
        double raw;
        switch (config.backoffStrategy()) {
            case CONSTANT:
                raw = initialNanos;
                break;
            case LINEAR:
                raw = initialNanos * attempt;
                break;
            case EXPONENTIAL:
                raw = initialNanos * Math.pow(config.backoffBase(), attempt - 1);
                break;
            default:
                throw new IllegalStateException("Unknown backoff strategy: " + config.backoffStrategy());
        }

        // 2. 상한 적용 (Infinity, NaN 포함)
        double delay = clamp(raw, maxNanos);

        // 3. Jitter 적용 후 다시 상한 적용
        if (config.jitterEnabled()) {
            double factor = JITTER_MIN + random.getAsDouble();
            delay = clamp(delay * factor, maxNanos);
        }

        return Duration.ofNanos((long) delay);
    }

    private static double clamp(double value, double maxNanos) {
        if (Double.isNaN(value) || value > maxNanos) {
            return maxNanos;
        }
        return Math.max(0.0, value);
    }
}
