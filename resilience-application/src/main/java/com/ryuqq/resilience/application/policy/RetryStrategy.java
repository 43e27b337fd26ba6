package com.ryuqq.resilience.application.policy;

import com.ryuqq.resilience.core.config.BackoffStrategy;
import com.ryuqq.resilience.core.config.RetryConfig;

import java.time.Duration;

/**
 * 이름으로 직접 선택하는 재시도 전략.
 *
 * <p>원하는 동작을 이미 알고 있는 호출자는 긴급도 조회를 거치지 않고 전략을 바로 지정할 수 있습니다.</p>
 *
 * <table>
 *   <caption>전략별 설정 (모두 EXPONENTIAL)</caption>
 *   <tr><th>전략</th><th>maxAttempts</th><th>initialDelay</th><th>maxDelay</th><th>base</th><th>jitter</th></tr>
 *   <tr><td>AGGRESSIVE</td><td>5</td><td>100ms</td><td>5s</td><td>2.0</td><td>on</td></tr>
 *   <tr><td>STANDARD</td><td>3</td><td>1s</td><td>30s</td><td>2.0</td><td>on</td></tr>
 *   <tr><td>CONSERVATIVE</td><td>2</td><td>2s</td><td>60s</td><td>3.0</td><td>on</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RetryStrategy {

    /**
     * 짧은 간격으로 많이 재시도.
     */
    AGGRESSIVE(5, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0),

    /**
     * 기본 전략. 일치하는 정책이 없을 때 사용됩니다.
     */
    STANDARD(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0),

    /**
     * 긴 간격으로 적게 재시도.
     */
    CONSERVATIVE(2, Duration.ofSeconds(2), Duration.ofSeconds(60), 3.0);

    private final RetryConfig config;

    RetryStrategy(int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffBase) {
        this.config = RetryConfig.builder()
            .maxAttempts(maxAttempts)
            .initialDelay(initialDelay)
            .maxDelay(maxDelay)
            .backoffBase(backoffBase)
            .backoffStrategy(BackoffStrategy.EXPONENTIAL)
            .jitterEnabled(true)
            .build();
    }

    /**
     * 전략에 해당하는 설정.
     *
     * @return 불변 RetryConfig
     */
    public RetryConfig config() {
        return config;
    }
}
