package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.breaker.CircuitBreakerRegistry;
import com.ryuqq.resilience.adapter.inmemory.metrics.InMemoryMetricsCollector;
import com.ryuqq.resilience.application.manager.CircuitBreakerStatus;
import com.ryuqq.resilience.application.manager.ResilienceManager;
import com.ryuqq.resilience.application.policy.RetryPolicyRegistry;
import com.ryuqq.resilience.application.policy.RetryStrategy;
import com.ryuqq.resilience.core.classify.FailureClassifier;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.model.CancellationToken;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.Urgency;
import com.ryuqq.resilience.core.outcome.RetryOutcome;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.spi.CircuitBreakerMetricsSnapshot;
import com.ryuqq.resilience.core.spi.MetricsCollector;
import com.ryuqq.resilience.core.spi.OperationMetricsSnapshot;
import com.ryuqq.resilience.core.spi.ResilienceEventSink;
import com.ryuqq.resilience.core.spi.Sleeper;
import com.ryuqq.resilience.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.function.DoubleSupplier;

/**
 * 기본 {@link ResilienceManager} 구현.
 *
 * <p>Operation별 Circuit Breaker는 {@link CircuitBreakerRegistry}가, 메트릭은 {@link MetricsCollector}가
 * 소유하며, 실제 재시도 루프는 {@link RetryExecutor}에 위임합니다.
 * 전역 상태는 없으며 인스턴스마다 독립된 Breaker와 메트릭을 가집니다.</p>
 *
 * <p>{@link Builder#circuitBreakerEnabled(boolean)}를 false로 설정하면 모든 호출이
 * {@link NoOpCircuitBreaker}를 거치는 재시도 전용 모드로 동작합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResilienceManager manager = DefaultResilienceManager.builder()
 *     .policyRegistry(RetryPolicyRegistry.builder()
 *         .register("healthlake.search", UrgencyTier.ROUTINE, RetryStrategy.CONSERVATIVE.config())
 *         .build())
 *     .circuitBreakerConfig("bedrock.invoke", new CircuitBreakerConfig().withFailureThreshold(3))
 *     .eventSink(new Slf4jEventSink())
 *     .build();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultResilienceManager implements ResilienceManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilienceManager.class);

    private final RetryPolicyRegistry policyRegistry;
    private final CircuitBreakerRegistry breakerRegistry;
    private final MetricsCollector metrics;
    private final RetryExecutor retryExecutor;
    private final boolean circuitBreakerEnabled;

    private DefaultResilienceManager(Builder builder) {
        this.policyRegistry = builder.policyRegistry;
        this.circuitBreakerEnabled = builder.circuitBreakerEnabled;
        this.metrics = builder.metrics;
        this.breakerRegistry = new CircuitBreakerRegistry(
            builder.defaultCircuitBreakerConfig, builder.circuitBreakerConfigs, builder.timeSource, builder.metrics);
        this.retryExecutor = new RetryExecutor(
            builder.random == null ? new BackoffCalculator() : new BackoffCalculator(builder.random),
            builder.failureClassifier,
            new AttemptInvoker(builder.timeSource, builder.attemptExecutor),
            builder.sleeper,
            builder.timeSource,
            builder.metrics,
            builder.eventSink
        );
    }

    /**
     * 기본 구성 Manager.
     *
     * @return 기본 정책, 기본 Breaker 설정, 시스템 시계를 사용하는 Manager
     */
    public static DefaultResilienceManager create() {
        return builder().build();
    }

    /**
     * 새 Builder 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <T> T executeWithResilience(Callable<T> operation, String operationId, Urgency urgency,
                                       CancellationToken token) {
        return execute(operation, operationId, urgency, token).getOrThrow();
    }

    @Override
    public <T> T executeWithResilience(Callable<T> operation, String operationId, RetryConfig config,
                                       CancellationToken token) {
        return execute(operation, operationId, config, token).getOrThrow();
    }

    @Override
    public <T> T executeWithResilience(Callable<T> operation, String operationId, RetryStrategy strategy,
                                       CancellationToken token) {
        return execute(operation, operationId, strategy, token).getOrThrow();
    }

    @Override
    public <T> RetryOutcome<T> execute(Callable<T> operation, String operationId, Urgency urgency,
                                       CancellationToken token) {
        OperationId id = OperationId.of(operationId);
        return run(operation, id, policyRegistry.resolve(id, urgency), urgency, token);
    }

    @Override
    public <T> RetryOutcome<T> execute(Callable<T> operation, String operationId, RetryConfig config,
                                       CancellationToken token) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return run(operation, OperationId.of(operationId), config, null, token);
    }

    @Override
    public <T> RetryOutcome<T> execute(Callable<T> operation, String operationId, RetryStrategy strategy,
                                       CancellationToken token) {
        return run(operation, OperationId.of(operationId), policyRegistry.resolve(strategy), null, token);
    }

    @Override
    public <T> Callable<T> protect(Callable<T> operation, String operationId, Urgency urgency) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        OperationId id = OperationId.of(operationId);
        return () -> executeWithResilience(operation, id.getValue(), urgency);
    }

    @Override
    public Map<String, OperationMetricsSnapshot> getMetrics() {
        Map<String, OperationMetricsSnapshot> result = new HashMap<>();
        metrics.operationSnapshots().forEach((id, snapshot) -> result.put(id.getValue(), snapshot));
        return Map.copyOf(result);
    }

    @Override
    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
        Map<OperationId, CircuitBreakerMetricsSnapshot> breakerMetrics = metrics.breakerSnapshots();
        Map<String, CircuitBreakerStatus> result = new HashMap<>();
        for (Map.Entry<OperationId, CircuitBreakerSnapshot> entry : breakerRegistry.snapshots().entrySet()) {
            result.put(entry.getKey().getValue(),
                CircuitBreakerStatus.of(entry.getValue(), breakerMetrics.get(entry.getKey())));
        }
        return Map.copyOf(result);
    }

    @Override
    public void resetCircuitBreaker(String operationId) {
        OperationId id = OperationId.of(operationId);
        if (!breakerRegistry.reset(id)) {
            log.debug("No circuit breaker to reset for {}", operationId);
        }
    }

    @Override
    public void resetAll() {
        breakerRegistry.resetAll();
        log.info("All circuit breakers reset ({})", breakerRegistry.size());
    }

    @Override
    public void resetMetrics() {
        metrics.reset();
        log.info("Resilience metrics reset");
    }

    /**
     * Operation의 Circuit Breaker 조회 (없으면 생성).
     *
     * @param operationId Operation 식별자
     * @return Circuit Breaker (비활성 시 {@link NoOpCircuitBreaker})
     */
    public CircuitBreaker circuitBreaker(String operationId) {
        return breakerFor(OperationId.of(operationId));
    }

    private CircuitBreaker breakerFor(OperationId id) {
        return circuitBreakerEnabled ? breakerRegistry.getOrCreate(id) : new NoOpCircuitBreaker(id);
    }

    private <T> RetryOutcome<T> run(Callable<T> operation, OperationId id, RetryConfig config,
                                    Urgency urgency, CancellationToken token) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        CircuitBreaker breaker = breakerFor(id);
        return retryExecutor.execute(operation, id, config, breaker, ExecutionContext.of(token, urgency));
    }

    /**
     * DefaultResilienceManager Builder.
     */
    public static final class Builder {

        private TimeSource timeSource = TimeSource.system();
        private Sleeper sleeper = Sleeper.cancellable();
        private ResilienceEventSink eventSink = ResilienceEventSink.noop();
        private MetricsCollector metrics = new InMemoryMetricsCollector();
        private RetryPolicyRegistry policyRegistry = RetryPolicyRegistry.defaults();
        private FailureClassifier failureClassifier = FailureClassifier.allowList();
        private CircuitBreakerConfig defaultCircuitBreakerConfig = new CircuitBreakerConfig();
        private final Map<OperationId, CircuitBreakerConfig> circuitBreakerConfigs = new HashMap<>();
        private ExecutorService attemptExecutor;
        private DoubleSupplier random;
        private boolean circuitBreakerEnabled = true;

        private Builder() {
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = requireNonNull(timeSource, "timeSource");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder eventSink(ResilienceEventSink eventSink) {
            this.eventSink = requireNonNull(eventSink, "eventSink");
            return this;
        }

        public Builder metricsCollector(MetricsCollector metrics) {
            this.metrics = requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder policyRegistry(RetryPolicyRegistry policyRegistry) {
            this.policyRegistry = requireNonNull(policyRegistry, "policyRegistry");
            return this;
        }

        public Builder failureClassifier(FailureClassifier failureClassifier) {
            this.failureClassifier = requireNonNull(failureClassifier, "failureClassifier");
            return this;
        }

        /**
         * 개별 설정이 없는 Operation에 적용할 Circuit Breaker 설정.
         */
        public Builder defaultCircuitBreakerConfig(CircuitBreakerConfig config) {
            this.defaultCircuitBreakerConfig = requireNonNull(config, "config");
            return this;
        }

        /**
         * Operation별 Circuit Breaker 설정.
         */
        public Builder circuitBreakerConfig(String operationId, CircuitBreakerConfig config) {
            circuitBreakerConfigs.put(OperationId.of(operationId), requireNonNull(config, "config"));
            return this;
        }

        /**
         * hard attempt timeout에 사용할 ExecutorService.
         *
         * <p>설정하지 않으면 attemptTimeout은 soft timeout으로 동작합니다.
         * 생명주기는 호출자가 관리합니다.</p>
         */
        public Builder attemptExecutor(ExecutorService attemptExecutor) {
            this.attemptExecutor = requireNonNull(attemptExecutor, "attemptExecutor");
            return this;
        }

        /**
         * Circuit Breaker 사용 여부 (기본 true).
         *
         * <p>false이면 Breaker를 만들지 않고 재시도만 수행합니다.
         * 이 경우 {@link DefaultResilienceManager#getCircuitBreakerStatus()}는 비어 있습니다.</p>
         */
        public Builder circuitBreakerEnabled(boolean circuitBreakerEnabled) {
            this.circuitBreakerEnabled = circuitBreakerEnabled;
            return this;
        }

        /**
         * Jitter 난수 소스 (테스트용).
         */
        public Builder random(DoubleSupplier random) {
            this.random = requireNonNull(random, "random");
            return this;
        }

        public DefaultResilienceManager build() {
            return new DefaultResilienceManager(this);
        }

        private static <V> V requireNonNull(V value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
