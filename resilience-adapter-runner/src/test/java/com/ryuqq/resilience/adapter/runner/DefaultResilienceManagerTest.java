package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.adapter.inmemory.metrics.InMemoryMetricsCollector;
import com.ryuqq.resilience.application.manager.CircuitBreakerStatus;
import com.ryuqq.resilience.application.policy.RetryPolicyRegistry;
import com.ryuqq.resilience.application.policy.RetryStrategy;
import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.exception.AttemptTimeoutException;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.RetryExhaustedException;
import com.ryuqq.resilience.core.exception.TerminalKind;
import com.ryuqq.resilience.core.model.CancellationToken;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.Urgency;
import com.ryuqq.resilience.core.outcome.Fail;
import com.ryuqq.resilience.core.outcome.RetryOutcome;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.spi.OperationMetricsSnapshot;
import com.ryuqq.resilience.testkit.support.ManualTimeSource;
import com.ryuqq.resilience.testkit.support.RecordingEventSink;
import com.ryuqq.resilience.testkit.support.ScriptedOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultResilienceManager 통합 테스트.
 *
 * <p>Contract 테스트 외의 조립 동작을 검증합니다:</p>
 * <ul>
 *   <li>긴급도 등급 및 RetryStrategy에 따른 정책 선택</li>
 *   <li>protect 래핑</li>
 *   <li>Operation별 Circuit Breaker 설정</li>
 *   <li>메트릭 조회 및 초기화</li>
 *   <li>hard timeout Executor</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DefaultResilienceManagerTest {

    private ManualTimeSource clock;
    private RecordingEventSink events;
    private DefaultResilienceManager manager;

    @BeforeEach
    void setUp() {
        clock = new ManualTimeSource();
        events = new RecordingEventSink();
        manager = baseBuilder().build();
    }

    // ============================================================
    // 1. 정책 선택
    // ============================================================

    @Test
    void ROUTINE_긴급도는_3회_시도와_1초_시작_백오프를_사용한다() {
        ScriptedOperation<String> failing = ScriptedOperation.alwaysFailing(new IOException("reset"));

        RetryOutcome<String> outcome = manager.execute(failing, "fhir.read", Urgency.of(1), CancellationToken.none());

        assertThat(((Fail<String>) outcome).kind()).isEqualTo(TerminalKind.EXHAUSTED);
        assertThat(failing.calls()).isEqualTo(3);
        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void CRITICAL_긴급도는_4회_시도와_500ms_시작_백오프를_사용한다() {
        ScriptedOperation<String> failing = ScriptedOperation.alwaysFailing(new IOException("reset"));

        manager.execute(failing, "bedrock.invoke", Urgency.of(4), CancellationToken.none());

        assertThat(failing.calls()).isEqualTo(4);
        assertThat(clock.sleeps()).containsExactly(
            Duration.ofMillis(500), Duration.ofMillis(1_000), Duration.ofMillis(2_000));
        assertThat(manager.circuitBreaker("bedrock.invoke").getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void RetryStrategy_AGGRESSIVE는_5회_시도한다() {
        ScriptedOperation<String> failing = ScriptedOperation.alwaysFailing(new IOException("reset"));

        assertThatThrownBy(() -> manager.executeWithResilience(
            failing, "s3.get", RetryStrategy.AGGRESSIVE, CancellationToken.none()))
            .isInstanceOf(RetryExhaustedException.class);

        assertThat(failing.calls()).isEqualTo(5);
        assertThat(clock.sleeps()).containsExactly(
            Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400), Duration.ofMillis(800));
    }

    @Test
    void Operation별_정책_override가_긴급도_기본값보다_우선한다() {
        RetryPolicyRegistry registry = RetryPolicyRegistry.builder()
            .registerAll("healthlake.search", RetryConfig.builder().maxAttempts(1).build())
            .build();
        DefaultResilienceManager custom = baseBuilder().policyRegistry(registry).build();
        ScriptedOperation<String> failing = ScriptedOperation.alwaysFailing(new IOException("reset"));

        custom.execute(failing, "healthlake.search", Urgency.emergency(), CancellationToken.none());

        assertThat(failing.calls()).isEqualTo(1);
    }

    // ============================================================
    // 2. protect
    // ============================================================

    @Test
    void protect는_호출될_때까지_작업을_실행하지_않는다() throws Exception {
        ScriptedOperation<String> operation = ScriptedOperation.<String>create()
            .thenFail(new IOException("reset"))
            .thenReturn("ok");

        Callable<String> protectedCall = manager.protect(operation, "bedrock.invoke", Urgency.emergency());

        assertThat(operation.calls()).isZero();
        assertThat(protectedCall.call()).isEqualTo("ok");
        assertThat(operation.calls()).isEqualTo(2);
    }

    @Test
    void protect는_최종_실패를_ResilienceException으로_던진다() {
        Callable<String> protectedCall = manager.protect(
            ScriptedOperation.alwaysFailing(new IOException("reset")), "bedrock.invoke", Urgency.of(1));

        assertThatThrownBy(protectedCall::call)
            .isInstanceOf(RetryExhaustedException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    // ============================================================
    // 3. Circuit Breaker 설정과 초기화
    // ============================================================

    @Test
    void Operation별_Circuit_Breaker_설정이_적용된다() {
        DefaultResilienceManager custom = baseBuilder()
            .circuitBreakerConfig("s3.put", new CircuitBreakerConfig().withFailureThreshold(1))
            .build();
        RetryConfig once = RetryConfig.builder().maxAttempts(1).build();

        custom.execute(ScriptedOperation.alwaysFailing(new IOException("down")), "s3.put", once,
            CancellationToken.none());
        custom.execute(ScriptedOperation.alwaysFailing(new IOException("down")), "s3.get", once,
            CancellationToken.none());

        Map<String, CircuitBreakerStatus> status = custom.getCircuitBreakerStatus();
        assertThat(status.get("s3.put").state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(status.get("s3.get").state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThatThrownBy(() -> custom.executeWithResilience(() -> "ok", "s3.put", once, CancellationToken.none()))
            .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void resetAll은_모든_Circuit을_닫는다() {
        DefaultResilienceManager custom = baseBuilder()
            .defaultCircuitBreakerConfig(new CircuitBreakerConfig().withFailureThreshold(1))
            .build();
        RetryConfig once = RetryConfig.builder().maxAttempts(1).build();
        custom.execute(ScriptedOperation.alwaysFailing(new IOException("down")), "a", once, CancellationToken.none());
        custom.execute(ScriptedOperation.alwaysFailing(new IOException("down")), "b", once, CancellationToken.none());

        custom.resetAll();

        assertThat(custom.getCircuitBreakerStatus().values())
            .extracting(CircuitBreakerStatus::state)
            .containsOnly(CircuitBreakerState.CLOSED);
    }

    @Test
    void Circuit_Breaker를_끄면_연속_실패에도_차단하지_않고_재시도만_한다() {
        DefaultResilienceManager retryOnly = baseBuilder()
            .circuitBreakerEnabled(false)
            .defaultCircuitBreakerConfig(new CircuitBreakerConfig().withFailureThreshold(1))
            .build();
        RetryConfig config = RetryConfig.builder()
            .maxAttempts(2)
            .initialDelay(Duration.ofMillis(100))
            .jitterEnabled(false)
            .build();
        ScriptedOperation<String> failing = ScriptedOperation.alwaysFailing(new IOException("down"));

        RetryOutcome<String> first = retryOnly.execute(failing, "bedrock.invoke", config, CancellationToken.none());
        String second = retryOnly.executeWithResilience(() -> "ok", "bedrock.invoke", config, CancellationToken.none());

        assertThat(((Fail<String>) first).kind()).isEqualTo(TerminalKind.EXHAUSTED);
        assertThat(failing.calls()).isEqualTo(2);
        assertThat(second).isEqualTo("ok");
        assertThat(retryOnly.circuitBreaker("bedrock.invoke")).isInstanceOf(NoOpCircuitBreaker.class);
        assertThat(retryOnly.circuitBreaker("bedrock.invoke").getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(retryOnly.getCircuitBreakerStatus()).isEmpty();
        assertThat(retryOnly.getMetrics().get("bedrock.invoke").attempts()).isEqualTo(3);
    }

    @Test
    void 없는_Circuit_reset은_아무것도_하지_않는다() {
        manager.resetCircuitBreaker("unknown.op");

        assertThat(manager.getCircuitBreakerStatus()).isEmpty();
    }

    // ============================================================
    // 4. 메트릭
    // ============================================================

    @Test
    void 메트릭은_OperationId_문자열로_조회된다() {
        manager.execute(ScriptedOperation.<String>create().thenFail(new IOException("reset")).thenReturn("ok"),
            "bedrock.invoke", Urgency.emergency(), CancellationToken.none());

        OperationMetricsSnapshot snapshot = manager.getMetrics().get("bedrock.invoke");

        assertThat(snapshot.attempts()).isEqualTo(2);
        assertThat(snapshot.successes()).isEqualTo(1);
        assertThat(snapshot.failures()).isEqualTo(1);
        assertThat(snapshot.retriesObserved()).isEqualTo(1);
        assertThat(snapshot.averageRetryWait()).isEqualTo(Duration.ofMillis(100));
        assertThat(snapshot.lastError()).isEqualTo("IOException: reset");

        CircuitBreakerStatus status = manager.getCircuitBreakerStatus().get("bedrock.invoke");
        assertThat(status.totalRequests()).isEqualTo(2);
        assertThat(status.successfulRequests()).isEqualTo(1);
        assertThat(status.failedRequests()).isEqualTo(1);
    }

    @Test
    void resetMetrics는_메트릭만_지우고_Breaker_상태는_유지한다() {
        InMemoryMetricsCollector collector = new InMemoryMetricsCollector();
        DefaultResilienceManager custom = baseBuilder()
            .metricsCollector(collector)
            .defaultCircuitBreakerConfig(new CircuitBreakerConfig().withFailureThreshold(1))
            .build();
        custom.execute(ScriptedOperation.alwaysFailing(new IOException("down")), "a",
            RetryConfig.builder().maxAttempts(1).build(), CancellationToken.none());

        custom.resetMetrics();

        assertThat(custom.getMetrics()).isEmpty();
        CircuitBreakerStatus status = custom.getCircuitBreakerStatus().get("a");
        assertThat(status.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(status.totalRequests()).isZero();
        assertThat(collector.breakerSnapshots().get(OperationId.of("a")).currentState())
            .isEqualTo(custom.circuitBreaker("a").getState());
    }

    // ============================================================
    // 5. hard timeout
    // ============================================================

    @Test
    void attemptExecutor가_있으면_느린_시도를_timeout으로_재시도한다() {
        ExecutorService attemptExecutor = Executors.newCachedThreadPool();
        try {
            DefaultResilienceManager custom = baseBuilder().attemptExecutor(attemptExecutor).build();
            RetryConfig config = RetryConfig.builder()
                .maxAttempts(2)
                .initialDelay(Duration.ZERO)
                .maxDelay(Duration.ZERO)
                .attemptTimeout(Duration.ofMillis(50))
                .build();
            ScriptedOperation<String> slow = ScriptedOperation.<String>create().onCall(() -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }).thenReturn("late");

            RetryOutcome<String> outcome = custom.execute(slow, "bedrock.invoke", config, CancellationToken.none());

            Fail<String> fail = (Fail<String>) outcome;
            assertThat(fail.kind()).isEqualTo(TerminalKind.EXHAUSTED);
            assertThat(((RetryExhaustedException) fail.error()).getLastError())
                .isInstanceOf(AttemptTimeoutException.class);
            assertThat(fail.attempts()).isEqualTo(2);
        } finally {
            attemptExecutor.shutdownNow();
        }
    }

    // ============================================================
    // 6. 인자 검증
    // ============================================================

    @Test
    void 잘못된_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> manager.execute(null, "op", Urgency.of(3), CancellationToken.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.execute(() -> "ok", "invalid op", Urgency.of(3), CancellationToken.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.execute(() -> "ok", "op", Urgency.of(3), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.execute(() -> "ok", "op", (RetryConfig) null, CancellationToken.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DefaultResilienceManager.builder().timeSource(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void create는_기본_구성으로_동작한다() {
        DefaultResilienceManager defaults = DefaultResilienceManager.create();

        String result = defaults.executeWithResilience(() -> "ok", "op", Urgency.of(3));

        assertThat(result).isEqualTo("ok");
    }

    private DefaultResilienceManager.Builder baseBuilder() {
        return DefaultResilienceManager.builder()
            .timeSource(clock)
            .sleeper(clock)
            .eventSink(events)
            .random(() -> 0.5);
    }
}
