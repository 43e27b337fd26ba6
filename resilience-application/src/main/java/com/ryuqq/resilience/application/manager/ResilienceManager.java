package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.application.policy.RetryStrategy;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.model.CancellationToken;
import com.ryuqq.resilience.core.model.Urgency;
import com.ryuqq.resilience.core.outcome.RetryOutcome;
import com.ryuqq.resilience.core.spi.OperationMetricsSnapshot;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 외부 호출을 재시도와 Circuit Breaker로 감싸는 진입점.
 *
 * <p>Operation 식별자마다 Circuit Breaker 하나와 메트릭 항목 하나가 lazy하게 생성되며,
 * Manager 인스턴스가 살아있는 동안 (또는 reset 전까지) 유지됩니다.</p>
 *
 * <p><strong>종료 오류:</strong></p>
 * <ul>
 *   <li>{@code RetryExhaustedException}: 재시도 가능한 실패로 maxAttempts 소진</li>
 *   <li>{@code NonRetryableException}: 재시도 불가 오류 (즉시 종료)</li>
 *   <li>{@code CircuitOpenException}: Circuit이 열려 있어 호출하지 않음</li>
 *   <li>{@code CancelledException}: 호출자 취소 또는 deadline 경과</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * String answer = manager.executeWithResilience(
 *     () -> bedrock.invoke(prompt),
 *     "bedrock.invoke",
 *     Urgency.of(5),
 *     CancellationToken.withDeadline(Duration.ofSeconds(3), TimeSource.system())
 * );
 *
 * RetryOutcome<Bundle> outcome = manager.execute(
 *     () -> healthLake.search(query), "healthlake.search", RetryStrategy.CONSERVATIVE, CancellationToken.none());
 * if (outcome instanceof Fail<Bundle> fail && fail.kind() == TerminalKind.CIRCUIT_OPEN) {
 *     // 대체 응답
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilienceManager {

    /**
     * 긴급도 기반 정책으로 실행.
     *
     * @param operation 실행할 작업
     * @param operationId Operation 식별자
     * @param urgency 긴급도 (null이면 STANDARD 전략)
     * @param token 취소 토큰
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.resilience.core.exception.ResilienceException 종료 오류 발생 시
     * @throws IllegalArgumentException operation, operationId, token이 유효하지 않은 경우
     */
    <T> T executeWithResilience(Callable<T> operation, String operationId, Urgency urgency, CancellationToken token);

    /**
     * 명시적 RetryConfig로 실행.
     *
     * @param operation 실행할 작업
     * @param operationId Operation 식별자
     * @param config 재시도 설정
     * @param token 취소 토큰
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.resilience.core.exception.ResilienceException 종료 오류 발생 시
     */
    <T> T executeWithResilience(Callable<T> operation, String operationId, RetryConfig config, CancellationToken token);

    /**
     * 이름 있는 전략으로 실행.
     *
     * @param operation 실행할 작업
     * @param operationId Operation 식별자
     * @param strategy 재시도 전략
     * @param token 취소 토큰
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.resilience.core.exception.ResilienceException 종료 오류 발생 시
     */
    <T> T executeWithResilience(Callable<T> operation, String operationId, RetryStrategy strategy, CancellationToken token);

    /**
     * 취소 없이 긴급도 기반 정책으로 실행.
     */
    default <T> T executeWithResilience(Callable<T> operation, String operationId, Urgency urgency) {
        return executeWithResilience(operation, operationId, urgency, CancellationToken.none());
    }

    /**
     * 긴급도 기반 정책으로 실행하고 결과를 값으로 반환.
     *
     * <p>종료 오류를 던지는 대신 {@code Fail}로 감싸 반환합니다.
     * 인자 검증 실패는 여전히 {@link IllegalArgumentException}으로 던집니다.</p>
     *
     * @return Ok 또는 Fail
     */
    <T> RetryOutcome<T> execute(Callable<T> operation, String operationId, Urgency urgency, CancellationToken token);

    /**
     * 명시적 RetryConfig로 실행하고 결과를 값으로 반환.
     *
     * @return Ok 또는 Fail
     */
    <T> RetryOutcome<T> execute(Callable<T> operation, String operationId, RetryConfig config, CancellationToken token);

    /**
     * 이름 있는 전략으로 실행하고 결과를 값으로 반환.
     *
     * @return Ok 또는 Fail
     */
    <T> RetryOutcome<T> execute(Callable<T> operation, String operationId, RetryStrategy strategy, CancellationToken token);

    /**
     * 작업을 보호된 Callable로 감쌈.
     *
     * <p>반환된 Callable은 호출될 때마다 {@link #executeWithResilience(Callable, String, Urgency)}를
     * 수행합니다. operationId는 감싸는 시점에 검증됩니다.</p>
     *
     * @param operation 감쌀 작업
     * @param operationId Operation 식별자
     * @param urgency 긴급도
     * @param <T> 결과 타입
     * @return 보호된 Callable
     */
    <T> Callable<T> protect(Callable<T> operation, String operationId, Urgency urgency);

    /**
     * Operation별 메트릭 스냅샷.
     *
     * @return operationId → 스냅샷 (불변 복사본)
     */
    Map<String, OperationMetricsSnapshot> getMetrics();

    /**
     * Operation별 Circuit Breaker 상태.
     *
     * @return operationId → 상태 (불변 복사본)
     */
    Map<String, CircuitBreakerStatus> getCircuitBreakerStatus();

    /**
     * 특정 Circuit Breaker를 CLOSED로 초기화.
     *
     * <p>아직 생성되지 않은 Operation이면 아무 것도 하지 않습니다.</p>
     *
     * @param operationId Operation 식별자
     */
    void resetCircuitBreaker(String operationId);

    /**
     * 모든 Circuit Breaker를 CLOSED로 초기화.
     */
    void resetAll();

    /**
     * 누적 메트릭 초기화.
     */
    void resetMetrics();
}
