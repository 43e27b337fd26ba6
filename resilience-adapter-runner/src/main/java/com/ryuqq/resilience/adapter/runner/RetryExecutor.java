package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.classify.AllowListFailureClassifier;
import com.ryuqq.resilience.core.classify.FailureClassification;
import com.ryuqq.resilience.core.classify.FailureClassifier;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.exception.CancelledException;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.NonRetryableException;
import com.ryuqq.resilience.core.exception.RetryExhaustedException;
import com.ryuqq.resilience.core.model.CancellationToken;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.outcome.Fail;
import com.ryuqq.resilience.core.outcome.Ok;
import com.ryuqq.resilience.core.outcome.RetryOutcome;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.Permit;
import com.ryuqq.resilience.core.spi.BreakerCallResult;
import com.ryuqq.resilience.core.spi.EventOutcome;
import com.ryuqq.resilience.core.spi.MetricsCollector;
import com.ryuqq.resilience.core.spi.ResilienceEvent;
import com.ryuqq.resilience.core.spi.ResilienceEventSink;
import com.ryuqq.resilience.core.spi.Sleeper;
import com.ryuqq.resilience.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 재시도 루프 실행기.
 *
 * <p><strong>시도마다 (attempt = 1..maxAttempts):</strong></p>
 * <ol>
 *   <li>취소/deadline 확인 → CancelledException (Circuit Breaker 실패로 기록하지 않음)</li>
 *   <li>{@code breaker.tryAcquire()} 거부 → CircuitOpenException (작업 호출 안 함)</li>
 *   <li>{@link AttemptInvoker}로 작업 실행 (시도당 타임아웃 적용)</li>
 *   <li>성공 → Breaker/메트릭에 성공 기록 후 Ok 반환</li>
 *   <li>실패 → {@link FailureClassifier}로 분류
 *     <ul>
 *       <li>재시도 불가: permit 반환, 메트릭 실패 기록, NonRetryableException</li>
 *       <li>재시도 가능: Breaker/메트릭 실패 기록, 마지막 시도면 RetryExhaustedException,
 *           아니면 백오프 대기 후 다음 시도</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>호출 스레드 인터럽트는 취소로 처리하며, 인터럽트 플래그는 복원합니다.</p>
 *
 * <p><strong>로깅:</strong> 중간 실패는 WARN, 재시도 소진은 ERROR, 취소는 DEBUG로만 남깁니다.</p>
 *
 * <p>이 클래스는 상태가 없으며 모든 공유 상태는 CircuitBreaker와 MetricsCollector가 소유합니다.
 * 어떤 락도 작업 실행이나 백오프 대기 동안 잡고 있지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final BackoffCalculator backoffCalculator;
    private final FailureClassifier failureClassifier;
    private final AttemptInvoker attemptInvoker;
    private final Sleeper sleeper;
    private final TimeSource timeSource;
    private final MetricsCollector metrics;
    private final ResilienceEventSink eventSink;

    /**
     * RetryExecutor 생성.
     *
     * @param backoffCalculator 대기 시간 계산기
     * @param failureClassifier 실패 분류기
     * @param attemptInvoker 시도 실행기
     * @param sleeper 백오프 대기
     * @param timeSource 시간 소스
     * @param metrics 메트릭 수집기
     * @param eventSink 이벤트 수신자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryExecutor(BackoffCalculator backoffCalculator,
                         FailureClassifier failureClassifier,
                         AttemptInvoker attemptInvoker,
                         Sleeper sleeper,
                         TimeSource timeSource,
                         MetricsCollector metrics,
                         ResilienceEventSink eventSink) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (failureClassifier == null) {
            throw new IllegalArgumentException("failureClassifier cannot be null");
        }
        if (attemptInvoker == null) {
            throw new IllegalArgumentException("attemptInvoker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (eventSink == null) {
            throw new IllegalArgumentException("eventSink cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
        this.failureClassifier = failureClassifier;
        this.attemptInvoker = attemptInvoker;
        this.sleeper = sleeper;
        this.timeSource = timeSource;
        this.metrics = metrics;
        this.eventSink = eventSink;
    }

    /**
     * 재시도 루프 실행.
     *
     * @param operation 실행할 작업
     * @param operationId Operation 식별자
     * @param config 재시도 설정
     * @param breaker Operation의 Circuit Breaker
     * @param context 취소 토큰과 긴급도
     * @param <T> 결과 타입
     * @return Ok(값, 시도 횟수, 경과 시간) 또는 Fail(종료 오류)
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public <T> RetryOutcome<T> execute(Callable<T> operation, OperationId operationId, RetryConfig config,
                                       CircuitBreaker breaker, ExecutionContext context) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        CancellationToken token = context.token();
        long startNanos = timeSource.nanoTime();
        int attempts = 0;

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            // 1. 취소 확인
            if (token.isCancelled()) {
                return cancelled(operationId, context, attempts, startNanos, null);
            }

            // 2. Circuit Breaker 확인
            Permit permit = breaker.tryAcquire();
            if (!permit.granted()) {
                metrics.recordBreakerCall(operationId, BreakerCallResult.REJECTED);
                publish(context, operationId, attempts, EventOutcome.CIRCUIT_OPEN, Duration.ZERO, null);
                log.warn("Circuit OPEN for {}, rejected after {} attempts", operationId.getValue(), attempts);
                return new Fail<>(new CircuitOpenException(operationId, breaker.snapshot().lastOpenedAt(),
                    attempts, elapsedSince(startNanos)));
            }

            // 3. 작업 실행
            attempts++;
            T value;
            try {
                value = attemptInvoker.invoke(operation, config);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                breaker.releasePermit(permit);
                metrics.recordBreakerCall(operationId, BreakerCallResult.IGNORED);
                return cancelled(operationId, context, attempts, startNanos, e);
            } catch (Exception e) {
                Throwable error = AllowListFailureClassifier.unwrap(e);
                FailureClassification classification = failureClassifier.classify(e, config);
                metrics.recordFailure(operationId, error);
                publish(context, operationId, attempt, EventOutcome.ATTEMPT_FAILED, Duration.ZERO, error);

                // 5-1. 재시도 불가
                if (!classification.isRetryable()) {
                    breaker.releasePermit(permit);
                    metrics.recordBreakerCall(operationId, BreakerCallResult.IGNORED);
                    publish(context, operationId, attempt, EventOutcome.NON_RETRYABLE, Duration.ZERO, error);
                    log.warn("Non-retryable failure for {} on attempt {}: {}",
                        operationId.getValue(), attempt, error.toString());
                    return new Fail<>(new NonRetryableException(operationId, error, attempts, elapsedSince(startNanos)));
                }

                // 5-2. 재시도 가능
                breaker.recordFailure(permit, error);
                metrics.recordBreakerCall(operationId, BreakerCallResult.FAILURE);

                if (attempt == config.maxAttempts()) {
                    Duration elapsed = elapsedSince(startNanos);
                    publish(context, operationId, attempt, EventOutcome.EXHAUSTED, Duration.ZERO, error);
                    log.error("Retries exhausted for {} after {} attempts ({}ms)",
                        operationId.getValue(), attempts, elapsed.toMillis(), error);
                    return new Fail<>(new RetryExhaustedException(operationId, error, attempts, elapsed));
                }

                Duration delay = backoffCalculator.computeDelay(attempt, config);
                log.warn("Attempt {}/{} for {} failed: {}. Retrying in {}ms",
                    attempt, config.maxAttempts(), operationId.getValue(), error.toString(), delay.toMillis());
                publish(context, operationId, attempt, EventOutcome.RETRY_SCHEDULED, delay, error);

                if (!awaitBackoff(delay, token)) {
                    return cancelled(operationId, context, attempts, startNanos, null);
                }
                metrics.recordRetryWait(operationId, delay);
                continue;
            } catch (Error e) {
                breaker.releasePermit(permit);
                throw e;
            }

            // 4. 성공
            breaker.recordSuccess(permit);
            metrics.recordSuccess(operationId);
            metrics.recordBreakerCall(operationId, BreakerCallResult.SUCCESS);
            publish(context, operationId, attempt, EventOutcome.ATTEMPT_SUCCEEDED, Duration.ZERO, null);
            if (attempt > 1) {
                log.info("{} succeeded on attempt {}", operationId.getValue(), attempt);
            }
            return new Ok<>(value, attempts, elapsedSince(startNanos));
        }

        throw new IllegalStateException("Retry loop ended without outcome for " + operationId.getValue());
    }

    private boolean awaitBackoff(Duration delay, CancellationToken token) {
        try {
            return sleeper.sleep(delay, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private <T> RetryOutcome<T> cancelled(OperationId operationId, ExecutionContext context,
                                          int attempts, long startNanos, Throwable cause) {
        publish(context, operationId, attempts, EventOutcome.CANCELLED, Duration.ZERO, cause);
        log.debug("Execution of {} cancelled after {} attempts", operationId.getValue(), attempts);
        return new Fail<>(new CancelledException(operationId, cause, attempts, elapsedSince(startNanos)));
    }

    private Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, timeSource.nanoTime() - startNanos));
    }

    private void publish(ExecutionContext context, OperationId operationId, int attempt,
                         EventOutcome outcome, Duration delay, Throwable error) {
        ResilienceEvent event = new ResilienceEvent(operationId, context.urgency(), attempt, outcome,
            delay, error, timeSource.now());
        try {
            eventSink.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed for {} ({})", operationId.getValue(), outcome, e);
        }
    }
}
