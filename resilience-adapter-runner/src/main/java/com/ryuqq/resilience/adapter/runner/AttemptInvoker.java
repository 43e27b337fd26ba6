package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.exception.AttemptTimeoutException;
import com.ryuqq.resilience.core.spi.TimeSource;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 시도 1회 실행 (시도당 타임아웃 적용).
 *
 * <p><strong>타임아웃 방식:</strong></p>
 * <ul>
 *   <li>attemptTimeout 비활성: 호출 스레드에서 그대로 실행</li>
 *   <li>ExecutorService 제공 (hard): 작업을 제출하고 {@link Future#get(long, TimeUnit)}로 대기,
 *       초과 시 {@code cancel(true)}로 인터럽트</li>
 *   <li>ExecutorService 없음 (soft): 호출 스레드에서 실행 후 경과 시간이 timeout을 넘으면 결과를 버림</li>
 * </ul>
 *
 * <p>두 방식 모두 타임아웃은 {@link AttemptTimeoutException}으로 보고되며, 기본 설정에서 재시도 대상입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AttemptInvoker {

    private final TimeSource timeSource;
    private final ExecutorService executor;

    /**
     * soft timeout만 사용하는 Invoker.
     *
     * @param timeSource 시간 소스
     */
    public AttemptInvoker(TimeSource timeSource) {
        this(timeSource, null);
    }

    /**
     * Invoker 생성.
     *
     * @param timeSource 시간 소스
     * @param executor hard timeout용 ExecutorService (null이면 soft timeout)
     */
    public AttemptInvoker(TimeSource timeSource, ExecutorService executor) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.timeSource = timeSource;
        this.executor = executor;
    }

    /**
     * hard timeout 사용 여부.
     *
     * @return ExecutorService가 설정되어 있으면 true
     */
    public boolean isHardTimeout() {
        return executor != null;
    }

    /**
     * 작업 1회 실행.
     *
     * @param operation 실행할 작업
     * @param config attemptTimeout을 담은 설정
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws AttemptTimeoutException 시도당 타임아웃 초과 시
     * @throws InterruptedException 호출 스레드가 대기 중 인터럽트된 경우
     * @throws Exception 작업이 던진 예외
     */
    public <T> T invoke(Callable<T> operation, RetryConfig config) throws Exception {
        if (!config.hasAttemptTimeout()) {
            return operation.call();
        }
        if (executor != null) {
            return invokeWithHardTimeout(operation, config.attemptTimeout());
        }
        return invokeWithSoftTimeout(operation, config.attemptTimeout());
    }

    private <T> T invokeWithHardTimeout(Callable<T> operation, Duration timeout) throws Exception {
        Future<T> future = executor.submit(operation);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AttemptTimeoutException(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private <T> T invokeWithSoftTimeout(Callable<T> operation, Duration timeout) throws Exception {
        long startNanos = timeSource.nanoTime();
        T result = operation.call();
        if (timeSource.nanoTime() - startNanos > timeout.toNanos()) {
            throw new AttemptTimeoutException(timeout);
        }
        return result;
    }
}
