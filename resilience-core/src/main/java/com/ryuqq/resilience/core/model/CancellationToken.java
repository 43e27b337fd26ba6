package com.ryuqq.resilience.core.model;

import com.ryuqq.resilience.core.spi.TimeSource;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 호출자 측 취소 신호 및 전체 마감 시각(deadline).
 *
 * <p>RetryExecutor는 매 시도 직전과 백오프 대기 중에 이 토큰을 확인합니다.
 * {@link #cancel()} 호출 또는 deadline 경과 시 재시도 루프는 더 이상 시도하지 않고
 * {@code CancelledException}으로 종료됩니다.</p>
 *
 * <p>백오프 대기는 {@link #await(Duration)}를 통해 이루어지며,
 * 취소되면 대기 중인 스레드가 즉시 깨어납니다 (busy-wait 없음).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.withDeadline(Duration.ofSeconds(3), TimeSource.system());
 * manager.executeWithResilience(() -> client.invoke(request), "bedrock.invoke", Urgency.of(5), token);
 *
 * // 다른 스레드에서
 * token.cancel();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final TimeSource timeSource;
    private final long startNanos;
    private final long timeoutNanos;

    private CancellationToken(TimeSource timeSource, long startNanos, long timeoutNanos) {
        this.timeSource = timeSource;
        this.startNanos = startNanos;
        this.timeoutNanos = timeoutNanos;
    }

    /**
     * deadline 없는 토큰 생성.
     *
     * <p>{@link #cancel()} 호출 시에만 취소됩니다.</p>
     *
     * @return 새 토큰
     */
    public static CancellationToken create() {
        return new CancellationToken(null, 0L, 0L);
    }

    /**
     * 취소 신호를 사용하지 않는 호출을 위한 토큰.
     *
     * <p>호출마다 새 인스턴스를 반환하므로 다른 호출에 영향을 주지 않습니다.</p>
     *
     * @return 새 토큰
     */
    public static CancellationToken none() {
        return create();
    }

    /**
     * deadline이 설정된 토큰 생성.
     *
     * <p>long 나노초 범위를 넘는 timeout은 약 292년으로 제한됩니다.</p>
     *
     * @param timeout 현재 시점부터 deadline까지의 시간 (양수여야 함)
     * @param timeSource 시간 소스
     * @return 새 토큰
     * @throws IllegalArgumentException timeout이 양수가 아니거나 timeSource가 null인 경우
     */
    public static CancellationToken withDeadline(Duration timeout, TimeSource timeSource) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        return new CancellationToken(timeSource, timeSource.nanoTime(), saturatedNanos(timeout));
    }

    /**
     * 취소 요청.
     *
     * <p>여러 번 호출해도 안전하며, 대기 중인 스레드를 즉시 깨웁니다.</p>
     */
    public void cancel() {
        cancelled.countDown();
    }

    /**
     * 명시적 취소 요청 여부.
     *
     * @return {@link #cancel()}이 호출된 경우 true
     */
    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * deadline 경과 여부.
     *
     * @return deadline이 설정되어 있고 이미 지난 경우 true
     */
    public boolean isDeadlineExceeded() {
        return timeSource != null && elapsedNanos() >= timeoutNanos;
    }

    /**
     * 취소 여부 (명시적 취소 또는 deadline 경과).
     *
     * @return 더 이상 시도하면 안 되는 경우 true
     */
    public boolean isCancelled() {
        return isCancellationRequested() || isDeadlineExceeded();
    }

    /**
     * deadline까지 남은 시간.
     *
     * @return 남은 시간 (deadline이 없으면 empty, 지났으면 ZERO)
     */
    public Optional<Duration> remaining() {
        if (timeSource == null) {
            return Optional.empty();
        }
        long remainingNanos = timeoutNanos - elapsedNanos();
        return Optional.of(remainingNanos > 0 ? Duration.ofNanos(remainingNanos) : Duration.ZERO);
    }

    /**
     * 최대 timeout 동안 취소를 기다림.
     *
     * <p>deadline이 timeout보다 먼저 도래하면 deadline까지만 대기합니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 대기 종료 시점에 취소된 상태이면 true, timeout이 정상 경과했으면 false
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long waitNanos = Math.max(0L, saturatedNanos(timeout));
        if (timeSource != null) {
            waitNanos = Math.min(waitNanos, Math.max(0L, timeoutNanos - elapsedNanos()));
        }
        if (waitNanos > 0) {
            cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
        }
        return isCancelled();
    }

    private long elapsedNanos() {
        return Math.max(0L, timeSource.nanoTime() - startNanos);
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + isCancellationRequested()
            + ", deadline=" + (timeSource == null ? "none" : remaining().orElse(Duration.ZERO)) + '}';
    }
}
