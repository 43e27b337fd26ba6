package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.CancellationToken;

import java.time.Duration;

/**
 * 백오프 대기 SPI.
 *
 * <p>재시도 사이의 대기를 담당합니다. 구현체는 취소 신호에 즉시 반응해야 하며,
 * busy-wait 루프를 사용해서는 안 됩니다.</p>
 *
 * <p>대기 중에는 어떤 락도 잡지 않은 상태여야 합니다 (호출자 책임).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * duration 동안 대기.
     *
     * @param duration 대기 시간
     * @param token 취소 토큰
     * @return 대기가 정상 완료되면 true, 취소(또는 deadline 경과)로 중단되면 false
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /**
     * 취소 토큰 기반 기본 구현.
     *
     * @return {@link CancellationToken#await(Duration)}로 대기하는 Sleeper
     */
    static Sleeper cancellable() {
        return (duration, token) -> !token.await(duration);
    }
}
