package com.ryuqq.resilience.core.spi;

import java.time.Instant;

/**
 * 시간 소스 SPI.
 *
 * <p>경과 시간 계산에는 단조 증가 시계({@link #nanoTime()})를 사용하고,
 * 외부에 노출되는 시각(예: Circuit OPEN 시각)에는 {@link #now()}를 사용합니다.</p>
 *
 * <p>테스트에서는 수동으로 시간을 전진시키는 구현을 주입하여
 * Circuit Breaker 타임아웃과 백오프 대기를 결정적으로 검증할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TimeSource {

    /**
     * 단조 증가 시계 값.
     *
     * @return 나노초 단위 시계 값 (절대값 자체에는 의미 없음)
     */
    long nanoTime();

    /**
     * 현재 시각.
     *
     * @return 현재 시각
     */
    Instant now();

    /**
     * 시스템 시계 기반 TimeSource.
     *
     * @return {@link System#nanoTime()} 및 {@link Instant#now()} 기반 구현
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
