package com.ryuqq.resilience.core.spi;

import java.time.Instant;

/**
 * 시스템 시계 기반 {@link TimeSource}.
 */
enum SystemTimeSource implements TimeSource {

    INSTANCE;

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public Instant now() {
        return Instant.now();
    }
}
