package com.ryuqq.resilience.testkit.support;

import com.ryuqq.resilience.core.model.CancellationToken;
import com.ryuqq.resilience.core.spi.Sleeper;
import com.ryuqq.resilience.core.spi.TimeSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Deterministic clock and sleeper for tests.
 *
 * <p>Time only moves when {@link #advance(Duration)} is called or when a retry loop sleeps.
 * A sleep advances the clock by the requested duration (or only up to the token's deadline)
 * and returns immediately, so backoff sequences can be asserted without real waiting.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ManualTimeSource clock = new ManualTimeSource();
 * ResilienceManager manager = DefaultResilienceManager.builder()
 *     .timeSource(clock)
 *     .sleeper(clock)
 *     .build();
 *
 * manager.executeWithResilience(op, "svc.call", config, CancellationToken.none());
 * assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), clock.sleeps());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ManualTimeSource implements TimeSource, Sleeper {

    private static final Instant DEFAULT_EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private final Instant epoch;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private volatile Consumer<Duration> onSleep = duration -> { };
    private long nanos;

    /**
     * Creates a clock starting at 2024-01-01T00:00:00Z.
     */
    public ManualTimeSource() {
        this(DEFAULT_EPOCH);
    }

    /**
     * Creates a clock starting at the given instant.
     *
     * @param epoch wall-clock value at nanoTime 0
     */
    public ManualTimeSource(Instant epoch) {
        if (epoch == null) {
            throw new IllegalArgumentException("epoch cannot be null");
        }
        this.epoch = epoch;
    }

    @Override
    public synchronized long nanoTime() {
        return nanos;
    }

    @Override
    public synchronized Instant now() {
        return epoch.plusNanos(nanos);
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount (non-negative)
     */
    public synchronized void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        nanos += duration.toNanos();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Records the requested duration, runs the sleep hook, then advances the clock.
     * Returns false without advancing past the token's deadline when the token is (or becomes) cancelled.</p>
     */
    @Override
    public boolean sleep(Duration duration, CancellationToken token) {
        if (token.isCancelled()) {
            return false;
        }
        sleeps.add(duration);
        onSleep.accept(duration);
        if (token.isCancellationRequested()) {
            return false;
        }
        Duration step = token.remaining()
            .filter(remaining -> remaining.compareTo(duration) < 0)
            .orElse(duration);
        advance(step);
        return !token.isCancelled();
    }

    /**
     * Hook invoked on every sleep before the clock moves (e.g. to cancel a token mid-backoff).
     *
     * @param onSleep hook receiving the requested duration
     */
    public void onSleep(Consumer<Duration> onSleep) {
        if (onSleep == null) {
            throw new IllegalArgumentException("onSleep cannot be null");
        }
        this.onSleep = onSleep;
    }

    /**
     * Requested sleep durations in order.
     *
     * @return copy of the recorded sleeps
     */
    public List<Duration> sleeps() {
        return new ArrayList<>(sleeps);
    }

    /**
     * Sum of all requested sleeps.
     *
     * @return total
     */
    public Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    /**
     * Elapsed time since the clock was created.
     *
     * @return elapsed
     */
    public synchronized Duration elapsed() {
        return Duration.ofNanos(nanos);
    }
}
