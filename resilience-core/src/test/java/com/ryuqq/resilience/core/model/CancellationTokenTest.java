package com.ryuqq.resilience.core.model;

import com.ryuqq.resilience.core.spi.TimeSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CancellationToken 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("CancellationToken 테스트")
class CancellationTokenTest {

    @Test
    @DisplayName("새 토큰은 취소되지 않은 상태이다")
    void create_취소되지_않음() {
        // given
        CancellationToken token = CancellationToken.create();

        // then
        assertThat(token.isCancelled()).isFalse();
        assertThat(token.remaining()).isEmpty();
    }

    @Test
    @DisplayName("cancel() 후에는 취소 상태이며 여러 번 호출해도 안전하다")
    void cancel_멱등() {
        // given
        CancellationToken token = CancellationToken.create();

        // when
        token.cancel();
        token.cancel();

        // then
        assertThat(token.isCancellationRequested()).isTrue();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("none()은 호출마다 독립된 토큰을 반환한다")
    void none_독립된_인스턴스() {
        // given
        CancellationToken first = CancellationToken.none();
        CancellationToken second = CancellationToken.none();

        // when
        first.cancel();

        // then
        assertThat(second.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("deadline이 지나면 취소 상태가 된다")
    void withDeadline_경과_시_취소() {
        // given
        FakeTime time = new FakeTime();
        CancellationToken token = CancellationToken.withDeadline(Duration.ofMillis(100), time);

        // when
        time.advance(Duration.ofMillis(99));

        // then
        assertThat(token.isDeadlineExceeded()).isFalse();
        assertThat(token.remaining()).contains(Duration.ofMillis(1));

        // when
        time.advance(Duration.ofMillis(1));

        // then
        assertThat(token.isDeadlineExceeded()).isTrue();
        assertThat(token.isCancellationRequested()).isFalse();
        assertThat(token.isCancelled()).isTrue();
        assertThat(token.remaining()).isEqualTo(Optional.of(Duration.ZERO));
    }

    @Test
    @DisplayName("long 나노초 범위를 넘는 deadline도 예외 없이 생성된다")
    void withDeadline_매우_긴_timeout() {
        // given
        FakeTime time = new FakeTime(Long.MAX_VALUE - Duration.ofSeconds(1).toNanos());
        CancellationToken token = CancellationToken.withDeadline(Duration.ofDays(365L * 1000), time);

        // when
        time.advance(Duration.ofDays(1));

        // then
        assertThat(token.isDeadlineExceeded()).isFalse();
        assertThat(token.isCancelled()).isFalse();
        assertThat(token.remaining()).hasValueSatisfying(remaining ->
            assertThat(remaining).isGreaterThan(Duration.ofDays(365L * 200)));
    }

    @Test
    @DisplayName("nanoTime이 long 경계를 넘어도 deadline은 정확히 판정된다")
    void withDeadline_nanoTime_경계() {
        // given
        FakeTime time = new FakeTime(Long.MAX_VALUE - Duration.ofMillis(50).toNanos());
        CancellationToken token = CancellationToken.withDeadline(Duration.ofMillis(100), time);

        // when
        time.advance(Duration.ofMillis(99));

        // then
        assertThat(token.isDeadlineExceeded()).isFalse();

        // when
        time.advance(Duration.ofMillis(1));

        // then
        assertThat(token.isDeadlineExceeded()).isTrue();
    }

    @Test
    @DisplayName("양수가 아닌 deadline은 거부된다")
    void withDeadline_잘못된_timeout() {
        assertThatThrownBy(() -> CancellationToken.withDeadline(Duration.ZERO, TimeSource.system()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout must be positive");
        assertThatThrownBy(() -> CancellationToken.withDeadline(Duration.ofSeconds(1), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("await()는 cancel() 호출 시 즉시 깨어난다")
    void await_cancel_시_즉시_반환() throws Exception {
        // given
        CancellationToken token = CancellationToken.create();
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean result = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            started.countDown();
            try {
                result.set(token.await(Duration.ofMinutes(5)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // when
        waiter.start();
        started.await(1, TimeUnit.SECONDS);
        token.cancel();
        waiter.join(TimeUnit.SECONDS.toMillis(5));

        // then
        assertThat(waiter.isAlive()).isFalse();
        assertThat(result.get()).isTrue();
    }

    @Test
    @DisplayName("await()는 timeout이 정상 경과하면 false를 반환한다")
    void await_timeout_경과() throws Exception {
        // given
        CancellationToken token = CancellationToken.create();

        // when
        boolean cancelled = token.await(Duration.ofMillis(10));

        // then
        assertThat(cancelled).isFalse();
    }

    private static final class FakeTime implements TimeSource {
        private final AtomicLong nanos;

        FakeTime() {
            this(0L);
        }

        FakeTime(long startNanos) {
            this.nanos = new AtomicLong(startNanos);
        }

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }

        @Override
        public long nanoTime() {
            return nanos.get();
        }

        @Override
        public Instant now() {
            return Instant.EPOCH.plusNanos(nanos.get());
        }
    }
}
