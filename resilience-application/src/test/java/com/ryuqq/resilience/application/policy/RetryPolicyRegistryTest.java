package com.ryuqq.resilience.application.policy;

import com.ryuqq.resilience.core.config.BackoffStrategy;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.Urgency;
import com.ryuqq.resilience.core.model.UrgencyTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryPolicyRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("RetryPolicyRegistry 테스트")
class RetryPolicyRegistryTest {

    private static final OperationId OPERATION = OperationId.of("bedrock.invoke");

    private final RetryPolicyRegistry registry = RetryPolicyRegistry.defaults();

    @Test
    @DisplayName("긴급도 5는 5회, 100ms ~ 2s, jitter 없는 정책으로 조회된다")
    void 긴급도_5_기본_정책() {
        // when
        RetryConfig config = registry.resolve(OPERATION, Urgency.of(5));

        // then
        assertThat(config.maxAttempts()).isEqualTo(5);
        assertThat(config.initialDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.backoffBase()).isEqualTo(2.0);
        assertThat(config.backoffStrategy()).isEqualTo(BackoffStrategy.EXPONENTIAL);
        assertThat(config.jitterEnabled()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 4})
    @DisplayName("긴급도 3-4는 4회, 500ms ~ 10s, jitter 정책으로 조회된다")
    void 긴급도_3_4_기본_정책(int level) {
        // when
        RetryConfig config = registry.resolve(OPERATION, Urgency.of(level));

        // then
        assertThat(config.maxAttempts()).isEqualTo(4);
        assertThat(config.initialDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.jitterEnabled()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2})
    @DisplayName("긴급도 1-2는 3회, 1s ~ 30s, jitter 정책으로 조회된다")
    void 긴급도_1_2_기본_정책(int level) {
        // when
        RetryConfig config = registry.resolve(OPERATION, Urgency.of(level));

        // then
        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.initialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.jitterEnabled()).isTrue();
    }

    @Test
    @DisplayName("긴급도가 없으면 STANDARD 전략을 반환한다")
    void 긴급도_없음_STANDARD() {
        assertThat(registry.resolve(OPERATION, null)).isEqualTo(RetryStrategy.STANDARD.config());
    }

    @Test
    @DisplayName("레벨 개별 등록이 등급 등록보다 우선한다")
    void 조회_우선순위() {
        // given
        RetryConfig tierConfig = RetryStrategy.CONSERVATIVE.config();
        RetryConfig levelConfig = RetryStrategy.AGGRESSIVE.config();
        RetryPolicyRegistry custom = RetryPolicyRegistry.builder()
            .register("bedrock.invoke", UrgencyTier.CRITICAL, tierConfig)
            .register("bedrock.invoke", 4, levelConfig)
            .build();

        // then
        assertThat(custom.resolve(OPERATION, Urgency.of(4))).isEqualTo(levelConfig);
        assertThat(custom.resolve(OPERATION, Urgency.of(3))).isEqualTo(tierConfig);
        assertThat(custom.resolve(OPERATION, Urgency.of(5)))
            .isEqualTo(RetryPolicyRegistry.defaultFor(UrgencyTier.EMERGENCY));
        assertThat(custom.resolve(OperationId.of("other.op"), Urgency.of(4)))
            .isEqualTo(RetryPolicyRegistry.defaultFor(UrgencyTier.CRITICAL));
    }

    @Test
    @DisplayName("registerAll은 모든 등급에 같은 정책을 등록하되 등급의 Jitter 규칙을 따른다")
    void registerAll_모든_등급() {
        // given
        RetryConfig config = new RetryConfig().withMaxAttempts(2);
        RetryPolicyRegistry custom = RetryPolicyRegistry.builder()
            .registerAll("bedrock.invoke", config)
            .build();

        // then
        for (int level = Urgency.MIN_LEVEL; level <= Urgency.MAX_LEVEL; level++) {
            assertThat(custom.resolve(OPERATION, Urgency.of(level)).maxAttempts()).isEqualTo(2);
        }
        assertThat(custom.resolve(OPERATION, Urgency.of(5))).isEqualTo(config.withJitterEnabled(false));
        assertThat(custom.resolve(OPERATION, Urgency.of(3))).isEqualTo(config);
        assertThat(custom.resolve(OPERATION, Urgency.of(1))).isEqualTo(config.withJitterEnabled(true));
    }

    @Test
    @DisplayName("Jitter 켜진 전략을 registerAll해도 긴급도 5는 Jitter 없이 조회된다")
    void registerAll_응급_Jitter_제거() {
        // given
        RetryPolicyRegistry custom = RetryPolicyRegistry.builder()
            .registerAll("x", RetryStrategy.AGGRESSIVE.config())
            .build();

        // then
        assertThat(custom.resolve(OperationId.of("x"), Urgency.of(5)).jitterEnabled()).isFalse();
        assertThat(custom.resolve(OperationId.of("x"), Urgency.of(4)).jitterEnabled()).isTrue();
        assertThat(custom.resolve(OperationId.of("x"), Urgency.of(2)).jitterEnabled()).isTrue();
    }

    @Test
    @DisplayName("Jitter 없는 ROUTINE 정책은 registerAll 시 Jitter가 켜진다")
    void registerAll_일반_Jitter_적용() {
        // given
        RetryConfig noJitter = RetryConfig.builder().jitterEnabled(false).build();
        RetryPolicyRegistry custom = RetryPolicyRegistry.builder()
            .registerAll("bedrock.invoke", noJitter)
            .build();

        // then
        assertThat(custom.resolve(OPERATION, Urgency.of(1)).jitterEnabled()).isTrue();
        assertThat(custom.resolve(OPERATION, Urgency.of(2)).jitterEnabled()).isTrue();
        assertThat(custom.resolve(OPERATION, Urgency.of(5)).jitterEnabled()).isFalse();
    }

    @Test
    @DisplayName("긴급도 5에 Jitter 켜진 정책을 등록하면 거부된다")
    void 응급_Jitter_등록_거부() {
        RetryConfig jittered = RetryConfig.builder().jitterEnabled(true).build();

        assertThatThrownBy(() -> RetryPolicyRegistry.builder().register("bedrock.invoke", 5, jittered))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("EMERGENCY");
        assertThatThrownBy(() -> RetryPolicyRegistry.builder()
            .register("bedrock.invoke", UrgencyTier.EMERGENCY, jittered))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("EMERGENCY");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2})
    @DisplayName("긴급도 1-2에 Jitter 없는 정책을 등록하면 거부된다")
    void 일반_Jitter_없는_등록_거부(int level) {
        RetryConfig noJitter = RetryConfig.builder().jitterEnabled(false).build();

        assertThatThrownBy(() -> RetryPolicyRegistry.builder().register("bedrock.invoke", level, noJitter))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ROUTINE");
        assertThatThrownBy(() -> RetryPolicyRegistry.builder()
            .register("bedrock.invoke", UrgencyTier.ROUTINE, noJitter))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("긴급도 3-4는 Jitter 여부와 무관하게 등록된다")
    void 중요_Jitter_자유() {
        // given
        RetryConfig noJitter = RetryConfig.builder().jitterEnabled(false).build();
        RetryPolicyRegistry custom = RetryPolicyRegistry.builder()
            .register("bedrock.invoke", 3, noJitter)
            .build();

        // then
        assertThat(custom.resolve(OPERATION, Urgency.of(3))).isEqualTo(noJitter);
    }

    @Test
    @DisplayName("build 이후 Builder 변경은 Registry에 반영되지 않는다")
    void 불변성() {
        // given
        RetryPolicyRegistry.Builder builder = RetryPolicyRegistry.builder();
        RetryPolicyRegistry built = builder.build();

        // when
        builder.register("bedrock.invoke", 5, RetryStrategy.CONSERVATIVE.config().withJitterEnabled(false));

        // then
        assertThat(built.resolve(OPERATION, Urgency.of(5)))
            .isEqualTo(RetryPolicyRegistry.defaultFor(UrgencyTier.EMERGENCY));
    }

    @Test
    @DisplayName("잘못된 등록은 거부된다")
    void 잘못된_등록_거부() {
        assertThatThrownBy(() -> RetryPolicyRegistry.builder().register("bedrock.invoke", 6, new RetryConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicyRegistry.builder().register("bad op", 3, new RetryConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicyRegistry.builder().register("bedrock.invoke", UrgencyTier.ROUTINE, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.resolve((OperationId) null, Urgency.of(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("이름 있는 전략 조회는 긴급도 조회를 거치지 않는다")
    void 전략_조회() {
        assertThat(registry.resolve(RetryStrategy.AGGRESSIVE)).isEqualTo(RetryStrategy.AGGRESSIVE.config());
        assertThat(registry.resolve((RetryStrategy) null)).isEqualTo(RetryStrategy.STANDARD.config());
    }
}
