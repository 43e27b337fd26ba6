package com.ryuqq.resilience.application.policy;

import com.ryuqq.resilience.core.config.BackoffStrategy;
import com.ryuqq.resilience.core.config.RetryConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.Urgency;
import com.ryuqq.resilience.core.model.UrgencyTier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * (Operation, 긴급도) → RetryConfig 매핑.
 *
 * <p><strong>기본 등급 정책 (EXPONENTIAL, base=2.0):</strong></p>
 * <pre>
 * 긴급도 5   (EMERGENCY): 5회, 100ms ~ 2s,  jitter off
 * 긴급도 3-4 (CRITICAL) : 4회, 500ms ~ 10s, jitter on
 * 긴급도 1-2 (ROUTINE)  : 3회, 1s ~ 30s,    jitter on
 * </pre>
 *
 * <p><strong>조회 순서:</strong></p>
 * <ol>
 *   <li>(operation, 긴급도 레벨) 개별 등록</li>
 *   <li>(operation, 긴급도 등급) 개별 등록</li>
 *   <li>기본 등급 정책</li>
 * </ol>
 * <p>긴급도가 없으면 {@link RetryStrategy#STANDARD}를 반환합니다.</p>
 *
 * <p>개별 등록도 등급의 Jitter 규칙을 따릅니다. EMERGENCY(긴급도 5)에는 Jitter가 꺼진 설정만,
 * ROUTINE(긴급도 1~2)에는 Jitter가 켜진 설정만 등록할 수 있습니다.</p>
 *
 * <p>Registry는 생성 후 변경되지 않으며, 조회는 부작용 없는 순수 lookup입니다.
 * 반환되는 모든 설정은 RetryConfig 검증을 통과하므로 무한 재시도 설정은 존재할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryPolicyRegistry registry = RetryPolicyRegistry.builder()
 *     .register("healthlake.search", UrgencyTier.ROUTINE, RetryStrategy.CONSERVATIVE.config())
 *     .register("bedrock.invoke", 5, emergencyInferenceConfig)
 *     .build();
 *
 * RetryConfig config = registry.resolve(OperationId.of("bedrock.invoke"), Urgency.of(5));
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPolicyRegistry {

    private static final Map<UrgencyTier, RetryConfig> DEFAULT_TIERS = defaultTiers();

    private final Map<OperationId, Map<Integer, RetryConfig>> levelOverrides;
    private final Map<OperationId, Map<UrgencyTier, RetryConfig>> tierOverrides;

    private RetryPolicyRegistry(Map<OperationId, Map<Integer, RetryConfig>> levelOverrides,
                                Map<OperationId, Map<UrgencyTier, RetryConfig>> tierOverrides) {
        this.levelOverrides = copyLevels(levelOverrides);
        this.tierOverrides = copyTiers(tierOverrides);
    }

    /**
     * 기본 등급 정책만 가진 Registry.
     *
     * @return 개별 등록이 없는 Registry
     */
    public static RetryPolicyRegistry defaults() {
        return new RetryPolicyRegistry(Map.of(), Map.of());
    }

    /**
     * 새 Builder 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 긴급도 기반 정책 조회.
     *
     * @param operationId 대상 Operation
     * @param urgency 긴급도 (null이면 STANDARD)
     * @return 적용할 RetryConfig
     * @throws IllegalArgumentException operationId가 null인 경우
     */
    public RetryConfig resolve(OperationId operationId, Urgency urgency) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (urgency == null) {
            return RetryStrategy.STANDARD.config();
        }

        Map<Integer, RetryConfig> byLevel = levelOverrides.get(operationId);
        if (byLevel != null && byLevel.containsKey(urgency.getLevel())) {
            return byLevel.get(urgency.getLevel());
        }

        Map<UrgencyTier, RetryConfig> byTier = tierOverrides.get(operationId);
        if (byTier != null && byTier.containsKey(urgency.tier())) {
            return byTier.get(urgency.tier());
        }

        return DEFAULT_TIERS.get(urgency.tier());
    }

    /**
     * 이름 있는 전략 조회 (긴급도 조회 생략).
     *
     * @param strategy 전략 (null이면 STANDARD)
     * @return 전략의 RetryConfig
     */
    public RetryConfig resolve(RetryStrategy strategy) {
        return strategy == null ? RetryStrategy.STANDARD.config() : strategy.config();
    }

    /**
     * 기본 등급 정책 조회.
     *
     * @param tier 긴급도 등급
     * @return 등급의 기본 RetryConfig
     */
    public static RetryConfig defaultFor(UrgencyTier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        return DEFAULT_TIERS.get(tier);
    }

    private static Map<UrgencyTier, RetryConfig> defaultTiers() {
        Map<UrgencyTier, RetryConfig> tiers = new EnumMap<>(UrgencyTier.class);
        tiers.put(UrgencyTier.EMERGENCY, tier(5, Duration.ofMillis(100), Duration.ofSeconds(2), false));
        tiers.put(UrgencyTier.CRITICAL, tier(4, Duration.ofMillis(500), Duration.ofSeconds(10), true));
        tiers.put(UrgencyTier.ROUTINE, tier(3, Duration.ofSeconds(1), Duration.ofSeconds(30), true));
        return Map.copyOf(tiers);
    }

    private static RetryConfig tier(int maxAttempts, Duration initialDelay, Duration maxDelay, boolean jitter) {
        return RetryConfig.builder()
            .maxAttempts(maxAttempts)
            .initialDelay(initialDelay)
            .maxDelay(maxDelay)
            .backoffBase(2.0)
            .backoffStrategy(BackoffStrategy.EXPONENTIAL)
            .jitterEnabled(jitter)
            .build();
    }

    private static Map<OperationId, Map<Integer, RetryConfig>> copyLevels(Map<OperationId, Map<Integer, RetryConfig>> source) {
        Map<OperationId, Map<Integer, RetryConfig>> copy = new HashMap<>();
        source.forEach((id, byLevel) -> copy.put(id, Map.copyOf(byLevel)));
        return Map.copyOf(copy);
    }

    private static Map<OperationId, Map<UrgencyTier, RetryConfig>> copyTiers(Map<OperationId, Map<UrgencyTier, RetryConfig>> source) {
        Map<OperationId, Map<UrgencyTier, RetryConfig>> copy = new HashMap<>();
        source.forEach((id, byTier) -> copy.put(id, Map.copyOf(byTier)));
        return Map.copyOf(copy);
    }

    /**
     * RetryPolicyRegistry Builder.
     */
    public static final class Builder {

        private final Map<OperationId, Map<Integer, RetryConfig>> levelOverrides = new HashMap<>();
        private final Map<OperationId, Map<UrgencyTier, RetryConfig>> tierOverrides = new HashMap<>();

        private Builder() {
        }

        /**
         * 특정 긴급도 레벨 정책 등록.
         *
         * @param operationId Operation 식별자
         * @param urgencyLevel 긴급도 (1~5)
         * @param config 적용할 설정
         * @return this
         * @throws IllegalArgumentException 파라미터가 유효하지 않거나 등급의 Jitter 규칙과 맞지 않는 경우
         */
        public Builder register(String operationId, int urgencyLevel, RetryConfig config) {
            Urgency urgency = Urgency.of(urgencyLevel);
            requireConfig(config);
            requireTierJitter(urgency.tier(), config);
            levelOverrides.computeIfAbsent(OperationId.of(operationId), k -> new HashMap<>())
                .put(urgency.getLevel(), config);
            return this;
        }

        /**
         * 긴급도 등급 정책 등록.
         *
         * @param operationId Operation 식별자
         * @param tier 긴급도 등급
         * @param config 적용할 설정
         * @return this
         * @throws IllegalArgumentException 파라미터가 유효하지 않거나 등급의 Jitter 규칙과 맞지 않는 경우
         */
        public Builder register(String operationId, UrgencyTier tier, RetryConfig config) {
            if (tier == null) {
                throw new IllegalArgumentException("tier cannot be null");
            }
            requireConfig(config);
            requireTierJitter(tier, config);
            tierOverrides.computeIfAbsent(OperationId.of(operationId), k -> new EnumMap<>(UrgencyTier.class))
                .put(tier, config);
            return this;
        }

        /**
         * 모든 긴급도에 같은 정책 등록.
         *
         * <p>Jitter 여부는 등급 규칙에 맞춰 조정됩니다.
         * EMERGENCY에는 Jitter를 끈 설정이, ROUTINE에는 Jitter를 켠 설정이 등록됩니다.</p>
         *
         * @param operationId Operation 식별자
         * @param config 적용할 설정
         * @return this
         */
        public Builder registerAll(String operationId, RetryConfig config) {
            requireConfig(config);
            for (UrgencyTier tier : UrgencyTier.values()) {
                register(operationId, tier, alignJitter(tier, config));
            }
            return this;
        }

        /**
         * Registry 생성.
         *
         * @return 불변 Registry
         */
        public RetryPolicyRegistry build() {
            return new RetryPolicyRegistry(levelOverrides, tierOverrides);
        }

        private static void requireConfig(RetryConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
        }

        private static void requireTierJitter(UrgencyTier tier, RetryConfig config) {
            if (tier == UrgencyTier.EMERGENCY && config.jitterEnabled()) {
                throw new IllegalArgumentException(
                    "jitterEnabled must be false for EMERGENCY (current: true)");
            }
            if (tier == UrgencyTier.ROUTINE && !config.jitterEnabled()) {
                throw new IllegalArgumentException(
                    "jitterEnabled must be true for ROUTINE (current: false)");
            }
        }

        private static RetryConfig alignJitter(UrgencyTier tier, RetryConfig config) {
            switch (tier) {
                case EMERGENCY:
                    return config.withJitterEnabled(false);
                case ROUTINE:
                    return config.withJitterEnabled(true);
                default:
                    return config;
            }
        }
    }
}
