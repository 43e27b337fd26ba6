package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerListener;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.spi.TimeSource;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates and holds one {@link InMemoryCircuitBreaker} per {@link OperationId}.
 *
 * <p>Creation uses {@link ConcurrentHashMap#computeIfAbsent}, so concurrent first calls for the
 * same operation observe the same breaker and different operations never contend on a shared lock.
 * Breakers live until the registry is discarded; {@link #reset(OperationId)} closes a breaker
 * but keeps the instance.</p>
 *
 * <p>Per-operation {@link CircuitBreakerConfig} overrides take precedence over the default config.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitBreakerRegistry {

    private final ConcurrentHashMap<OperationId, InMemoryCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    private final Map<OperationId, CircuitBreakerConfig> overrides;
    private final TimeSource timeSource;
    private final CircuitBreakerListener listener;

    /**
     * Creates a registry with default config and no overrides.
     */
    public CircuitBreakerRegistry() {
        this(new CircuitBreakerConfig(), Map.of(), TimeSource.system(), CircuitBreakerListener.noop());
    }

    /**
     * Creates a registry.
     *
     * @param defaultConfig config for operations without an override
     * @param overrides per-operation configs
     * @param timeSource clock shared by every breaker
     * @param listener transition listener shared by every breaker
     * @throws IllegalArgumentException if any argument is null
     */
    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig,
                                  Map<OperationId, CircuitBreakerConfig> overrides,
                                  TimeSource timeSource,
                                  CircuitBreakerListener listener) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.defaultConfig = defaultConfig;
        this.overrides = Map.copyOf(overrides);
        this.timeSource = timeSource;
        this.listener = listener;
    }

    /**
     * Returns the breaker for the operation, creating it on first use.
     *
     * @param operationId operation
     * @return breaker (same instance for every call with an equal id)
     */
    public CircuitBreaker getOrCreate(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return breakers.computeIfAbsent(operationId,
            id -> new InMemoryCircuitBreaker(id, configFor(id), timeSource, listener));
    }

    /**
     * Returns the breaker only if it was already created.
     *
     * @param operationId operation
     * @return breaker or empty
     */
    public Optional<CircuitBreaker> find(OperationId operationId) {
        return Optional.ofNullable(breakers.get(operationId));
    }

    /**
     * Config in effect for the operation.
     *
     * @param operationId operation
     * @return override if registered, otherwise the default
     */
    public CircuitBreakerConfig configFor(OperationId operationId) {
        return overrides.getOrDefault(operationId, defaultConfig);
    }

    /**
     * Closes the breaker of one operation.
     *
     * @param operationId operation
     * @return true if a breaker existed
     */
    public boolean reset(OperationId operationId) {
        InMemoryCircuitBreaker breaker = breakers.get(operationId);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    /**
     * Closes every breaker.
     */
    public void resetAll() {
        breakers.values().forEach(InMemoryCircuitBreaker::reset);
    }

    /**
     * Snapshot of every created breaker.
     *
     * @return operation → snapshot (immutable copy)
     */
    public Map<OperationId, CircuitBreakerSnapshot> snapshots() {
        Map<OperationId, CircuitBreakerSnapshot> result = new HashMap<>();
        breakers.forEach((id, breaker) -> result.put(id, breaker.snapshot()));
        return Map.copyOf(result);
    }

    /**
     * Number of created breakers.
     *
     * @return size
     */
    public int size() {
        return breakers.size();
    }
}
