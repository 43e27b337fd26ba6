package com.ryuqq.resilience.adapter.inmemory.metrics;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.spi.BreakerCallResult;
import com.ryuqq.resilience.core.spi.CircuitBreakerMetricsSnapshot;
import com.ryuqq.resilience.core.spi.MetricsCollector;
import com.ryuqq.resilience.core.spi.OperationMetricsSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link MetricsCollector} SPI.
 *
 * <p>Each operation id owns its own counter objects; updates for one operation never block
 * another. Counter objects guard their fields with their own monitor, and snapshots copy
 * the fields under that monitor so a snapshot is never torn.</p>
 *
 * <p><strong>Tracked per operation:</strong></p>
 * <ul>
 *   <li>attempts, successes, failures, last error</li>
 *   <li>observed retry waits and their total (mean = total / observed)</li>
 * </ul>
 *
 * <p><strong>Tracked per breaker:</strong></p>
 * <ul>
 *   <li>total / successful / failed / ignored / rejected calls</li>
 *   <li>transition count per target state and the last state reported by the breaker listener</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Counters are lost on process restart</li>
 *   <li>{@link #reset()} zeroes every counter but keeps the last reported breaker state,
 *       since the breakers themselves are not reset</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMetricsCollector implements MetricsCollector {

    private static final int MAX_ERROR_LENGTH = 512;

    private final ConcurrentHashMap<OperationId, OperationCounters> operations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<OperationId, BreakerCounters> breakers = new ConcurrentHashMap<>();

    @Override
    public void recordSuccess(OperationId operationId) {
        counters(operationId).success();
    }

    @Override
    public void recordFailure(OperationId operationId, Throwable error) {
        counters(operationId).failure(describe(error));
    }

    @Override
    public void recordRetryWait(OperationId operationId, Duration wait) {
        if (wait == null || wait.isNegative()) {
            throw new IllegalArgumentException("wait must be non-negative (current: " + wait + ")");
        }
        counters(operationId).retryWait(wait);
    }

    @Override
    public void recordBreakerCall(OperationId operationId, BreakerCallResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        breakerCounters(operationId).call(result);
    }

    @Override
    public void onStateTransition(OperationId operationId, CircuitBreakerState from,
                                  CircuitBreakerState to, Instant at) {
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        breakerCounters(operationId).transition(to);
    }

    @Override
    public Map<OperationId, OperationMetricsSnapshot> operationSnapshots() {
        Map<OperationId, OperationMetricsSnapshot> result = new HashMap<>();
        operations.forEach((id, counters) -> result.put(id, counters.snapshot(id)));
        return Map.copyOf(result);
    }

    @Override
    public Map<OperationId, CircuitBreakerMetricsSnapshot> breakerSnapshots() {
        Map<OperationId, CircuitBreakerMetricsSnapshot> result = new HashMap<>();
        breakers.forEach((id, counters) -> result.put(id, counters.snapshot(id)));
        return Map.copyOf(result);
    }

    @Override
    public void reset() {
        operations.clear();
        breakers.values().forEach(BreakerCounters::clear);
    }

    private OperationCounters counters(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return operations.computeIfAbsent(operationId, id -> new OperationCounters());
    }

    private BreakerCounters breakerCounters(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return breakers.computeIfAbsent(operationId, id -> new BreakerCounters());
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        String text = message == null
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
        return text.length() > MAX_ERROR_LENGTH ? text.substring(0, MAX_ERROR_LENGTH) : text;
    }

    private static final class OperationCounters {
        private long attempts;
        private long successes;
        private long failures;
        private long retriesObserved;
        private long totalRetryNanos;
        private String lastError;

        synchronized void success() {
            attempts++;
            successes++;
        }

        synchronized void failure(String error) {
            attempts++;
            failures++;
            lastError = error;
        }

        synchronized void retryWait(Duration wait) {
            retriesObserved++;
            totalRetryNanos += wait.toNanos();
        }

        synchronized OperationMetricsSnapshot snapshot(OperationId id) {
            return new OperationMetricsSnapshot(id, attempts, successes, failures, retriesObserved,
                Duration.ofNanos(totalRetryNanos), lastError);
        }
    }

    private static final class BreakerCounters {
        private long total;
        private long successful;
        private long failed;
        private long ignored;
        private long rejected;
        private final Map<CircuitBreakerState, Long> transitions = new EnumMap<>(CircuitBreakerState.class);
        private CircuitBreakerState current = CircuitBreakerState.CLOSED;

        synchronized void call(BreakerCallResult result) {
            total++;
            switch (result) {
                case SUCCESS:
                    successful++;
                    break;
                case FAILURE:
                    failed++;
                    break;
                case IGNORED:
                    ignored++;
                    break;
                case REJECTED:
                    rejected++;
                    break;
                default:
                    throw new IllegalStateException("Unknown result: " + result);
            }
        }

        synchronized void transition(CircuitBreakerState to) {
            transitions.merge(to, 1L, Long::sum);
            current = to;
        }

        synchronized void clear() {
            total = 0;
            successful = 0;
            failed = 0;
            ignored = 0;
            rejected = 0;
            transitions.clear();
        }

        synchronized CircuitBreakerMetricsSnapshot snapshot(OperationId id) {
            return new CircuitBreakerMetricsSnapshot(id, total, successful, failed, ignored, rejected,
                new EnumMap<>(transitions), current);
        }
    }
}
