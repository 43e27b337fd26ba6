package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerListener;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.Permit;
import com.ryuqq.resilience.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CircuitBreaker} SPI guarding a single operation.
 *
 * <p>All counters live inside this instance and are only read or written while holding
 * a single {@link ReentrantLock}, so every read-increment-transition step is atomic.
 * The lock is never held while the protected operation runs or while a retry waits.</p>
 *
 * <p><strong>State Transitions:</strong></p>
 * <ul>
 *   <li><strong>CLOSED → OPEN:</strong> consecutive failures reach failureThreshold</li>
 *   <li><strong>OPEN → HALF_OPEN:</strong> first tryAcquire() after openTimeout elapsed (that call is admitted)</li>
 *   <li><strong>HALF_OPEN → CLOSED:</strong> consecutive probe successes reach successThreshold</li>
 *   <li><strong>HALF_OPEN → OPEN:</strong> any probe failure</li>
 * </ul>
 *
 * <p><strong>Generations:</strong></p>
 * <p>Every transition starts a new generation and every {@link Permit} carries the generation
 * it was granted in. A completion for a permit from an older generation is ignored, so a slow
 * call admitted before the breaker opened cannot close it again or release a probe slot of
 * a newer HALF_OPEN window.</p>
 *
 * <p><strong>Listener:</strong></p>
 * <p>Transitions are queued while the state lock is held and handed to the
 * {@link CircuitBreakerListener} after it is released. Delivery is serialized by a separate
 * publish lock and drains the queue front to back, so the listener sees transitions one at a time
 * and in the order they happened on this breaker, whichever thread drains them.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreaker breaker = new InMemoryCircuitBreaker(
 *     OperationId.of("bedrock.invoke"), new CircuitBreakerConfig(), TimeSource.system(), metrics);
 *
 * Permit permit = breaker.tryAcquire();
 * if (!permit.granted()) {
 *     // fail fast
 * }
 * try {
 *     Object result = call();
 *     breaker.recordSuccess(permit);
 * } catch (IOException e) {
 *     breaker.recordFailure(permit, e);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final OperationId operationId;
    private final CircuitBreakerConfig config;
    private final TimeSource timeSource;
    private final CircuitBreakerListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock publishLock = new ReentrantLock();
    private final Queue<Transition> pending = new ConcurrentLinkedQueue<>();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int halfOpenInflight;
    private long generation;
    private long lastTransitionNanos;
    private Instant lastTransitionTime;
    private Instant lastOpenedAt;

    /**
     * Creates a breaker without a listener.
     *
     * @param operationId guarded operation
     * @param config breaker thresholds
     * @param timeSource clock used for openTimeout
     */
    public InMemoryCircuitBreaker(OperationId operationId, CircuitBreakerConfig config, TimeSource timeSource) {
        this(operationId, config, timeSource, CircuitBreakerListener.noop());
    }

    /**
     * Creates a breaker.
     *
     * @param operationId guarded operation
     * @param config breaker thresholds
     * @param timeSource clock used for openTimeout
     * @param listener transition listener
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryCircuitBreaker(OperationId operationId, CircuitBreakerConfig config,
                                  TimeSource timeSource, CircuitBreakerListener listener) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.operationId = operationId;
        this.config = config;
        this.timeSource = timeSource;
        this.listener = listener;
    }

    @Override
    public OperationId operationId() {
        return operationId;
    }

    /**
     * Breaker thresholds in effect.
     *
     * @return config
     */
    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>CLOSED: always granted</li>
     *   <li>OPEN: rejected until openTimeout elapsed, then moves to HALF_OPEN and grants a probe</li>
     *   <li>HALF_OPEN: granted while in-flight probes &lt; halfOpenMaxRequests</li>
     * </ul>
     */
    @Override
    public Permit tryAcquire() {
        Permit permit;
        lock.lock();
        try {
            if (state == CircuitBreakerState.OPEN) {
                long openNanos = timeSource.nanoTime() - lastTransitionNanos;
                if (openNanos < config.openTimeout().toNanos()) {
                    return Permit.rejected();
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
            }

            if (state == CircuitBreakerState.HALF_OPEN) {
                if (halfOpenInflight >= config.halfOpenMaxRequests()) {
                    permit = Permit.rejected();
                } else {
                    halfOpenInflight++;
                    permit = Permit.probe(generation);
                }
            } else {
                permit = Permit.closed(generation);
            }
        } finally {
            lock.unlock();
        }
        publishPending();
        return permit;
    }

    @Override
    public void recordSuccess(Permit permit) {
        lock.lock();
        try {
            if (isStale(permit)) {
                return;
            }
            if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                releaseProbe(permit);
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= config.successThreshold()) {
                    transitionTo(CircuitBreakerState.CLOSED);
                }
            }
        } finally {
            lock.unlock();
        }
        publishPending();
    }

    @Override
    public void recordFailure(Permit permit, Throwable throwable) {
        boolean tripped = false;
        lock.lock();
        try {
            if (isStale(permit)) {
                return;
            }
            if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    transitionTo(CircuitBreakerState.OPEN);
                    tripped = true;
                }
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                consecutiveFailures++;
                transitionTo(CircuitBreakerState.OPEN);
                tripped = true;
            }
        } finally {
            lock.unlock();
        }
        if (tripped && throwable != null) {
            log.debug("Circuit for {} tripped by {}", operationId.getValue(), throwable.toString());
        }
        publishPending();
    }

    @Override
    public void releasePermit(Permit permit) {
        lock.lock();
        try {
            if (isStale(permit)) {
                return;
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                releaseProbe(permit);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(operationId, state, consecutiveFailures, consecutiveSuccesses,
                halfOpenInflight, lastTransitionTime, lastOpenedAt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Outstanding permits become stale. A listener call is made only when the breaker was not CLOSED.</p>
     */
    @Override
    public void reset() {
        lock.lock();
        try {
            if (state != CircuitBreakerState.CLOSED) {
                transitionTo(CircuitBreakerState.CLOSED);
            } else {
                generation++;
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
                halfOpenInflight = 0;
            }
        } finally {
            lock.unlock();
        }
        log.info("Circuit for {} reset", operationId.getValue());
        publishPending();
    }

    private boolean isStale(Permit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
        return !permit.granted() || permit.generation() != generation;
    }

    private void releaseProbe(Permit permit) {
        if (permit.probe() && halfOpenInflight > 0) {
            halfOpenInflight--;
        }
    }

    // lock must be held
    private void transitionTo(CircuitBreakerState target) {
        CircuitBreakerState from = state;
        Instant now = timeSource.now();

        state = target;
        generation++;
        lastTransitionNanos = timeSource.nanoTime();
        lastTransitionTime = now;
        halfOpenInflight = 0;
        consecutiveSuccesses = 0;

        if (target == CircuitBreakerState.OPEN) {
            lastOpenedAt = now;
        } else if (target == CircuitBreakerState.CLOSED) {
            consecutiveFailures = 0;
        }
        pending.offer(new Transition(from, target, now));
    }

    private void publishPending() {
        if (pending.isEmpty()) {
            return;
        }
        publishLock.lock();
        try {
            Transition transition;
            while ((transition = pending.poll()) != null) {
                publish(transition);
            }
        } finally {
            publishLock.unlock();
        }
    }

    private void publish(Transition transition) {
        log.info("Circuit for {}: {} → {}", operationId.getValue(), transition.from(), transition.to());
        try {
            listener.onStateTransition(operationId, transition.from(), transition.to(), transition.at());
        } catch (RuntimeException e) {
            log.warn("Circuit listener failed for {} ({} → {})",
                operationId.getValue(), transition.from(), transition.to(), e);
        }
    }

    private record Transition(CircuitBreakerState from, CircuitBreakerState to, Instant at) {
    }
}
