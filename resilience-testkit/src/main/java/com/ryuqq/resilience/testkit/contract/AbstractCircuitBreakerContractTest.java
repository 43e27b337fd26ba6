package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.config.CircuitBreakerConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.Permit;
import com.ryuqq.resilience.core.spi.TimeSource;
import com.ryuqq.resilience.testkit.support.ManualTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CircuitBreaker} implementations.
 *
 * <p>Validates the CLOSED / OPEN / HALF_OPEN transitions against a {@link ManualTimeSource}
 * so openTimeout can be crossed without waiting.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN exactly at failureThreshold, not before</li>
 *   <li>OPEN rejects every call within openTimeout</li>
 *   <li>First call after openTimeout moves to HALF_OPEN and is admitted</li>
 *   <li>HALF_OPEN admits at most halfOpenMaxRequests probes</li>
 *   <li>successThreshold probe successes close the breaker and reset counters</li>
 *   <li>Any probe failure reopens the breaker and restarts the timeout</li>
 *   <li>Stale permits from an earlier phase are ignored</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyBreakerContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Override
 *     protected CircuitBreaker createCircuitBreaker(OperationId id, CircuitBreakerConfig config, TimeSource time) {
 *         return new MyBreaker(id, config, time);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected static final OperationId OPERATION = OperationId.of("contract.breaker");

    protected ManualTimeSource clock;

    /**
     * Creates the breaker under test.
     *
     * @param operationId guarded operation
     * @param config thresholds
     * @param timeSource clock the breaker must use for openTimeout
     * @return fresh breaker in CLOSED state
     */
    protected abstract CircuitBreaker createCircuitBreaker(OperationId operationId, CircuitBreakerConfig config,
                                                           TimeSource timeSource);

    @BeforeEach
    public void setUpClock() {
        clock = new ManualTimeSource();
    }

    // ===================================================================
    // CLOSED
    // ===================================================================

    @Test
    public void testInitialState_IsClosed() {
        // Given
        CircuitBreaker cb = breaker(new CircuitBreakerConfig());

        // Then
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
        assertTrue(cb.tryAcquire().granted(), "CLOSED circuit should allow requests");
        assertEquals(OPERATION, cb.operationId());
    }

    @Test
    public void testClosed_OpensExactlyAtFailureThreshold() {
        // Given
        CircuitBreaker cb = breaker(new CircuitBreakerConfig().withFailureThreshold(5));

        // When: 4 failures
        recordFailures(cb, 4);

        // Then: still closed
        assertEquals(CircuitBreakerState.CLOSED, cb.getState(), "Circuit must not open before threshold");
        assertEquals(4, cb.snapshot().consecutiveFailures());

        // When: 5th failure
        recordFailures(cb, 1);

        // Then
        assertEquals(CircuitBreakerState.OPEN, cb.getState());
        assertEquals(clock.now(), cb.snapshot().lastTransitionTime());
        assertEquals(clock.now(), cb.snapshot().lastOpenedAt());
    }

    @Test
    public void testClosed_SuccessResetsConsecutiveFailures() {
        // Given
        CircuitBreaker cb = breaker(new CircuitBreakerConfig().withFailureThreshold(3));
        recordFailures(cb, 2);

        // When
        recordSuccesses(cb, 1);
        recordFailures(cb, 2);

        // Then
        assertEquals(CircuitBreakerState.CLOSED, cb.getState(), "Success must reset the failure streak");
        assertEquals(2, cb.snapshot().consecutiveFailures());
    }

    // ===================================================================
    // OPEN
    // ===================================================================

    @Test
    public void testOpen_RejectsWithinOpenTimeout() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(1));

        // When / Then
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(5));
            assertFalse(cb.tryAcquire().granted(), "OPEN circuit should reject requests");
        }
        assertEquals(CircuitBreakerState.OPEN, cb.getState());
    }

    @Test
    public void testOpen_AfterTimeout_NextCallMovesToHalfOpen() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(1));

        // When
        clock.advance(Duration.ofSeconds(60));
        Permit permit = cb.tryAcquire();

        // Then
        assertTrue(permit.granted(), "First call after openTimeout should be admitted");
        assertTrue(permit.probe());
        assertEquals(CircuitBreakerState.HALF_OPEN, cb.getState());
        assertEquals(1, cb.snapshot().halfOpenInflight());
    }

    // ===================================================================
    // HALF_OPEN
    // ===================================================================

    @Test
    public void testHalfOpen_AdmitsAtMostMaxRequests() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(1).withHalfOpenMaxRequests(2));
        clock.advance(Duration.ofSeconds(60));

        // When
        Permit first = cb.tryAcquire();
        Permit second = cb.tryAcquire();
        Permit third = cb.tryAcquire();

        // Then
        assertTrue(first.granted());
        assertTrue(second.granted());
        assertFalse(third.granted(), "Probe beyond halfOpenMaxRequests must be rejected");
        assertEquals(CircuitBreakerState.HALF_OPEN, cb.getState());
    }

    @Test
    public void testHalfOpen_SuccessThresholdCloses_AndResetsCounters() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(1).withSuccessThreshold(2));
        clock.advance(Duration.ofSeconds(60));

        // When: first probe succeeds
        recordSuccesses(cb, 1);

        // Then: still half-open
        assertEquals(CircuitBreakerState.HALF_OPEN, cb.getState());
        assertEquals(1, cb.snapshot().consecutiveSuccesses());

        // When: second probe succeeds
        recordSuccesses(cb, 1);

        // Then
        CircuitBreakerSnapshot snapshot = cb.snapshot();
        assertEquals(CircuitBreakerState.CLOSED, snapshot.state());
        assertEquals(0, snapshot.consecutiveFailures());
        assertEquals(0, snapshot.consecutiveSuccesses());
        assertEquals(0, snapshot.halfOpenInflight());
    }

    @Test
    public void testHalfOpen_FailureReopens_AndRestartsTimeout() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(1));
        clock.advance(Duration.ofSeconds(60));

        // When
        recordFailures(cb, 1);

        // Then
        assertEquals(CircuitBreakerState.OPEN, cb.getState());
        assertEquals(clock.now(), cb.snapshot().lastTransitionTime());

        clock.advance(Duration.ofSeconds(59));
        assertFalse(cb.tryAcquire().granted(), "Timeout must restart from the probe failure");

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cb.tryAcquire().granted());
    }

    @Test
    public void testReleasePermit_FreesProbeSlotWithoutCounting() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(1));
        clock.advance(Duration.ofSeconds(60));
        Permit probe = cb.tryAcquire();
        assertFalse(cb.tryAcquire().granted());

        // When
        cb.releasePermit(probe);

        // Then
        CircuitBreakerSnapshot snapshot = cb.snapshot();
        assertEquals(CircuitBreakerState.HALF_OPEN, snapshot.state());
        assertEquals(0, snapshot.consecutiveSuccesses());
        assertEquals(0, snapshot.halfOpenInflight());
        assertTrue(cb.tryAcquire().granted(), "Released slot should be available again");
    }

    @Test
    public void testStaleCompletion_DoesNotAffectNewerPhase() {
        // Given: a permit granted while CLOSED
        CircuitBreaker cb = breaker(new CircuitBreakerConfig().withFailureThreshold(1));
        Permit slow = cb.tryAcquire();
        recordFailures(cb, 1);
        clock.advance(Duration.ofSeconds(60));
        Permit probe = cb.tryAcquire();

        // When: the slow CLOSED-phase call completes late
        cb.recordSuccess(slow);
        cb.recordFailure(slow, new IOException("late"));

        // Then
        CircuitBreakerSnapshot snapshot = cb.snapshot();
        assertEquals(CircuitBreakerState.HALF_OPEN, snapshot.state());
        assertEquals(1, snapshot.halfOpenInflight());
        assertEquals(0, snapshot.consecutiveSuccesses());

        cb.recordSuccess(probe);
        assertEquals(1, cb.snapshot().consecutiveSuccesses());
    }

    @Test
    public void testReset_ClosesBreaker() {
        // Given
        CircuitBreaker cb = openBreaker(new CircuitBreakerConfig().withFailureThreshold(2));

        // When
        cb.reset();

        // Then
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
        assertEquals(0, cb.snapshot().consecutiveFailures());
        assertTrue(cb.tryAcquire().granted());
    }

    // ===================================================================
    // HELPERS
    // ===================================================================

    protected CircuitBreaker breaker(CircuitBreakerConfig config) {
        return createCircuitBreaker(OPERATION, config, clock);
    }

    protected CircuitBreaker openBreaker(CircuitBreakerConfig config) {
        CircuitBreaker cb = breaker(config);
        recordFailures(cb, config.failureThreshold());
        assertEquals(CircuitBreakerState.OPEN, cb.getState(), "Precondition: circuit should be OPEN");
        return cb;
    }

    protected static void recordFailures(CircuitBreaker cb, int times) {
        for (int i = 0; i < times; i++) {
            Permit permit = cb.tryAcquire();
            assertTrue(permit.granted(), "Precondition: permit should be granted");
            cb.recordFailure(permit, new IOException("failure " + i));
        }
    }

    protected static void recordSuccesses(CircuitBreaker cb, int times) {
        for (int i = 0; i < times; i++) {
            Permit permit = cb.tryAcquire();
            assertTrue(permit.granted(), "Precondition: permit should be granted");
            cb.recordSuccess(permit);
        }
    }
}
