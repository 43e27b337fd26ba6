package com.ryuqq.resilience.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Urgency Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class UrgencyTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -1, 100})
    void of_OutOfRange_ThrowsException(int level) {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Urgency.of(level)
        );
        assertTrue(exception.getMessage().contains("between 1 and 5"));
    }

    @Test
    void tier_MapsLevelsToTiers() {
        assertEquals(UrgencyTier.ROUTINE, Urgency.of(1).tier());
        assertEquals(UrgencyTier.ROUTINE, Urgency.of(2).tier());
        assertEquals(UrgencyTier.CRITICAL, Urgency.of(3).tier());
        assertEquals(UrgencyTier.CRITICAL, Urgency.of(4).tier());
        assertEquals(UrgencyTier.EMERGENCY, Urgency.of(5).tier());
    }

    @Test
    void of_SameLevel_ReturnsCachedInstance() {
        assertSame(Urgency.of(3), Urgency.of(3));
        assertSame(Urgency.emergency(), Urgency.of(5));
    }

    @Test
    void getLevel_ReturnsLevel() {
        assertEquals(4, Urgency.of(4).getLevel());
    }
}
