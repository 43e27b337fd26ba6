package com.ryuqq.resilience.core.model;

/**
 * 호출자가 선언한 긴급도 (1~5).
 *
 * <p>값이 클수록 시간에 민감한 작업입니다. 5는 응급 작업을 의미합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Urgency {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;

    private static final Urgency[] CACHE = new Urgency[MAX_LEVEL + 1];

    static {
        for (int level = MIN_LEVEL; level <= MAX_LEVEL; level++) {
            CACHE[level] = new Urgency(level);
        }
    }

    private final int level;

    private Urgency(int level) {
        this.level = level;
    }

    /**
     * 긴급도 생성.
     *
     * @param level 긴급도 (1~5)
     * @return Urgency 인스턴스
     * @throws IllegalArgumentException level이 범위를 벗어난 경우
     */
    public static Urgency of(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException(
                String.format("urgency level must be between %d and %d (current: %d)", MIN_LEVEL, MAX_LEVEL, level)
            );
        }
        return CACHE[level];
    }

    /**
     * 응급 긴급도 (5).
     *
     * @return 긴급도 5
     */
    public static Urgency emergency() {
        return CACHE[MAX_LEVEL];
    }

    public int getLevel() {
        return level;
    }

    /**
     * 긴급도가 속한 등급 조회.
     *
     * @return ROUTINE(1~2), CRITICAL(3~4), EMERGENCY(5)
     */
    public UrgencyTier tier() {
        if (level == MAX_LEVEL) {
            return UrgencyTier.EMERGENCY;
        }
        if (level >= 3) {
            return UrgencyTier.CRITICAL;
        }
        return UrgencyTier.ROUTINE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return level == ((Urgency) o).level;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(level);
    }

    @Override
    public String toString() {
        return "Urgency{" + level + '}';
    }
}
