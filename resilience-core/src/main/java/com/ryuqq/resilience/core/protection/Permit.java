package com.ryuqq.resilience.core.protection;

/**
 * {@link CircuitBreaker#tryAcquire()} 결과.
 *
 * <p>허용된 Permit은 시도 종료 후 반드시 {@code recordSuccess}, {@code recordFailure},
 * {@code releasePermit} 중 하나로 반납되어야 합니다.</p>
 *
 * <p>generation은 permit이 발급된 상태 구간을 식별합니다. 상태가 전이된 뒤 늦게 도착한
 * 결과가 새 HALF_OPEN 구간의 probe 집계를 오염시키지 않도록 하는 데 사용됩니다.</p>
 *
 * @param granted 통과 허용 여부
 * @param probe HALF_OPEN probe로 발급되었는지 여부
 * @param generation 발급 시점의 상태 구간 번호
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Permit(boolean granted, boolean probe, long generation) {

    private static final Permit REJECTED = new Permit(false, false, -1L);
    private static final Permit UNRESTRICTED = new Permit(true, false, 0L);

    /**
     * 거부된 Permit.
     *
     * @return granted=false
     */
    public static Permit rejected() {
        return REJECTED;
    }

    /**
     * 상태 추적 없이 항상 허용되는 Permit.
     *
     * @return granted=true, probe=false
     */
    public static Permit unrestricted() {
        return UNRESTRICTED;
    }

    /**
     * CLOSED 상태에서 발급되는 Permit.
     *
     * @param generation 상태 구간 번호
     * @return granted=true, probe=false
     */
    public static Permit closed(long generation) {
        return new Permit(true, false, generation);
    }

    /**
     * HALF_OPEN probe Permit.
     *
     * @param generation 상태 구간 번호
     * @return granted=true, probe=true
     */
    public static Permit probe(long generation) {
        return new Permit(true, true, generation);
    }
}
