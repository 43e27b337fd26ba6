package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.OperationId;

/**
 * Circuit Breaker SPI.
 *
 * <p>Operation 하나에 대한 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 이미 실패 중인 의존 대상에 대한 부하를 줄입니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 제한된 probe 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Permit permit = cb.tryAcquire();
 * if (!permit.granted()) {
 *     throw new CircuitOpenException(cb.operationId(), cb.snapshot().lastOpenedAt(), 0, Duration.ZERO);
 * }
 *
 * try {
 *     Result result = externalApi.call();
 *     cb.recordSuccess(permit);
 *     return result;
 * } catch (IOException e) {
 *     cb.recordFailure(permit, e);
 *     throw e;
 * } catch (ValidationException e) {
 *     cb.releasePermit(permit);   // 분류 오류는 상태에 반영하지 않음
 *     throw e;
 * }
 * }</pre>
 *
 * <p><strong>원자성:</strong> 구현체는 상태 조회, 카운터 증가, 그에 따른 전이를
 * 하나의 원자적 단위로 적용해야 합니다. 동시 호출자가 임계값 경계를 넘어서거나
 * halfOpenMaxRequests보다 많은 probe를 허용해서는 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 Operation.
     *
     * @return Operation ID
     */
    OperationId operationId();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 허용</li>
     *   <li>OPEN: openTimeout 경과 전에는 거부, 경과 후 첫 호출은 HALF_OPEN으로 전이 후 허용</li>
     *   <li>HALF_OPEN: 진행 중 probe가 halfOpenMaxRequests 미만일 때만 허용</li>
     * </ul>
     *
     * @return 발급된 Permit ({@link Permit#granted()}가 false면 차단)
     */
    Permit tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 수 초기화</li>
     *   <li>HALF_OPEN: 연속 성공 임계값 도달 시 CLOSED로 전이</li>
     * </ul>
     *
     * @param permit tryAcquire()로 발급받은 Permit
     */
    void recordSuccess(Permit permit);

    /**
     * 재시도 대상 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 수 증가, 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param permit tryAcquire()로 발급받은 Permit
     * @param throwable 발생한 예외
     */
    void recordFailure(Permit permit, Throwable throwable);

    /**
     * 결과를 집계하지 않고 Permit만 반납.
     *
     * <p>재시도 불가로 분류된 오류나 취소된 시도처럼 상태에 영향을 주면 안 되는 경우 사용합니다.
     * HALF_OPEN probe의 진행 중 카운트만 감소합니다.</p>
     *
     * @param permit tryAcquire()로 발급받은 Permit
     */
    void releasePermit(Permit permit);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 상태와 카운터의 불변 스냅샷.
     *
     * @return 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>관리자 수동 복구 또는 테스트 목적으로 사용됩니다.
     * 모든 카운터가 초기화됩니다.</p>
     */
    void reset();
}
