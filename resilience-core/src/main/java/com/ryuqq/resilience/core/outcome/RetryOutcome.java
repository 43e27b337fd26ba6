package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.exception.ResilienceException;

import java.time.Duration;

/**
 * 보호된 호출 한 번의 최종 결과.
 *
 * <p>RetryOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 어느 시도에서든 성공하여 값을 얻음</li>
 *   <li>{@link Fail}: 최종 오류로 종료 (소진, 재시도 불가, Circuit OPEN, 취소)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryOutcome<Report> outcome = manager.execute(op, "report.render", Urgency.of(2), token);
 * if (outcome instanceof Fail<Report> fail && fail.error().kind() == TerminalKind.CIRCUIT_OPEN) {
 *     return cachedReport();
 * }
 * return outcome.getOrThrow();
 * }</pre>
 *
 * @param <T> 결과 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface RetryOutcome<T> permits Ok, Fail {

    /**
     * 실제로 Operation을 호출한 횟수.
     *
     * @return 시도 횟수
     */
    int attempts();

    /**
     * 첫 시도부터 종료까지 경과 시간.
     *
     * @return 경과 시간
     */
    Duration elapsed();

    /**
     * 성공 값을 반환하거나 최종 오류를 던짐.
     *
     * @return 성공 값 (Operation이 null을 반환했다면 null)
     * @throws ResilienceException 최종 오류로 종료된 경우
     */
    T getOrThrow();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
