package com.ryuqq.resilience.core.spi;

/**
 * 구조화 이벤트 수신 SPI.
 *
 * <p>구현체에서 발생한 예외는 호출 결과에 영향을 주지 않습니다 (RetryExecutor가 로그 후 무시).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResilienceEventSink {

    /**
     * 이벤트 발행.
     *
     * @param event 이벤트
     */
    void publish(ResilienceEvent event);

    /**
     * 아무것도 하지 않는 Sink.
     *
     * @return NoOp Sink
     */
    static ResilienceEventSink noop() {
        return event -> {
            // NoOp
        };
    }
}
