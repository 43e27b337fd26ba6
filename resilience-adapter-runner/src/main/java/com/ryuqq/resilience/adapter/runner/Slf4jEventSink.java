package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.spi.EventOutcome;
import com.ryuqq.resilience.core.spi.ResilienceEvent;
import com.ryuqq.resilience.core.spi.ResilienceEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ResilienceEvent를 구조화된 로그 한 줄로 남기는 Sink.
 *
 * <p>운영 환경에서 별도 수집기가 없을 때 사용합니다.
 * 종료 실패(EXHAUSTED, NON_RETRYABLE, CIRCUIT_OPEN)는 INFO, 나머지는 DEBUG로 기록합니다.
 * 취소는 실패가 아니므로 DEBUG입니다.</p>
 *
 * <pre>
 * resilience event op=bedrock.invoke urgency=5 attempt=2 outcome=RETRY_SCHEDULED delayMs=212 error=IOException
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Slf4jEventSink implements ResilienceEventSink {

    private static final Logger log = LoggerFactory.getLogger(Slf4jEventSink.class);

    @Override
    public void publish(ResilienceEvent event) {
        if (event.outcome().isTerminal() && event.outcome() != EventOutcome.CANCELLED) {
            if (log.isInfoEnabled()) {
                log.info(format(event));
            }
        } else if (log.isDebugEnabled()) {
            log.debug(format(event));
        }
    }

    static String format(ResilienceEvent event) {
        StringBuilder sb = new StringBuilder("resilience event op=")
            .append(event.operationId().getValue())
            .append(" urgency=").append(event.urgency() == null ? "-" : event.urgency().getLevel())
            .append(" attempt=").append(event.attempt())
            .append(" outcome=").append(event.outcome());
        if (!event.delay().isZero()) {
            sb.append(" delayMs=").append(event.delay().toMillis());
        }
        if (event.error() != null) {
            sb.append(" error=").append(event.error().getClass().getSimpleName());
        }
        return sb.toString();
    }
}
