/**
 * 외부 협력자 SPI (Service Provider Interface) 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.spi.TimeSource} - 단조 시계 및 현재 시각</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.Sleeper} - 취소 가능한 백오프 대기</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.MetricsCollector} - 메트릭 수집</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.ResilienceEventSink} - 구조화 이벤트 수신</li>
 * </ul>
 *
 * <p>모든 SPI는 테스트에서 결정적 구현으로 교체할 수 있도록 주입 방식으로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
