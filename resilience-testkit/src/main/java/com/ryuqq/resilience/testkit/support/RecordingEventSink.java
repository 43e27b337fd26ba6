package com.ryuqq.resilience.testkit.support;

import com.ryuqq.resilience.core.spi.EventOutcome;
import com.ryuqq.resilience.core.spi.ResilienceEvent;
import com.ryuqq.resilience.core.spi.ResilienceEventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Event sink that keeps every published event for assertions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingEventSink implements ResilienceEventSink {

    private final List<ResilienceEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(ResilienceEvent event) {
        events.add(event);
    }

    public List<ResilienceEvent> events() {
        return new ArrayList<>(events);
    }

    public List<EventOutcome> outcomes() {
        return events.stream().map(ResilienceEvent::outcome).collect(Collectors.toList());
    }

    public long count(EventOutcome outcome) {
        return events.stream().filter(event -> event.outcome() == outcome).count();
    }

    /**
     * Most recent event.
     *
     * @return last event
     * @throws IllegalStateException if nothing was published
     */
    public ResilienceEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("No events recorded");
        }
        return events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
    }
}
