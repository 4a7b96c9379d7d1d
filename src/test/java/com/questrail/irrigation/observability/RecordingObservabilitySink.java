package com.questrail.irrigation.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements IrrigationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onZoneTransition(ZoneTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onScheduleEvent(ScheduleEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(IrrigationErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ZoneTransitionEvent> getZoneTransitions() {
        return events.stream()
            .filter(e -> e instanceof ZoneTransitionEvent)
            .map(e -> (ZoneTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<IrrigationErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof IrrigationErrorEvent)
            .map(e -> (IrrigationErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasScheduleEvent(ScheduleEvent.Kind kind) {
        return events.stream()
            .anyMatch(e -> e instanceof ScheduleEvent && ((ScheduleEvent) e).kind() == kind);
    }

    public synchronized long countScheduleEvents(ScheduleEvent.Kind kind) {
        return events.stream()
            .filter(e -> e instanceof ScheduleEvent && ((ScheduleEvent) e).kind() == kind)
            .count();
    }

    public synchronized void clear() {
        events.clear();
    }
}
