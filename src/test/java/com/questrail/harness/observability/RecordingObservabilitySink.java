package com.questrail.harness.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements HarnessObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ConductorStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCallEvent(CallObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSignal(SignalObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(HarnessErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ConductorStateTransitionEvent> getStateTransitions() {
        return eventsOfType(ConductorStateTransitionEvent.class);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
