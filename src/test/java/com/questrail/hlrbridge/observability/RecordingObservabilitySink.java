package com.questrail.hlrbridge.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BridgeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onConnection(ConnectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMessage(MessageEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onFrameDropped(FrameDroppedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(BridgeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
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
