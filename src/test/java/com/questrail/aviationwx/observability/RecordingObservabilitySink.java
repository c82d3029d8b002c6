package com.questrail.aviationwx.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ReportObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onReportDecoded(ReportDecodedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onFieldDefect(FieldDefectEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ReportErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> getEvents(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
