package com.questrail.menton.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements MentonObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onRunCompleted(RunCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRunFailed(RunFailedEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<RunFailedEvent> getFailures() {
        return events.stream()
            .filter(e -> e instanceof RunFailedEvent)
            .map(e -> (RunFailedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<RunCompletedEvent> getCompletions() {
        return events.stream()
            .filter(e -> e instanceof RunCompletedEvent)
            .map(e -> (RunCompletedEvent) e)
            .collect(Collectors.toList());
    }
}
