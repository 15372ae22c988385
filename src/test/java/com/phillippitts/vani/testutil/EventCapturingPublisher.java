package com.phillippitts.vani.testutil;

import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * @return captured events of the given type, in publication order
     */
    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
