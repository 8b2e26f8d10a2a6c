package com.yerin.retrydlq.support;

import com.yerin.retrydlq.observability.Event;
import com.yerin.retrydlq.observability.EventHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 테스트에서 발행된 이벤트를 순서대로 모은다.
 */
public class RecordingEvents implements EventHandler {

    private final List<Event> events = new CopyOnWriteArrayList<>();

    @Override
    public void handle(Event event) {
        events.add(event);
    }

    public List<Event> all() {
        return List.copyOf(events);
    }

    public List<String> names() {
        return events.stream().map(Event::eventName).toList();
    }

    public List<Event> named(String eventName) {
        return events.stream().filter(e -> e.eventName().equals(eventName)).toList();
    }

    public long count(String eventName) {
        return events.stream().filter(e -> e.eventName().equals(eventName)).count();
    }
}
