package com.yerin.retrydlq.observability;

/**
 * 둘 다 null이면 모든 이벤트를 받는다.
 */
public record EventFilter(EventType eventType, String eventName) {

    public static EventFilter all() {
        return new EventFilter(null, null);
    }

    public static EventFilter named(String eventName) {
        return new EventFilter(null, eventName);
    }

    public boolean matches(Event event) {
        return (eventType == null || eventType == event.eventType())
                && (eventName == null || eventName.equals(event.eventName()));
    }

    boolean isGlobal() {
        return eventType == null && eventName == null;
    }
}
