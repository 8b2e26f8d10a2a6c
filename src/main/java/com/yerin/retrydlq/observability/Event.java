package com.yerin.retrydlq.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 관측 이벤트. eventData는 삽입 순서를 유지한 읽기 전용 맵이다.
 */
public record Event(
        EventType eventType,
        String eventName,
        EventSeverity eventSeverity,
        String eventScope,
        Map<String, Object> eventData,
        Instant eventTimestamp
) {
    public Event {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(eventSeverity, "eventSeverity");
        eventData = eventData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
        eventTimestamp = eventTimestamp == null ? Instant.now() : eventTimestamp;
    }

    public static Event of(EventType type, String name, EventSeverity severity, String scope,
                           Map<String, Object> data) {
        return new Event(type, name, severity, scope, data, Instant.now());
    }

    public Object data(String key) {
        return eventData.get(key);
    }
}
