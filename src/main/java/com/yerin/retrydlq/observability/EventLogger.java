package com.yerin.retrydlq.observability;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 모든 이벤트를 심각도에 맞는 로그 레벨로 남긴다.
 */
@Slf4j
public class EventLogger implements EventHandler {

    @Override
    public void handle(Event event) {
        Throwable error = event.data("error") instanceof Throwable t ? t : null;
        String line = format(event);
        switch (event.eventSeverity()) {
            case ERROR -> log.error(line, error);
            case WARN -> log.warn(line, error);
            case INFO -> log.info(line);
            case DEBUG -> log.debug(line);
            case TRACE -> log.trace(line);
        }
    }

    static String format(Event event) {
        String data = event.eventData().entrySet().stream()
                .filter(e -> !"error".equals(e.getKey()))
                .map(EventLogger::pair)
                .collect(Collectors.joining(", "));
        return "[" + event.eventScope() + "] " + event.eventName() + " " + data;
    }

    private static String pair(Map.Entry<String, Object> e) {
        return e.getKey() + "=" + e.getValue();
    }
}
