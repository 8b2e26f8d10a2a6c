package com.yerin.retrydlq.observability;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class DefaultObservabilityService implements ObservabilityService {

    private final List<EventHandler> globalHandlers = new CopyOnWriteArrayList<>();
    private final List<Registration> filteredHandlers = new CopyOnWriteArrayList<>();

    @Override
    public void on(EventFilter filter, EventHandler handler) {
        if (filter == null || filter.isGlobal()) {
            globalHandlers.add(handler);
        } else {
            filteredHandlers.add(new Registration(filter, handler));
        }
    }

    @Override
    public void emit(Event event) {
        for (EventHandler h : globalHandlers) {
            dispatch(h, event);
        }
        for (Registration r : filteredHandlers) {
            if (r.filter().matches(event)) {
                dispatch(r.handler(), event);
            }
        }
    }

    private void dispatch(EventHandler handler, Event event) {
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            // 관측 싱크 장애가 작업 처리로 번지면 안 된다
            log.warn("[Observability] handler failed event={}, err={}", event.eventName(), e.toString());
        }
    }

    private record Registration(EventFilter filter, EventHandler handler) {}
}
