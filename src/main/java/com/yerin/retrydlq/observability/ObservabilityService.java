package com.yerin.retrydlq.observability;

public interface ObservabilityService {

    /**
     * 등록된 핸들러에 이벤트를 전달한다. 호출자는 결과를 기다리거나 의존하지 않는다.
     */
    void emit(Event event);

    void on(EventFilter filter, EventHandler handler);
}
