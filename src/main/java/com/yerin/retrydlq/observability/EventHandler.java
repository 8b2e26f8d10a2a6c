package com.yerin.retrydlq.observability;

@FunctionalInterface
public interface EventHandler {
    void handle(Event event);
}
