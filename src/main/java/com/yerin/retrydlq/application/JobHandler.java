package com.yerin.retrydlq.application;

@FunctionalInterface
public interface JobHandler<T> {
    void handle(T data) throws Exception;
}
