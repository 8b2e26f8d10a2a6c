package com.yerin.retrydlq.observability;

public enum EventType {
    NOOP,
    READ,
    WRITE,
    DELETE
}
