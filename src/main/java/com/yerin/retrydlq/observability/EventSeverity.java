package com.yerin.retrydlq.observability;

public enum EventSeverity {
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE
}
