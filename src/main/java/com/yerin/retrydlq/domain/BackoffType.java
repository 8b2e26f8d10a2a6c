package com.yerin.retrydlq.domain;

public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
