package com.yerin.retrydlq.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * 재시도 사이 대기 정책.
 * FIXED는 매번 delay, EXPONENTIAL은 delay * 2^(attemptsMade-1).
 */
public record BackoffOptions(BackoffType type, Duration delay, double jitterRatio) {

    public BackoffOptions {
        Objects.requireNonNull(type, "type");
        delay = delay == null ? Duration.ZERO : delay;
        if (delay.isNegative()) {
            throw new IllegalArgumentException("backoff delay must not be negative");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
        }
    }

    public static BackoffOptions fixed(Duration delay) {
        return new BackoffOptions(BackoffType.FIXED, delay, 0.0);
    }

    public static BackoffOptions exponential(Duration delay) {
        return new BackoffOptions(BackoffType.EXPONENTIAL, delay, 0.0);
    }

    public BackoffOptions withJitter(double ratio) {
        return new BackoffOptions(type, delay, ratio);
    }
}
