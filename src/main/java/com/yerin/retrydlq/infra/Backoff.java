package com.yerin.retrydlq.infra;

import com.yerin.retrydlq.domain.BackoffOptions;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private static final long MAX_BACKOFF_MILLIS = Duration.ofDays(1).toMillis();

    private Backoff() {}

    /**
     * attemptsMade번 실패한 작업이 다음 시도 전까지 기다릴 시간.
     */
    public static Duration delayFor(BackoffOptions backoff, int attemptsMade) {
        if (backoff == null) return Duration.ZERO;
        long base = backoff.delay().toMillis();
        return switch (backoff.type()) {
            case FIXED -> jitter(base, backoff.jitterRatio());
            case EXPONENTIAL -> expJitter(attemptsMade - 1, base, MAX_BACKOFF_MILLIS, backoff.jitterRatio());
        };
    }

    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio) {
        long exp = (long)(baseMillis * Math.pow(2, Math.max(0, retryCount)));
        long capped = Math.min(exp, capMillis);
        return jitter(capped, jitterRatio);
    }

    private static Duration jitter(long millis, double jitterRatio) {
        if (jitterRatio <= 0) return Duration.ofMillis(millis);
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio; // 1±r
        return Duration.ofMillis(Math.max(0, (long)(millis * factor)));
    }
}
