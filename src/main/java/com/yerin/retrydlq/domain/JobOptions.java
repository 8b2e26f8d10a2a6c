package com.yerin.retrydlq.domain;

import java.time.Duration;

/**
 * 스토어가 작업 단위로 강제하는 재시도 예산.
 *
 * @param attempts 최초 실행을 포함한 최대 실행 횟수
 * @param delay    최초 실행 전 대기 (null이면 즉시)
 * @param backoff  재시도 사이 대기 (null이면 즉시 재시도)
 */
public record JobOptions(int attempts, Duration delay, BackoffOptions backoff) {

    public JobOptions {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1 but was " + attempts);
        }
        if (delay != null && delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    public static JobOptions defaults() {
        return new JobOptions(1, null, null);
    }

    public static JobOptions attempts(int attempts) {
        return new JobOptions(attempts, null, null);
    }

    public Duration delayOrZero() {
        return delay == null ? Duration.ZERO : delay;
    }
}
