package com.yerin.retrydlq.domain;

import com.yerin.retrydlq.application.RetryDlqHandler;
import lombok.Builder;

import java.time.Duration;
import java.util.Objects;

/**
 * 재시도/DLQ 도메인 하나의 선언.
 * Spring 빈으로 등록하면 빈 이름이 도메인 이름이 된다.
 */
@Builder
public record RetryDlqConfig<T>(
        RetryIdentifier identifier,
        int attempts,
        Duration delay,
        BackoffOptions backoff,
        Class<T> payloadType,
        RetryDlqHandler<T> handler
) {
    public RetryDlqConfig {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(handler, "handler");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1 but was " + attempts);
        }
    }

    public JobOptions jobOptions() {
        return new JobOptions(attempts, delay, backoff);
    }
}
