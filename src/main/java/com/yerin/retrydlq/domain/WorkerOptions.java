package com.yerin.retrydlq.domain;

import java.time.Duration;
import java.util.Objects;

public record WorkerOptions(
        boolean autorun,
        Duration pollInterval,
        Duration leaseDuration,
        Duration closeTimeout
) {
    public WorkerOptions {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        Objects.requireNonNull(closeTimeout, "closeTimeout");
    }

    public static WorkerOptions defaults() {
        return new WorkerOptions(true, Duration.ofMillis(100), Duration.ofSeconds(30), Duration.ofSeconds(30));
    }

    public WorkerOptions withAutorun(boolean autorun) {
        return new WorkerOptions(autorun, pollInterval, leaseDuration, closeTimeout);
    }
}
