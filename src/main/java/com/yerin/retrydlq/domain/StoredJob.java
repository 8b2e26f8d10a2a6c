package com.yerin.retrydlq.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Builder(toBuilder = true)
@ToString(exclude = "stacktrace")
public class StoredJob {

    /** 시도별 스택트레이스는 최근 것만 보관한다. */
    public static final int STACKTRACE_LIMIT = 10;

    private final String id;
    private final String queueName;
    private final String payloadJson;
    private final JobOptions options;
    private final int attemptsMade;

    @Builder.Default
    private final List<String> stacktrace = List.of();

    private final String failedReason;
    private final Instant timestamp;
    private final Instant finishedOn;

    public int attemptsAllowed() {
        return options.attempts();
    }

    public List<String> stacktraceWith(String entry) {
        List<String> next = new ArrayList<>(stacktrace);
        next.add(entry);
        while (next.size() > STACKTRACE_LIMIT) {
            next.remove(0);
        }
        return List.copyOf(next);
    }
}
