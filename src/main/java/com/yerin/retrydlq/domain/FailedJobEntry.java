package com.yerin.retrydlq.domain;

import java.util.List;

/**
 * DLQ에 머물러 있는 작업.
 *
 * @param stacktrace      시도별 스택트레이스 (오래된 것부터)
 * @param attemptsMade    지금까지 실행한 횟수
 * @param attemptsAllowed 큐 설정상 허용된 최대 실행 횟수
 */
public record FailedJobEntry<T>(
        String id,
        T data,
        List<String> stacktrace,
        int attemptsMade,
        int attemptsAllowed
) {
    public FailedJobEntry {
        stacktrace = stacktrace == null ? List.of() : List.copyOf(stacktrace);
    }

    public JobEntry<T> entry() {
        return new JobEntry<>(id, data);
    }
}
