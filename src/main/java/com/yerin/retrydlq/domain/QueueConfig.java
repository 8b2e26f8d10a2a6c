package com.yerin.retrydlq.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class QueueConfig {

    private final String name;

    @Builder.Default
    private final int numWorkers = 1;

    @Builder.Default
    private final JobOptions defaultJobOptions = JobOptions.defaults();

    // null이면 JobService 기본값 사용
    private final WorkerOptions workerOptions;
}
