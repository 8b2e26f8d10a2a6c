package com.yerin.retrydlq.application;

import com.yerin.retrydlq.observability.ObservabilityService;
import com.yerin.retrydlq.service.JobService;

/**
 * 재시도 핸들러가 사용할 수 있는 협력 객체 묶음. 큐 등록 시점에 핸들러에 바인딩된다.
 */
public record RetryDlqDependencies(
        ObservabilityService observabilityService,
        JobService jobService
) {
}
