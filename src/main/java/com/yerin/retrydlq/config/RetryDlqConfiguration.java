package com.yerin.retrydlq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.retrydlq.domain.JobStore;
import com.yerin.retrydlq.domain.RetryDlqConfig;
import com.yerin.retrydlq.domain.RetryDlqMetrics;
import com.yerin.retrydlq.domain.WorkerOptions;
import com.yerin.retrydlq.observability.DefaultObservabilityService;
import com.yerin.retrydlq.observability.EventFilter;
import com.yerin.retrydlq.observability.EventLogger;
import com.yerin.retrydlq.observability.ObservabilityService;
import com.yerin.retrydlq.service.JobService;
import com.yerin.retrydlq.service.RetryDlqService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

/**
 * 재시도 도메인은 {@link RetryDlqConfig} 타입 빈으로 선언한다. 빈 이름이 도메인 이름이 된다.
 */
@Slf4j
@Configuration
public class RetryDlqConfiguration {

    @Bean
    public WorkerOptions workerOptions(
            @Value("${retrydlq.worker.autorun:true}") boolean autorun,
            @Value("${retrydlq.worker.pollMillis:100}") long pollMillis,
            @Value("${retrydlq.worker.leaseSeconds:30}") long leaseSeconds,
            @Value("${retrydlq.worker.closeTimeoutSeconds:30}") long closeTimeoutSeconds) {
        return new WorkerOptions(
                autorun,
                Duration.ofMillis(pollMillis),
                Duration.ofSeconds(leaseSeconds),
                Duration.ofSeconds(closeTimeoutSeconds));
    }

    @Bean
    public ObservabilityService observabilityService() {
        DefaultObservabilityService service = new DefaultObservabilityService();
        service.on(EventFilter.all(), new EventLogger());
        return service;
    }

    @Bean(destroyMethod = "stop")
    public JobService jobService(JobStore jobStore,
                                 ObservabilityService observabilityService,
                                 RetryDlqMetrics metrics,
                                 ObjectMapper objectMapper,
                                 WorkerOptions workerOptions) {
        return new JobService(jobStore, observabilityService, metrics, objectMapper, workerOptions);
    }

    /**
     * 도메인 선언이 하나도 없으면 빈 맵이 주입된다.
     */
    @Bean(destroyMethod = "stop")
    public RetryDlqService retryDlqService(JobService jobService,
                                           ObservabilityService observabilityService,
                                           Map<String, RetryDlqConfig<?>> domains) {
        log.info("[RetryDlq] domains={}", domains.keySet());
        return new RetryDlqService(jobService, observabilityService, domains);
    }
}
