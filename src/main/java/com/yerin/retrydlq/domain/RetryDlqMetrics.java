package com.yerin.retrydlq.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class RetryDlqMetrics {

    private final MeterRegistry registry;

    private final Counter jobAdded;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter jobRetried;
    private final Counter jobDlq;
    private final Counter jobRevived;

    public RetryDlqMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobAdded     = Counter.builder("retrydlq_jobs_added_total")
                .description("jobs enqueued").register(registry);
        this.jobSucceeded = Counter.builder("retrydlq_jobs_succeeded_total")
                .description("jobs completed by a handler").register(registry);
        this.jobFailed    = Counter.builder("retrydlq_jobs_failed_total")
                .description("handler attempts that threw").register(registry);
        this.jobRetried   = Counter.builder("retrydlq_jobs_retried_total")
                .description("jobs scheduled for another attempt").register(registry);
        this.jobDlq       = Counter.builder("retrydlq_jobs_dlq_total")
                .description("jobs moved to DLQ").register(registry);
        this.jobRevived   = Counter.builder("retrydlq_jobs_revived_total")
                .description("jobs revived from DLQ").register(registry);
    }

    public void incAdded()     { jobAdded.increment(); }
    public void incSucceeded() { jobSucceeded.increment(); }
    public void incFailed()    { jobFailed.increment(); }
    public void incRetried()   { jobRetried.increment(); }
    public void incDlq()       { jobDlq.increment(); }
    public void incRevived()   { jobRevived.increment(); }

    public Timer handlerTimer(String queueName) {
        return Timer.builder("retrydlq_handler_duration_seconds")
                .description("handler duration by queue")
                .tag("queue", queueName)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
