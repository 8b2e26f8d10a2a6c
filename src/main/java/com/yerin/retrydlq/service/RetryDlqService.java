package com.yerin.retrydlq.service;

import com.yerin.retrydlq.application.RetryDlqDependencies;
import com.yerin.retrydlq.domain.ConsumerIdentifier;
import com.yerin.retrydlq.domain.FailedJobEntry;
import com.yerin.retrydlq.domain.JobEntry;
import com.yerin.retrydlq.domain.ProducerIdentifier;
import com.yerin.retrydlq.domain.QueueConfig;
import com.yerin.retrydlq.domain.RetryDlqConfig;
import com.yerin.retrydlq.global.exception.AppException;
import com.yerin.retrydlq.global.exception.code.JobErrorCode;
import com.yerin.retrydlq.observability.ObservabilityService;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 컨슈머/프로듀서 실패를 재시도 큐로 보내고 DLQ 조회와 수동 복구(revive)를 제공한다.
 * <p>
 * 도메인마다 큐 하나를 {@link JobService}에 등록하며, 생명주기 연산은 자기 큐에만 적용된다.
 */
@Slf4j
public class RetryDlqService {

    private final JobService jobService;
    private final RetryDlqDependencies dependencies;
    private final Set<String> queueNames = new LinkedHashSet<>(); // guarded by itself

    public RetryDlqService(JobService jobService,
                           ObservabilityService observabilityService,
                           Map<String, RetryDlqConfig<?>> domains) {
        this.jobService = jobService;
        this.dependencies = new RetryDlqDependencies(observabilityService, jobService);

        for (Map.Entry<String, RetryDlqConfig<?>> e : domains.entrySet()) {
            register(e.getKey(), e.getValue());
        }
    }

    private <T> void register(String domain, RetryDlqConfig<T> config) {
        String queueName = config.identifier().queueName();
        QueueConfig queueConfig = QueueConfig.builder()
                .name(queueName)
                .defaultJobOptions(config.jobOptions())
                .build();

        jobService.addQueue(queueConfig, config.payloadType(),
                data -> config.handler().handle(dependencies, data));

        synchronized (queueNames) {
            queueNames.add(queueName);
        }
        log.info("[RetryDlq] domain registered domain={}, queue={}, attempts={}",
                domain, queueName, config.attempts());
    }

    public boolean start() {
        return jobService.start();
    }

    /** 자기 큐만 닫는다. 같은 JobService를 쓰는 다른 큐는 영향받지 않는다. */
    public boolean stop() {
        for (String name : getQueueNames()) {
            try {
                jobService.stopQueue(name);
            } catch (AppException e) {
                if (!JobErrorCode.QUEUE_NOT_FOUND.getCode().equals(e.getErrorCode().getCode())) throw e;
                log.debug("[RetryDlq] queue already stopped queue={}", name);
            }
        }
        synchronized (queueNames) {
            queueNames.clear();
        }
        return true;
    }

    public boolean pause() {
        for (String name : getQueueNames()) {
            if (!jobService.isPaused(name)) {
                jobService.pauseQueue(name);
            }
        }
        return true;
    }

    public boolean resume() {
        for (String name : getQueueNames()) {
            if (jobService.isPaused(name)) {
                jobService.resumeQueue(name);
            }
        }
        return true;
    }

    public <T> JobEntry<T> enqueueConsumerRetry(String topic, String consumerGroup, T data) {
        return jobService.enqueueJob(ConsumerIdentifier.queueName(topic, consumerGroup), data);
    }

    public <T> JobEntry<T> enqueueProducerRetry(String producer, T data) {
        return jobService.enqueueJob(ProducerIdentifier.queueName(producer), data);
    }

    public <T> List<FailedJobEntry<T>> getConsumerDlq(String topic, String consumerGroup) {
        return jobService.getFailedJobs(ConsumerIdentifier.queueName(topic, consumerGroup));
    }

    public <T> List<FailedJobEntry<T>> getProducerDlq(String producer) {
        return jobService.getFailedJobs(ProducerIdentifier.queueName(producer));
    }

    /**
     * 재투입만 보장한다. 재처리 결과는 {@link #getConsumerDlq}로 다시 확인해야 한다.
     */
    public <T> JobEntry<T> reviveConsumerDlq(String topic, String consumerGroup, String entryId) {
        return jobService.retryJob(ConsumerIdentifier.queueName(topic, consumerGroup), entryId);
    }

    public <T> JobEntry<T> reviveProducerDlq(String producer, String entryId) {
        return jobService.retryJob(ProducerIdentifier.queueName(producer), entryId);
    }

    public List<String> getQueueNames() {
        synchronized (queueNames) {
            return List.copyOf(queueNames);
        }
    }
}
