package com.yerin.retrydlq.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.retrydlq.application.JobHandler;
import com.yerin.retrydlq.domain.FailedJobEntry;
import com.yerin.retrydlq.domain.JobEntry;
import com.yerin.retrydlq.domain.JobStore;
import com.yerin.retrydlq.domain.QueueConfig;
import com.yerin.retrydlq.domain.RetryDlqMetrics;
import com.yerin.retrydlq.domain.StoredJob;
import com.yerin.retrydlq.domain.WorkerOptions;
import com.yerin.retrydlq.global.exception.AppException;
import com.yerin.retrydlq.global.exception.code.CommonErrorCode;
import com.yerin.retrydlq.global.exception.code.JobErrorCode;
import com.yerin.retrydlq.infra.QueueWorker;
import com.yerin.retrydlq.infra.WorkerId;
import com.yerin.retrydlq.observability.JobServiceEvents;
import com.yerin.retrydlq.observability.ObservabilityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 이름 붙은 큐와 워커 풀의 생명주기 관리.
 * <p>
 * 재시도 횟수, backoff, DLQ 이동은 {@link JobStore}가 결정한다. 이 클래스는 큐 등록/해제와
 * 작업 투입만 담당하며 payload 의미는 알지 못한다.
 * <p>
 * 레지스트리는 하나의 락으로 보호된다. 종료 중인 큐는 stopQueue가 끝날 때까지 이름을 점유하고
 * 새 작업 투입은 {@link JobErrorCode#QUEUE_CLOSING}으로 거절한다.
 * <p>
 * 저장소 접근 오류({@link DataAccessException})는 queue.error 이벤트를 남긴 뒤
 * {@link JobErrorCode#STORE_UNAVAILABLE}로 바뀐다.
 */
@Slf4j
public class JobService {

    private final JobStore store;
    private final ObservabilityService observability;
    private final RetryDlqMetrics metrics;
    private final ObjectMapper objectMapper;
    private final WorkerOptions defaultWorkerOptions;

    private final Map<String, QueueHandle<?>> queues = new LinkedHashMap<>(); // guarded by registryLock
    private final Object registryLock = new Object();

    public JobService(JobStore store,
                      ObservabilityService observability,
                      RetryDlqMetrics metrics,
                      ObjectMapper objectMapper,
                      WorkerOptions defaultWorkerOptions) {
        this.store = store;
        this.observability = observability;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.defaultWorkerOptions = defaultWorkerOptions;
    }

    /** 실행 중이 아닌 워커를 모두 시작한다. */
    public boolean start() {
        int started = 0;
        for (QueueHandle<?> q : snapshot()) {
            if (q.isClosing()) continue;
            for (QueueWorker<?> w : q.getWorkers()) {
                if (w.getState() == QueueWorker.State.IDLE) {
                    w.run();
                    started++;
                }
            }
        }
        log.info("[JobService] start queues={}, startedWorkers={}", getQueueNames().size(), started);
        return true;
    }

    public boolean pause() {
        for (QueueHandle<?> q : snapshot()) {
            if (q.isClosing()) continue;
            if (!storeCall(q.getName(), () -> store.isPaused(q.getName()))) {
                pauseQueue(q.getName());
            }
        }
        return true;
    }

    public boolean resume() {
        for (QueueHandle<?> q : snapshot()) {
            if (q.isClosing()) continue;
            if (storeCall(q.getName(), () -> store.isPaused(q.getName()))) {
                resumeQueue(q.getName());
            }
        }
        return true;
    }

    /** 모든 큐를 닫고 레지스트리를 비운다. */
    public boolean stop() {
        for (QueueHandle<?> q : snapshot()) {
            try {
                stopQueue(q.getName());
            } catch (AppException e) {
                // 다른 스레드가 먼저 닫은 경우
                log.debug("[JobService] skip stop name={}, reason={}", q.getName(), e.getMessage());
            }
        }
        synchronized (registryLock) {
            queues.clear();
        }
        log.info("[JobService] stopped");
        return true;
    }

    public <T> AddQueueResult<T> addQueue(QueueConfig config, Class<T> payloadType, JobHandler<T> handler) {
        validate(config);
        String name = config.getName();

        storeRun(name, () -> store.ping(name));

        WorkerOptions workerOptions = config.getWorkerOptions() != null
                ? config.getWorkerOptions()
                : defaultWorkerOptions;

        List<QueueWorker<T>> workers = new ArrayList<>(config.getNumWorkers());
        for (int i = 0; i < config.getNumWorkers(); i++) {
            workers.add(new QueueWorker<>(WorkerId.next(i), name, payloadType, handler,
                    store, observability, metrics, objectMapper, workerOptions));
        }
        QueueHandle<T> handle = new QueueHandle<>(config, payloadType, handler, workers);

        synchronized (registryLock) {
            if (queues.containsKey(name)) {
                throw new AppException(JobErrorCode.QUEUE_ALREADY_EXISTS
                        .withDetail("Queue '" + name + "' already exists"));
            }
            queues.put(name, handle);
        }

        if (workerOptions.autorun()) {
            handle.getWorkers().forEach(QueueWorker::run);
        }
        observability.emit(JobServiceEvents.queueAdded(name));
        log.info("[JobService] queue added name={}, workers={}, attempts={}",
                name, config.getNumWorkers(), config.getDefaultJobOptions().attempts());
        return new AddQueueResult<>(handle, handle.getWorkers());
    }

    /**
     * 워커를 등록 순서대로 닫은 뒤 큐를 닫는다. 반환 시점에는 이 큐에서 실행 중인 작업이 없다.
     */
    public boolean stopQueue(String name) {
        QueueHandle<?> handle;
        synchronized (registryLock) {
            handle = queues.get(name);
            if (handle == null || !handle.beginClose()) {
                throw queueNotFound(name);
            }
        }

        for (QueueWorker<?> w : handle.getWorkers()) {
            w.close();
        }

        synchronized (registryLock) {
            queues.remove(name, handle);
        }
        observability.emit(JobServiceEvents.queueClosed(name));
        log.info("[JobService] queue closed name={}", name);
        return true;
    }

    public boolean pauseQueue(String name) {
        requireQueue(name);
        storeRun(name, () -> store.pause(name));
        observability.emit(JobServiceEvents.queuePaused(name));
        return true;
    }

    public boolean resumeQueue(String name) {
        requireQueue(name);
        storeRun(name, () -> store.resume(name));
        observability.emit(JobServiceEvents.queueResumed(name));
        return true;
    }

    public boolean isPaused(String name) {
        requireQueue(name);
        return storeCall(name, () -> store.isPaused(name));
    }

    public <T> JobEntry<T> enqueueJob(String name, T data) {
        QueueHandle<?> handle = requireOpenQueue(name);
        String payloadJson = toJson(data);

        StoredJob job = storeCall(name, () -> store.add(name, payloadJson, handle.getConfig().getDefaultJobOptions()));
        metrics.incAdded();
        observability.emit(JobServiceEvents.jobAdded(name, job.getId(), data));
        return new JobEntry<>(job.getId(), data);
    }

    /**
     * DLQ에 있는 작업을 다시 대기열로 보낸다. 재투입 성공 시점에 반환하며 실제 처리 결과는 기다리지 않는다.
     */
    public <T> JobEntry<T> retryJob(String name, String jobId) {
        QueueHandle<?> handle = requireOpenQueue(name);
        StoredJob job = storeCall(name, () -> store.find(name, jobId))
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND
                        .withDetail("Job '" + jobId + "' not found in queue '" + name + "'")));
        T data = decode(handle, job.getPayloadJson());

        if (!storeCall(name, () -> store.retry(name, jobId))) {
            throw new AppException(JobErrorCode.JOB_NOT_IN_DLQ
                    .withDetail("Job '" + jobId + "' in queue '" + name + "' is not in the dead-letter set"));
        }
        metrics.incRevived();
        observability.emit(JobServiceEvents.jobRetrying(name, jobId, data));
        return new JobEntry<>(jobId, data);
    }

    /** 등록되지 않은 큐면 빈 목록. 큐 생성 전에 폴링해도 안전하다. */
    public <T> List<FailedJobEntry<T>> getFailedJobs(String name) {
        QueueHandle<?> handle = findQueue(name);
        if (handle == null) return List.of();

        List<StoredJob> failed = storeCall(name, () -> store.getFailed(name));
        observability.emit(JobServiceEvents.failedJobsRead(name,
                failed.stream().map(StoredJob::getId).toList()));

        List<FailedJobEntry<T>> out = new ArrayList<>(failed.size());
        for (StoredJob j : failed) {
            T data = decode(handle, j.getPayloadJson());
            out.add(new FailedJobEntry<>(
                    j.getId(),
                    data,
                    j.getStacktrace(),
                    j.getAttemptsMade(),
                    j.attemptsAllowed()));
        }
        return out;
    }

    /** 리스가 만료된 작업을 재전달 대상으로 되돌린다. */
    public int reapExpiredLeases() {
        Instant now = Instant.now();
        int reaped = 0;
        for (QueueHandle<?> q : snapshot()) {
            List<String> ids = storeCall(q.getName(), () -> store.reapExpiredLeases(q.getName(), now));
            for (String id : ids) {
                observability.emit(JobServiceEvents.workerStalled(q.getName(), id));
            }
            reaped += ids.size();
        }
        return reaped;
    }

    public List<String> getQueueNames() {
        synchronized (registryLock) {
            return List.copyOf(queues.keySet());
        }
    }

    private List<QueueHandle<?>> snapshot() {
        synchronized (registryLock) {
            return new ArrayList<>(queues.values());
        }
    }

    private QueueHandle<?> findQueue(String name) {
        synchronized (registryLock) {
            return queues.get(name);
        }
    }

    private QueueHandle<?> requireQueue(String name) {
        QueueHandle<?> handle = findQueue(name);
        if (handle == null) throw queueNotFound(name);
        return handle;
    }

    private QueueHandle<?> requireOpenQueue(String name) {
        QueueHandle<?> handle = requireQueue(name);
        if (handle.isClosing()) {
            throw new AppException(JobErrorCode.QUEUE_CLOSING
                    .withDetail("Queue '" + name + "' is closing"));
        }
        return handle;
    }

    private <R> R storeCall(String queueName, Supplier<R> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            observability.emit(JobServiceEvents.queueError(queueName, e));
            throw new AppException(JobErrorCode.STORE_UNAVAILABLE
                    .withDetail("Job store unavailable for queue '" + queueName + "'"), e);
        }
    }

    private void storeRun(String queueName, Runnable call) {
        storeCall(queueName, () -> {
            call.run();
            return null;
        });
    }

    /** 큐에 등록된 payload 타입으로 역직렬화한다. 호출자의 T는 등록 타입과 같아야 한다. */
    private <T> T decode(QueueHandle<?> handle, String json) {
        return (T) fromJson(json, handle.getPayloadType());
    }

    private static AppException queueNotFound(String name) {
        return new AppException(JobErrorCode.QUEUE_NOT_FOUND.withDetail("Queue '" + name + "' not found"));
    }

    private static void validate(QueueConfig config) {
        if (config == null || config.getName() == null || config.getName().isBlank()) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail("queue name is required"));
        }
        if (config.getNumWorkers() < 1) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER
                    .withDetail("numWorkers must be >= 1 but was " + config.getNumWorkers()));
        }
        if (config.getDefaultJobOptions() == null) {
            throw new AppException(CommonErrorCode.INVALID_PARAMETER.withDetail("defaultJobOptions is required"));
        }
    }

    private String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new AppException(JobErrorCode.PAYLOAD_NOT_SERIALIZABLE, e);
        }
    }

    private Object fromJson(String json, Class<?> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AppException(JobErrorCode.PAYLOAD_NOT_SERIALIZABLE, e);
        }
    }
}
