package com.yerin.retrydlq.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JobService와 워커가 내보내는 이벤트 정의. 이벤트 이름과 메시지 형식은 외부 대시보드가 의존한다.
 */
public final class JobServiceEvents {

    public static final String QUEUE_SCOPE = "job-service:queue";
    public static final String WORKER_SCOPE = "job-service:worker";
    public static final String JOB_SCOPE = "job-service:job";

    public static final String QUEUE_ADDED = "job-service.queue.added";
    public static final String QUEUE_PAUSED = "job-service.queue.paused";
    public static final String QUEUE_RESUMED = "job-service.queue.resumed";
    public static final String QUEUE_CLOSED = "job-service.queue.closed";
    public static final String QUEUE_ERROR = "job-service.queue.error";
    public static final String QUEUE_FAILED_READ = "job-service.queue.jobs.failed.read";

    public static final String WORKER_READY = "job-service.worker.ready";
    public static final String WORKER_STARTED = "job-service.worker.started";
    public static final String WORKER_FAILED = "job-service.worker.failed";
    public static final String WORKER_STALLED = "job-service.worker.stalled";
    public static final String WORKER_PAUSED = "job-service.worker.paused";
    public static final String WORKER_RESUMED = "job-service.worker.resumed";
    public static final String WORKER_CLOSED = "job-service.worker.closed";
    public static final String WORKER_ERROR = "job-service.worker.error";

    public static final String JOB_ADDED = "job-service.job.added";
    public static final String JOB_COMPLETED = "job-service.job.completed";
    public static final String JOB_FAILED = "job-service.job.failed";
    public static final String JOB_RETRY = "job-service.job.retry";

    private JobServiceEvents() {}

    public static Event queueAdded(String queueName) {
        return queue(QUEUE_ADDED, EventSeverity.INFO, data(
                "queueName", queueName,
                "message", "Queue with name '" + queueName + "' has been added"));
    }

    public static Event queuePaused(String queueName) {
        return queue(QUEUE_PAUSED, EventSeverity.INFO, data(
                "queueName", queueName,
                "message", "Queue '" + queueName + "' has been paused"));
    }

    public static Event queueResumed(String queueName) {
        return queue(QUEUE_RESUMED, EventSeverity.INFO, data(
                "queueName", queueName,
                "message", "Queue '" + queueName + "' has been resumed"));
    }

    public static Event queueClosed(String queueName) {
        return queue(QUEUE_CLOSED, EventSeverity.INFO, data(
                "queueName", queueName,
                "message", "Queue '" + queueName + "' has been closed"));
    }

    public static Event queueError(String queueName, Throwable err) {
        return queue(QUEUE_ERROR, EventSeverity.ERROR, data(
                "queueName", queueName,
                "error", err,
                "message", "Queue '" + queueName + "' has failed with error '" + err.getMessage() + "'"));
    }

    public static Event failedJobsRead(String queueName, List<String> failedJobIds) {
        return Event.of(EventType.READ, QUEUE_FAILED_READ, EventSeverity.TRACE, QUEUE_SCOPE, data(
                "queueName", queueName,
                "failedJobs", failedJobIds,
                "message", "Failed jobs have been read for queue with name: '" + queueName + "'"));
    }

    public static Event workerReady(String queueName, String workerId) {
        return worker(WORKER_READY, EventSeverity.INFO, data(
                "queueName", queueName,
                "workerId", workerId,
                "message", "Worker " + workerId + " for queue '" + queueName + "' is ready to process jobs"));
    }

    public static Event workerStarted(String queueName, String workerId, String jobId) {
        return worker(WORKER_STARTED, EventSeverity.INFO, data(
                "queueName", queueName,
                "workerId", workerId,
                "jobId", jobId,
                "message", "Job " + jobId + " in queue '" + queueName + "' has been started"));
    }

    public static Event workerFailed(String queueName, String workerId, Throwable err) {
        return worker(WORKER_FAILED, EventSeverity.ERROR, data(
                "queueName", queueName,
                "workerId", workerId,
                "message", "Worker " + workerId + " for queue '" + queueName
                        + "' has failed with error '" + err.getMessage() + "'",
                "error", err));
    }

    public static Event workerStalled(String queueName, String jobId) {
        return worker(WORKER_STALLED, EventSeverity.WARN, data(
                "queueName", queueName,
                "jobId", jobId,
                "message", "Job " + jobId + " in queue '" + queueName + "' has been stalled"));
    }

    public static Event workerPaused(String queueName, String workerId) {
        return worker(WORKER_PAUSED, EventSeverity.WARN, data(
                "queueName", queueName,
                "workerId", workerId,
                "message", "Worker " + workerId + " for queue '" + queueName + "' has been paused"));
    }

    public static Event workerResumed(String queueName, String workerId) {
        return worker(WORKER_RESUMED, EventSeverity.INFO, data(
                "queueName", queueName,
                "workerId", workerId,
                "message", "Worker " + workerId + " for queue '" + queueName + "' has been resumed"));
    }

    public static Event workerClosed(String queueName, String workerId) {
        return worker(WORKER_CLOSED, EventSeverity.INFO, data(
                "workerId", workerId,
                "queueName", queueName,
                "message", "Worker " + workerId + " for queue '" + queueName + "' has been closed"));
    }

    public static Event workerError(String queueName, String workerId, Throwable err) {
        return worker(WORKER_ERROR, EventSeverity.ERROR, data(
                "queueName", queueName,
                "workerId", workerId,
                "message", "Worker " + workerId + " for queue '" + queueName
                        + "' has failed with error '" + err.getMessage() + "'",
                "error", err));
    }

    public static Event jobAdded(String queueName, String jobId, Object payload) {
        return job(JOB_ADDED, EventSeverity.INFO, data(
                "jobId", jobId,
                "queueName", queueName,
                "message", "Job " + jobId + " added to queue '" + queueName + "'",
                "data", payload));
    }

    public static Event jobCompleted(String queueName, String workerId, String jobId) {
        return job(JOB_COMPLETED, EventSeverity.INFO, data(
                "queueName", queueName,
                "workerId", workerId,
                "jobId", jobId,
                "message", "Job " + jobId + " in queue '" + queueName + "' has been completed"));
    }

    public static Event jobFailed(String queueName, String workerId, String jobId, Throwable err) {
        return job(JOB_FAILED, EventSeverity.ERROR, data(
                "queueName", queueName,
                "workerId", workerId,
                "jobId", jobId,
                "message", "Job " + jobId + " in queue '" + queueName
                        + "' has failed with error '" + err.getMessage() + "'",
                "error", err));
    }

    public static Event jobRetrying(String queueName, String jobId, Object payload) {
        return job(JOB_RETRY, EventSeverity.INFO, data(
                "queueName", queueName,
                "jobId", jobId,
                "data", payload,
                "message", "Job with job id: " + jobId + " is being retried"));
    }

    private static Event queue(String name, EventSeverity severity, Map<String, Object> data) {
        return Event.of(EventType.NOOP, name, severity, QUEUE_SCOPE, data);
    }

    private static Event worker(String name, EventSeverity severity, Map<String, Object> data) {
        return Event.of(EventType.NOOP, name, severity, WORKER_SCOPE, data);
    }

    private static Event job(String name, EventSeverity severity, Map<String, Object> data) {
        return Event.of(EventType.NOOP, name, severity, JOB_SCOPE, data);
    }

    private static Map<String, Object> data(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }
}
