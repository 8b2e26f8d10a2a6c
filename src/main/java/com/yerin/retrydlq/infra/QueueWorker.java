package com.yerin.retrydlq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.retrydlq.application.JobHandler;
import com.yerin.retrydlq.domain.FailOutcome;
import com.yerin.retrydlq.domain.JobStore;
import com.yerin.retrydlq.domain.RetryDlqMetrics;
import com.yerin.retrydlq.domain.StoredJob;
import com.yerin.retrydlq.domain.WorkerOptions;
import com.yerin.retrydlq.observability.Event;
import com.yerin.retrydlq.observability.JobServiceEvents;
import com.yerin.retrydlq.observability.ObservabilityService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 큐 하나에 묶인 워커. 전용 스레드 하나로 리스 → 핸들러 실행 → 완료/실패 보고를 반복한다.
 * <p>
 * 상태 전이: IDLE → RUNNING ⇄ PAUSED → CLOSING → CLOSED.
 * 상태 변경과 이벤트 발행은 {@link #transition}에서만 일어난다.
 */
@Slf4j
public class QueueWorker<T> {

    public enum State { IDLE, RUNNING, PAUSED, CLOSING, CLOSED }

    @Getter
    private final String id;
    @Getter
    private final String queueName;
    private final Class<T> payloadType;
    private final JobHandler<T> handler;
    private final JobStore store;
    private final ObservabilityService observability;
    private final RetryDlqMetrics metrics;
    private final ObjectMapper objectMapper;
    private final WorkerOptions options;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final Object monitor = new Object();
    private ExecutorService executor; // guarded by monitor

    public QueueWorker(String id,
                       String queueName,
                       Class<T> payloadType,
                       JobHandler<T> handler,
                       JobStore store,
                       ObservabilityService observability,
                       RetryDlqMetrics metrics,
                       ObjectMapper objectMapper,
                       WorkerOptions options) {
        this.id = id;
        this.queueName = queueName;
        this.payloadType = payloadType;
        this.handler = handler;
        this.store = store;
        this.observability = observability;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.options = options;
    }

    public State getState() {
        return state.get();
    }

    public boolean isRunning() {
        State s = state.get();
        return s == State.RUNNING || s == State.PAUSED;
    }

    /**
     * 폴링 스레드를 시작한다. 이미 실행 중이면 아무 일도 하지 않는다.
     */
    public void run() {
        synchronized (monitor) {
            State s = state.get();
            if (s == State.CLOSING || s == State.CLOSED) {
                throw new IllegalStateException("worker " + id + " is closed");
            }
            if (executor != null) return;

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "retrydlq-worker-" + id);
                t.setDaemon(true);
                return t;
            });
            transition(State.IDLE, State.RUNNING);
            executor.submit(this::loop);
        }
    }

    /**
     * 새 리스를 멈추고 진행 중인 작업이 끝나기를 closeTimeout까지 기다린다.
     * 시간 안에 끝나지 않은 작업은 리스 만료 후 재전달된다.
     */
    public void close() {
        ExecutorService running;
        State previous;
        synchronized (monitor) {
            previous = state.get();
            if (previous == State.CLOSING || previous == State.CLOSED) return;
            state.set(State.CLOSING);
            running = executor;
            monitor.notifyAll();
        }

        if (running != null) {
            running.shutdown();
            try {
                if (!running.awaitTermination(options.closeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[Worker] close timeout, interrupting queue={}, worker={}", queueName, id);
                    running.shutdownNow();
                }
            } catch (InterruptedException ie) {
                running.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        transition(State.CLOSING, State.CLOSED);
    }

    private void loop() {
        while (!Thread.currentThread().isInterrupted() && !closing()) {
            try {
                if (store.isPaused(queueName)) {
                    transition(State.RUNNING, State.PAUSED);
                    idle();
                    continue;
                }
                transition(State.PAUSED, State.RUNNING);

                Optional<StoredJob> leased = store.lease(queueName, id, options.leaseDuration());
                if (leased.isEmpty()) {
                    idle();
                    continue;
                }
                process(leased.get());
            } catch (RuntimeException e) {
                log.warn("[Worker] poll loop error queue={}, worker={}, err={}", queueName, id, e.toString());
                observability.emit(JobServiceEvents.workerError(queueName, id, e));
                idle();
            }
        }
    }

    void process(StoredJob job) {
        observability.emit(JobServiceEvents.workerStarted(queueName, id, job.getId()));

        long start = System.nanoTime();
        try {
            T data = objectMapper.readValue(job.getPayloadJson(), payloadType);
            handler.handle(data);
        } catch (Throwable e) {
            // Error를 포함한 모든 핸들러 실패는 스토어에 보고된다
            onFailure(job, e);
            return;
        } finally {
            metrics.handlerTimer(queueName).record(Duration.ofNanos(System.nanoTime() - start));
        }

        if (store.complete(queueName, job.getId())) {
            metrics.incSucceeded();
            observability.emit(JobServiceEvents.jobCompleted(queueName, id, job.getId()));
        } else {
            log.warn("[Worker] lease lost before ack queue={}, jobId={}", queueName, job.getId());
        }
    }

    private void onFailure(StoredJob job, Throwable error) {
        metrics.incFailed();
        observability.emit(JobServiceEvents.jobFailed(queueName, id, job.getId(), error));

        FailOutcome outcome;
        try {
            outcome = store.fail(queueName, job, stackTrace(error), error.toString());
        } catch (RuntimeException storeError) {
            // 리스가 만료되면 리퍼가 다시 대기열로 돌려놓는다
            log.error("[Worker] failed to report failure queue={}, jobId={}", queueName, job.getId(), storeError);
            observability.emit(JobServiceEvents.workerFailed(queueName, id, storeError));
            return;
        }

        switch (outcome) {
            case DEAD_LETTERED -> {
                metrics.incDlq();
                log.warn("[Worker] DLQ queue={}, jobId={}, attempts={}, err={}",
                        queueName, job.getId(), job.attemptsAllowed(), error.toString());
            }
            case RETRY_SCHEDULED -> {
                metrics.incRetried();
                log.info("[Worker] reserved retry queue={}, jobId={}, attemptsMade={}",
                        queueName, job.getId(), job.getAttemptsMade() + 1);
            }
            case LEASE_LOST -> log.warn("[Worker] retry update lost race queue={}, jobId={}", queueName, job.getId());
        }
    }

    private boolean transition(State from, State to) {
        if (!state.compareAndSet(from, to)) return false;

        Event event = switch (to) {
            case RUNNING -> from == State.PAUSED
                    ? JobServiceEvents.workerResumed(queueName, id)
                    : JobServiceEvents.workerReady(queueName, id);
            case PAUSED -> JobServiceEvents.workerPaused(queueName, id);
            case CLOSED -> JobServiceEvents.workerClosed(queueName, id);
            case IDLE, CLOSING -> null;
        };
        if (event != null) observability.emit(event);
        return true;
    }

    private boolean closing() {
        State s = state.get();
        return s == State.CLOSING || s == State.CLOSED;
    }

    private void idle() {
        synchronized (monitor) {
            if (closing()) return;
            try {
                monitor.wait(options.pollInterval().toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
