package com.yerin.retrydlq.infra;

import com.yerin.retrydlq.domain.FailOutcome;
import com.yerin.retrydlq.domain.JobOptions;
import com.yerin.retrydlq.domain.JobStore;
import com.yerin.retrydlq.domain.StoredJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 프로세스 메모리 기반 스토어. RedisJobStore와 같은 전이 규칙을 따르지만 재시작하면 사라진다.
 */
@Slf4j
@Component
@Profile("inmem")
public class InMemoryJobStore implements JobStore {

    private final ConcurrentMap<String, QueueState> queues = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void ping(String queueName) {
        // 항상 연결되어 있음
    }

    @Override
    public StoredJob add(String queueName, String payloadJson, JobOptions options) {
        QueueState q = state(queueName);
        Instant now = clock.instant();
        synchronized (q) {
            String id = String.valueOf(q.sequence.incrementAndGet());
            StoredJob job = StoredJob.builder()
                    .id(id)
                    .queueName(queueName)
                    .payloadJson(payloadJson)
                    .options(options)
                    .attemptsMade(0)
                    .timestamp(now)
                    .build();
            q.jobs.put(id, job);
            Duration delay = options.delayOrZero();
            if (delay.isZero()) {
                q.waiting.addFirst(id);
            } else {
                q.delayed.put(id, now.plus(delay));
            }
            log.debug("[InMemoryStore] add queue={}, jobId={}", queueName, id);
            return job;
        }
    }

    @Override
    public Optional<StoredJob> lease(String queueName, String workerId, Duration leaseDuration) {
        QueueState q = state(queueName);
        Instant now = clock.instant();
        synchronized (q) {
            promoteDue(q, now);
            if (q.paused) return Optional.empty();

            String id = q.waiting.pollLast();
            if (id == null) return Optional.empty();

            q.active.put(id, now.plus(leaseDuration));
            return Optional.ofNullable(q.jobs.get(id));
        }
    }

    @Override
    public boolean complete(String queueName, String jobId) {
        QueueState q = state(queueName);
        synchronized (q) {
            if (q.active.remove(jobId) == null) return false;
            q.jobs.remove(jobId);
            return true;
        }
    }

    @Override
    public FailOutcome fail(String queueName, StoredJob job, String stacktrace, String failedReason) {
        QueueState q = state(queueName);
        Instant now = clock.instant();
        synchronized (q) {
            if (q.active.remove(job.getId()) == null) return FailOutcome.LEASE_LOST;

            StoredJob current = q.jobs.getOrDefault(job.getId(), job);
            int attemptsMade = current.getAttemptsMade() + 1;
            StoredJob.StoredJobBuilder updated = current.toBuilder()
                    .attemptsMade(attemptsMade)
                    .stacktrace(current.stacktraceWith(stacktrace))
                    .failedReason(failedReason);

            if (attemptsMade >= current.attemptsAllowed()) {
                q.jobs.put(current.getId(), updated.finishedOn(now).build());
                q.failed.put(current.getId(), now);
                return FailOutcome.DEAD_LETTERED;
            }

            q.jobs.put(current.getId(), updated.build());
            Duration wait = Backoff.delayFor(current.getOptions().backoff(), attemptsMade);
            if (wait.isZero()) {
                q.waiting.addFirst(current.getId());
            } else {
                q.delayed.put(current.getId(), now.plus(wait));
            }
            return FailOutcome.RETRY_SCHEDULED;
        }
    }

    @Override
    public Optional<StoredJob> find(String queueName, String jobId) {
        QueueState q = queues.get(queueName);
        if (q == null) return Optional.empty();
        synchronized (q) {
            return Optional.ofNullable(q.jobs.get(jobId));
        }
    }

    @Override
    public boolean retry(String queueName, String jobId) {
        QueueState q = state(queueName);
        synchronized (q) {
            if (q.failed.remove(jobId) == null) return false;
            StoredJob job = q.jobs.get(jobId);
            if (job != null) {
                q.jobs.put(jobId, job.toBuilder().finishedOn(null).failedReason(null).build());
            }
            q.waiting.addFirst(jobId);
            return true;
        }
    }

    @Override
    public List<StoredJob> getFailed(String queueName) {
        QueueState q = queues.get(queueName);
        if (q == null) return List.of();
        synchronized (q) {
            List<StoredJob> out = new ArrayList<>(q.failed.size());
            for (String id : q.failed.keySet()) {
                StoredJob job = q.jobs.get(id);
                if (job != null) out.add(job);
            }
            return out;
        }
    }

    @Override
    public void pause(String queueName) {
        QueueState q = state(queueName);
        synchronized (q) {
            q.paused = true;
        }
    }

    @Override
    public void resume(String queueName) {
        QueueState q = state(queueName);
        synchronized (q) {
            q.paused = false;
        }
    }

    @Override
    public boolean isPaused(String queueName) {
        QueueState q = queues.get(queueName);
        if (q == null) return false;
        synchronized (q) {
            return q.paused;
        }
    }

    @Override
    public List<String> reapExpiredLeases(String queueName, Instant now) {
        QueueState q = queues.get(queueName);
        if (q == null) return List.of();
        synchronized (q) {
            List<String> reaped = new ArrayList<>();
            q.active.entrySet().removeIf(e -> {
                if (e.getValue().isAfter(now)) return false;
                reaped.add(e.getKey());
                return true;
            });
            // 만료된 작업은 다음 리스 대상이 되도록 꼬리 쪽에 넣는다
            reaped.forEach(q.waiting::addLast);
            return reaped;
        }
    }

    private QueueState state(String queueName) {
        return queues.computeIfAbsent(queueName, k -> new QueueState());
    }

    private static void promoteDue(QueueState q, Instant now) {
        if (q.delayed.isEmpty()) return;
        List<Map.Entry<String, Instant>> due = new ArrayList<>();
        for (Map.Entry<String, Instant> e : q.delayed.entrySet()) {
            if (!e.getValue().isAfter(now)) due.add(e);
        }
        due.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));
        for (Map.Entry<String, Instant> e : due) {
            q.delayed.remove(e.getKey());
            q.waiting.addFirst(e.getKey());
        }
    }

    private static final class QueueState {
        final AtomicLong sequence = new AtomicLong();
        final Map<String, StoredJob> jobs = new HashMap<>();
        final Deque<String> waiting = new ArrayDeque<>();
        final Map<String, Instant> active = new HashMap<>();
        final Map<String, Instant> delayed = new HashMap<>();
        final Map<String, Instant> failed = new LinkedHashMap<>();
        boolean paused;
    }
}
