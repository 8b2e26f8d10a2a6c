package com.yerin.retrydlq.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.retrydlq.domain.BackoffOptions;
import com.yerin.retrydlq.domain.BackoffType;
import com.yerin.retrydlq.domain.FailOutcome;
import com.yerin.retrydlq.domain.JobOptions;
import com.yerin.retrydlq.domain.JobStore;
import com.yerin.retrydlq.domain.StoredJob;
import com.yerin.retrydlq.global.exception.AppException;
import com.yerin.retrydlq.global.exception.code.CommonErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis 기반 스토어.
 * <pre>
 * {prefix}:{queue}:id         INCR 카운터
 * {prefix}:{queue}:job:{id}   작업 해시
 * {prefix}:{queue}:wait       대기 리스트 (LPUSH / RPOP)
 * {prefix}:{queue}:active     리스 중 ZSET (score = leaseUntil)
 * {prefix}:{queue}:delayed    지연 ZSET (score = dueAt)
 * {prefix}:{queue}:failed     DLQ ZSET (score = finishedOn)
 * {prefix}:{queue}:meta       paused 플래그
 * </pre>
 * 여러 키에 걸친 전이는 모두 Lua 스크립트로 원자 처리한다.
 */
@Slf4j
@Component
@Profile("!inmem")
public class RedisJobStore implements JobStore {

    private static final RedisScript<String> ADD = script("redis/add.lua", String.class);
    private static final RedisScript<String> LEASE = script("redis/lease.lua", String.class);
    private static final RedisScript<Long> COMPLETE = script("redis/complete.lua", Long.class);
    private static final RedisScript<Long> FAIL = script("redis/fail.lua", Long.class);
    private static final RedisScript<Long> RETRY = script("redis/retry.lua", Long.class);
    private static final RedisScript<String> REAP = script("redis/reap.lua", String.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final String DLQ = "-1";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String prefix;

    public RedisJobStore(StringRedisTemplate redis,
                         ObjectMapper objectMapper,
                         @Value("${retrydlq.redis.prefix:rdlq}") String prefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.prefix = prefix;
    }

    @Override
    public void ping(String queueName) {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
        log.debug("[RedisStore] ping queue={}, reply={}", queueName, pong);
    }

    @Override
    public StoredJob add(String queueName, String payloadJson, JobOptions options) {
        Instant now = Instant.now();
        long delayMs = options.delayOrZero().toMillis();
        BackoffOptions backoff = options.backoff();

        String id = redis.execute(ADD,
                List.of(key(queueName, "id"), key(queueName, "wait"), key(queueName, "delayed")),
                jobKeyPrefix(queueName),
                payloadJson,
                String.valueOf(options.attempts()),
                String.valueOf(delayMs),
                backoff == null ? "" : backoff.type().name(),
                backoff == null ? "0" : String.valueOf(backoff.delay().toMillis()),
                backoff == null ? "0" : String.valueOf(backoff.jitterRatio()),
                String.valueOf(now.toEpochMilli()),
                String.valueOf(now.toEpochMilli() + delayMs));

        log.debug("[RedisStore] add queue={}, jobId={}, delayMs={}", queueName, id, delayMs);
        return StoredJob.builder()
                .id(id)
                .queueName(queueName)
                .payloadJson(payloadJson)
                .options(options)
                .attemptsMade(0)
                .timestamp(now)
                .build();
    }

    @Override
    public Optional<StoredJob> lease(String queueName, String workerId, Duration leaseDuration) {
        long now = System.currentTimeMillis();
        String id = redis.execute(LEASE,
                List.of(key(queueName, "wait"), key(queueName, "active"),
                        key(queueName, "delayed"), key(queueName, "meta")),
                String.valueOf(now),
                String.valueOf(now + leaseDuration.toMillis()));
        if (id == null) return Optional.empty();

        Optional<StoredJob> job = find(queueName, id);
        if (job.isEmpty()) {
            log.warn("[RedisStore] leased id without job hash queue={}, jobId={}, worker={}", queueName, id, workerId);
        }
        return job;
    }

    @Override
    public boolean complete(String queueName, String jobId) {
        Long r = redis.execute(COMPLETE,
                List.of(key(queueName, "active"), jobKey(queueName, jobId)),
                jobId);
        return r != null && r == 1L;
    }

    @Override
    public FailOutcome fail(String queueName, StoredJob job, String stacktrace, String failedReason) {
        long now = System.currentTimeMillis();
        int attemptsMade = job.getAttemptsMade() + 1;
        String retryAt = attemptsMade >= job.attemptsAllowed()
                ? DLQ
                : String.valueOf(now + Backoff.delayFor(job.getOptions().backoff(), attemptsMade).toMillis());

        Long r = redis.execute(FAIL,
                List.of(key(queueName, "active"), key(queueName, "delayed"), key(queueName, "failed"),
                        key(queueName, "wait"), jobKey(queueName, job.getId())),
                job.getId(),
                String.valueOf(attemptsMade),
                toJson(job.stacktraceWith(stacktrace)),
                failedReason == null ? "" : failedReason,
                String.valueOf(now),
                retryAt);

        if (r == null || r == 0L) return FailOutcome.LEASE_LOST;
        return r == 2L ? FailOutcome.DEAD_LETTERED : FailOutcome.RETRY_SCHEDULED;
    }

    @Override
    public Optional<StoredJob> find(String queueName, String jobId) {
        Map<Object, Object> hash = redis.opsForHash().entries(jobKey(queueName, jobId));
        if (hash == null || hash.isEmpty()) return Optional.empty();
        return Optional.of(toStoredJob(queueName, jobId, hash));
    }

    @Override
    public boolean retry(String queueName, String jobId) {
        Long r = redis.execute(RETRY,
                List.of(key(queueName, "failed"), key(queueName, "wait"), jobKey(queueName, jobId)),
                jobId);
        return r != null && r == 1L;
    }

    @Override
    public List<StoredJob> getFailed(String queueName) {
        Set<String> ids = redis.opsForZSet().range(key(queueName, "failed"), 0, -1);
        if (ids == null || ids.isEmpty()) return List.of();

        List<StoredJob> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            find(queueName, id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public void pause(String queueName) {
        redis.opsForHash().put(key(queueName, "meta"), "paused", "1");
    }

    @Override
    public void resume(String queueName) {
        redis.opsForHash().delete(key(queueName, "meta"), "paused");
    }

    @Override
    public boolean isPaused(String queueName) {
        return "1".equals(redis.opsForHash().get(key(queueName, "meta"), "paused"));
    }

    @Override
    public List<String> reapExpiredLeases(String queueName, Instant now) {
        String ids = redis.execute(REAP,
                List.of(key(queueName, "active"), key(queueName, "wait")),
                String.valueOf(now.toEpochMilli()));
        if (ids == null) return List.of();
        return readIds(ids);
    }

    private StoredJob toStoredJob(String queueName, String id, Map<Object, Object> h) {
        String backoffType = str(h, "backoffType");
        BackoffOptions backoff = backoffType.isEmpty()
                ? null
                : new BackoffOptions(
                        BackoffType.valueOf(backoffType),
                        Duration.ofMillis(num(h, "backoffDelay")),
                        Double.parseDouble(str(h, "backoffJitter", "0")));
        long delayMs = num(h, "delay");
        JobOptions options = new JobOptions(
                (int) num(h, "attempts", 1),
                delayMs > 0 ? Duration.ofMillis(delayMs) : null,
                backoff);

        String finishedOn = str(h, "finishedOn");
        String failedReason = str(h, "failedReason");
        return StoredJob.builder()
                .id(id)
                .queueName(queueName)
                .payloadJson(str(h, "data"))
                .options(options)
                .attemptsMade((int) num(h, "attemptsMade"))
                .stacktrace(fromJson(str(h, "stacktrace", "[]")))
                .failedReason(failedReason.isEmpty() ? null : failedReason)
                .timestamp(Instant.ofEpochMilli(num(h, "timestamp")))
                .finishedOn(finishedOn.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(finishedOn)))
                .build();
    }

    private String toJson(List<String> stacktrace) {
        try {
            return objectMapper.writeValueAsString(stacktrace);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.INTERNAL_ERROR.withDetail("stacktrace serialization failed"), e);
        }
    }

    private List<String> fromJson(String json) {
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("[RedisStore] unreadable stacktrace field, err={}", e.toString());
            return List.of();
        }
    }

    private List<String> readIds(String json) {
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.INTERNAL_ERROR.withDetail("unreadable reap result " + json), e);
        }
    }

    private static String str(Map<Object, Object> h, String field) {
        return str(h, field, "");
    }

    private static String str(Map<Object, Object> h, String field, String fallback) {
        Object v = h.get(field);
        return v == null ? fallback : v.toString();
    }

    private static long num(Map<Object, Object> h, String field) {
        return num(h, field, 0);
    }

    private static long num(Map<Object, Object> h, String field, long fallback) {
        String v = str(h, field);
        return v.isEmpty() ? fallback : Long.parseLong(v);
    }

    private String key(String queueName, String suffix) {
        return prefix + ":" + queueName + ":" + suffix;
    }

    private String jobKeyPrefix(String queueName) {
        return key(queueName, "job:");
    }

    private String jobKey(String queueName, String jobId) {
        return jobKeyPrefix(queueName) + jobId;
    }

    private static <T> RedisScript<T> script(String path, Class<T> resultType) {
        return RedisScript.of(new ClassPathResource(path), resultType);
    }
}
