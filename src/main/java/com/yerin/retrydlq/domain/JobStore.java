package com.yerin.retrydlq.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 내구성 있는 작업 큐 저장소.
 * <p>
 * 시도 횟수 집계, backoff 계산, DLQ 이동 판단은 모두 스토어 책임이다.
 * JobService는 큐/워커 생명주기만 관리한다.
 */
public interface JobStore {

    /** 연결 가능 여부 확인. 실패 시 스토어 예외를 그대로 던진다. */
    void ping(String queueName);

    StoredJob add(String queueName, String payloadJson, JobOptions options);

    /** 기한이 된 지연 작업을 대기열로 옮긴 뒤 다음 작업 하나를 리스한다. 일시정지 중이면 empty. */
    Optional<StoredJob> lease(String queueName, String workerId, Duration leaseDuration);

    /** 리스를 잃었으면 false. */
    boolean complete(String queueName, String jobId);

    FailOutcome fail(String queueName, StoredJob job, String stacktrace, String failedReason);

    Optional<StoredJob> find(String queueName, String jobId);

    /** DLQ에 있는 작업을 다시 대기열로. DLQ에 없으면 false. */
    boolean retry(String queueName, String jobId);

    List<StoredJob> getFailed(String queueName);

    void pause(String queueName);

    void resume(String queueName);

    boolean isPaused(String queueName);

    /** 리스가 만료된 작업을 대기열로 되돌리고 그 id 목록을 반환한다. */
    List<String> reapExpiredLeases(String queueName, Instant now);
}
