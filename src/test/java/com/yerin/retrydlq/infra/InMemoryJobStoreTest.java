package com.yerin.retrydlq.infra;

import com.yerin.retrydlq.domain.BackoffOptions;
import com.yerin.retrydlq.domain.FailOutcome;
import com.yerin.retrydlq.domain.JobOptions;
import com.yerin.retrydlq.domain.StoredJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("인메모리 스토어 상태 전이 테스트")
public class InMemoryJobStoreTest {

    private static final String Q = "q";
    private static final Duration LEASE = Duration.ofSeconds(30);

    MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    InMemoryJobStore store = new InMemoryJobStore(clock);

    @Test
    @DisplayName("먼저 넣은 작업이 먼저 리스된다")
    void fifo_lease() {
        StoredJob first = store.add(Q, "\"a\"", JobOptions.defaults());
        StoredJob second = store.add(Q, "\"b\"", JobOptions.defaults());

        assertThat(store.lease(Q, "w", LEASE)).map(StoredJob::getId).contains(first.getId());
        assertThat(store.lease(Q, "w", LEASE)).map(StoredJob::getId).contains(second.getId());
        assertThat(store.lease(Q, "w", LEASE)).isEmpty();
    }

    @Test
    @DisplayName("일시정지 중에는 리스하지 않는다")
    void paused_queue_leases_nothing() {
        store.add(Q, "1", JobOptions.defaults());
        store.pause(Q);

        assertThat(store.isPaused(Q)).isTrue();
        assertThat(store.lease(Q, "w", LEASE)).isEmpty();

        store.resume(Q);
        assertThat(store.lease(Q, "w", LEASE)).isPresent();
    }

    @Test
    @DisplayName("완료된 작업은 삭제되고 두 번 완료할 수 없다")
    void complete_removes_job() {
        StoredJob job = store.add(Q, "1", JobOptions.defaults());
        store.lease(Q, "w", LEASE);

        assertThat(store.complete(Q, job.getId())).isTrue();
        assertThat(store.complete(Q, job.getId())).isFalse();
        assertThat(store.find(Q, job.getId())).isEmpty();
    }

    @Test
    @DisplayName("attempts 소진 시 DLQ로 이동")
    void retry_then_dead_letter() {
        store.add(Q, "1", JobOptions.attempts(2));

        StoredJob leased = store.lease(Q, "w", LEASE).orElseThrow();
        assertThat(store.fail(Q, leased, "trace-1", "boom")).isEqualTo(FailOutcome.RETRY_SCHEDULED);

        StoredJob again = store.lease(Q, "w", LEASE).orElseThrow();
        assertThat(again.getAttemptsMade()).isEqualTo(1);
        assertThat(store.fail(Q, again, "trace-2", "boom")).isEqualTo(FailOutcome.DEAD_LETTERED);

        assertThat(store.getFailed(Q)).singleElement().satisfies(j -> {
            assertThat(j.getAttemptsMade()).isEqualTo(2);
            assertThat(j.attemptsAllowed()).isEqualTo(2);
            assertThat(j.getStacktrace()).containsExactly("trace-1", "trace-2");
            assertThat(j.getFinishedOn()).isEqualTo(clock.instant());
        });
        assertThat(store.lease(Q, "w", LEASE)).isEmpty();
    }

    @Test
    @DisplayName("백오프 시간이 지나야 다시 리스된다")
    void backoff_delays_next_attempt() {
        store.add(Q, "1", new JobOptions(3, null, BackoffOptions.fixed(Duration.ofSeconds(5))));
        StoredJob leased = store.lease(Q, "w", LEASE).orElseThrow();
        store.fail(Q, leased, "t", "boom");

        assertThat(store.lease(Q, "w", LEASE)).isEmpty();

        clock.advance(Duration.ofSeconds(5));
        assertThat(store.lease(Q, "w", LEASE)).isPresent();
    }

    @Test
    @DisplayName("지연 작업은 due 시각 이후에 리스된다")
    void delayed_add() {
        store.add(Q, "1", new JobOptions(1, Duration.ofSeconds(2), null));

        assertThat(store.lease(Q, "w", LEASE)).isEmpty();
        clock.advance(Duration.ofSeconds(2));
        assertThat(store.lease(Q, "w", LEASE)).isPresent();
    }

    @Test
    @DisplayName("리스 만료 작업은 시도 횟수 증가 없이 재전달, 늦은 실패 보고는 무시")
    void reap_expired_lease() {
        StoredJob job = store.add(Q, "1", JobOptions.attempts(3));
        StoredJob leased = store.lease(Q, "w1", Duration.ofSeconds(1)).orElseThrow();

        assertThat(store.reapExpiredLeases(Q, clock.instant())).isEmpty();

        clock.advance(Duration.ofSeconds(2));
        assertThat(store.reapExpiredLeases(Q, clock.instant())).containsExactly(job.getId());
        assertThat(store.fail(Q, leased, "late", "late")).isEqualTo(FailOutcome.LEASE_LOST);

        StoredJob redelivered = store.lease(Q, "w2", LEASE).orElseThrow();
        assertThat(redelivered.getId()).isEqualTo(job.getId());
        assertThat(redelivered.getAttemptsMade()).isZero();
    }

    @Test
    @DisplayName("DLQ 작업만 재투입되며 attemptsMade는 유지된다")
    void retry_from_failed_keeps_attempts() {
        StoredJob job = store.add(Q, "1", JobOptions.defaults());
        assertThat(store.retry(Q, job.getId())).isFalse();

        StoredJob leased = store.lease(Q, "w", LEASE).orElseThrow();
        store.fail(Q, leased, "t", "boom");

        assertThat(store.retry(Q, job.getId())).isTrue();
        assertThat(store.getFailed(Q)).isEmpty();

        StoredJob revived = store.lease(Q, "w", LEASE).orElseThrow();
        assertThat(revived.getAttemptsMade()).isEqualTo(1);
        assertThat(store.fail(Q, revived, "t2", "boom")).isEqualTo(FailOutcome.DEAD_LETTERED);
        assertThat(store.getFailed(Q)).singleElement()
                .extracting(StoredJob::getAttemptsMade).isEqualTo(2);
    }

    @Test
    @DisplayName("스택트레이스는 최근 10개만 보관")
    void stacktrace_is_capped() {
        store.add(Q, "1", JobOptions.attempts(15));
        for (int i = 0; i < 12; i++) {
            StoredJob leased = store.lease(Q, "w", LEASE).orElseThrow();
            store.fail(Q, leased, "trace-" + i, "boom");
        }

        StoredJob current = store.lease(Q, "w", LEASE).orElseThrow();
        assertThat(current.getStacktrace()).hasSize(StoredJob.STACKTRACE_LIMIT);
        assertThat(current.getStacktrace().get(0)).isEqualTo("trace-2");
    }

    @Test
    @DisplayName("큐끼리 상태를 공유하지 않는다")
    void queues_are_isolated() {
        store.add("a", "1", JobOptions.defaults());
        store.pause("b");

        assertThat(store.lease("b", "w", LEASE)).isEmpty();
        assertThat(store.lease("a", "w", LEASE)).isPresent();
        assertThat(store.isPaused("a")).isFalse();
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
