package com.yerin.retrydlq.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.retrydlq.application.RetryDlqDependencies;
import com.yerin.retrydlq.domain.ConsumerIdentifier;
import com.yerin.retrydlq.domain.FailedJobEntry;
import com.yerin.retrydlq.domain.JobEntry;
import com.yerin.retrydlq.domain.ProducerIdentifier;
import com.yerin.retrydlq.domain.QueueConfig;
import com.yerin.retrydlq.domain.RetryDlqConfig;
import com.yerin.retrydlq.domain.RetryDlqMetrics;
import com.yerin.retrydlq.domain.WorkerOptions;
import com.yerin.retrydlq.global.exception.AppException;
import com.yerin.retrydlq.global.exception.code.JobErrorCode;
import com.yerin.retrydlq.infra.InMemoryJobStore;
import com.yerin.retrydlq.observability.DefaultObservabilityService;
import com.yerin.retrydlq.observability.EventFilter;
import com.yerin.retrydlq.observability.JobServiceEvents;
import com.yerin.retrydlq.support.RecordingEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryDlqService 재시도/DLQ/revive 시나리오 테스트")
public class RetryDlqServiceTest {

    public record Message(String key, String value) {}

    static final String TOPIC = "orders";
    static final String GROUP = "billing";
    static final String PRODUCER = "checkout";

    RecordingEvents events = new RecordingEvents();
    DefaultObservabilityService observability = new DefaultObservabilityService();
    JobService jobService;
    RetryDlqService sut;

    AtomicInteger consumerCalls = new AtomicInteger();
    AtomicInteger consumerFailuresLeft = new AtomicInteger();
    AtomicInteger producerCalls = new AtomicInteger();
    AtomicBoolean producerHealthy = new AtomicBoolean(false);
    AtomicReference<RetryDlqDependencies> seenDependencies = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        observability.on(EventFilter.all(), events);
        jobService = new JobService(new InMemoryJobStore(), observability,
                new RetryDlqMetrics(new SimpleMeterRegistry()), new ObjectMapper(),
                new WorkerOptions(true, Duration.ofMillis(10), Duration.ofSeconds(5), Duration.ofSeconds(2)));

        Map<String, RetryDlqConfig<?>> domains = new LinkedHashMap<>();
        domains.put("orderEvents", RetryDlqConfig.<Message>builder()
                .identifier(new ConsumerIdentifier(TOPIC, GROUP))
                .attempts(3)
                .payloadType(Message.class)
                .handler((deps, msg) -> {
                    seenDependencies.set(deps);
                    consumerCalls.incrementAndGet();
                    if (consumerFailuresLeft.getAndDecrement() > 0) {
                        throw new IllegalStateException("billing unavailable for " + msg.key());
                    }
                })
                .build());
        domains.put("checkoutProducer", RetryDlqConfig.<Message>builder()
                .identifier(new ProducerIdentifier(PRODUCER))
                .attempts(1)
                .payloadType(Message.class)
                .handler((deps, msg) -> {
                    producerCalls.incrementAndGet();
                    if (!producerHealthy.get()) throw new IllegalStateException("broker rejected " + msg.key());
                })
                .build());

        sut = new RetryDlqService(jobService, observability, domains);
        sut.start();
    }

    @AfterEach
    void tearDown() {
        sut.stop();
        jobService.stop();
    }

    @Test
    @DisplayName("도메인마다 규칙대로 이름 붙은 큐가 생긴다")
    void queue_names() {
        assertThat(sut.getQueueNames())
                .containsExactly("retry||consumer||orders||billing", "retry||producer||checkout");
        assertThat(jobService.getQueueNames()).containsExactlyInAnyOrderElementsOf(sut.getQueueNames());
    }

    @Test
    @DisplayName("계속 실패하면 attempts만큼 시도 후 DLQ")
    void retry_until_dlq() {
        consumerFailuresLeft.set(Integer.MAX_VALUE);

        JobEntry<Message> entry = sut.enqueueConsumerRetry(TOPIC, GROUP, new Message("o-1", "paid"));

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> sut.getConsumerDlq(TOPIC, GROUP).size() == 1);
        List<FailedJobEntry<Message>> dlq = sut.getConsumerDlq(TOPIC, GROUP);
        assertThat(dlq).singleElement().satisfies(f -> {
            assertThat(f.entry()).isEqualTo(entry);
            assertThat(f.attemptsMade()).isEqualTo(3);
            assertThat(f.attemptsAllowed()).isEqualTo(3);
        });
        assertThat(consumerCalls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("재시도 중 성공하면 DLQ에 남지 않는다")
    void success_after_retry() {
        consumerFailuresLeft.set(2);

        sut.enqueueConsumerRetry(TOPIC, GROUP, new Message("o-2", "paid"));

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> events.count(JobServiceEvents.JOB_COMPLETED) == 1);
        assertThat(consumerCalls.get()).isEqualTo(3);
        assertThat(sut.<Message>getConsumerDlq(TOPIC, GROUP)).isEmpty();
    }

    @Test
    @DisplayName("핸들러는 서비스 협력 객체를 전달받는다")
    void handler_receives_dependencies() {
        sut.enqueueConsumerRetry(TOPIC, GROUP, new Message("o-3", "paid"));

        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> seenDependencies.get() != null);
        assertThat(seenDependencies.get().jobService()).isSameAs(jobService);
        assertThat(seenDependencies.get().observabilityService()).isSameAs(observability);
    }

    @Test
    @DisplayName("원인이 해소된 뒤 revive하면 DLQ에서 빠진다")
    void revive_success() {
        JobEntry<Message> entry = sut.enqueueProducerRetry(PRODUCER, new Message("c-1", "order"));
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> sut.getProducerDlq(PRODUCER).size() == 1);

        producerHealthy.set(true);
        JobEntry<Message> revived = sut.reviveProducerDlq(PRODUCER, entry.id());

        assertThat(revived).isEqualTo(entry);
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> sut.getProducerDlq(PRODUCER).isEmpty() && producerCalls.get() == 2);
        assertThat(events.names()).contains(JobServiceEvents.JOB_RETRY, JobServiceEvents.JOB_COMPLETED);
    }

    @Test
    @DisplayName("revive 후에도 실패하면 attemptsMade가 1 늘어 다시 DLQ")
    void revive_failure() {
        JobEntry<Message> entry = sut.enqueueProducerRetry(PRODUCER, new Message("c-2", "order"));
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> sut.getProducerDlq(PRODUCER).size() == 1);

        sut.reviveProducerDlq(PRODUCER, entry.id());

        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(sut.<Message>getProducerDlq(PRODUCER)).singleElement().satisfies(f -> {
                    assertThat(f.id()).isEqualTo(entry.id());
                    assertThat(f.attemptsMade()).isEqualTo(2);
                    assertThat(f.attemptsAllowed()).isEqualTo(1);
                    assertThat(f.stacktrace()).hasSize(2);
                }));
        assertThat(producerCalls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("없는 엔트리 revive는 JOB_NOT_FOUND")
    void revive_unknown_entry() {
        assertThatThrownBy(() -> sut.reviveConsumerDlq(TOPIC, GROUP, "404"))
                .isInstanceOfSatisfying(AppException.class, e ->
                        assertThat(e.getErrorCode().getCode()).isEqualTo(JobErrorCode.JOB_NOT_FOUND.getCode()));
    }

    @Test
    @DisplayName("등록되지 않은 도메인의 DLQ 조회는 빈 목록")
    void unknown_domain_dlq_is_empty() {
        assertThat(sut.getConsumerDlq("unknown-topic", GROUP)).isEmpty();
        assertThat(sut.getProducerDlq("unknown-producer")).isEmpty();
    }

    @Test
    @DisplayName("stop은 같은 JobService의 다른 큐를 닫지 않는다")
    void stop_leaves_foreign_queues() {
        AtomicInteger otherCalls = new AtomicInteger();
        jobService.addQueue(QueueConfig.builder().name("other").build(), Message.class, m -> otherCalls.incrementAndGet());

        sut.stop();

        assertThat(sut.getQueueNames()).isEmpty();
        assertThat(jobService.getQueueNames()).containsExactly("other");
        jobService.enqueueJob("other", new Message("k", "v"));
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> otherCalls.get() == 1);
    }

    @Test
    @DisplayName("pause/resume은 자기 큐에만 적용된다")
    void pause_resume_own_queues() {
        jobService.addQueue(QueueConfig.builder().name("other").build(), Message.class, m -> {});

        sut.pause();

        assertThat(jobService.isPaused("retry||consumer||orders||billing")).isTrue();
        assertThat(jobService.isPaused("retry||producer||checkout")).isTrue();
        assertThat(jobService.isPaused("other")).isFalse();

        sut.resume();
        assertThat(jobService.isPaused("retry||consumer||orders||billing")).isFalse();
    }
}
