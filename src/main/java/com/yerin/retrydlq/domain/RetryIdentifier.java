package com.yerin.retrydlq.domain;

/**
 * 재시도 큐의 소유자(failure domain).
 * 큐 이름은 기존 DLQ 조회 도구와 호환되어야 하므로 형식을 바꾸지 않는다.
 */
public sealed interface RetryIdentifier permits ConsumerIdentifier, ProducerIdentifier {

    String QUEUE_PREFIX = "retry";
    String SEPARATOR = "||";

    String queueName();
}
