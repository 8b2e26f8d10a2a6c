package com.yerin.retrydlq.domain;

import java.util.Objects;

public record ConsumerIdentifier(String topic, String consumerGroup) implements RetryIdentifier {

    public ConsumerIdentifier {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(consumerGroup, "consumerGroup");
    }

    /** retry||consumer||{topic}||{consumerGroup} */
    public static String queueName(String topic, String consumerGroup) {
        return QUEUE_PREFIX + SEPARATOR + "consumer" + SEPARATOR + topic + SEPARATOR + consumerGroup;
    }

    @Override
    public String queueName() {
        return queueName(topic, consumerGroup);
    }
}
