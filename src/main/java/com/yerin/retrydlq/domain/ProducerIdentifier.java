package com.yerin.retrydlq.domain;

import java.util.Objects;

public record ProducerIdentifier(String producer) implements RetryIdentifier {

    public ProducerIdentifier {
        Objects.requireNonNull(producer, "producer");
    }

    /** retry||producer||{producer} */
    public static String queueName(String producer) {
        return QUEUE_PREFIX + SEPARATOR + "producer" + SEPARATOR + producer;
    }

    @Override
    public String queueName() {
        return queueName(producer);
    }
}
