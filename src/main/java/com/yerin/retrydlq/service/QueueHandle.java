package com.yerin.retrydlq.service;

import com.yerin.retrydlq.application.JobHandler;
import com.yerin.retrydlq.domain.QueueConfig;
import com.yerin.retrydlq.infra.QueueWorker;
import lombok.Getter;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 등록된 큐와 그 워커 목록. 이름은 stopQueue가 끝날 때까지 이 핸들이 점유한다.
 */
@Getter
public class QueueHandle<T> {

    private final String name;
    private final QueueConfig config;
    private final Class<T> payloadType;
    private final JobHandler<T> handler;
    private final List<QueueWorker<T>> workers;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean closing = new AtomicBoolean(false);

    QueueHandle(QueueConfig config, Class<T> payloadType, JobHandler<T> handler, List<QueueWorker<T>> workers) {
        this.name = config.getName();
        this.config = config;
        this.payloadType = payloadType;
        this.handler = handler;
        this.workers = List.copyOf(workers);
    }

    public boolean isClosing() {
        return closing.get();
    }

    boolean beginClose() {
        return closing.compareAndSet(false, true);
    }
}
