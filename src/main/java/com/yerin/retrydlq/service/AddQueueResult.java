package com.yerin.retrydlq.service;

import com.yerin.retrydlq.infra.QueueWorker;

import java.util.List;

public record AddQueueResult<T>(QueueHandle<T> queue, List<QueueWorker<T>> workers) {
}
