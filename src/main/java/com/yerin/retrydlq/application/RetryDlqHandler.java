package com.yerin.retrydlq.application;

/**
 * 재시도 큐에서 꺼낸 메시지를 다시 처리하는 도메인 핸들러.
 * 예외를 던지면 스토어의 재시도/backoff 정책으로 넘어간다.
 */
@FunctionalInterface
public interface RetryDlqHandler<T> {
    void handle(RetryDlqDependencies dependencies, T data) throws Exception;
}
