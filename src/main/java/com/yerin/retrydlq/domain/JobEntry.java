package com.yerin.retrydlq.domain;

/**
 * 큐에 적재된 작업 한 건. id는 스토어가 부여한다.
 */
public record JobEntry<T>(String id, T data) {
}
