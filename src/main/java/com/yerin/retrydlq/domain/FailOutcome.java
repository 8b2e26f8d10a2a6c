package com.yerin.retrydlq.domain;

/**
 * 실패 보고 후 스토어가 내린 결정.
 */
public enum FailOutcome {
    /** 남은 시도가 있어 backoff 후 다시 대기열로 */
    RETRY_SCHEDULED,
    /** 시도 소진, DLQ로 이동 */
    DEAD_LETTERED,
    /** 리스가 이미 만료되어 다른 워커에게 넘어감 */
    LEASE_LOST
}
