package com.yerin.retrydlq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND("작업을 찾을 수 없습니다.", "JOB-001"),
    JOB_NOT_IN_DLQ("DLQ 상태의 작업만 재실행할 수 있습니다.", "JOB-002"),
    QUEUE_NOT_FOUND("큐를 찾을 수 없습니다.", "QUEUE-001"),
    QUEUE_ALREADY_EXISTS("이미 등록된 큐 이름입니다.", "QUEUE-002"),
    QUEUE_CLOSING("종료 중인 큐에는 작업을 넣을 수 없습니다.", "QUEUE-003"),
    STORE_UNAVAILABLE("작업 저장소에 연결할 수 없습니다.", "STORE-001"),
    PAYLOAD_NOT_SERIALIZABLE("작업 데이터를 직렬화할 수 없습니다.", "STORE-002");

    private final String message;
    private final String code;
}
