package com.yerin.retrydlq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    INVALID_PARAMETER("요청 파라미터가 잘못되었습니다.", "COMMON-002"),
    INTERNAL_ERROR("내부에서 에러가 발생했습니다.", "COMMON-004");

    private final String message;
    private final String code;
}
