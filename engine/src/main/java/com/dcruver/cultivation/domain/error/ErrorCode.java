package com.dcruver.cultivation.domain.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the engine. None of these are fatal to a session.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INSUFFICIENT_RESOURCE("C001", "资源不足：%s"),
    INVALID_PHASE("C002", "当前无法行动：%s"),
    INVALID_ARGUMENT("C003", "参数无效：%s"),
    OUT_OF_RANGE("C004", "超出范围：%s");

    private final String code;
    private final String message;

    public String format(Object... args) {
        return String.format(message, args);
    }
}
