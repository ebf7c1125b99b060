package com.dcruver.cultivation.domain.error;

import lombok.Getter;

/**
 * Base of every recoverable engine failure.
 */
@Getter
public abstract class CultivationException extends RuntimeException {
    private final ErrorCode errorCode;

    protected CultivationException(ErrorCode errorCode, String detail) {
        super(errorCode.format(detail));
        this.errorCode = errorCode;
    }
}
