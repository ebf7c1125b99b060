package com.dcruver.cultivation.domain.error;

/**
 * A value passed in is outside what the engine accepts (negative experience, empty talent range).
 */
public class InvalidArgumentException extends CultivationException {
    public InvalidArgumentException(String detail) {
        super(ErrorCode.INVALID_ARGUMENT, detail);
    }
}
