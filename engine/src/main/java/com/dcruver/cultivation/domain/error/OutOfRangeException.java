package com.dcruver.cultivation.domain.error;

/**
 * A stage lookup went past the terminal tier.
 */
public class OutOfRangeException extends CultivationException {
    public OutOfRangeException(String detail) {
        super(ErrorCode.OUT_OF_RANGE, detail);
    }
}
