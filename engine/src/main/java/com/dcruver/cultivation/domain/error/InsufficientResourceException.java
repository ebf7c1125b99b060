package com.dcruver.cultivation.domain.error;

/**
 * A consumption precondition is unmet (no pills, not enough mana).
 */
public class InsufficientResourceException extends CultivationException {
    public InsufficientResourceException(String detail) {
        super(ErrorCode.INSUFFICIENT_RESOURCE, detail);
    }
}
