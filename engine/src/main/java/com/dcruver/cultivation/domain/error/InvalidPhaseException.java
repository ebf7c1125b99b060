package com.dcruver.cultivation.domain.error;

/**
 * An action was attempted while the session is not Active.
 */
public class InvalidPhaseException extends CultivationException {
    public InvalidPhaseException(String detail) {
        super(ErrorCode.INVALID_PHASE, detail);
    }
}
