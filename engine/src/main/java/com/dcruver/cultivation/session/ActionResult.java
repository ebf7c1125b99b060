package com.dcruver.cultivation.session;

import com.dcruver.cultivation.domain.actions.ActionOutcome;
import com.dcruver.cultivation.domain.actions.ActionType;
import com.dcruver.cultivation.domain.error.ErrorCode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one {@link SessionManager#applyAction} call: the entries it appended,
 * the state afterwards, and a readable summary.
 */
@Value
@Builder
public class ActionResult {
    boolean accepted;
    ActionType action;
    String summary;
    ErrorCode errorCode;
    ActionOutcome outcome;
    List<LogEntry> entries;
    StatusView status;

    public boolean isRejected() {
        return !accepted;
    }
}
