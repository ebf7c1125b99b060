package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.StageLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What one applied action actually did. Deltas are the clamped amounts, not the requested ones.
 */
@Value
@Builder
public class ActionOutcome {
    ActionType action;
    int healthDelta;
    int manaDelta;
    long experienceGained;
    int pillsConsumed;
    @Singular("stageCrossed")
    List<StageLevel> stagesCrossed;
    String message;

    public boolean isBreakthrough() {
        return !stagesCrossed.isEmpty();
    }
}
