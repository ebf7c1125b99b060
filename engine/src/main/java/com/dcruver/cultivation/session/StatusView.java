package com.dcruver.cultivation.session;

import com.dcruver.cultivation.domain.Achievement;
import com.dcruver.cultivation.domain.ActionCost;
import com.dcruver.cultivation.domain.SessionPhase;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.actions.ActionType;
import com.dcruver.cultivation.domain.character.CharacterStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Everything a renderer may read about the current session.
 * Built fresh on every call; holds no reference into live session state.
 */
@Value
@Builder
public class StatusView {
    String sessionId;
    String difficultyName;
    SessionPhase phase;
    CharacterStatus character;

    // Progression
    double stageProgressPercent;
    Long nextStageThreshold;

    // Derived advice and ratings
    long powerLevel;
    String recommendation;
    List<ActionType> availableActions;
    Map<ActionType, ActionCost> actionCosts;
    Set<Achievement> achievements;

    List<LogEntry> recentLog;

    public StageLevel getStage() {
        return character.getStage();
    }

    public boolean isAlive() {
        return character.isAlive();
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    /**
     * Experience still missing for the next stage, empty at the terminal tier.
     */
    public OptionalLong getExperienceToNextStage() {
        if (nextStageThreshold == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.max(0L, nextStageThreshold - character.getTotalExperience()));
    }
}
