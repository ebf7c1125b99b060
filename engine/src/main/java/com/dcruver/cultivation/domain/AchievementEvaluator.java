package com.dcruver.cultivation.domain;

import com.dcruver.cultivation.domain.actions.ActionType;
import com.dcruver.cultivation.domain.character.CharacterStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which achievements an applied action unlocks.
 * Stateless; the unlocked set belongs to the session.
 */
@Component
public class AchievementEvaluator {

    static final int MEDITATION_BEGINNER_STREAK = 5;
    static final int MEDITATION_MASTER_STREAK = 10;
    static final int ENTHUSIAST_MIN_ACTIONS = 5;
    static final int PERSISTENT_MIN_ACTIONS = 10;

    /**
     * @param action The action just applied
     * @param status Character state after the action
     * @param stagesCrossed Stages the action crossed
     * @param unlocked Achievements already held
     * @return newly earned achievements, in declaration order
     */
    public List<Achievement> evaluate(ActionType action, CharacterStatus status,
                                      List<StageLevel> stagesCrossed, Set<Achievement> unlocked) {
        List<Achievement> earned = new ArrayList<>();
        for (Achievement achievement : Achievement.values()) {
            if (!unlocked.contains(achievement) && isMet(achievement, action, status, stagesCrossed)) {
                earned.add(achievement);
            }
        }
        return earned;
    }

    private boolean isMet(Achievement achievement, ActionType action,
                          CharacterStatus status, List<StageLevel> stagesCrossed) {
        return switch (achievement) {
            case FIRST_ACTION -> status.getTotalActions() >= 1;
            case FIRST_BREAKTHROUGH -> !stagesCrossed.isEmpty();
            case MEDITATION_BEGINNER -> status.getMeditationStreak() >= MEDITATION_BEGINNER_STREAK;
            case MEDITATION_MASTER -> status.getMeditationStreak() >= MEDITATION_MASTER_STREAK;
            case CULTIVATION_ENTHUSIAST -> action == ActionType.CULTIVATE
                && status.getTotalActions() >= ENTHUSIAST_MIN_ACTIONS;
            case PERSISTENT_CULTIVATOR -> status.getTotalActions() >= PERSISTENT_MIN_ACTIONS;
            case FIRST_DEATH -> !status.isAlive();
        };
    }
}
