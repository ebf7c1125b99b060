package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.ActionCost;
import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import com.dcruver.cultivation.domain.error.InsufficientResourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cultivate (修炼): the main source of experience.
 *
 * Preconditions:
 * - mana covers the cultivation cost
 *
 * Effects:
 * - experience scaled by talent, difficulty and the preceding meditation streak
 * - may cross one or more stage thresholds
 * - if a health cost is configured, health drops and may reach zero
 *
 * Cost: mana, plus optional health
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CultivateAction implements CultivationAction {

    private final CultivationRules rules;

    @Override
    public ActionType getType() {
        return ActionType.CULTIVATE;
    }

    @Override
    public String getDescription() {
        return "运转心法，大量提升修为";
    }

    @Override
    public void validate(CharacterAggregate character) {
        int required = rules.costOf(getType()).getMana();
        if (!character.getMana().hasAtLeast(required)) {
            throw new InsufficientResourceException(String.format(
                "仙力不足，无法修炼（需要%d，当前%d）", required, character.getMana().getCurrent()));
        }
    }

    @Override
    public ActionOutcome apply(CharacterAggregate character, DifficultySettings difficulty) {
        ActionCost cost = rules.costOf(getType());
        int streak = character.getMeditationStreak();
        long gain = rules.cultivationGain(character.getTalentValue(), difficulty, streak);

        int manaSpent = character.getMana().applyDelta(-cost.getMana());
        int healthLost = character.getHealth().applyDelta(-cost.getHealth());
        List<StageLevel> crossed = character.gainExperience(gain);

        log.debug("Cultivation: +{} exp (streak {}), {} mp, {} hp", gain, streak, manaSpent, healthLost);

        StringBuilder message = new StringBuilder();
        message.append(String.format("你运转心法，消耗%d点仙力，获得%d点修为", -manaSpent, gain));
        if (streak > 0) {
            message.append(String.format("（%d次连续打坐凝神加成）", streak));
        }
        if (healthLost < 0) {
            message.append(String.format("，气血翻涌，损失%d点生命", -healthLost));
        }
        message.append("。");

        return ActionOutcome.builder()
            .action(getType())
            .healthDelta(healthLost)
            .manaDelta(manaSpent)
            .experienceGained(gain)
            .stagesCrossed(crossed)
            .message(message.toString())
            .build();
    }
}
