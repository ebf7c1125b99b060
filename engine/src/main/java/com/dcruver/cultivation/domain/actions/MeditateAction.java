package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.RecoveryEffect;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Meditate (打坐): restore health and mana, gather a little experience.
 *
 * Preconditions:
 * - none beyond an active session; a full character may still meditate
 *
 * Effects:
 * - health and mana restored, scaled by talent and difficulty recovery
 * - small experience gain
 * - extends the meditation streak
 *
 * Cost: free
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MeditateAction implements CultivationAction {

    private final CultivationRules rules;

    @Override
    public ActionType getType() {
        return ActionType.MEDITATE;
    }

    @Override
    public String getDescription() {
        return "进入冥想状态，恢复生命与仙力并获得少量修为";
    }

    @Override
    public void validate(CharacterAggregate character) {
        // Always allowed while the session is active
    }

    @Override
    public ActionOutcome apply(CharacterAggregate character, DifficultySettings difficulty) {
        int talent = character.getTalentValue();
        RecoveryEffect effect = rules.meditationEffect(talent, difficulty);
        long experience = rules.meditationExperience(talent, difficulty);

        int healthRestored = character.getHealth().applyDelta(effect.getHealthDelta());
        int manaRestored = character.getMana().applyDelta(effect.getManaDelta());
        List<StageLevel> crossed = character.gainExperience(experience);

        log.debug("Meditation: +{} hp (requested {}), +{} mp (requested {}), +{} exp",
            healthRestored, effect.getHealthDelta(), manaRestored, effect.getManaDelta(), experience);

        return ActionOutcome.builder()
            .action(getType())
            .healthDelta(healthRestored)
            .manaDelta(manaRestored)
            .experienceGained(experience)
            .stagesCrossed(crossed)
            .message(String.format("你进入打坐修炼状态，恢复%d点生命和%d点仙力，获得%d点修为。",
                healthRestored, manaRestored, experience))
            .build();
    }
}
