package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.ActionCost;
import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.RecoveryEffect;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import com.dcruver.cultivation.domain.error.InsufficientResourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Consume a pill (吃丹药) for a fixed burst of health and mana.
 *
 * Preconditions:
 * - at least one pill in the inventory
 *
 * Effects:
 * - pill restoration (independent of talent); clamped at max, so it may restore nothing
 * - breaks the meditation streak
 *
 * Cost: one pill, even when nothing is restored
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConsumePillAction implements CultivationAction {

    private final CultivationRules rules;

    @Override
    public ActionType getType() {
        return ActionType.CONSUME_PILL;
    }

    @Override
    public String getDescription() {
        return "服用丹药，快速恢复生命与仙力";
    }

    @Override
    public void validate(CharacterAggregate character) {
        int required = rules.costOf(getType()).getPills();
        if (!character.getInventory().hasPills(required)) {
            throw new InsufficientResourceException("没有丹药可用");
        }
    }

    @Override
    public ActionOutcome apply(CharacterAggregate character, DifficultySettings difficulty) {
        ActionCost cost = rules.costOf(getType());
        RecoveryEffect effect = rules.pillEffect(difficulty);

        int remaining = character.consumePills(cost.getPills());
        int healthRestored = character.getHealth().applyDelta(effect.getHealthDelta());
        int manaRestored = character.getMana().applyDelta(effect.getManaDelta());

        log.debug("Pill consumed ({} left): +{} hp, +{} mp", remaining, healthRestored, manaRestored);

        return ActionOutcome.builder()
            .action(getType())
            .healthDelta(healthRestored)
            .manaDelta(manaRestored)
            .pillsConsumed(cost.getPills())
            .message(String.format("你服下一颗丹药，恢复%d点生命和%d点仙力，剩余丹药%d颗。",
                healthRestored, manaRestored, remaining))
            .build();
    }
}
