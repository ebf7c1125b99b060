package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import org.springframework.stereotype.Component;

/**
 * Wait (等待): let time pass with no effect. Still counts as an action and breaks the streak.
 */
@Component
public class WaitAction implements CultivationAction {

    @Override
    public ActionType getType() {
        return ActionType.WAIT;
    }

    @Override
    public String getDescription() {
        return "静心养神，让时间流逝";
    }

    @Override
    public void validate(CharacterAggregate character) {
        // Always allowed while the session is active
    }

    @Override
    public ActionOutcome apply(CharacterAggregate character, DifficultySettings difficulty) {
        return ActionOutcome.builder()
            .action(getType())
            .message("你静心等待，时光悄然流逝。")
            .build();
    }
}
