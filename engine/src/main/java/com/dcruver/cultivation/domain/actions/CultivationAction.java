package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.character.CharacterAggregate;

/**
 * Two-phase contract every player action implements.
 *
 * {@link #validate} must not change anything. {@link #apply} is only called after
 * {@code validate} passed and must not fail, so a rejected action never leaves partial effects.
 */
public interface CultivationAction {

    ActionType getType();

    String getDescription();

    default String getName() {
        return getType().getDisplayName();
    }

    /**
     * @throws com.dcruver.cultivation.domain.error.CultivationException if a precondition is unmet
     */
    void validate(CharacterAggregate character);

    ActionOutcome apply(CharacterAggregate character, DifficultySettings difficulty);
}
