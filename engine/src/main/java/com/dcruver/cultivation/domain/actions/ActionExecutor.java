package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.SessionPhase;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import com.dcruver.cultivation.domain.error.CultivationException;
import com.dcruver.cultivation.domain.error.InvalidPhaseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the common action protocol: check phase, validate, apply, update counters.
 * Logging to the event log and phase transitions are left to the session manager.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ActionExecutor {

    private final MeditateAction meditateAction;
    private final ConsumePillAction consumePillAction;
    private final CultivateAction cultivateAction;
    private final WaitAction waitAction;

    /**
     * Validate and apply one action.
     *
     * @param type The action to run
     * @param phase Current session phase; anything but ACTIVE is rejected
     * @param character The character to mutate
     * @param difficulty Session difficulty, passed through to the rules
     * @return What the action did
     * @throws CultivationException if the action is rejected; nothing has been changed in that case
     */
    public ActionOutcome execute(ActionType type, SessionPhase phase,
                                 CharacterAggregate character, DifficultySettings difficulty) {
        CultivationAction action = getAction(type);
        validate(action, phase, character);

        log.debug("Applying action '{}'", action.getName());
        ActionOutcome outcome = action.apply(character, difficulty);
        character.recordAction(type);
        return outcome;
    }

    /**
     * Action types whose preconditions currently hold.
     */
    public List<ActionType> availableActions(SessionPhase phase, CharacterAggregate character) {
        List<ActionType> available = new ArrayList<>();
        if (phase != SessionPhase.ACTIVE) {
            return available;
        }
        for (ActionType type : ActionType.values()) {
            try {
                getAction(type).validate(character);
                available.add(type);
            } catch (CultivationException e) {
                log.trace("Action '{}' unavailable: {}", type, e.getMessage());
            }
        }
        return available;
    }

    public CultivationAction getAction(ActionType type) {
        return switch (type) {
            case MEDITATE -> meditateAction;
            case CONSUME_PILL -> consumePillAction;
            case CULTIVATE -> cultivateAction;
            case WAIT -> waitAction;
        };
    }

    private void validate(CultivationAction action, SessionPhase phase, CharacterAggregate character) {
        if (phase != SessionPhase.ACTIVE) {
            throw new InvalidPhaseException(String.format("游戏已结束（%s），无法%s", phase, action.getName()));
        }
        if (!character.isAlive()) {
            throw new InvalidPhaseException("你已经无法行动");
        }
        action.validate(character);
    }
}
