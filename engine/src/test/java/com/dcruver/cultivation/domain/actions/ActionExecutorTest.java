package com.dcruver.cultivation.domain.actions;

import com.dcruver.cultivation.EngineFixtures;
import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.DifficultySettings;
import com.dcruver.cultivation.domain.SessionPhase;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.character.CharacterAggregate;
import com.dcruver.cultivation.domain.character.CharacterStatus;
import com.dcruver.cultivation.domain.error.InsufficientResourceException;
import com.dcruver.cultivation.domain.error.InvalidPhaseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The common action protocol: validation before any effect, clamped deltas, counters.
 */
class ActionExecutorTest {

    private CultivationRules rules;
    private ActionExecutor executor;
    private CharacterAggregate character;

    @BeforeEach
    void setUp() {
        rules = new CultivationRules();
        executor = EngineFixtures.executor(rules);
        character = new CharacterAggregate(null, rules, 5, 1);
    }

    @Test
    void testEveryTypeDispatchesToMatchingAction() {
        for (ActionType type : ActionType.values()) {
            CultivationAction action = executor.getAction(type);
            assertEquals(type, action.getType());
            assertEquals(type.getDisplayName(), action.getName());
            assertNotNull(action.getDescription());
        }
    }

    @Test
    void testMeditateOnFullHealthRestoresNoHealth() {
        ActionOutcome outcome = run(ActionType.MEDITATE);

        assertEquals(0, outcome.getHealthDelta());
        assertEquals(18, outcome.getManaDelta());
        assertEquals(8L, outcome.getExperienceGained());
        assertEquals(100, character.getHealth().getCurrent());
        assertEquals(68, character.getMana().getCurrent());
        assertEquals(1, character.getTotalActions());
        assertEquals(1, character.getMeditationStreak());
    }

    @Test
    void testMeditateReportsClampedManaDelta() {
        run(ActionType.MEDITATE);
        run(ActionType.MEDITATE);
        ActionOutcome third = run(ActionType.MEDITATE);

        assertEquals(14, third.getManaDelta());
        assertEquals(100, character.getMana().getCurrent());
    }

    @Test
    void testConsumePillAtFullResourcesStillSpendsPill() {
        character.getMana().applyDelta(100);

        ActionOutcome outcome = run(ActionType.CONSUME_PILL);

        assertEquals(0, outcome.getHealthDelta());
        assertEquals(0, outcome.getManaDelta());
        assertEquals(1, outcome.getPillsConsumed());
        assertEquals(0, character.getInventory().getPillCount());
        assertEquals(1, character.getTotalActions());
    }

    @Test
    void testConsumePillWithoutPillsIsRejected() {
        run(ActionType.CONSUME_PILL);
        CharacterStatus before = character.snapshot();

        assertThrows(InsufficientResourceException.class, () -> run(ActionType.CONSUME_PILL));
        assertEquals(before, character.snapshot());
    }

    @Test
    void testCultivateSpendsManaAndGainsExperience() {
        ActionOutcome outcome = run(ActionType.CULTIVATE);

        assertEquals(-20, outcome.getManaDelta());
        assertEquals(0, outcome.getHealthDelta());
        assertEquals(22L, outcome.getExperienceGained());
        assertEquals(30, character.getMana().getCurrent());
        assertEquals(22L, character.getExperience().getTotalExperience());
    }

    @Test
    void testCultivateUsesPrecedingMeditationStreak() {
        run(ActionType.MEDITATE);
        run(ActionType.MEDITATE);
        run(ActionType.MEDITATE);

        ActionOutcome outcome = run(ActionType.CULTIVATE);

        assertEquals(29L, outcome.getExperienceGained());
        assertEquals(0, character.getMeditationStreak());
        assertEquals(24L + 29L, character.getExperience().getTotalExperience());
    }

    @Test
    void testCultivateWithoutEnoughManaIsRejected() {
        run(ActionType.CULTIVATE);
        run(ActionType.CULTIVATE);
        CharacterStatus before = character.snapshot();
        assertEquals(10, before.getMana());

        assertThrows(InsufficientResourceException.class, () -> run(ActionType.CULTIVATE));
        assertEquals(before, character.snapshot());
    }

    @Test
    void testCultivateReportsEveryStageCrossed() {
        ActionOutcome outcome = executor.execute(ActionType.CULTIVATE, SessionPhase.ACTIVE,
            character, EngineFixtures.boosted(15.0));

        assertEquals(330L, outcome.getExperienceGained());
        assertTrue(outcome.isBreakthrough());
        assertEquals(List.of(StageLevel.FOUNDATION, StageLevel.CORE_FORMATION), outcome.getStagesCrossed());
    }

    @Test
    void testWaitHasNoResourceEffect() {
        run(ActionType.MEDITATE);
        CharacterStatus before = character.snapshot();

        ActionOutcome outcome = run(ActionType.WAIT);

        assertEquals(0, outcome.getHealthDelta());
        assertEquals(0, outcome.getManaDelta());
        assertEquals(0L, outcome.getExperienceGained());
        CharacterStatus after = character.snapshot();
        assertEquals(before.getMana(), after.getMana());
        assertEquals(before.getTotalExperience(), after.getTotalExperience());
        assertEquals(0, after.getMeditationStreak());
        assertEquals(before.getTotalActions() + 1, after.getTotalActions());
    }

    @Test
    void testTerminalPhaseRejectsEveryAction() {
        CharacterStatus before = character.snapshot();
        for (ActionType type : ActionType.values()) {
            assertThrows(InvalidPhaseException.class, () -> executor.execute(
                type, SessionPhase.GAME_OVER, character, DifficultySettings.NORMAL));
            assertThrows(InvalidPhaseException.class, () -> executor.execute(
                type, SessionPhase.ASCENDED, character, DifficultySettings.NORMAL));
        }
        assertEquals(before, character.snapshot());
    }

    @Test
    void testAvailableActions() {
        assertEquals(List.of(ActionType.values()), executor.availableActions(SessionPhase.ACTIVE, character));

        run(ActionType.CONSUME_PILL);
        run(ActionType.CULTIVATE);
        run(ActionType.CULTIVATE);
        run(ActionType.CULTIVATE);
        assertEquals(15, character.getMana().getCurrent());
        assertEquals(List.of(ActionType.MEDITATE, ActionType.WAIT),
            executor.availableActions(SessionPhase.ACTIVE, character));

        assertTrue(executor.availableActions(SessionPhase.GAME_OVER, character).isEmpty());
    }

    private ActionOutcome run(ActionType type) {
        return executor.execute(type, SessionPhase.ACTIVE, character, DifficultySettings.NORMAL);
    }
}
