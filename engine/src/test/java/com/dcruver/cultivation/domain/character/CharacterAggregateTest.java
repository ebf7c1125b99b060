package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.actions.ActionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Composition, counters and the derived flags of the character aggregate.
 */
class CharacterAggregateTest {

    private CultivationRules rules;

    @BeforeEach
    void setUp() {
        rules = new CultivationRules();
    }

    @Test
    void testInitialState() {
        CharacterAggregate character = new CharacterAggregate("韩立", rules, 5, 1);
        CharacterStatus status = character.snapshot();

        assertEquals("韩立", status.getName());
        assertTrue(status.isAlive());
        assertEquals(100, status.getHealth());
        assertEquals(100, status.getMaxHealth());
        assertEquals(50, status.getMana());
        assertEquals(0L, status.getTotalExperience());
        assertEquals(StageLevel.QI_REFINING, status.getStage());
        assertEquals(5, status.getTalent());
        assertEquals(1, status.getPillCount());
        assertEquals(0, status.getMeditationStreak());
        assertEquals(0, status.getTotalActions());
    }

    @Test
    void testBlankNameFallsBackToDefault() {
        assertEquals(CharacterAggregate.DEFAULT_NAME, new CharacterAggregate(null, rules, 5, 0).getName());
        assertEquals(CharacterAggregate.DEFAULT_NAME, new CharacterAggregate("  ", rules, 5, 0).getName());
    }

    @Test
    void testAliveIsDerivedFromHealth() {
        CharacterAggregate character = new CharacterAggregate(null, rules, 5, 0);
        character.getHealth().applyDelta(-100);

        assertFalse(character.isAlive());
        assertFalse(character.snapshot().isAlive());
    }

    @Test
    void testMeditationStreakCountsConsecutiveMeditations() {
        CharacterAggregate character = new CharacterAggregate(null, rules, 5, 0);

        character.recordAction(ActionType.MEDITATE);
        character.recordAction(ActionType.MEDITATE);
        character.recordAction(ActionType.MEDITATE);
        assertEquals(3, character.getMeditationStreak());

        character.recordAction(ActionType.WAIT);
        assertEquals(0, character.getMeditationStreak());

        character.recordAction(ActionType.MEDITATE);
        assertEquals(1, character.getMeditationStreak());
        assertEquals(5, character.getTotalActions());
    }

    @Test
    void testCountersTrackPillsAndBreakthroughs() {
        CharacterAggregate character = new CharacterAggregate(null, rules, 5, 3);

        assertEquals(1, character.consumePills(2));
        assertEquals(2, character.getPillsConsumed());

        character.gainExperience(350);
        assertEquals(2, character.getBreakthroughs());
        assertEquals(StageLevel.CORE_FORMATION, character.getCurrentStage());
    }

    @Test
    void testSnapshotIsDetachedFromLiveState() {
        CharacterAggregate character = new CharacterAggregate(null, rules, 5, 0);
        CharacterStatus before = character.snapshot();

        character.getMana().applyDelta(10);
        character.gainExperience(5);

        assertEquals(50, before.getMana());
        assertEquals(0L, before.getTotalExperience());
        assertNotEquals(before, character.snapshot());
    }
}
