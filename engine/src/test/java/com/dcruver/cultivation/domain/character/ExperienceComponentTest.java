package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.CultivationRules;
import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Experience accumulation and stage derivation, including multi-tier jumps.
 */
class ExperienceComponentTest {

    private ExperienceComponent experience;

    @BeforeEach
    void setUp() {
        experience = new ExperienceComponent(new CultivationRules()::resolveStage);
    }

    @Test
    void testStartsAtFirstStage() {
        assertEquals(0L, experience.getTotalExperience());
        assertEquals(StageLevel.QI_REFINING, experience.getCurrentStage());
    }

    @Test
    void testGainBelowThresholdCrossesNothing() {
        assertTrue(experience.add(99).isEmpty());
        assertEquals(StageLevel.QI_REFINING, experience.getCurrentStage());

        assertTrue(experience.add(0).isEmpty());
        assertEquals(99L, experience.getTotalExperience());
    }

    @Test
    void testSingleThresholdCrossing() {
        experience.add(90);
        List<StageLevel> crossed = experience.add(10);

        assertEquals(List.of(StageLevel.FOUNDATION), crossed);
        assertEquals(StageLevel.FOUNDATION, experience.getCurrentStage());
    }

    @Test
    void testLargeGainReportsEveryTierInAscendingOrder() {
        List<StageLevel> crossed = experience.add(350);

        assertEquals(List.of(StageLevel.FOUNDATION, StageLevel.CORE_FORMATION), crossed);
        assertEquals(StageLevel.CORE_FORMATION, experience.getCurrentStage());

        List<StageLevel> toTheTop = experience.add(10_000);
        assertEquals(List.of(
            StageLevel.NASCENT_SOUL,
            StageLevel.SPIRITUAL_TRANSFORMATION,
            StageLevel.ASCENSION), toTheTop);
        assertTrue(experience.getCurrentStage().isTerminal());
    }

    @Test
    void testNegativeGainRejected() {
        experience.add(50);

        assertThrows(InvalidArgumentException.class, () -> experience.add(-1));
        assertEquals(50L, experience.getTotalExperience());
    }
}
