package com.dcruver.cultivation.domain;

import com.dcruver.cultivation.domain.actions.ActionType;
import com.dcruver.cultivation.domain.character.CharacterStatus;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;
import com.dcruver.cultivation.domain.error.OutOfRangeException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Numeric rules of the game: restoration, experience gains, action costs and stage thresholds.
 *
 * Every calculation is a pure function of its arguments and the bound constants below.
 * Nothing here reads or writes character state.
 */
@Component
@ConfigurationProperties(prefix = "cultivation.rules")
@Data
@Slf4j
public class CultivationRules {
    private int maxHealth = 100;
    private int maxMana = 100;
    private double startingManaRatio = 0.5;

    // Meditation (打坐)
    private int meditationBaseHealth = 2;
    private int meditationHealthPerTalent = 1;
    private int meditationBaseMana = 8;
    private int meditationManaPerTalent = 2;
    private int meditationBaseExperience = 3;
    private int meditationExperiencePerTalent = 1;

    // Pill (丹药)
    private int pillHealth = 25;
    private int pillMana = 25;

    // Cultivation (修炼)
    private int cultivationBaseExperience = 12;
    private int cultivationExperiencePerTalent = 2;
    private int cultivationManaCost = 20;
    private int cultivationHealthCost = 0;
    private double streakBonusPerMeditation = 0.1;
    private int streakBonusCap = 5;

    @PostConstruct
    public void validate() {
        requirePositive("maxHealth", maxHealth);
        requirePositive("maxMana", maxMana);
        requirePositive("meditationHealthPerTalent", meditationHealthPerTalent);
        requirePositive("meditationManaPerTalent", meditationManaPerTalent);
        requirePositive("cultivationExperiencePerTalent", cultivationExperiencePerTalent);
        requireNonNegative("meditationBaseHealth", meditationBaseHealth);
        requireNonNegative("meditationBaseMana", meditationBaseMana);
        requireNonNegative("meditationBaseExperience", meditationBaseExperience);
        requireNonNegative("meditationExperiencePerTalent", meditationExperiencePerTalent);
        requireNonNegative("pillHealth", pillHealth);
        requireNonNegative("pillMana", pillMana);
        requireNonNegative("cultivationBaseExperience", cultivationBaseExperience);
        requireNonNegative("cultivationManaCost", cultivationManaCost);
        requireNonNegative("cultivationHealthCost", cultivationHealthCost);
        requireNonNegative("streakBonusCap", streakBonusCap);
        if (cultivationManaCost > maxMana) {
            throw new InvalidArgumentException(String.format(
                "cultivationManaCost (%d) 不能超过 maxMana (%d)", cultivationManaCost, maxMana));
        }
        if (startingManaRatio < 0 || startingManaRatio > 1) {
            throw new InvalidArgumentException("startingManaRatio 必须在 [0, 1] 内: " + startingManaRatio);
        }
        if (streakBonusPerMeditation < 0) {
            throw new InvalidArgumentException("streakBonusPerMeditation 不能为负: " + streakBonusPerMeditation);
        }
        log.debug("Cultivation rules validated (cultivate cost: {} mana / {} health)",
            cultivationManaCost, cultivationHealthCost);
    }

    public int initialMana() {
        return (int) Math.floor(maxMana * startingManaRatio);
    }

    /**
     * Restoration from one meditation. Strictly increasing in talent.
     */
    public RecoveryEffect meditationEffect(int talent, DifficultySettings difficulty) {
        double recovery = difficulty.getRecoveryMultiplier();
        int health = (int) Math.floor(meditationBaseHealth * recovery) + talent * meditationHealthPerTalent;
        int mana = (int) Math.floor(meditationBaseMana * recovery) + talent * meditationManaPerTalent;
        return new RecoveryEffect(health, mana);
    }

    /**
     * Small amount of experience gathered while meditating.
     */
    public long meditationExperience(int talent, DifficultySettings difficulty) {
        long raw = meditationBaseExperience + (long) talent * meditationExperiencePerTalent;
        return Math.round(raw * difficulty.getExperienceMultiplier());
    }

    /**
     * Experience from one cultivation. A preceding meditation streak adds a focus bonus
     * that stops growing after {@code streakBonusCap} meditations.
     */
    public long cultivationGain(int talent, DifficultySettings difficulty, int streak) {
        if (streak < 0) {
            throw new InvalidArgumentException("连续打坐次数不能为负: " + streak);
        }
        long raw = cultivationBaseExperience + (long) talent * cultivationExperiencePerTalent;
        double focus = 1.0 + streakBonusPerMeditation * Math.min(streak, streakBonusCap);
        return Math.round(raw * difficulty.getExperienceMultiplier() * focus);
    }

    /**
     * Fixed restoration of one pill, independent of talent.
     */
    public RecoveryEffect pillEffect(DifficultySettings difficulty) {
        double recovery = difficulty.getRecoveryMultiplier();
        return new RecoveryEffect(
            (int) Math.floor(pillHealth * recovery),
            (int) Math.floor(pillMana * recovery));
    }

    public ActionCost costOf(ActionType type) {
        return switch (type) {
            case MEDITATE, WAIT -> ActionCost.FREE;
            case CONSUME_PILL -> ActionCost.builder().pills(1).build();
            case CULTIVATE -> ActionCost.builder()
                .mana(cultivationManaCost)
                .health(cultivationHealthCost)
                .build();
        };
    }

    /**
     * Cumulative experience needed to enter the stage with the given ordinal.
     */
    public long stageThreshold(int stageOrdinal) {
        StageLevel[] stages = StageLevel.values();
        if (stageOrdinal < 0 || stageOrdinal >= stages.length) {
            throw new OutOfRangeException(String.format(
                "境界序号 %d 不在 [0, %d] 内", stageOrdinal, stages.length - 1));
        }
        return stages[stageOrdinal].getThreshold();
    }

    /**
     * Threshold of the tier after {@code stage}. The terminal tier has none.
     */
    public long nextStageThreshold(StageLevel stage) {
        if (stage.isTerminal()) {
            throw new OutOfRangeException(stage.getDisplayName() + " 已是最终境界");
        }
        return stageThreshold(stage.ordinal() + 1);
    }

    /**
     * Highest stage whose threshold is at or below {@code totalExperience}.
     */
    public StageLevel resolveStage(long totalExperience) {
        if (totalExperience < 0) {
            throw new InvalidArgumentException("总经验不能为负: " + totalExperience);
        }
        StageLevel resolved = StageLevel.QI_REFINING;
        for (StageLevel stage : StageLevel.values()) {
            if (stage.getThreshold() <= totalExperience) {
                resolved = stage;
            }
        }
        return resolved;
    }

    /**
     * Percentage of the way from the current stage's threshold to the next one (0-100).
     */
    public double stageProgressPercent(long totalExperience) {
        StageLevel stage = resolveStage(totalExperience);
        if (stage.isTerminal()) {
            return 100.0;
        }
        long floor = stage.getThreshold();
        long span = nextStageThreshold(stage) - floor;
        return Math.min(100.0, (totalExperience - floor) * 100.0 / span);
    }

    /**
     * Overall strength rating shown to the player. Zero for a dead character.
     */
    public long powerLevel(CharacterStatus status) {
        if (!status.isAlive()) {
            return 0L;
        }
        double base = status.getHealth() * 0.3
            + status.getMana() * 0.3
            + status.getTotalExperience() * 0.2
            + status.getTalent() * 10
            + status.getPillCount() * 5;
        return (long) (base * status.getStage().getPowerMultiplier());
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new InvalidArgumentException(name + " 必须 >= 1: " + value);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new InvalidArgumentException(name + " 不能为负: " + value);
        }
    }
}
