package com.dcruver.cultivation.domain;

import com.dcruver.cultivation.domain.error.InvalidArgumentException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration chosen once before a session starts.
 * Instances may be built from untrusted configuration, so {@link #validate()} is run
 * by the session manager before anything is created from them.
 */
@Value
@Builder(toBuilder = true)
public class DifficultySettings {
    public static final int MIN_TALENT = 1;
    public static final int MAX_TALENT = 10;

    public static final DifficultySettings EASY = DifficultySettings.builder()
        .id("easy").displayName("简单")
        .talentMin(5).talentMax(10)
        .initialPillCount(3)
        .experienceMultiplier(1.2)
        .recoveryMultiplier(1.3)
        .build();

    public static final DifficultySettings NORMAL = DifficultySettings.builder()
        .id("normal").displayName("普通")
        .talentMin(1).talentMax(10)
        .initialPillCount(1)
        .experienceMultiplier(1.0)
        .recoveryMultiplier(1.0)
        .build();

    public static final DifficultySettings HARD = DifficultySettings.builder()
        .id("hard").displayName("困难")
        .talentMin(1).talentMax(6)
        .initialPillCount(0)
        .experienceMultiplier(0.8)
        .recoveryMultiplier(0.7)
        .build();

    String id;
    String displayName;
    int talentMin;
    int talentMax;
    int initialPillCount;
    double experienceMultiplier;
    @Builder.Default
    double recoveryMultiplier = 1.0;

    public boolean acceptsTalent(int talent) {
        return talent >= talentMin && talent <= talentMax;
    }

    /**
     * Reject settings that would let bad values reach gameplay.
     */
    public void validate() {
        if (id == null || id.isBlank() || displayName == null || displayName.isBlank()) {
            throw new InvalidArgumentException("难度必须有标识和名称");
        }
        if (talentMin > talentMax) {
            throw new InvalidArgumentException(String.format(
                "难度 %s 的资质区间为空 [%d, %d]", displayName, talentMin, talentMax));
        }
        if (talentMin < MIN_TALENT || talentMax > MAX_TALENT) {
            throw new InvalidArgumentException(String.format(
                "难度 %s 的资质区间 [%d, %d] 超出 [%d, %d]",
                displayName, talentMin, talentMax, MIN_TALENT, MAX_TALENT));
        }
        if (initialPillCount < 0) {
            throw new InvalidArgumentException("初始丹药数不能为负: " + initialPillCount);
        }
        if (!(experienceMultiplier > 0) || !(recoveryMultiplier > 0)) {
            throw new InvalidArgumentException(String.format(
                "倍率必须为正数 (经验 %.2f, 恢复 %.2f)", experienceMultiplier, recoveryMultiplier));
        }
    }
}
