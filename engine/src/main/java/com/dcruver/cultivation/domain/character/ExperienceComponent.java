package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.StageLevel;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongFunction;

/**
 * Cumulative experience (修为) and the stage derived from it.
 *
 * The stage is never set directly: it is re-resolved from the total after every gain.
 */
public class ExperienceComponent {
    private final LongFunction<StageLevel> stageResolver;
    private long totalExperience;
    private StageLevel currentStage;

    public ExperienceComponent(LongFunction<StageLevel> stageResolver) {
        this.stageResolver = stageResolver;
        this.totalExperience = 0L;
        this.currentStage = stageResolver.apply(0L);
    }

    public long getTotalExperience() {
        return totalExperience;
    }

    public StageLevel getCurrentStage() {
        return currentStage;
    }

    /**
     * Add experience and report every stage entered on the way, lowest first.
     * A gain that skips past several thresholds yields one entry per tier.
     */
    public List<StageLevel> add(long delta) {
        if (delta < 0) {
            throw new InvalidArgumentException("经验增量不能为负: " + delta);
        }
        StageLevel before = currentStage;
        totalExperience += delta;
        currentStage = stageResolver.apply(totalExperience);

        List<StageLevel> crossed = new ArrayList<>();
        StageLevel[] stages = StageLevel.values();
        for (int i = before.ordinal() + 1; i <= currentStage.ordinal(); i++) {
            crossed.add(stages[i]);
        }
        return crossed;
    }
}
