package com.dcruver.cultivation.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Cultivation stages (境界), ordered by ordinal.
 * Thresholds are cumulative experience and strictly increasing; exactly one tier is terminal.
 */
@Getter
@RequiredArgsConstructor
public enum StageLevel {
    /**
     * Starting tier - every character begins here
     */
    QI_REFINING("炼气期", 0L, 1.0, false),

    FOUNDATION("筑基期", 100L, 1.5, false),

    CORE_FORMATION("结丹期", 300L, 2.5, false),

    NASCENT_SOUL("元婴期", 700L, 4.0, false),

    SPIRITUAL_TRANSFORMATION("化神期", 1500L, 6.0, false),

    /**
     * Final ascension - reaching it ends the session as a victory
     */
    ASCENSION("飞升", 3100L, 10.0, true);

    private final String displayName;
    private final long threshold;
    private final double powerMultiplier;
    private final boolean terminal;

    public int getRank() {
        return ordinal();
    }

    public static StageLevel terminalStage() {
        StageLevel[] stages = values();
        return stages[stages.length - 1];
    }
}
