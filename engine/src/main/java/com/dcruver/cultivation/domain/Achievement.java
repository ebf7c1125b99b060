package com.dcruver.cultivation.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Session-scoped milestones. Each unlocks at most once per session.
 */
@Getter
@RequiredArgsConstructor
public enum Achievement {
    FIRST_ACTION("开始修炼"),
    FIRST_BREAKTHROUGH("首次突破"),
    MEDITATION_BEGINNER("打坐初学者"),
    MEDITATION_MASTER("打坐大师"),
    CULTIVATION_ENTHUSIAST("修炼爱好者"),
    PERSISTENT_CULTIVATOR("坚持修炼"),
    FIRST_DEATH("初次死亡");

    private final String displayName;
}
