package com.dcruver.cultivation.domain.actions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of player actions.
 */
@Getter
@RequiredArgsConstructor
public enum ActionType {
    MEDITATE("打坐"),
    CONSUME_PILL("吃丹药"),
    CULTIVATE("修炼"),
    WAIT("等待");

    private final String displayName;
}
