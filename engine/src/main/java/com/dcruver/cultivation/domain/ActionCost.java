package com.dcruver.cultivation.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Resources an action takes from the character.
 */
@Value
@Builder
public class ActionCost {
    public static final ActionCost FREE = ActionCost.builder().build();

    int health;
    int mana;
    int pills;

    public boolean isFree() {
        return health == 0 && mana == 0 && pills == 0;
    }
}
