package com.dcruver.cultivation.domain;

import lombok.Value;

/**
 * Health and mana restored by one action, before clamping.
 */
@Value
public class RecoveryEffect {
    public static final RecoveryEffect NONE = new RecoveryEffect(0, 0);

    int healthDelta;
    int manaDelta;
}
