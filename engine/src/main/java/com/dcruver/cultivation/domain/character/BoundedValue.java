package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.error.InvalidArgumentException;

/**
 * Integer held in [0, max]. Shared by the health and mana components.
 */
final class BoundedValue {
    private final int max;
    private int current;

    BoundedValue(String label, int max, int initial) {
        if (max < 0) {
            throw new InvalidArgumentException(label + " 上限不能为负: " + max);
        }
        if (initial < 0 || initial > max) {
            throw new InvalidArgumentException(String.format("%s 初始值 %d 不在 [0, %d] 内", label, initial, max));
        }
        this.max = max;
        this.current = initial;
    }

    int current() {
        return current;
    }

    int max() {
        return max;
    }

    /**
     * Clamp into [0, max] and return the change that actually happened.
     */
    int applyDelta(int amount) {
        long target = (long) current + amount;
        int clamped = (int) Math.max(0L, Math.min(max, target));
        int applied = clamped - current;
        current = clamped;
        return applied;
    }
}
