package com.dcruver.cultivation.domain.character;

import com.dcruver.cultivation.domain.error.InsufficientResourceException;
import com.dcruver.cultivation.domain.error.InvalidArgumentException;

/**
 * Consumable pills (丹药). Only the starting stock ever adds to it.
 */
public class InventoryComponent {
    private int pillCount;

    public InventoryComponent(int initialPillCount) {
        if (initialPillCount < 0) {
            throw new InvalidArgumentException("丹药数量不能为负: " + initialPillCount);
        }
        this.pillCount = initialPillCount;
    }

    public int getPillCount() {
        return pillCount;
    }

    public boolean hasPills(int n) {
        return pillCount >= n;
    }

    /**
     * Remove {@code n} pills.
     *
     * @return the remaining count
     * @throws InsufficientResourceException if fewer than {@code n} pills are left
     */
    public int consume(int n) {
        if (n < 0) {
            throw new InvalidArgumentException("消耗数量不能为负: " + n);
        }
        if (n > pillCount) {
            throw new InsufficientResourceException(String.format("需要 %d 颗丹药，仅有 %d 颗", n, pillCount));
        }
        pillCount -= n;
        return pillCount;
    }
}
