package com.dcruver.cultivation.domain.character;

/**
 * Spendable energy (仙力).
 */
public class ManaComponent {
    private final BoundedValue value;

    public ManaComponent(int max, int initial) {
        this.value = new BoundedValue("仙力", max, initial);
    }

    public int getCurrent() {
        return value.current();
    }

    public int getMax() {
        return value.max();
    }

    /**
     * @return the change actually applied after clamping into [0, max]
     */
    public int applyDelta(int amount) {
        return value.applyDelta(amount);
    }

    public boolean hasAtLeast(int amount) {
        return value.current() >= amount;
    }

    public double getPercentage() {
        return value.max() == 0 ? 0.0 : (double) value.current() / value.max();
    }
}
