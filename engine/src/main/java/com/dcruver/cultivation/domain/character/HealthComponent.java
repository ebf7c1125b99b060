package com.dcruver.cultivation.domain.character;

/**
 * Vitality (生命). A character with zero health is dead.
 */
public class HealthComponent {
    private final BoundedValue value;

    public HealthComponent(int max) {
        this.value = new BoundedValue("生命", max, max);
    }

    public int getCurrent() {
        return value.current();
    }

    public int getMax() {
        return value.max();
    }

    /**
     * Add {@code amount} (negative for damage), clamped into [0, max].
     *
     * @return the change actually applied, which callers must log instead of the request
     */
    public int applyDelta(int amount) {
        return value.applyDelta(amount);
    }

    public boolean isDepleted() {
        return value.current() == 0;
    }

    public double getPercentage() {
        return value.max() == 0 ? 0.0 : (double) value.current() / value.max();
    }
}
