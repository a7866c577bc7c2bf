package com.measure.compiler.model;

import java.util.Objects;

/**
 * A quantity of time before or after an anchor, e.g. "10 years before".
 */
public final class TimingWindow {
    private final int value;
    private final TimingUnit unit;
    private final TimingDirection direction;

    public TimingWindow(int value, TimingUnit unit, TimingDirection direction) {
        if (value < 0) {
            throw new IllegalArgumentException("Timing window value must not be negative: " + value);
        }
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public int getValue() {
        return value;
    }

    public TimingUnit getUnit() {
        return unit;
    }

    public TimingDirection getDirection() {
        return direction;
    }

    /**
     * Approximate length of the window in days (30 per month, 365 per year).
     */
    public int toDays() {
        return switch (unit) {
            case DAYS -> value;
            case MONTHS -> value * 30;
            case YEARS -> value * 365;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimingWindow that)) return false;
        return value == that.value && unit == that.unit && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit, direction);
    }

    @Override
    public String toString() {
        return value + " " + unit.label(value) + " " + direction.name().toLowerCase();
    }
}
