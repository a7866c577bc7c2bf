package com.measure.compiler.generator;

import com.measure.compiler.model.TimingUnit;

import java.util.Objects;

/**
 * How far back from the end of the measurement period an event still counts.
 */
public final class LookbackPeriod {
    private final int amount;
    private final TimingUnit unit;
    private final String keyword;

    public LookbackPeriod(int amount, TimingUnit unit, String keyword) {
        this.amount = amount;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.keyword = keyword;
    }

    public int getAmount() {
        return amount;
    }

    public TimingUnit getUnit() {
        return unit;
    }

    /**
     * The keyword that selected this period, if it came from a lookup table.
     */
    public String getKeyword() {
        return keyword;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LookbackPeriod that)) return false;
        return amount == that.amount && unit == that.unit && Objects.equals(keyword, that.keyword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit, keyword);
    }

    @Override
    public String toString() {
        return amount + " " + unit.label(amount);
    }
}
