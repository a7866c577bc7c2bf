package com.measure.compiler.generator;

import com.measure.compiler.model.TimingUnit;

/**
 * Backend-neutral timing of one data element.
 */
public final class NormalizedTiming {
    private static final NormalizedTiming DURING = new NormalizedTiming(TimingKind.DURING_MEASUREMENT_PERIOD,
            0, null, null, null, null, "default");

    private final TimingKind kind;
    private final int amount;
    private final TimingUnit unit;
    private final Integer daysBeforeIndex;
    private final Integer daysAfterIndex;
    private final String matchedKeyword;
    private final String source;

    private NormalizedTiming(TimingKind kind, int amount, TimingUnit unit, Integer daysBeforeIndex,
                             Integer daysAfterIndex, String matchedKeyword, String source) {
        this.kind = kind;
        this.amount = amount;
        this.unit = unit;
        this.daysBeforeIndex = daysBeforeIndex;
        this.daysAfterIndex = daysAfterIndex;
        this.matchedKeyword = matchedKeyword;
        this.source = source;
    }

    public static NormalizedTiming duringMeasurementPeriod() {
        return DURING;
    }

    public static NormalizedTiming lookback(LookbackPeriod period) {
        return new NormalizedTiming(TimingKind.BEFORE_PERIOD_END, period.getAmount(), period.getUnit(), null, null,
                period.getKeyword(), "lookback table");
    }

    public static NormalizedTiming beforePeriodEnd(int amount, TimingUnit unit, String source) {
        return new NormalizedTiming(TimingKind.BEFORE_PERIOD_END, amount, unit, null, null, null, source);
    }

    public static NormalizedTiming afterPeriodStart(int amount, TimingUnit unit, String source) {
        return new NormalizedTiming(TimingKind.AFTER_PERIOD_START, amount, unit, null, null, null, source);
    }

    public static NormalizedTiming indexEvent(Integer daysBefore, Integer daysAfter) {
        return new NormalizedTiming(TimingKind.INDEX_EVENT, 0, TimingUnit.DAYS, daysBefore, daysAfter, null,
                "index event");
    }

    public TimingKind getKind() {
        return kind;
    }

    public int getAmount() {
        return amount;
    }

    public TimingUnit getUnit() {
        return unit;
    }

    public Integer getDaysBeforeIndex() {
        return daysBeforeIndex;
    }

    public Integer getDaysAfterIndex() {
        return daysAfterIndex;
    }

    public String getMatchedKeyword() {
        return matchedKeyword;
    }

    /**
     * Where the timing came from, for generated comments.
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case DURING_MEASUREMENT_PERIOD -> "during measurement period";
            case BEFORE_PERIOD_END -> amount + " " + unit.label(amount) + " before period end";
            case AFTER_PERIOD_START -> amount + " " + unit.label(amount) + " after period start";
            case INDEX_EVENT -> "relative to index event";
        };
    }
}
