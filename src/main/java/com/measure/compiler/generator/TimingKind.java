package com.measure.compiler.generator;

public enum TimingKind {
    /** Event occurs during the measurement period. */
    DURING_MEASUREMENT_PERIOD,
    /** Event ends within an amount of time before the end of the measurement period. */
    BEFORE_PERIOD_END,
    /** Event starts within an amount of time after the start of the measurement period. */
    AFTER_PERIOD_START,
    /** Event is placed relative to the index prescription start date. */
    INDEX_EVENT
}
