package com.measure.compiler.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Timing constraint on a data element: an optional window relative to an optional anchor.
 * A requirement with neither means "during the measurement period".
 */
public final class TimingRequirement {
    public static final String MEASUREMENT_PERIOD = "measurement_period";

    private final String description;
    private final TimingWindow window;
    private final String anchor;

    public TimingRequirement(String description, TimingWindow window, String anchor) {
        this.description = description;
        this.window = window;
        this.anchor = anchor;
    }

    public static TimingRequirement duringMeasurementPeriod() {
        return new TimingRequirement("During the measurement period", null, MEASUREMENT_PERIOD);
    }

    public static TimingRequirement within(int value, TimingUnit unit, TimingDirection direction, String anchor) {
        return new TimingRequirement(null, new TimingWindow(value, unit, direction), anchor);
    }

    public String getDescription() {
        return description;
    }

    public TimingWindow getWindow() {
        return window;
    }

    public String getAnchor() {
        return anchor;
    }

    public boolean hasWindow() {
        return window != null;
    }

    /**
     * True when the anchor is absent or names the measurement period.
     */
    public boolean isMeasurementPeriodAnchored() {
        if (anchor == null || anchor.isBlank()) {
            return true;
        }
        String normalized = anchor.toLowerCase(Locale.ROOT).replace(' ', '_');
        return normalized.contains(MEASUREMENT_PERIOD);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimingRequirement that)) return false;
        return Objects.equals(description, that.description)
                && Objects.equals(window, that.window)
                && Objects.equals(anchor, that.anchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, window, anchor);
    }
}
