package com.measure.compiler.model;

import java.util.Locale;

public enum TimingUnit {
    DAYS("day"),
    MONTHS("month"),
    YEARS("year");

    private final String singular;

    TimingUnit(String singular) {
        this.singular = singular;
    }

    /**
     * Unit word for the given quantity, e.g. "1 year" but "2 years".
     */
    public String label(int quantity) {
        return quantity == 1 ? singular : singular + "s";
    }

    public static TimingUnit fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Timing unit is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!normalized.endsWith("s")) {
            normalized = normalized + "s";
        }
        return switch (normalized) {
            case "days" -> DAYS;
            case "months" -> MONTHS;
            case "years" -> YEARS;
            default -> throw new IllegalArgumentException("Unknown timing unit: " + value);
        };
    }
}
