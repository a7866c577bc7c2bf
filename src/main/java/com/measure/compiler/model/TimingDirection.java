package com.measure.compiler.model;

import java.util.Locale;

public enum TimingDirection {
    BEFORE,
    AFTER;

    public static TimingDirection fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Timing direction is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "before", "within" -> BEFORE;
            case "after" -> AFTER;
            default -> throw new IllegalArgumentException("Unknown timing direction: " + value);
        };
    }
}
