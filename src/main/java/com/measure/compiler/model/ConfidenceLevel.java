package com.measure.compiler.model;

import java.util.Locale;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Lenient parse; unknown or missing values fall back to MEDIUM.
     */
    public static ConfidenceLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "low" -> LOW;
            default -> MEDIUM;
        };
    }
}
