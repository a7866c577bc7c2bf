package com.measure.compiler.model;

import java.util.Locale;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    FLAGGED;

    public static ReviewStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approved" -> APPROVED;
            case "flagged", "needs_revision" -> FLAGGED;
            case "pending" -> PENDING;
            default -> throw new IllegalArgumentException("Unknown review status: " + value);
        };
    }
}
