package com.measure.compiler.model;

import java.util.Locale;

/**
 * Clinical category of a data element.
 */
public enum ClinicalType {
    DEMOGRAPHIC("demographic"),
    ENCOUNTER("encounter"),
    DIAGNOSIS("diagnosis"),
    PROCEDURE("procedure"),
    OBSERVATION("observation"),
    MEDICATION("medication"),
    IMMUNIZATION("immunization"),
    ASSESSMENT("assessment");

    private final String value;

    ClinicalType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse the lower-case wire spelling. "condition" and "lab" are accepted as aliases.
     * @param value The wire value
     * @return The matching type
     */
    public static ClinicalType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Clinical type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "condition" -> DIAGNOSIS;
            case "lab", "result" -> OBSERVATION;
            default -> {
                for (ClinicalType type : values()) {
                    if (type.value.equals(normalized)) {
                        yield type;
                    }
                }
                throw new IllegalArgumentException("Unknown clinical type: " + value);
            }
        };
    }
}
