package com.measure.compiler.model;

import java.util.Locale;

public enum Gender {
    MALE("male"),
    FEMALE("female"),
    ALL("all");

    private final String value;

    Gender(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Gender fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "male", "m" -> MALE;
            case "female", "f" -> FEMALE;
            default -> ALL;
        };
    }
}
