package com.measure.compiler.model;

import java.util.Locale;

public enum LogicalOperator {
    AND,
    OR,
    NOT;

    public static LogicalOperator fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operator is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown logical operator: " + value, e);
        }
    }
}
