package com.measure.compiler.model;

public enum ComplexityLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Map a score to its level: low up to 3, medium up to 7, high from 8.
     */
    public static ComplexityLevel fromScore(int score) {
        if (score <= 3) {
            return LOW;
        }
        if (score <= 7) {
            return MEDIUM;
        }
        return HIGH;
    }
}
