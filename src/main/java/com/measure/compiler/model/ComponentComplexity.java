package com.measure.compiler.model;

import java.util.Objects;

public final class ComponentComplexity {
    private final int score;
    private final ComplexityLevel level;
    private final boolean composite;
    private final ComplexityFactors factors;

    public ComponentComplexity(int score, boolean composite, ComplexityFactors factors) {
        this.score = score;
        this.level = ComplexityLevel.fromScore(score);
        this.composite = composite;
        this.factors = Objects.requireNonNull(factors, "factors");
    }

    public int getScore() {
        return score;
    }

    public ComplexityLevel getLevel() {
        return level;
    }

    public boolean isComposite() {
        return composite;
    }

    public ComplexityFactors getFactors() {
        return factors;
    }

    @Override
    public String toString() {
        return score + " (" + level.name().toLowerCase() + ")";
    }
}
