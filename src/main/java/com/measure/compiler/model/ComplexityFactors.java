package com.measure.compiler.model;

/**
 * Breakdown of a complexity score. Atomic scores fill base, timing and negation;
 * composite scores fill children sum, AND operators and nesting depth.
 */
public final class ComplexityFactors {
    private final int base;
    private final int timingClauses;
    private final int negations;
    private final int childrenSum;
    private final int andOperators;
    private final int nestingDepth;

    public ComplexityFactors(int base, int timingClauses, int negations, int childrenSum, int andOperators,
                             int nestingDepth) {
        this.base = base;
        this.timingClauses = timingClauses;
        this.negations = negations;
        this.childrenSum = childrenSum;
        this.andOperators = andOperators;
        this.nestingDepth = nestingDepth;
    }

    public static ComplexityFactors atomic(int base, int timingClauses, int negations) {
        return new ComplexityFactors(base, timingClauses, negations, 0, 0, 0);
    }

    public static ComplexityFactors composite(int childrenSum, int andOperators, int nestingDepth) {
        return new ComplexityFactors(0, 0, 0, childrenSum, andOperators, nestingDepth);
    }

    public int getBase() {
        return base;
    }

    public int getTimingClauses() {
        return timingClauses;
    }

    public int getNegations() {
        return negations;
    }

    public int getChildrenSum() {
        return childrenSum;
    }

    public int getAndOperators() {
        return andOperators;
    }

    public int getNestingDepth() {
        return nestingDepth;
    }
}
