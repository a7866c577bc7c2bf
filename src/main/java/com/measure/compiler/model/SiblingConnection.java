package com.measure.compiler.model;

import java.util.Objects;

/**
 * Operator override between two adjacent children of a clause.
 * Stored normalized so that {@code fromIndex < toIndex}.
 */
public final class SiblingConnection {
    private final int fromIndex;
    private final int toIndex;
    private final LogicalOperator operator;

    public SiblingConnection(int fromIndex, int toIndex, LogicalOperator operator) {
        if (fromIndex < 0 || toIndex < 0) {
            throw new IllegalArgumentException("Sibling indices must not be negative");
        }
        if (Math.abs(fromIndex - toIndex) != 1) {
            throw new IllegalArgumentException(
                    "Sibling connection must join adjacent children, got " + fromIndex + " and " + toIndex);
        }
        if (operator == LogicalOperator.NOT) {
            throw new IllegalArgumentException("NOT cannot connect two siblings");
        }
        this.fromIndex = Math.min(fromIndex, toIndex);
        this.toIndex = Math.max(fromIndex, toIndex);
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public int getFromIndex() {
        return fromIndex;
    }

    public int getToIndex() {
        return toIndex;
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public boolean touches(int index) {
        return fromIndex == index || toIndex == index;
    }

    public boolean joins(int a, int b) {
        return fromIndex == Math.min(a, b) && toIndex == Math.max(a, b);
    }

    /**
     * Copy moved by {@code delta} positions.
     */
    public SiblingConnection shift(int delta) {
        return new SiblingConnection(fromIndex + delta, toIndex + delta, operator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SiblingConnection that)) return false;
        return fromIndex == that.fromIndex && toIndex == that.toIndex && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromIndex, toIndex, operator);
    }

    @Override
    public String toString() {
        return fromIndex + "-" + toIndex + ":" + operator;
    }
}
