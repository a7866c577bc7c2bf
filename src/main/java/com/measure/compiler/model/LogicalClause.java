package com.measure.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Internal node of a criteria tree. Immutable; the {@code with*} methods return copies
 * that share unchanged children with the original.
 */
public final class LogicalClause {
    private final String id;
    private final LogicalOperator operator;
    private final String description;
    private final List<CriteriaNode> children;
    private final List<SiblingConnection> siblingConnections;
    private final ConfidenceLevel confidence;
    private final ReviewStatus reviewStatus;

    public LogicalClause(String id, LogicalOperator operator, String description, List<CriteriaNode> children,
                         List<SiblingConnection> siblingConnections, ConfidenceLevel confidence,
                         ReviewStatus reviewStatus) {
        this.id = Objects.requireNonNull(id, "id");
        this.operator = operator;
        this.description = description;
        this.children = children != null ? List.copyOf(children) : List.of();
        this.siblingConnections = siblingConnections != null ? List.copyOf(siblingConnections) : List.of();
        this.confidence = confidence != null ? confidence : ConfidenceLevel.MEDIUM;
        this.reviewStatus = reviewStatus != null ? reviewStatus : ReviewStatus.PENDING;
    }

    public LogicalClause(String id, LogicalOperator operator, List<CriteriaNode> children) {
        this(id, operator, null, children, null, null, null);
    }

    public static LogicalClause and(String id, CriteriaNode... children) {
        return new LogicalClause(id, LogicalOperator.AND, List.of(children));
    }

    public static LogicalClause or(String id, CriteriaNode... children) {
        return new LogicalClause(id, LogicalOperator.OR, List.of(children));
    }

    public static LogicalClause not(String id, CriteriaNode child) {
        return new LogicalClause(id, LogicalOperator.NOT, List.of(child));
    }

    // Getters
    public String getId() {
        return id;
    }

    /**
     * May be null for clauses read from untrusted input; validation reports it.
     */
    public LogicalOperator getOperator() {
        return operator;
    }

    public String getDescription() {
        return description;
    }

    public List<CriteriaNode> getChildren() {
        return children;
    }

    public List<SiblingConnection> getSiblingConnections() {
        return siblingConnections;
    }

    public boolean hasSiblingConnections() {
        return !siblingConnections.isEmpty();
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public ReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    /**
     * Operator joining children {@code i} and {@code j}: the override if one exists, else the default.
     */
    public LogicalOperator operatorBetween(int i, int j) {
        for (SiblingConnection connection : siblingConnections) {
            if (connection.joins(i, j)) {
                return connection.getOperator();
            }
        }
        return operator;
    }

    public LogicalClause withChildren(List<CriteriaNode> newChildren) {
        return new LogicalClause(id, operator, description, newChildren, siblingConnections, confidence, reviewStatus);
    }

    public LogicalClause withChildren(List<CriteriaNode> newChildren, List<SiblingConnection> newConnections) {
        return new LogicalClause(id, operator, description, newChildren, newConnections, confidence, reviewStatus);
    }

    public LogicalClause withOperator(LogicalOperator newOperator) {
        return new LogicalClause(id, newOperator, description, children, siblingConnections, confidence, reviewStatus);
    }

    public LogicalClause withSiblingConnections(List<SiblingConnection> newConnections) {
        return new LogicalClause(id, operator, description, children, newConnections, confidence, reviewStatus);
    }

    public LogicalClause withId(String newId) {
        return new LogicalClause(newId, operator, description, children, siblingConnections, confidence, reviewStatus);
    }

    public LogicalClause withDescription(String newDescription) {
        return new LogicalClause(id, operator, newDescription, children, siblingConnections, confidence, reviewStatus);
    }

    /**
     * Mutable copy of the children, for edit helpers that build a new list.
     */
    public List<CriteriaNode> copyChildren() {
        return new ArrayList<>(children);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalClause that)) return false;
        return id.equals(that.id) && operator == that.operator && Objects.equals(description, that.description)
                && children.equals(that.children) && siblingConnections.equals(that.siblingConnections)
                && confidence == that.confidence && reviewStatus == that.reviewStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operator, description, children, siblingConnections, confidence, reviewStatus);
    }

    @Override
    public String toString() {
        return "LogicalClause[" + id + ", " + operator + ", " + children.size() + " children]";
    }
}
