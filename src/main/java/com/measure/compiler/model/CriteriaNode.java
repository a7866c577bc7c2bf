package com.measure.compiler.model;

import java.util.Objects;

/**
 * A child of a logical clause: exactly one of a data element or a nested clause.
 * Callers switch on {@link #getKind()} rather than testing types.
 */
public final class CriteriaNode {
    private final NodeKind kind;
    private final DataElement element;
    private final LogicalClause clause;

    private CriteriaNode(NodeKind kind, DataElement element, LogicalClause clause) {
        this.kind = kind;
        this.element = element;
        this.clause = clause;
    }

    public static CriteriaNode of(DataElement element) {
        return new CriteriaNode(NodeKind.ELEMENT, Objects.requireNonNull(element, "element"), null);
    }

    public static CriteriaNode of(LogicalClause clause) {
        return new CriteriaNode(NodeKind.CLAUSE, null, Objects.requireNonNull(clause, "clause"));
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isClause() {
        return kind == NodeKind.CLAUSE;
    }

    public boolean isElement() {
        return kind == NodeKind.ELEMENT;
    }

    public String getId() {
        return kind == NodeKind.CLAUSE ? clause.getId() : element.getId();
    }

    public String getDescription() {
        return kind == NodeKind.CLAUSE ? clause.getDescription() : element.getDescription();
    }

    public DataElement asElement() {
        if (kind != NodeKind.ELEMENT) {
            throw new IllegalStateException("Node " + getId() + " is a clause, not an element");
        }
        return element;
    }

    public LogicalClause asClause() {
        if (kind != NodeKind.CLAUSE) {
            throw new IllegalStateException("Node " + getId() + " is an element, not a clause");
        }
        return clause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CriteriaNode that)) return false;
        return kind == that.kind && Objects.equals(element, that.element) && Objects.equals(clause, that.clause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, element, clause);
    }

    @Override
    public String toString() {
        return kind == NodeKind.CLAUSE ? clause.toString() : element.toString();
    }
}
