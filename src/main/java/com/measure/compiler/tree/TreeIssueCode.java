package com.measure.compiler.tree;

public enum TreeIssueCode {
    EMPTY_TREE(Severity.ERROR),
    EMPTY_GROUP(Severity.ERROR),
    NOT_WITH_MULTIPLE_CHILDREN(Severity.ERROR),
    INVALID_OPERATOR(Severity.ERROR),
    /** Reported for a reused node id. */
    CIRCULAR_REFERENCE(Severity.ERROR),
    SINGLE_CHILD_GROUP(Severity.WARNING),
    DEEPLY_NESTED(Severity.WARNING),
    MIXED_OPERATORS(Severity.WARNING);

    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;

    TreeIssueCode(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
