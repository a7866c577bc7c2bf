package com.measure.compiler.tree;

import com.measure.compiler.model.LogicalOperator;

public final class OperatorChange {
    private final String groupId;
    private final LogicalOperator from;
    private final LogicalOperator to;

    public OperatorChange(String groupId, LogicalOperator from, LogicalOperator to) {
        this.groupId = groupId;
        this.from = from;
        this.to = to;
    }

    public String getGroupId() {
        return groupId;
    }

    public LogicalOperator getFrom() {
        return from;
    }

    public LogicalOperator getTo() {
        return to;
    }

    @Override
    public String toString() {
        return groupId + ": " + from + " -> " + to;
    }
}
