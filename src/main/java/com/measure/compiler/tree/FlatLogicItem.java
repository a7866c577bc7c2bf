package com.measure.compiler.tree;

import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.NodeKind;
import com.measure.compiler.model.SiblingConnection;

import java.util.List;

/**
 * Row of the flat projection of a tree. Groups carry their operator and overrides;
 * criteria carry only their id and a label.
 */
public final class FlatLogicItem {
    private final String id;
    private final NodeKind kind;
    private final int depth;
    private final String parentId;
    private final String label;
    private final LogicalOperator operator;
    private final List<SiblingConnection> siblingConnections;

    public FlatLogicItem(String id, NodeKind kind, int depth, String parentId, String label,
                         LogicalOperator operator, List<SiblingConnection> siblingConnections) {
        this.id = id;
        this.kind = kind;
        this.depth = depth;
        this.parentId = parentId;
        this.label = label;
        this.operator = operator;
        this.siblingConnections = siblingConnections != null ? List.copyOf(siblingConnections) : List.of();
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Id of the enclosing group, null for the root.
     */
    public String getParentId() {
        return parentId;
    }

    public String getLabel() {
        return label;
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public List<SiblingConnection> getSiblingConnections() {
        return siblingConnections;
    }
}
