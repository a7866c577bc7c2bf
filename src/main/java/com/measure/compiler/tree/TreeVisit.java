package com.measure.compiler.tree;

import com.measure.compiler.model.CriteriaNode;

/**
 * One step of a pre-order walk.
 */
public final class TreeVisit {
    private final CriteriaNode node;
    private final int depth;
    private final TreePath path;

    public TreeVisit(CriteriaNode node, int depth, TreePath path) {
        this.node = node;
        this.depth = depth;
        this.path = path;
    }

    public CriteriaNode getNode() {
        return node;
    }

    public int getDepth() {
        return depth;
    }

    public TreePath getPath() {
        return path;
    }

    public boolean isClause() {
        return node.isClause();
    }
}
