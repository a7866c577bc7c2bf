package com.measure.compiler.tree;

public final class TreeIssue {
    private final TreeIssueCode code;
    private final String message;
    private final String nodeId;
    private final TreePath path;

    public TreeIssue(TreeIssueCode code, String message, String nodeId, TreePath path) {
        this.code = code;
        this.message = message;
        this.nodeId = nodeId;
        this.path = path;
    }

    public TreeIssueCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getNodeId() {
        return nodeId;
    }

    public TreePath getPath() {
        return path;
    }

    @Override
    public String toString() {
        return code + " at " + (path != null ? path : "-") + ": " + message;
    }
}
