package com.measure.compiler.tree;

public final class TreeStats {
    private final int totalNodes;
    private final int maxDepth;
    private final int criteriaCount;
    private final int groupCount;

    public TreeStats(int totalNodes, int maxDepth, int criteriaCount, int groupCount) {
        this.totalNodes = totalNodes;
        this.maxDepth = maxDepth;
        this.criteriaCount = criteriaCount;
        this.groupCount = groupCount;
    }

    public static TreeStats empty() {
        return new TreeStats(0, 0, 0, 0);
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getCriteriaCount() {
        return criteriaCount;
    }

    public int getGroupCount() {
        return groupCount;
    }
}
