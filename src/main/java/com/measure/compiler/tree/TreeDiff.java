package com.measure.compiler.tree;

import java.util.List;

public final class TreeDiff {
    private final List<String> addedCriterionIds;
    private final List<String> removedCriterionIds;
    private final List<OperatorChange> operatorChanges;

    public TreeDiff(List<String> addedCriterionIds, List<String> removedCriterionIds,
                    List<OperatorChange> operatorChanges) {
        this.addedCriterionIds = List.copyOf(addedCriterionIds);
        this.removedCriterionIds = List.copyOf(removedCriterionIds);
        this.operatorChanges = List.copyOf(operatorChanges);
    }

    public List<String> getAddedCriterionIds() {
        return addedCriterionIds;
    }

    public List<String> getRemovedCriterionIds() {
        return removedCriterionIds;
    }

    public List<OperatorChange> getOperatorChanges() {
        return operatorChanges;
    }

    public boolean isEmpty() {
        return addedCriterionIds.isEmpty() && removedCriterionIds.isEmpty() && operatorChanges.isEmpty();
    }
}
