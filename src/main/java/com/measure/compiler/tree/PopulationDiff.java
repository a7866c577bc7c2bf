package com.measure.compiler.tree;

import com.measure.compiler.model.PopulationType;

public final class PopulationDiff {
    private final PopulationType populationType;
    private final ChangeType changeType;
    private final TreeDiff treeDiff;

    public PopulationDiff(PopulationType populationType, ChangeType changeType, TreeDiff treeDiff) {
        this.populationType = populationType;
        this.changeType = changeType;
        this.treeDiff = treeDiff;
    }

    public PopulationType getPopulationType() {
        return populationType;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public TreeDiff getTreeDiff() {
        return treeDiff;
    }
}
