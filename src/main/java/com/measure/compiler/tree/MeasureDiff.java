package com.measure.compiler.tree;

import java.util.List;

/**
 * Differences between two snapshots of the same measure.
 */
public final class MeasureDiff {
    private final List<String> changedMetadataFields;
    private final List<PopulationDiff> populationDiffs;
    private final List<String> addedValueSetKeys;
    private final List<String> removedValueSetKeys;

    public MeasureDiff(List<String> changedMetadataFields, List<PopulationDiff> populationDiffs,
                       List<String> addedValueSetKeys, List<String> removedValueSetKeys) {
        this.changedMetadataFields = List.copyOf(changedMetadataFields);
        this.populationDiffs = List.copyOf(populationDiffs);
        this.addedValueSetKeys = List.copyOf(addedValueSetKeys);
        this.removedValueSetKeys = List.copyOf(removedValueSetKeys);
    }

    public List<String> getChangedMetadataFields() {
        return changedMetadataFields;
    }

    /**
     * One entry per population type present in either snapshot, unchanged ones included.
     */
    public List<PopulationDiff> getPopulationDiffs() {
        return populationDiffs;
    }

    public List<String> getAddedValueSetKeys() {
        return addedValueSetKeys;
    }

    public List<String> getRemovedValueSetKeys() {
        return removedValueSetKeys;
    }

    public int totalChanges() {
        int populationChanges = (int) populationDiffs.stream()
                .filter(d -> d.getChangeType() != ChangeType.UNCHANGED)
                .count();
        return changedMetadataFields.size() + populationChanges + addedValueSetKeys.size()
                + removedValueSetKeys.size();
    }
}
