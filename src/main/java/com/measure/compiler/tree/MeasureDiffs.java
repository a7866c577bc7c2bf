package com.measure.compiler.tree;

import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compares two measure snapshots population by population.
 */
public final class MeasureDiffs {

    private MeasureDiffs() {
    }

    public static MeasureDiff diff(UniversalMeasureSpec before, UniversalMeasureSpec after) {
        List<PopulationDiff> populationDiffs = new ArrayList<>();
        for (PopulationType type : PopulationType.values()) {
            Optional<PopulationDefinition> old = before.findPopulation(type);
            Optional<PopulationDefinition> current = after.findPopulation(type);
            if (old.isEmpty() && current.isEmpty()) {
                continue;
            }
            if (old.isEmpty()) {
                populationDiffs.add(new PopulationDiff(type, ChangeType.ADDED,
                        LogicTrees.diff(null, current.get().getCriteria())));
            } else if (current.isEmpty()) {
                populationDiffs.add(new PopulationDiff(type, ChangeType.REMOVED,
                        LogicTrees.diff(old.get().getCriteria(), null)));
            } else {
                TreeDiff treeDiff = LogicTrees.diff(old.get().getCriteria(), current.get().getCriteria());
                boolean same = treeDiff.isEmpty()
                        && LogicTrees.areEqual(old.get().getCriteria(), current.get().getCriteria())
                        && Objects.equals(old.get().getNarrative(), current.get().getNarrative());
                populationDiffs.add(new PopulationDiff(type, same ? ChangeType.UNCHANGED : ChangeType.MODIFIED,
                        treeDiff));
            }
        }

        Set<String> beforeKeys = valueSetKeys(before);
        Set<String> afterKeys = valueSetKeys(after);
        List<String> added = afterKeys.stream().filter(k -> !beforeKeys.contains(k)).toList();
        List<String> removed = beforeKeys.stream().filter(k -> !afterKeys.contains(k)).toList();

        return new MeasureDiff(changedMetadata(before.getMetadata(), after.getMetadata()), populationDiffs,
                added, removed);
    }

    private static Set<String> valueSetKeys(UniversalMeasureSpec measure) {
        Set<String> keys = new LinkedHashSet<>();
        for (ValueSetReference valueSet : measure.getValueSets()) {
            keys.add(valueSet.dedupKey());
        }
        return keys;
    }

    private static List<String> changedMetadata(MeasureMetadata before, MeasureMetadata after) {
        List<String> fields = new ArrayList<>();
        if (!Objects.equals(before.getMeasureId(), after.getMeasureId())) fields.add("measureId");
        if (!Objects.equals(before.getTitle(), after.getTitle())) fields.add("title");
        if (!Objects.equals(before.getVersion(), after.getVersion())) fields.add("version");
        if (!Objects.equals(before.getDescription(), after.getDescription())) fields.add("description");
        if (!Objects.equals(before.getMeasurementPeriod(), after.getMeasurementPeriod())) fields.add("measurementPeriod");
        return fields;
    }
}
