package com.measure.compiler.extraction;

import com.measure.compiler.model.ValueSetReference;

import java.util.List;
import java.util.Optional;

public final class MergedExtraction {
    private final MeasureSkeleton skeleton;
    private final List<PopulationExtractionResult> populationResults;
    private final List<ValueSetReference> valueSets;

    public MergedExtraction(MeasureSkeleton skeleton, List<PopulationExtractionResult> populationResults,
                            List<ValueSetReference> valueSets) {
        this.skeleton = skeleton;
        this.populationResults = List.copyOf(populationResults);
        this.valueSets = List.copyOf(valueSets);
    }

    public Optional<MeasureSkeleton> getSkeleton() {
        return Optional.ofNullable(skeleton);
    }

    public List<PopulationExtractionResult> getPopulationResults() {
        return populationResults;
    }

    public List<ValueSetReference> getValueSets() {
        return valueSets;
    }
}
