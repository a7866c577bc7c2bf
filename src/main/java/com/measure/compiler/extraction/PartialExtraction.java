package com.measure.compiler.extraction;

import com.measure.compiler.model.ValueSetReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What the passes produced for one chunk of a long document.
 */
public final class PartialExtraction {
    private final DocumentChunk chunk;
    private final MeasureSkeleton skeleton;
    private final List<PopulationExtractionResult> populationResults;

    public PartialExtraction(DocumentChunk chunk, MeasureSkeleton skeleton,
                             List<PopulationExtractionResult> populationResults) {
        this.chunk = chunk;
        this.skeleton = skeleton;
        this.populationResults = populationResults != null ? List.copyOf(populationResults) : List.of();
    }

    public DocumentChunk getChunk() {
        return chunk;
    }

    public Optional<MeasureSkeleton> getSkeleton() {
        return Optional.ofNullable(skeleton);
    }

    public List<PopulationExtractionResult> getPopulationResults() {
        return populationResults;
    }

    /**
     * Value sets of every population result in this chunk, in result order.
     */
    public List<ValueSetReference> getValueSets() {
        List<ValueSetReference> valueSets = new ArrayList<>();
        for (PopulationExtractionResult result : populationResults) {
            valueSets.addAll(result.getValueSets());
        }
        return valueSets;
    }
}
