package com.measure.compiler.extraction;

import com.measure.compiler.model.ConfidenceLevel;
import com.measure.compiler.model.MeasureMetadata;

import java.util.List;
import java.util.Objects;

/**
 * Result of the skeleton pass: measure metadata and the ordered list of populations to detail.
 */
public final class MeasureSkeleton {
    private final MeasureMetadata metadata;
    private final List<PopulationSkeleton> populations;
    private final ConfidenceLevel confidence;

    public MeasureSkeleton(MeasureMetadata metadata, List<PopulationSkeleton> populations, ConfidenceLevel confidence) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.populations = populations != null ? List.copyOf(populations) : List.of();
        this.confidence = confidence != null ? confidence : ConfidenceLevel.MEDIUM;
    }

    public MeasureMetadata getMetadata() {
        return metadata;
    }

    public String getMeasureId() {
        return metadata.getMeasureId();
    }

    public String getTitle() {
        return metadata.getTitle();
    }

    public List<PopulationSkeleton> getPopulations() {
        return populations;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }
}
