package com.measure.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate root of a structured measure: metadata, populations and value sets.
 * Populations refer to value sets by name or OID only.
 */
public final class UniversalMeasureSpec {
    private final String id;
    private final MeasureMetadata metadata;
    private final List<PopulationDefinition> populations;
    private final List<ValueSetReference> valueSets;
    private final GlobalConstraints globalConstraints;
    private final ConfidenceLevel overallConfidence;
    private final ReviewProgress reviewProgress;

    private UniversalMeasureSpec(Builder builder) {
        this.id = builder.id;
        this.metadata = Objects.requireNonNull(builder.metadata, "metadata");
        this.populations = List.copyOf(builder.populations);
        this.valueSets = List.copyOf(builder.valueSets);
        this.globalConstraints = builder.globalConstraints != null ? builder.globalConstraints : GlobalConstraints.none();
        this.overallConfidence = builder.overallConfidence != null ? builder.overallConfidence : ConfidenceLevel.MEDIUM;
        this.reviewProgress = builder.reviewProgress != null
                ? builder.reviewProgress
                : ReviewProgress.allPending(builder.populations.size());
    }

    public static Builder builder(MeasureMetadata metadata) {
        return new Builder(metadata);
    }

    public Builder toBuilder() {
        return new Builder(metadata)
                .id(id)
                .populations(populations)
                .valueSets(valueSets)
                .globalConstraints(globalConstraints)
                .overallConfidence(overallConfidence)
                .reviewProgress(reviewProgress);
    }

    public String getId() {
        return id;
    }

    public MeasureMetadata getMetadata() {
        return metadata;
    }

    public List<PopulationDefinition> getPopulations() {
        return populations;
    }

    public List<ValueSetReference> getValueSets() {
        return valueSets;
    }

    public GlobalConstraints getGlobalConstraints() {
        return globalConstraints;
    }

    public ConfidenceLevel getOverallConfidence() {
        return overallConfidence;
    }

    public ReviewProgress getReviewProgress() {
        return reviewProgress;
    }

    /**
     * First population of the given type, if any.
     */
    public Optional<PopulationDefinition> findPopulation(PopulationType type) {
        return populations.stream().filter(p -> p.getPopulationType() == type).findFirst();
    }

    /**
     * Value set with the given name, compared case-insensitively.
     */
    public Optional<ValueSetReference> findValueSet(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return valueSets.stream()
                .filter(vs -> vs.getName() != null && vs.getName().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public static final class Builder {
        private String id;
        private final MeasureMetadata metadata;
        private final List<PopulationDefinition> populations = new ArrayList<>();
        private final List<ValueSetReference> valueSets = new ArrayList<>();
        private GlobalConstraints globalConstraints;
        private ConfidenceLevel overallConfidence;
        private ReviewProgress reviewProgress;

        private Builder(MeasureMetadata metadata) {
            this.metadata = metadata;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder population(PopulationDefinition population) {
            this.populations.add(population);
            return this;
        }

        public Builder populations(List<PopulationDefinition> populations) {
            this.populations.clear();
            this.populations.addAll(populations);
            return this;
        }

        public Builder valueSet(ValueSetReference valueSet) {
            this.valueSets.add(valueSet);
            return this;
        }

        public Builder valueSets(List<ValueSetReference> valueSets) {
            this.valueSets.clear();
            this.valueSets.addAll(valueSets);
            return this;
        }

        public Builder globalConstraints(GlobalConstraints globalConstraints) {
            this.globalConstraints = globalConstraints;
            return this;
        }

        public Builder overallConfidence(ConfidenceLevel overallConfidence) {
            this.overallConfidence = overallConfidence;
            return this;
        }

        public Builder reviewProgress(ReviewProgress reviewProgress) {
            this.reviewProgress = reviewProgress;
            return this;
        }

        public UniversalMeasureSpec build() {
            return new UniversalMeasureSpec(this);
        }
    }
}
