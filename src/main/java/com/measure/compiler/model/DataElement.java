package com.measure.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Leaf criterion of a criteria tree. Immutable; edits go through {@link #toBuilder()}.
 */
public final class DataElement {
    private final String id;
    private final ClinicalType clinicalType;
    private final String description;
    private final ValueSetReference valueSet;
    private final List<TimingRequirement> timingRequirements;
    private final boolean negation;
    private final Thresholds thresholds;
    private final ConfidenceLevel confidence;
    private final ReviewStatus reviewStatus;

    private DataElement(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.clinicalType = Objects.requireNonNull(builder.clinicalType, "clinicalType");
        this.description = builder.description != null ? builder.description : "";
        this.valueSet = builder.valueSet;
        this.timingRequirements = List.copyOf(builder.timingRequirements);
        this.negation = builder.negation;
        this.thresholds = builder.thresholds;
        this.confidence = builder.confidence != null ? builder.confidence : ConfidenceLevel.MEDIUM;
        this.reviewStatus = builder.reviewStatus != null ? builder.reviewStatus : ReviewStatus.PENDING;
    }

    public static Builder builder(String id, ClinicalType clinicalType) {
        return new Builder(id, clinicalType);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id, clinicalType)
                .description(description)
                .valueSet(valueSet)
                .negation(negation)
                .thresholds(thresholds)
                .confidence(confidence)
                .reviewStatus(reviewStatus);
        builder.timingRequirements.addAll(timingRequirements);
        return builder;
    }

    // Getters
    public String getId() {
        return id;
    }

    public ClinicalType getClinicalType() {
        return clinicalType;
    }

    public String getDescription() {
        return description;
    }

    public ValueSetReference getValueSet() {
        return valueSet;
    }

    public List<TimingRequirement> getTimingRequirements() {
        return timingRequirements;
    }

    public boolean isNegation() {
        return negation;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public ReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    public boolean hasValueSet() {
        return valueSet != null
                && ((valueSet.getName() != null && !valueSet.getName().isBlank()) || valueSet.getId() != null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataElement that)) return false;
        return negation == that.negation && id.equals(that.id) && clinicalType == that.clinicalType
                && description.equals(that.description) && Objects.equals(valueSet, that.valueSet)
                && timingRequirements.equals(that.timingRequirements)
                && Objects.equals(thresholds, that.thresholds)
                && confidence == that.confidence && reviewStatus == that.reviewStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, clinicalType, description, valueSet, timingRequirements, negation,
                thresholds, confidence, reviewStatus);
    }

    @Override
    public String toString() {
        return "DataElement[" + id + ", " + clinicalType.getValue() + ", " + description + "]";
    }

    public static final class Builder {
        private String id;
        private final ClinicalType clinicalType;
        private String description;
        private ValueSetReference valueSet;
        private final List<TimingRequirement> timingRequirements = new ArrayList<>();
        private boolean negation;
        private Thresholds thresholds;
        private ConfidenceLevel confidence;
        private ReviewStatus reviewStatus;

        private Builder(String id, ClinicalType clinicalType) {
            this.id = id;
            this.clinicalType = clinicalType;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder valueSet(ValueSetReference valueSet) {
            this.valueSet = valueSet;
            return this;
        }

        public Builder timing(TimingRequirement requirement) {
            this.timingRequirements.add(requirement);
            return this;
        }

        public Builder timingRequirements(List<TimingRequirement> requirements) {
            this.timingRequirements.clear();
            if (requirements != null) {
                this.timingRequirements.addAll(requirements);
            }
            return this;
        }

        public Builder negation(boolean negation) {
            this.negation = negation;
            return this;
        }

        public Builder thresholds(Thresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder confidence(ConfidenceLevel confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reviewStatus(ReviewStatus reviewStatus) {
            this.reviewStatus = reviewStatus;
            return this;
        }

        public DataElement build() {
            return new DataElement(this);
        }
    }
}
