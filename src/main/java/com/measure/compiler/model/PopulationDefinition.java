package com.measure.compiler.model;

import java.util.Objects;

public final class PopulationDefinition {
    private final String id;
    private final PopulationType populationType;
    private final String description;
    private final String narrative;
    private final LogicalClause criteria;
    private final ConfidenceLevel confidence;
    private final ReviewStatus reviewStatus;

    public PopulationDefinition(String id, PopulationType populationType, String description, String narrative,
                                LogicalClause criteria, ConfidenceLevel confidence, ReviewStatus reviewStatus) {
        this.id = Objects.requireNonNull(id, "id");
        this.populationType = Objects.requireNonNull(populationType, "populationType");
        this.description = description;
        this.narrative = narrative != null ? narrative : "";
        this.criteria = criteria;
        this.confidence = confidence != null ? confidence : ConfidenceLevel.MEDIUM;
        this.reviewStatus = reviewStatus != null ? reviewStatus : ReviewStatus.PENDING;
    }

    public PopulationDefinition(String id, PopulationType populationType, String narrative, LogicalClause criteria) {
        this(id, populationType, null, narrative, criteria, null, null);
    }

    public String getId() {
        return id;
    }

    public PopulationType getPopulationType() {
        return populationType;
    }

    public String getDescription() {
        return description;
    }

    public String getNarrative() {
        return narrative;
    }

    /**
     * Root of the criteria tree, or null when the population has no explicit criteria.
     */
    public LogicalClause getCriteria() {
        return criteria;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public ReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    public boolean hasCriteria() {
        return criteria != null && !criteria.getChildren().isEmpty();
    }

    public PopulationDefinition withCriteria(LogicalClause newCriteria) {
        return new PopulationDefinition(id, populationType, description, narrative, newCriteria, confidence, reviewStatus);
    }

    public PopulationDefinition withNarrative(String newNarrative) {
        return new PopulationDefinition(id, populationType, description, newNarrative, criteria, confidence, reviewStatus);
    }

    public PopulationDefinition withReviewStatus(ReviewStatus newStatus) {
        return new PopulationDefinition(id, populationType, description, narrative, criteria, confidence, newStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PopulationDefinition that)) return false;
        return id.equals(that.id) && populationType == that.populationType
                && Objects.equals(description, that.description) && narrative.equals(that.narrative)
                && Objects.equals(criteria, that.criteria) && confidence == that.confidence
                && reviewStatus == that.reviewStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, populationType, description, narrative, criteria, confidence, reviewStatus);
    }
}
