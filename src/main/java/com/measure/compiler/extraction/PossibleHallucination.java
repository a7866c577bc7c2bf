package com.measure.compiler.extraction;

public final class PossibleHallucination {
    private final String criterionDescription;
    private final String populationType;
    private final String reason;

    public PossibleHallucination(String criterionDescription, String populationType, String reason) {
        this.criterionDescription = criterionDescription;
        this.populationType = populationType;
        this.reason = reason;
    }

    public String getCriterionDescription() {
        return criterionDescription;
    }

    public String getPopulationType() {
        return populationType;
    }

    public String getReason() {
        return reason;
    }
}
