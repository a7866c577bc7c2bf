package com.measure.compiler.extraction;

import com.measure.compiler.model.ConfidenceLevel;

/**
 * Document text the validation pass believes was not captured as a criterion.
 */
public final class MissingCriterion {
    private final String specText;
    private final String populationType;
    private final ConfidenceLevel confidence;

    public MissingCriterion(String specText, String populationType, ConfidenceLevel confidence) {
        this.specText = specText;
        this.populationType = populationType;
        this.confidence = confidence != null ? confidence : ConfidenceLevel.MEDIUM;
    }

    public String getSpecText() {
        return specText;
    }

    public String getPopulationType() {
        return populationType;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }
}
