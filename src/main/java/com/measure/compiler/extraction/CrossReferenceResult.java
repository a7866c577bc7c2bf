package com.measure.compiler.extraction;

import java.util.List;

/**
 * Findings of the validation pass. Advisory only; never blocks assembly.
 */
public final class CrossReferenceResult {
    private final boolean valid;
    private final List<String> missingPopulations;
    private final List<MissingCriterion> missingCriteria;
    private final List<PossibleHallucination> possibleHallucinations;
    private final List<String> suggestions;

    public CrossReferenceResult(boolean valid, List<String> missingPopulations, List<MissingCriterion> missingCriteria,
                                List<PossibleHallucination> possibleHallucinations, List<String> suggestions) {
        this.valid = valid;
        this.missingPopulations = missingPopulations != null ? List.copyOf(missingPopulations) : List.of();
        this.missingCriteria = missingCriteria != null ? List.copyOf(missingCriteria) : List.of();
        this.possibleHallucinations = possibleHallucinations != null ? List.copyOf(possibleHallucinations) : List.of();
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    /**
     * A result that reports nothing except one suggestion, used when the pass itself could not complete.
     */
    public static CrossReferenceResult inconclusive(String suggestion) {
        return new CrossReferenceResult(true, List.of(), List.of(), List.of(), List.of(suggestion));
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getMissingPopulations() {
        return missingPopulations;
    }

    public List<MissingCriterion> getMissingCriteria() {
        return missingCriteria;
    }

    public List<PossibleHallucination> getPossibleHallucinations() {
        return possibleHallucinations;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }
}
