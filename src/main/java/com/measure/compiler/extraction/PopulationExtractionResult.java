package com.measure.compiler.extraction;

import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.ValueSetReference;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one detail pass. A failed pass has no population and at least one error.
 */
public final class PopulationExtractionResult {
    private final PopulationType populationType;
    private final boolean success;
    private final PopulationDefinition population;
    private final List<ValueSetReference> valueSets;
    private final List<OidValidationResult> oidValidations;
    private final List<String> errors;
    private final List<String> warnings;

    public PopulationExtractionResult(PopulationType populationType, boolean success, PopulationDefinition population,
                                      List<ValueSetReference> valueSets, List<OidValidationResult> oidValidations,
                                      List<String> errors, List<String> warnings) {
        this.populationType = Objects.requireNonNull(populationType, "populationType");
        this.success = success;
        this.population = population;
        this.valueSets = valueSets != null ? List.copyOf(valueSets) : List.of();
        this.oidValidations = oidValidations != null ? List.copyOf(oidValidations) : List.of();
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static PopulationExtractionResult success(PopulationDefinition population, List<ValueSetReference> valueSets,
                                                     List<OidValidationResult> oidValidations, List<String> warnings) {
        return new PopulationExtractionResult(population.getPopulationType(), true, population, valueSets,
                oidValidations, List.of(), warnings);
    }

    public static PopulationExtractionResult failure(PopulationType type, List<String> errors, List<String> warnings) {
        return new PopulationExtractionResult(type, false, null, List.of(), List.of(), errors, warnings);
    }

    public PopulationType getPopulationType() {
        return populationType;
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<PopulationDefinition> getPopulation() {
        return Optional.ofNullable(population);
    }

    public List<ValueSetReference> getValueSets() {
        return valueSets;
    }

    public List<OidValidationResult> getOidValidations() {
        return oidValidations;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
