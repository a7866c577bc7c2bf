package com.measure.compiler.generator;

import com.measure.compiler.complexity.ComplexityScorer;
import com.measure.compiler.model.ComplexityLevel;
import com.measure.compiler.model.ComponentComplexity;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.UniversalMeasureSpec;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks shared by the code generators.
 */
final class MeasureStructure {

    private MeasureStructure() {
    }

    /**
     * @return Structural errors; empty when generation may proceed
     */
    static List<String> check(UniversalMeasureSpec measure) {
        List<String> errors = new ArrayList<>();
        if (measure == null) {
            errors.add("Measure is required");
            return errors;
        }
        if (StringUtils.isBlank(measure.getMetadata().getMeasureId())) {
            errors.add("Measure ID is required");
        }
        if (measure.getPopulations().isEmpty()) {
            errors.add("At least one population definition is required");
        }
        return errors;
    }

    /**
     * One review warning per population whose criteria score HIGH.
     */
    static List<String> highComplexityWarnings(UniversalMeasureSpec measure) {
        List<String> warnings = new ArrayList<>();
        for (PopulationDefinition population : measure.getPopulations()) {
            ComponentComplexity complexity = ComplexityScorer.scorePopulation(population);
            if (complexity != null && complexity.getLevel() == ComplexityLevel.HIGH) {
                warnings.add(String.format("Population \"%s\" has HIGH complexity (score %d); review the generated logic",
                        population.getPopulationType().getDisplayName(), complexity.getScore()));
            }
        }
        return warnings;
    }
}
