package com.measure.compiler.extraction;

import com.measure.compiler.model.UniversalMeasureSpec;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link MultiPassExtractor#extractWithMultiPass(String)}. Successful means no stage recorded an error;
 * a spec may still be present when some populations failed.
 */
public final class ExtractionResult {
    private final boolean success;
    private final UniversalMeasureSpec spec;
    private final MeasureSkeleton skeleton;
    private final List<PopulationExtractionResult> populationResults;
    private final CrossReferenceResult crossReference;
    private final List<String> errors;
    private final List<String> warnings;
    private final StageTimings timings;

    public ExtractionResult(boolean success, UniversalMeasureSpec spec, MeasureSkeleton skeleton,
                            List<PopulationExtractionResult> populationResults, CrossReferenceResult crossReference,
                            List<String> errors, List<String> warnings, StageTimings timings) {
        this.success = success;
        this.spec = spec;
        this.skeleton = skeleton;
        this.populationResults = populationResults != null ? List.copyOf(populationResults) : List.of();
        this.crossReference = crossReference;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.timings = timings;
    }

    public static ExtractionResult failed(List<String> errors, List<String> warnings, StageTimings timings) {
        return new ExtractionResult(false, null, null, List.of(), null, errors, warnings, timings);
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<UniversalMeasureSpec> getSpec() {
        return Optional.ofNullable(spec);
    }

    public Optional<MeasureSkeleton> getSkeleton() {
        return Optional.ofNullable(skeleton);
    }

    public List<PopulationExtractionResult> getPopulationResults() {
        return populationResults;
    }

    public Optional<CrossReferenceResult> getCrossReference() {
        return Optional.ofNullable(crossReference);
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public StageTimings getTimings() {
        return timings;
    }
}
