package com.measure.compiler.extraction;

import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.ReviewProgress;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final measure from the skeleton metadata and the successful population results.
 */
public class MeasureSpecAssembler {
    private static final String DEFAULT_VERSION = "1.0.0";
    private static final String DEFAULT_STEWARD = "Unknown";

    public UniversalMeasureSpec assemble(MeasureSkeleton skeleton, List<PopulationExtractionResult> populationResults,
                                         List<ValueSetReference> valueSets) {
        List<PopulationDefinition> populations = new ArrayList<>();
        for (PopulationExtractionResult result : populationResults) {
            if (result.isSuccess()) {
                result.getPopulation().ifPresent(populations::add);
            }
        }

        Map<String, ValueSetReference> unique = new LinkedHashMap<>();
        for (ValueSetReference valueSet : valueSets) {
            unique.putIfAbsent(valueSet.dedupKey(), valueSet);
        }

        MeasureMetadata source = skeleton.getMetadata();
        MeasureMetadata metadata = source.toBuilder()
                .version(StringUtils.defaultIfBlank(source.getVersion(), DEFAULT_VERSION))
                .steward(StringUtils.defaultIfBlank(source.getSteward(), DEFAULT_STEWARD))
                .description(source.getDescription() != null ? source.getDescription() : "")
                .build();

        return UniversalMeasureSpec.builder(metadata)
                .id("ums_" + StringUtils.defaultIfBlank(source.getMeasureId(), "measure"))
                .populations(populations)
                .valueSets(new ArrayList<>(unique.values()))
                .overallConfidence(skeleton.getConfidence())
                .reviewProgress(ReviewProgress.allPending(populations.size()))
                .build();
    }
}
