package com.measure.compiler.extraction;

import com.measure.compiler.model.PopulationType;

import java.util.Objects;

/**
 * A population as listed by the skeleton pass, before its criteria are extracted.
 */
public final class PopulationSkeleton {
    private final PopulationType type;
    private final String name;
    private final String briefDescription;
    private final String specSection;
    private final int estimatedCriteriaCount;

    public PopulationSkeleton(PopulationType type, String name, String briefDescription, String specSection,
                              int estimatedCriteriaCount) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name != null ? name : type.getDisplayName();
        this.briefDescription = briefDescription != null ? briefDescription : "";
        this.specSection = specSection;
        this.estimatedCriteriaCount = estimatedCriteriaCount;
    }

    public PopulationType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getBriefDescription() {
        return briefDescription;
    }

    public String getSpecSection() {
        return specSection;
    }

    public int getEstimatedCriteriaCount() {
        return estimatedCriteriaCount;
    }

    @Override
    public String toString() {
        return "PopulationSkeleton[" + type.getValue() + ", " + name + "]";
    }
}
