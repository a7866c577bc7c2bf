package com.measure.compiler.generator;

import com.measure.compiler.model.MeasureMetadata;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Hand-curated CQL for a recognized measure family: helper defines, the numerator
 * expression and the exclusion references that join the hospice exclusion.
 */
public final class MeasureFamily {
    private final String name;
    private final Predicate<MeasureMetadata> matcher;
    private final String helperDefinitions;
    private final String numeratorExpression;
    private final List<String> exclusionExpressions;

    public MeasureFamily(String name, Predicate<MeasureMetadata> matcher, String helperDefinitions,
                         String numeratorExpression, List<String> exclusionExpressions) {
        this.name = name;
        this.matcher = matcher;
        this.helperDefinitions = helperDefinitions;
        this.numeratorExpression = numeratorExpression;
        this.exclusionExpressions = List.copyOf(exclusionExpressions);
    }

    /**
     * Matcher on lower-cased title keywords or an upper-cased measure id prefix.
     */
    public static Predicate<MeasureMetadata> titleOrId(List<String> titleKeywords, String measureIdPrefix) {
        return metadata -> {
            String title = metadata.getTitle() == null ? "" : metadata.getTitle().toLowerCase(Locale.ROOT);
            String measureId = metadata.getMeasureId() == null ? "" : metadata.getMeasureId().toUpperCase(Locale.ROOT);
            boolean titleMatch = !titleKeywords.isEmpty() && titleKeywords.stream().allMatch(title::contains);
            return titleMatch || measureId.contains(measureIdPrefix);
        };
    }

    public String getName() {
        return name;
    }

    public boolean matches(MeasureMetadata metadata) {
        return matcher.test(metadata);
    }

    public String getHelperDefinitions() {
        return helperDefinitions;
    }

    public String getNumeratorExpression() {
        return numeratorExpression;
    }

    public List<String> getExclusionExpressions() {
        return exclusionExpressions;
    }
}
