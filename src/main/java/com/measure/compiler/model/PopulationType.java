package com.measure.compiler.model;

import java.util.Locale;

/**
 * The six fixed population kinds of a quality measure.
 */
public enum PopulationType {
    INITIAL_POPULATION("initial_population", "Initial Population", "initial-population"),
    DENOMINATOR("denominator", "Denominator", "denominator"),
    DENOMINATOR_EXCLUSION("denominator_exclusion", "Denominator Exclusion", "denominator-exclusion"),
    DENOMINATOR_EXCEPTION("denominator_exception", "Denominator Exception", "denominator-exception"),
    NUMERATOR("numerator", "Numerator", "numerator"),
    NUMERATOR_EXCLUSION("numerator_exclusion", "Numerator Exclusion", "numerator-exclusion");

    private final String value;
    private final String displayName;
    private final String fhirCode;

    PopulationType(String value, String displayName, String fhirCode) {
        this.value = value;
        this.displayName = displayName;
        this.fhirCode = fhirCode;
    }

    public String getValue() {
        return value;
    }

    /**
     * Name used for the CQL define of this population.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Code in the measure-population code system.
     */
    public String getFhirCode() {
        return fhirCode;
    }

    /**
     * Parse either the underscore or the hyphen spelling, case-insensitively.
     * @param value The wire value
     * @return The matching population type
     */
    public static PopulationType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Population type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (PopulationType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown population type: " + value);
    }
}
