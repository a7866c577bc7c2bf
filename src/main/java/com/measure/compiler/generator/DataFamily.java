package com.measure.compiler.generator;

import com.measure.compiler.model.ClinicalType;

/**
 * Target resource/table family a clinical type lowers to. Both backends share this
 * classification; the CQL backend uses the FHIR side, the SQL backend binds the family
 * to a warehouse table through {@link SchemaBinding}.
 */
public enum DataFamily {
    DEMOGRAPHICS("Patient", "Pt", null, null, "DEMO"),
    CONDITION("Condition", "C", "C.clinicalStatus ~ QICoreCommon.\"active\"", "onset", "COND"),
    PROCEDURE("Procedure", "P", "P.status = 'completed'", "performed", "PROC"),
    RESULT("Observation", "O", "O.status in { 'final', 'amended', 'corrected' }", "effective", "RES"),
    MEDICATION("MedicationRequest", "M", "M.status in { 'active', 'completed' }", "authoredOn", "MED"),
    IMMUNIZATION("Immunization", "I", "I.status = 'completed'", "occurrence", "IMM"),
    ENCOUNTER("Encounter", "E", "E.status = 'finished'", "period", "ENC");

    private final String fhirResource;
    private final String cqlAlias;
    private final String cqlStatusFilter;
    private final String cqlTimingPath;
    private final String predicatePrefix;

    DataFamily(String fhirResource, String cqlAlias, String cqlStatusFilter, String cqlTimingPath,
               String predicatePrefix) {
        this.fhirResource = fhirResource;
        this.cqlAlias = cqlAlias;
        this.cqlStatusFilter = cqlStatusFilter;
        this.cqlTimingPath = cqlTimingPath;
        this.predicatePrefix = predicatePrefix;
    }

    public static DataFamily of(ClinicalType type) {
        return switch (type) {
            case DEMOGRAPHIC -> DEMOGRAPHICS;
            case ENCOUNTER -> ENCOUNTER;
            case DIAGNOSIS -> CONDITION;
            case PROCEDURE -> PROCEDURE;
            case OBSERVATION, ASSESSMENT -> RESULT;
            case MEDICATION -> MEDICATION;
            case IMMUNIZATION -> IMMUNIZATION;
        };
    }

    public String getFhirResource() {
        return fhirResource;
    }

    public String getCqlAlias() {
        return cqlAlias;
    }

    public String getCqlStatusFilter() {
        return cqlStatusFilter;
    }

    /**
     * Element of the FHIR resource that carries its clinically relevant time.
     */
    public String getCqlTimingPath() {
        return cqlTimingPath;
    }

    /**
     * Prefix of SQL predicate CTE names, e.g. PRED_COND_1.
     */
    public String getPredicatePrefix() {
        return predicatePrefix;
    }
}
