package com.measure.compiler.extraction;

/**
 * System prompts for the three extraction passes.
 */
final class ExtractionPrompts {

    static final String SKELETON =
            "You are a clinical quality measure analyst. Read the measure specification and report only its\n"
            + "structure. Do not extract detailed criteria in this step.\n"
            + "\n"
            + "Respond with a single JSON object:\n"
            + "{\n"
            + "  \"measureId\": \"CMS122v12\",\n"
            + "  \"title\": \"Measure title\",\n"
            + "  \"version\": \"12.0.0\",\n"
            + "  \"programType\": \"eCQM | MIPS_CQM | HEDIS | Custom\",\n"
            + "  \"measureType\": \"process | outcome | structure\",\n"
            + "  \"scoring\": \"proportion | ratio | continuous-variable\",\n"
            + "  \"steward\": \"Stewarding organization\",\n"
            + "  \"description\": \"One-paragraph summary\",\n"
            + "  \"measurementPeriod\": {\"start\": \"2025-01-01\", \"end\": \"2025-12-31\"},\n"
            + "  \"populations\": [\n"
            + "    {\n"
            + "      \"type\": \"initial-population\",\n"
            + "      \"name\": \"Initial Population\",\n"
            + "      \"briefDescription\": \"Patients 18-75 with diabetes and a qualifying visit\",\n"
            + "      \"specSection\": \"Section 2.1\",\n"
            + "      \"estimatedCriteriaCount\": 3\n"
            + "    }\n"
            + "  ],\n"
            + "  \"confidence\": \"high | medium | low\"\n"
            + "}\n"
            + "\n"
            + "Allowed population types: initial-population, denominator, denominator-exclusion,\n"
            + "denominator-exception, numerator, numerator-exclusion.\n"
            + "List only populations the specification defines.";

    static final String VALIDATION =
            "You are reviewing an automated extraction of a measure specification. Compare the specification\n"
            + "with the extracted summary and report:\n"
            + "- populations the specification defines that are missing from the extraction\n"
            + "- criteria the extraction did not capture, quoting the specification text\n"
            + "- extracted criteria that do not appear in the specification\n"
            + "- concrete suggestions for fixing the extraction\n"
            + "\n"
            + "Respond with a single JSON object:\n"
            + "{\n"
            + "  \"valid\": true,\n"
            + "  \"missingPopulations\": [\"Denominator Exclusion\"],\n"
            + "  \"missingCriteria\": [\n"
            + "    {\"specText\": \"quoted text\", \"populationType\": \"numerator\", \"confidence\": \"medium\"}\n"
            + "  ],\n"
            + "  \"possibleHallucinations\": [\n"
            + "    {\"criterionDescription\": \"text\", \"populationType\": \"denominator\", \"reason\": \"why\"}\n"
            + "  ],\n"
            + "  \"suggestions\": [\"suggestion\"]\n"
            + "}\n"
            + "\n"
            + "Flag only clear omissions or inventions.";

    private ExtractionPrompts() {
    }

    static String populationDetail(MeasureSkeleton skeleton, PopulationSkeleton population) {
        String type = population.getType().getFhirCode();
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are extracting the complete criteria of the ").append(type)
                .append(" population of measure ").append(skeleton.getMeasureId()).append(".\n\n");
        prompt.append("Context:\n");
        prompt.append("- Measure: ").append(skeleton.getTitle()).append("\n");
        prompt.append("- Population: ").append(population.getName()).append("\n");
        prompt.append("- Summary: ").append(population.getBriefDescription()).append("\n");
        if (population.getSpecSection() != null) {
            prompt.append("- Location in specification: ").append(population.getSpecSection()).append("\n");
        }
        prompt.append("\n"
                + "For every criterion give its clinical type (demographic, encounter, diagnosis, procedure,\n"
                + "observation, medication, immunization, assessment), the value set name and OID exactly as\n"
                + "written, its timing requirements and whether it is negated (absence of a finding).\n"
                + "\n"
                + "Respond with a single JSON object:\n"
                + "{\n"
                + "  \"populationType\": \"" + type + "\",\n"
                + "  \"criteria\": {\n"
                + "    \"operator\": \"AND\",\n"
                + "    \"children\": [\n"
                + "      {\n"
                + "        \"id\": \"crit_1\",\n"
                + "        \"type\": \"diagnosis\",\n"
                + "        \"description\": \"Diabetes diagnosis\",\n"
                + "        \"valueSet\": {\"name\": \"Diabetes\", \"oid\": \"2.16.840.1.113883.3.464.1003.103.12.1001\"},\n"
                + "        \"timingRequirements\": [\n"
                + "          {\"description\": \"Active during the measurement period\", \"relativeTo\": \"Measurement Period\"}\n"
                + "        ],\n"
                + "        \"thresholds\": {\"ageMin\": 18, \"ageMax\": 75},\n"
                + "        \"negation\": false,\n"
                + "        \"confidence\": \"high\"\n"
                + "      }\n"
                + "    ],\n"
                + "    \"confidence\": \"high\"\n"
                + "  },\n"
                + "  \"valueSets\": [\n"
                + "    {\"id\": \"vs_1\", \"name\": \"Diabetes\", \"oid\": \"2.16.840.1.113883.3.464.1003.103.12.1001\", \"codes\": []}\n"
                + "  ],\n"
                + "  \"narrative\": \"Plain-language description of the population\",\n"
                + "  \"warnings\": []\n"
                + "}\n"
                + "\n"
                + "Copy OIDs exactly; when an OID is not stated set it to null and add a warning.\n"
                + "Nest groups for mixed logic, e.g. A AND (B OR C).");
        return prompt.toString();
    }
}
