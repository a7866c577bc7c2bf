package com.measure.compiler.extraction;

import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.tree.LogicTrees;
import com.measure.compiler.tree.TreeVisit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MultiPassExtractor
 */
public class MultiPassExtractorTest {

    private static final String OFFICE_VISIT_OID = "2.16.840.1.113883.3.464.1003.101.12.1001";

    private static final String SKELETON = json("{'measureId': 'CMS130v12', 'title': 'Colorectal Cancer Screening', "
            + "'scoring': 'proportion', 'confidence': 'high', 'populations': ["
            + "{'type': 'initial_population', 'name': 'Initial Population', 'briefDescription': 'Patients 46-75 with a visit'}, "
            + "{'type': 'numerator', 'name': 'Numerator', 'briefDescription': 'Appropriate screening'}]}");

    private static final String INITIAL_POPULATION = json("{'narrative': 'Patients 46-75 years of age with a visit', "
            + "'criteria': {'operator': 'AND', 'confidence': 'high', 'children': ["
            + "{'id': 'age', 'type': 'demographic', 'description': 'Age 46-75', 'thresholds': {'ageMin': 46, 'ageMax': 75}}, "
            + "{'id': 'visit', 'type': 'encounter', 'description': 'Qualifying visit', "
            + "'valueSet': {'id': 'vs_office', 'name': 'Office Visit', 'oid': '" + OFFICE_VISIT_OID + "'}}]}, "
            + "'valueSets': [{'id': 'vs_office', 'name': 'Office Visit', 'oid': '" + OFFICE_VISIT_OID + "'}]}");

    private static final String NUMERATOR = "Here is the extraction:\n" + json("{'criteria': {'operator': 'OR', 'children': ["
            + "{'id': 'colonoscopy', 'type': 'procedure', 'description': 'Colonoscopy'}, "
            + "{'id': 'fobt', 'type': 'observation', 'description': 'FOBT'}]}}");

    // ========== Pipeline Tests ==========

    @Test
    public void testExtract_ThreePasses() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> NUMERATOR);
        List<ExtractionProgress> progress = Collections.synchronizedList(new ArrayList<>());
        MultiPassExtractor extractor = new MultiPassExtractor(oracle, new CatalogOidValidator(),
                ExtractionOptions.builder().progressListener(progress::add).build());

        ExtractionResult result = extractor.extractWithMultiPass("Colorectal Cancer Screening specification");

        assertTrue(result.isSuccess());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(List.of("skeleton", "initial-population", "numerator", "validation"), oracle.calls);

        UniversalMeasureSpec spec = result.getSpec().orElseThrow();
        assertEquals("ums_CMS130v12", spec.getId());
        assertEquals(2, spec.getPopulations().size());
        assertEquals("pop_initial_population", spec.getPopulations().get(0).getId());
        assertEquals("Patients 46-75 years of age with a visit", spec.getPopulations().get(0).getNarrative());
        assertEquals(1, spec.getValueSets().size());
        assertTrue(result.getCrossReference().orElseThrow().isValid());

        assertEquals(ExtractionPhase.SKELETON, progress.get(0).getPhase());
        assertEquals(ExtractionPhase.COMPLETE, progress.get(progress.size() - 1).getPhase());
        assertNotNull(result.getTimings());
    }

    @Test
    public void testExtract_FailingProgressListenerIgnored() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> NUMERATOR);
        MultiPassExtractor extractor = new MultiPassExtractor(oracle, new CatalogOidValidator(),
                ExtractionOptions.builder().progressListener(progress -> {
                    throw new IllegalStateException("listener down");
                }).build());

        ExtractionResult result = extractor.extractWithMultiPass("Colorectal Cancer Screening specification");

        assertTrue(result.isSuccess());
        assertEquals(List.of("skeleton", "initial-population", "numerator", "validation"), oracle.calls);
        assertEquals(2, result.getSpec().orElseThrow().getPopulations().size());
    }

    @Test
    public void testExtract_SkeletonNotJson() {
        ScriptedOracle oracle = new ScriptedOracle("I could not find a measure in this document.");

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Some unrelated text");

        assertFalse(result.isSuccess());
        assertEquals(List.of("Failed to extract measure skeleton"), result.getErrors());
        assertTrue(result.getSpec().isEmpty());
        assertEquals(List.of("skeleton"), oracle.calls);
    }

    @Test
    public void testExtract_SkeletonOracleError() {
        ScriptedOracle oracle = new ScriptedOracle(null);

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Measure text");

        assertFalse(result.isSuccess());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith(MultiPassExtractor.SKELETON_FAILURE + ": "));
    }

    @Test
    public void testExtract_DetailFailureIsRecorded() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> "Sorry, the numerator section is missing.");

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Measure text");

        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().contains("Failed to extract numerator: No JSON found in response"));
        UniversalMeasureSpec spec = result.getSpec().orElseThrow();
        assertEquals(1, spec.getPopulations().size());
        assertTrue(oracle.calls.contains("validation"));
    }

    @Test
    public void testExtract_DetailOracleError() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION);

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Measure text");

        assertTrue(result.getErrors().contains("Failed to extract numerator: No scripted response for numerator"));
    }

    // ========== Validation Pass Tests ==========

    @Test
    public void testExtract_SkipValidation() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> NUMERATOR);
        MultiPassExtractor extractor = new MultiPassExtractor(oracle, new CatalogOidValidator(),
                ExtractionOptions.builder().skipValidationPass(true).build());

        ExtractionResult result = extractor.extractWithMultiPass("Measure text");

        assertTrue(result.isSuccess());
        assertFalse(oracle.calls.contains("validation"));
        assertTrue(result.getCrossReference().isEmpty());
    }

    @Test
    public void testExtract_ValidationFindings() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> NUMERATOR);
        oracle.validationResponse = json("{'valid': false, 'missingPopulations': ['denominator-exclusion'], "
                + "'suggestions': ['Add the FIT-DNA test', 'Extract hospice exclusions']}");

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Measure text");

        assertTrue(result.isSuccess());
        assertTrue(result.getWarnings().contains(
                "Validation found potential issues: Add the FIT-DNA test; Extract hospice exclusions"));
        assertEquals(List.of("denominator-exclusion"), result.getCrossReference().orElseThrow().getMissingPopulations());
    }

    @Test
    public void testExtract_ValidationErrorIsNotFatal() {
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> NUMERATOR);
        oracle.validationResponse = null;

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Measure text");

        assertTrue(result.isSuccess());
        CrossReferenceResult crossReference = result.getCrossReference().orElseThrow();
        assertTrue(crossReference.getSuggestions().get(0).startsWith("Validation error: "));
    }

    @Test
    public void testExtract_OidWarning() {
        String mislabeled = INITIAL_POPULATION.replace("\"name\": \"Office Visit\"", "\"name\": \"Hospice Encounter\"");
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> mislabeled)
                .detail("numerator", user -> NUMERATOR);

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass("Measure text");

        assertTrue(result.isSuccess());
        assertTrue(result.getWarnings().stream()
                .anyMatch(w -> w.startsWith("OID validation failed for \"Hospice Encounter\": ")));
    }

    // ========== Chunked Extraction Tests ==========

    @Test
    public void testExtract_ChunkedNumeratorMerged() {
        String secondChunk = json("{'criteria': {'operator': 'OR', 'children': ["
                + "{'id': 'fobt', 'type': 'observation', 'description': 'FOBT'}, "
                + "{'id': 'colonoscopy', 'type': 'procedure', 'description': 'CT colonography'}, "
                + "{'id': 'fit_dna', 'type': 'observation', 'description': 'FIT-DNA'}]}}");
        ScriptedOracle oracle = new ScriptedOracle(SKELETON)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> user.contains("spec:\n\nInitial Population") ? NUMERATOR : secondChunk);
        String document = sectionedDocument();
        assertTrue(document.length() > ExtractionOptions.DEFAULT_CHUNKING_THRESHOLD);

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass(document);

        assertTrue(result.isSuccess());
        assertTrue(result.getWarnings().contains("Document chunked into 2 parts for processing"));
        assertEquals(List.of("skeleton", "initial-population", "numerator", "numerator", "validation"), oracle.calls);

        PopulationDefinition numerator = result.getSpec().orElseThrow().findPopulation(PopulationType.NUMERATOR).orElseThrow();
        List<String> descriptions = new ArrayList<>();
        for (CriteriaNode child : numerator.getCriteria().getChildren()) {
            descriptions.add(child.getDescription());
        }
        assertEquals(List.of("Colonoscopy", "FOBT", "CT colonography", "FIT-DNA"), descriptions);
        Set<String> ids = new HashSet<>();
        for (TreeVisit visit : LogicTrees.walk(numerator.getCriteria())) {
            assertTrue(ids.add(visit.getNode().getId()), "duplicate id " + visit.getNode().getId());
        }
    }

    @Test
    public void testExtract_ChunkedPopulationWithoutHeading() {
        String skeleton = SKELETON.replace("]}", ", {\"type\": \"denominator_exclusion\", \"name\": \"Exclusions\"}]}");
        ScriptedOracle oracle = new ScriptedOracle(skeleton)
                .detail("initial-population", user -> INITIAL_POPULATION)
                .detail("numerator", user -> NUMERATOR)
                .detail("denominator-exclusion", user -> json("{'criteria': {'operator': 'OR', 'children': ["
                        + "{'id': 'hospice', 'type': 'encounter', 'description': 'Hospice care'}]}}"));

        ExtractionResult result = new MultiPassExtractor(oracle).extractWithMultiPass(sectionedDocument());

        assertTrue(result.getWarnings().contains(
                "No Denominator Exclusion section found in any chunk; extracting it from the first chunk"));
        assertTrue(result.getSpec().orElseThrow().findPopulation(PopulationType.DENOMINATOR_EXCLUSION).isPresent());
    }

    private static String sectionedDocument() {
        StringBuilder sb = new StringBuilder("Initial Population\n");
        appendParagraphs(sb, 120);
        sb.append("Numerator\n");
        appendParagraphs(sb, 130);
        return sb.toString();
    }

    private static void appendParagraphs(StringBuilder sb, int count) {
        for (int i = 0; i < count; i++) {
            sb.append("x".repeat(97)).append(".\n\n");
        }
    }

    private static String json(String singleQuoted) {
        return singleQuoted.replace('\'', '"');
    }

    /**
     * Answers each pass from a script keyed by the system prompt and the population in the request.
     */
    private static final class ScriptedOracle implements OracleClient {
        private final String skeletonResponse;
        private final Map<String, Function<String, String>> details = new LinkedHashMap<>();
        private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
        private String validationResponse = "{\"valid\": true}";

        ScriptedOracle(String skeletonResponse) {
            this.skeletonResponse = skeletonResponse;
        }

        ScriptedOracle detail(String fhirCode, Function<String, String> response) {
            details.put(fhirCode, response);
            return this;
        }

        @Override
        public String complete(String systemPrompt, List<OracleMessage> messages, int maxTokens) {
            String user = messages.get(0).getContent();
            if (ExtractionPrompts.SKELETON.equals(systemPrompt)) {
                calls.add("skeleton");
                if (skeletonResponse == null) {
                    throw new OracleException("Service unavailable");
                }
                return skeletonResponse;
            }
            if (ExtractionPrompts.VALIDATION.equals(systemPrompt)) {
                calls.add("validation");
                if (validationResponse == null) {
                    throw new OracleException("Rate limited");
                }
                return validationResponse;
            }
            for (Map.Entry<String, Function<String, String>> entry : details.entrySet()) {
                if (user.startsWith("Extract detailed criteria for the " + entry.getKey() + " population")) {
                    calls.add(entry.getKey());
                    return entry.getValue().apply(user);
                }
            }
            String requested = user.substring("Extract detailed criteria for the ".length(), user.indexOf(" population"));
            calls.add(requested);
            throw new OracleException("No scripted response for " + requested);
        }
    }
}
