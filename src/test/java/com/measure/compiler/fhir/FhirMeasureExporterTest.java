package com.measure.compiler.fhir;

import ca.uhn.fhir.context.FhirContext;
import com.measure.compiler.generator.GenerationResult;
import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.CodeReference;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Library;
import org.hl7.fhir.r4.model.Measure;
import org.hl7.fhir.r4.model.ValueSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FhirMeasureExporter
 */
public class FhirMeasureExporterTest {

    private static final String COLONOSCOPY_OID = "2.16.840.1.113883.3.464.1003.108.12.1020";
    private static final String CQL = "library ColorectalCancerScreening version '12.0.0'\n\n"
            + "using QICore version '4.1.1'\n\n"
            + "define \"Initial Population\":\n  true\n";

    private static FhirContext fhirContext;

    private FhirMeasureExporter exporter;

    @BeforeAll
    public static void createContext() {
        fhirContext = FhirContext.forR4();
    }

    @BeforeEach
    public void setUp() {
        exporter = new FhirMeasureExporter(fhirContext, "http://example.org/fhir/");
    }

    // ========== Bundle Tests ==========

    @Test
    public void testToBundle_Entries() {
        Bundle bundle = exporter.toBundle(measure(), GenerationResult.success(CQL, List.of()));

        assertEquals(Bundle.BundleType.COLLECTION, bundle.getType());
        assertEquals(4, bundle.getEntry().size());
        assertTrue(bundle.getEntry().get(0).getResource() instanceof Measure);
        assertTrue(bundle.getEntry().get(1).getResource() instanceof Library);
        assertTrue(bundle.getEntry().get(2).getResource() instanceof ValueSet);
        assertEquals("http://example.org/fhir/Measure/CMS130v12", bundle.getEntry().get(0).getFullUrl());
    }

    @Test
    public void testToBundle_RequiresSuccessfulCql() {
        assertThrows(IllegalArgumentException.class, () -> exporter.toBundle(measure(), null));
        assertThrows(IllegalArgumentException.class,
                () -> exporter.toBundle(measure(), GenerationResult.failure(List.of("Measure ID is required"))));
    }

    // ========== Measure Tests ==========

    @Test
    public void testMeasure_Metadata() {
        Measure measure = (Measure) exporter.toBundle(measure(), GenerationResult.success(CQL, List.of()))
                .getEntry().get(0).getResource();

        assertEquals("CMS130v12", measure.getIdElement().getIdPart());
        assertEquals("Colorectal Cancer Screening", measure.getTitle());
        assertEquals("12.0.0", measure.getVersion());
        assertEquals("NCQA", measure.getPublisher());
        assertEquals("proportion", measure.getScoring().getCodingFirstRep().getCode());
        assertEquals("http://example.org/fhir/Library/ColorectalCancerScreening", measure.getLibrary().get(0).getValue());
        assertEquals(Date.from(Instant.parse("2025-01-01T00:00:00Z")), measure.getEffectivePeriod().getStart());
        assertEquals(Date.from(Instant.parse("2025-12-31T00:00:00Z")), measure.getEffectivePeriod().getEnd());
    }

    @Test
    public void testMeasure_PopulationsInStandardOrder() {
        Measure measure = (Measure) exporter.toBundle(measure(), GenerationResult.success(CQL, List.of()))
                .getEntry().get(0).getResource();

        List<String> codes = new ArrayList<>();
        for (Measure.MeasureGroupPopulationComponent population : measure.getGroupFirstRep().getPopulation()) {
            codes.add(population.getCode().getCodingFirstRep().getCode());
        }
        assertEquals(List.of("initial-population", "denominator", "denominator-exclusion", "numerator"), codes);

        Measure.MeasureGroupPopulationComponent initial = measure.getGroupFirstRep().getPopulation().get(0);
        assertEquals("text/cql-identifier", initial.getCriteria().getLanguage());
        assertEquals("Initial Population", initial.getCriteria().getExpression());
        assertEquals("Patients 46-75 with an outpatient visit", initial.getDescription());
        assertFalse(measure.getGroupFirstRep().getPopulation().get(1).hasDescription());
    }

    // ========== Library Tests ==========

    @Test
    public void testLibrary_CqlAttachment() {
        Library library = (Library) exporter.toBundle(measure(), GenerationResult.success(CQL, List.of()))
                .getEntry().get(1).getResource();

        assertEquals("ColorectalCancerScreening", library.getName());
        assertEquals("logic-library", library.getType().getCodingFirstRep().getCode());
        assertEquals("text/cql", library.getContentFirstRep().getContentType());
        assertEquals(CQL, new String(library.getContentFirstRep().getData(), StandardCharsets.UTF_8));
    }

    @Test
    public void testLibrary_NameFallsBackToMeasureId() {
        Library library = (Library) exporter.toBundle(measure(), GenerationResult.success("define \"X\":\n  true", List.of()))
                .getEntry().get(1).getResource();

        assertEquals("CMS130v12", library.getName());
    }

    // ========== ValueSet Tests ==========

    @Test
    public void testValueSet_FromOid() {
        ValueSet valueSet = (ValueSet) exporter.toBundle(measure(), GenerationResult.success(CQL, List.of()))
                .getEntry().get(2).getResource();

        assertEquals(COLONOSCOPY_OID, valueSet.getIdElement().getIdPart());
        assertEquals(ValueSetReference.VSAC_FHIR_BASE + COLONOSCOPY_OID, valueSet.getUrl());
        assertEquals("urn:oid:" + COLONOSCOPY_OID, valueSet.getIdentifierFirstRep().getValue());
        assertEquals(2, valueSet.getCompose().getInclude().size());
        ValueSet.ConceptSetComponent cpt = valueSet.getCompose().getInclude().get(0);
        assertEquals("http://www.ama-assn.org/go/cpt", cpt.getSystem());
        assertEquals(2, cpt.getConcept().size());
    }

    @Test
    public void testValueSet_WithoutOid() {
        Bundle bundle = exporter.toBundle(measure(), GenerationResult.success(CQL, List.of()));
        ValueSet valueSet = (ValueSet) bundle.getEntry().get(3).getResource();

        assertEquals("vs-2-Custom-Codes", valueSet.getIdElement().getIdPart());
        assertEquals("http://example.org/fhir/ValueSet/vs-2-Custom-Codes", valueSet.getUrl());
        assertEquals(valueSet.getUrl(), bundle.getEntry().get(3).getFullUrl());
        assertFalse(valueSet.hasIdentifier());
        assertFalse(valueSet.getCompose().getIncludeFirstRep().hasSystem());
    }

    // ========== Serialization Tests ==========

    @Test
    public void testToJson() {
        String json = exporter.toJson(exporter.toBundle(measure(), GenerationResult.success(CQL, List.of())));

        assertTrue(json.contains("\"resourceType\": \"Bundle\""));
        assertTrue(json.contains("\"resourceType\": \"Measure\""));
        assertTrue(json.contains("urn:oid:" + COLONOSCOPY_OID));
    }

    @Test
    public void testResourceId() {
        assertEquals("CMS-130-v12", FhirMeasureExporter.resourceId("CMS 130 v12!"));
        assertEquals("measure", FhirMeasureExporter.resourceId("***"));
        assertEquals(64, FhirMeasureExporter.resourceId("a".repeat(100)).length());
    }

    private static UniversalMeasureSpec measure() {
        MeasureMetadata metadata = MeasureMetadata.builder()
                .measureId("CMS130v12")
                .title("Colorectal Cancer Screening")
                .version("12.0.0")
                .steward("NCQA")
                .scoring("Proportion")
                .measurementPeriod(MeasurementPeriod.calendarYear(2025))
                .build();
        ValueSetReference colonoscopy = new ValueSetReference("vs_colo", "Colonoscopy", COLONOSCOPY_OID, null,
                List.of(new CodeReference("44388", "http://www.ama-assn.org/go/cpt", "Colonoscopy"),
                        new CodeReference("45378", "http://www.ama-assn.org/go/cpt", null),
                        new CodeReference("73761001", "http://snomed.info/sct", "Colonoscopy")), null);
        ValueSetReference custom = new ValueSetReference("vs_custom", "Custom Codes", null, null,
                List.of(new CodeReference("Z99", null, null)), null);
        return UniversalMeasureSpec.builder(metadata)
                .population(new PopulationDefinition("pop_ip", PopulationType.INITIAL_POPULATION,
                        "Patients 46-75 with an outpatient visit", LogicalClause.and("ip", leaf("visit"))))
                .population(new PopulationDefinition("pop_excl", PopulationType.DENOMINATOR_EXCLUSION, "",
                        LogicalClause.or("excl", leaf("hospice"))))
                .population(new PopulationDefinition("pop_num", PopulationType.NUMERATOR, "",
                        LogicalClause.or("num", leaf("colonoscopy"))))
                .valueSet(colonoscopy)
                .valueSet(custom)
                .build();
    }

    private static CriteriaNode leaf(String id) {
        return CriteriaNode.of(DataElement.builder(id, ClinicalType.PROCEDURE).description(id).build());
    }
}
