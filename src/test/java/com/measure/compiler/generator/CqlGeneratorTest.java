package com.measure.compiler.generator;

import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.CodeReference;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.Gender;
import com.measure.compiler.model.GlobalConstraints;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.Thresholds;
import com.measure.compiler.model.TimingRequirement;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import com.measure.compiler.tree.LogicTrees;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CqlGenerator
 */
public class CqlGeneratorTest {

    private static final String OFFICE_VISIT_OID = "2.16.840.1.113883.3.464.1003.101.12.1001";
    private static final String DIABETES_OID = "2.16.840.1.113883.3.464.1003.103.12.1001";

    private CqlGenerator generator;

    @BeforeEach
    public void setUp() {
        generator = new CqlGenerator(MeasureFamilies.standard(), new TimingNormalizer(),
                Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    // ========== Library Structure Tests ==========

    @Test
    public void testGenerate_ZeroValueSets() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes: HbA1c Poor Control"))
                .population(population(PopulationType.INITIAL_POPULATION, LogicalClause.and("ip",
                        CriteriaNode.of(DataElement.builder("age", ClinicalType.DEMOGRAPHIC)
                                .description("Age 18-75").thresholds(Thresholds.age(18, 75)).build()),
                        CriteriaNode.of(DataElement.builder("dm", ClinicalType.DIAGNOSIS).description("Diabetes").build()))))
                .population(population(PopulationType.NUMERATOR, LogicalClause.and("num",
                        CriteriaNode.of(DataElement.builder("a1c", ClinicalType.OBSERVATION).description("HbA1c > 9%").build()))))
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.isSuccess());
        String cql = result.getCode();
        assertTrue(cql.contains("library CMS122v12 version '12.0.0'"));
        assertTrue(cql.contains("// No value sets defined"));
        assertTrue(cql.contains("define \"Initial Population\":"));
        assertTrue(cql.contains("define \"Numerator\":"));
        assertTrue(cql.contains("AgeInYearsAt(date from end of \"Measurement Period\") in Interval[18, 75]"));
        assertTrue(result.getWarnings().contains("No value set defined for \"Diabetes\""));
        assertTrue(cql.contains("/* WARNING: No value set defined for \"Diabetes\" */ true"));
    }

    @Test
    public void testGenerate_HeaderAndParameters() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(population(PopulationType.INITIAL_POPULATION, null))
                .build();

        String cql = generator.generate(measure).getCode();

        assertTrue(cql.contains(" * Generated: 2025-03-01T12:00:00Z"));
        assertTrue(cql.contains("using FHIR version '4.0.1'"));
        assertTrue(cql.contains("include FHIRHelpers version '4.0.1' called FHIRHelpers"));
        assertTrue(cql.contains("default Interval[@2025-01-01T00:00:00.0, @2025-12-31T23:59:59.999]"));
        assertTrue(cql.contains("define \"SDE Sex\":"));
        assertTrue(cql.contains("context Patient"));
    }

    @Test
    public void testGenerate_LibraryNameSanitized() {
        assertEquals("CMS130v12", CqlGenerator.sanitizeLibraryName("CMS-130 v12"));
        assertEquals("_122", CqlGenerator.sanitizeLibraryName("122"));
    }

    @Test
    public void testGenerate_MissingMeasureIdFails() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(MeasureMetadata.builder().title("Untitled").build())
                .population(population(PopulationType.INITIAL_POPULATION, null))
                .build();

        GenerationResult result = generator.generate(measure);

        assertFalse(result.isSuccess());
        assertEquals("", result.getCode());
        assertTrue(result.getErrors().contains("Measure ID is required"));
    }

    @Test
    public void testGenerate_NoPopulationsFails() {
        GenerationResult result = generator.generate(UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes")).build());

        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().contains("At least one population definition is required"));
    }

    // ========== Value Set Tests ==========

    @Test
    public void testGenerate_ValueSetWithoutOidOrCodes() {
        ValueSetReference custom = new ValueSetReference("vs_1", "Custom Codes", null, null, List.of(), null);
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS999v1", "Custom"))
                .population(population(PopulationType.INITIAL_POPULATION, LogicalClause.and("ip",
                        CriteriaNode.of(DataElement.builder("c", ClinicalType.PROCEDURE).description("Custom procedure")
                                .valueSet(custom).build()))))
                .valueSet(custom)
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.isSuccess());
        assertTrue(result.getCode().contains("valueset \"Custom Codes\": 'urn:oid:UNSPECIFIED'"));
        assertTrue(result.getWarnings().contains("Value set \"Custom Codes\" has no codes defined"));
    }

    @Test
    public void testGenerate_ValueSetUrlFromOid() {
        ValueSetReference diabetes = new ValueSetReference("vs_1", "Diabetes", DIABETES_OID, null,
                List.of(new CodeReference("E11.9", "http://hl7.org/fhir/sid/icd-10-cm", "Type 2 diabetes")), null);
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(population(PopulationType.INITIAL_POPULATION, LogicalClause.and("ip",
                        CriteriaNode.of(DataElement.builder("dm", ClinicalType.DIAGNOSIS).description("Diabetes")
                                .valueSet(diabetes).build()))))
                .valueSet(diabetes)
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.getCode().contains("valueset \"Diabetes\": 'http://cts.nlm.nih.gov/fhir/ValueSet/" + DIABETES_OID + "'"));
        assertTrue(result.getCode().contains("exists ([Condition: \"Diabetes\"] C"));
        assertTrue(result.getWarnings().stream().noneMatch(w -> w.contains("Diabetes")));
    }

    // ========== Population Tests ==========

    @Test
    public void testGenerate_ColorectalNumeratorFromFamily() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS130v12", "Colorectal Cancer Screening"))
                .population(population(PopulationType.NUMERATOR, null))
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.isSuccess());
        String numerator = defineBody(result.getCode(), "Numerator");
        assertTrue(numerator.contains("\"Colonoscopy Performed\""));
        assertTrue(numerator.contains("\"Fecal Occult Blood Test Performed\""));
        assertTrue(numerator.contains("\"Flexible Sigmoidoscopy Performed\""));
        assertTrue(numerator.contains("\"FIT DNA Test Performed\""));
        assertTrue(numerator.contains("\"CT Colonography Performed\""));
        assertFalse(numerator.contains("WARNING"));
        assertTrue(result.getCode().contains("define \"Colonoscopy Performed\":"));
    }

    @Test
    public void testGenerate_FamilyExclusionsJoinHospice() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS124v12", "Cervical Cancer Screening"))
                .population(population(PopulationType.INITIAL_POPULATION, null))
                .build();

        String exclusion = defineBody(generator.generate(measure).getCode(), "Denominator Exclusion");

        assertTrue(exclusion.contains("\"Has Hospice Services\"\n    or \"Has Hysterectomy\""));
        assertTrue(exclusion.contains("\"Absence of Cervix Diagnosis\""));
    }

    @Test
    public void testGenerate_DenominatorDefaultsToInitialPopulation() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(population(PopulationType.INITIAL_POPULATION, null))
                .population(population(PopulationType.DENOMINATOR, null))
                .build();

        assertTrue(generator.generate(measure).getCode().contains("define \"Denominator\":\n  \"Initial Population\""));
    }

    @Test
    public void testGenerate_MissingNumeratorWarns() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(population(PopulationType.INITIAL_POPULATION, null))
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.isSuccess());
        assertTrue(result.getWarnings().contains("No numerator criteria defined; \"Numerator\" evaluates to true"));
    }

    @Test
    public void testGenerate_GlobalConstraints() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS125v12", "Mammogram Rates"))
                .population(population(PopulationType.INITIAL_POPULATION, null))
                .globalConstraints(new GlobalConstraints(52, 74, Gender.FEMALE))
                .build();

        String cql = generator.generate(measure).getCode();

        assertTrue(cql.contains("define \"Patient Age Valid\":"));
        assertTrue(cql.contains("in Interval[52, 74]"));
        assertTrue(cql.contains("Patient.gender = 'female'"));
        assertTrue(defineBody(cql, "Initial Population").contains("\"Patient Age Valid\"\n    and \"Patient Gender Valid\""));
    }

    @Test
    public void testGenerate_HighComplexityWarning() {
        LogicalClause criteria = LogicalClause.and("ip", leaf("a", "Visit A"), leaf("b", "Visit B"),
                leaf("c", "Visit C"), leaf("d", "Visit D"));
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(population(PopulationType.INITIAL_POPULATION, criteria))
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.getWarnings().stream()
                .anyMatch(w -> w.startsWith("Population \"Initial Population\" has HIGH complexity")));
        assertTrue(result.getCode().contains("define \"Qualifying Encounter During Measurement Period\":"));
    }

    // ========== Override Tests ==========

    @Test
    public void testGenerate_LockedPopulationOverride() {
        PopulationDefinition initial = population(PopulationType.INITIAL_POPULATION, null);
        EditNote note = new EditNote(Instant.parse("2025-02-01T09:00:00Z"), "analyst", "Use the shared library", "logic");
        CodeOverride override = new CodeOverride(initial.getId(), CodeOutputFormat.CQL,
                "Common.\"Adults With Diabetes\"", true, List.of(note));
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(initial)
                .build();

        String cql = generator.generate(measure, Map.of(initial.getId(), override)).getCode();

        assertTrue(cql.contains("// EDIT NOTE [logic] (2025-02-01T09:00:00Z) by analyst: Use the shared library\n"
                + "define \"Initial Population\":\n  Common.\"Adults With Diabetes\""));
    }

    @Test
    public void testGenerate_UnlockedOverrideIgnored() {
        PopulationDefinition initial = population(PopulationType.INITIAL_POPULATION, null);
        CodeOverride override = new CodeOverride(initial.getId(), CodeOutputFormat.CQL, "false", false, null);
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(initial)
                .build();

        String cql = generator.generate(measure, Map.of(initial.getId(), override)).getCode();

        assertTrue(defineBody(cql, "Initial Population").contains("true"));
        assertFalse(defineBody(cql, "Initial Population").contains("false"));
    }

    @Test
    public void testGenerate_CleanLibraryPassesSyntaxCheck() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS130v12", "Colorectal Cancer Screening"))
                .population(population(PopulationType.INITIAL_POPULATION, LogicalClause.and("ip", leaf("visit", "Office visit"))))
                .population(population(PopulationType.NUMERATOR, LogicalClause.or("num", leaf("a", "Visit A"), leaf("b", "Visit B"))))
                .build();

        GenerationResult result = generator.generate(measure);

        assertTrue(result.isSuccess());
        assertTrue(result.getWarnings().stream().noneMatch(w -> w.startsWith("Generated CQL check")));
    }

    @Test
    public void testGenerate_LockedOverrideSyntaxWarning() {
        PopulationDefinition initial = population(PopulationType.INITIAL_POPULATION, null);
        CodeOverride override = new CodeOverride(initial.getId(), CodeOutputFormat.CQL, "exists (\"Office Visit\"", true, null);
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("CMS122v12", "Diabetes"))
                .population(initial)
                .build();

        GenerationResult result = generator.generate(measure, Map.of(initial.getId(), override));

        assertTrue(result.isSuccess());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.startsWith("Generated CQL check: Unclosed parenthesis at line ")));
    }

    @Test
    public void testGenerate_PunctuationOnlyMeasureId() {
        UniversalMeasureSpec measure = UniversalMeasureSpec.builder(metadata("---", "Diabetes"))
                .population(population(PopulationType.INITIAL_POPULATION, LogicalClause.and("ip", leaf("visit", "Office visit"))))
                .build();

        GenerationResult result = generator.generate(measure);

        assertFalse(result.isSuccess());
        assertEquals(List.of("Measure ID is required"), result.getErrors());
        assertEquals("", result.getCode());
    }

    // ========== Component Tests ==========

    @Test
    public void testGenerateComponent_NegatedEncounter() {
        DataElement hospice = DataElement.builder("hospice", ClinicalType.ENCOUNTER)
                .description("Hospice encounter")
                .negation(true)
                .valueSet(new ValueSetReference("vs_h", "Hospice Encounter", "2.16.840.1.113883.3.464.1003.1003", null, List.of(), null))
                .build();

        GenerationResult result = generator.generateComponent(hospice, null);

        assertTrue(result.getCode().startsWith("not (exists ([Encounter: \"Hospice Encounter\"] E"));
        assertTrue(result.getCode().contains("E.period during \"Measurement Period\""));
    }

    @Test
    public void testGenerateComponent_LookbackTiming() {
        DataElement colonoscopy = DataElement.builder("colo", ClinicalType.PROCEDURE)
                .description("Colonoscopy")
                .valueSet(new ValueSetReference("vs_c", "Colonoscopy", "2.16.840.1.113883.3.464.1003.108.12.1020", null, List.of(), null))
                .build();

        GenerationResult result = generator.generateComponent(colonoscopy, null);

        assertTrue(result.getCode().contains("P.performed ends 10 years or less before end of \"Measurement Period\""));
    }

    @Test
    public void testGenerateComponent_OversizedTimingQuantity() {
        DataElement visit = DataElement.builder("visit", ClinicalType.ENCOUNTER)
                .description("Office visit")
                .timing(new TimingRequirement("within 99999999999 days", null, null))
                .valueSet(new ValueSetReference("vs_v", "Office Visit", OFFICE_VISIT_OID, null, List.of(), null))
                .build();

        GenerationResult result = generator.generateComponent(visit, null);

        assertTrue(result.isSuccess());
        assertTrue(result.getCode().contains("E.period during \"Measurement Period\""));
    }

    @Test
    public void testGenerateComponent_ClauseWithOverride() {
        LogicalClause clause = LogicalClause.or("either", leaf("a", "Visit A"), leaf("b", "Visit B"));
        CodeOverride override = new CodeOverride("either", CodeOutputFormat.CQL, "exists \"Any Visit\"", true, null);

        assertEquals("exists \"Any Visit\"", generator.generateComponent(clause, override).getCode());
        String generated = generator.generateComponent(clause, null).getCode();
        assertTrue(generated.startsWith("("));
        assertTrue(generated.contains("\n    or "));
    }

    @Test
    public void testGenerateComponent_MixedOperatorsGroupedLeftToRight() {
        LogicalClause flat = LogicalClause.and("visits", leaf("a", "Visit A"), leaf("b", "Visit B"), leaf("c", "Visit C"));
        LogicalClause mixed = LogicTrees.setOperatorBetween(flat, 0, 1, LogicalOperator.OR);

        String generated = generator.generateComponent(mixed, null).getCode();

        // (a or b) and c
        assertTrue(generated.startsWith("((exists ([Encounter"));
        assertTrue(generated.contains(")\n    or exists ([Encounter"));
        assertTrue(generated.contains("))\n    and exists ([Encounter"));
        assertTrue(generated.endsWith("))"));
    }

    private static String defineBody(String cql, String name) {
        int start = cql.indexOf("define \"" + name + "\":");
        assertTrue(start >= 0, "missing define " + name);
        int end = cql.indexOf("\ndefine ", start + 1);
        int comment = cql.indexOf("\n/*", start + 1);
        if (comment >= 0 && (end < 0 || comment < end)) {
            end = comment;
        }
        int section = cql.indexOf("\n//", start + 1);
        if (section >= 0 && (end < 0 || section < end)) {
            end = section;
        }
        return end < 0 ? cql.substring(start) : cql.substring(start, end);
    }

    private static CriteriaNode leaf(String id, String description) {
        return CriteriaNode.of(DataElement.builder(id, ClinicalType.ENCOUNTER).description(description)
                .valueSet(new ValueSetReference("vs_" + id, "Office Visit", OFFICE_VISIT_OID, null, List.of(), null))
                .build());
    }

    private static PopulationDefinition population(PopulationType type, LogicalClause criteria) {
        return new PopulationDefinition("pop_" + type.getValue(), type, "", criteria);
    }

    private static MeasureMetadata metadata(String measureId, String title) {
        return MeasureMetadata.builder()
                .measureId(measureId)
                .title(title)
                .version("12.0.0")
                .measurementPeriod(MeasurementPeriod.calendarYear(2025))
                .build();
    }
}
