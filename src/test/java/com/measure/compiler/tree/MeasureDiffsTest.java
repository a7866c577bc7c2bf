package com.measure.compiler.tree;

import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MeasureDiffs
 */
public class MeasureDiffsTest {

    private static final String DIABETES_OID = "2.16.840.1.113883.3.464.1003.103.12.1001";

    @Test
    public void testDiff_IdenticalSnapshots() {
        UniversalMeasureSpec measure = measure("Diabetes: HbA1c Poor Control", initialPopulation("Patients with diabetes"));

        MeasureDiff diff = MeasureDiffs.diff(measure, measure);

        assertEquals(0, diff.totalChanges());
        assertEquals(ChangeType.UNCHANGED, diff.getPopulationDiffs().get(0).getChangeType());
    }

    @Test
    public void testDiff_MetadataPopulationsAndValueSets() {
        UniversalMeasureSpec before = measure("Diabetes: HbA1c Poor Control", initialPopulation("Patients with diabetes"));
        DataElement visit = DataElement.builder("visit", ClinicalType.ENCOUNTER).description("Office visit").build();
        PopulationDefinition numerator = new PopulationDefinition("pop_numerator", PopulationType.NUMERATOR,
                "Most recent HbA1c > 9%", LogicalClause.and("num_root", CriteriaNode.of(visit)));
        UniversalMeasureSpec after = before.toBuilder()
                .population(numerator)
                .valueSets(List.of(new ValueSetReference("vs_2", "Office Visit",
                        "2.16.840.1.113883.3.464.1003.101.12.1001", null, List.of(), null)))
                .build();
        after = UniversalMeasureSpec.builder(before.getMetadata().toBuilder().title("Diabetes: Glycemic Status").build())
                .populations(after.getPopulations())
                .valueSets(after.getValueSets())
                .build();

        MeasureDiff diff = MeasureDiffs.diff(before, after);

        assertEquals(List.of("title"), diff.getChangedMetadataFields());
        assertEquals(List.of("2.16.840.1.113883.3.464.1003.101.12.1001"), diff.getAddedValueSetKeys());
        assertEquals(List.of(DIABETES_OID), diff.getRemovedValueSetKeys());
        PopulationDiff numeratorDiff = diff.getPopulationDiffs().stream()
                .filter(d -> d.getPopulationType() == PopulationType.NUMERATOR)
                .findFirst()
                .orElseThrow();
        assertEquals(ChangeType.ADDED, numeratorDiff.getChangeType());
        assertEquals(List.of("visit"), numeratorDiff.getTreeDiff().getAddedCriterionIds());
    }

    @Test
    public void testDiff_ModifiedNarrative() {
        UniversalMeasureSpec before = measure("Diabetes", initialPopulation("Patients with diabetes"));
        UniversalMeasureSpec after = measure("Diabetes", initialPopulation("Patients 18-75 with diabetes"));

        MeasureDiff diff = MeasureDiffs.diff(before, after);

        assertEquals(ChangeType.MODIFIED, diff.getPopulationDiffs().get(0).getChangeType());
        assertTrue(diff.getPopulationDiffs().get(0).getTreeDiff().isEmpty());
    }

    private static PopulationDefinition initialPopulation(String narrative) {
        DataElement diabetes = DataElement.builder("dm", ClinicalType.DIAGNOSIS).description("Diabetes").build();
        DataElement age = DataElement.builder("age", ClinicalType.DEMOGRAPHIC).description("Age 18-75").build();
        return new PopulationDefinition("pop_ip", PopulationType.INITIAL_POPULATION, narrative,
                LogicalClause.and("ip_root", CriteriaNode.of(age), CriteriaNode.of(diabetes)));
    }

    private static UniversalMeasureSpec measure(String title, PopulationDefinition population) {
        MeasureMetadata metadata = MeasureMetadata.builder()
                .measureId("CMS122v12")
                .title(title)
                .version("12.0.0")
                .measurementPeriod(MeasurementPeriod.calendarYear(2025))
                .build();
        return UniversalMeasureSpec.builder(metadata)
                .id("ums_CMS122v12")
                .population(population)
                .valueSet(new ValueSetReference("vs_1", "Diabetes", DIABETES_OID, null, List.of(), null))
                .build();
    }
}
