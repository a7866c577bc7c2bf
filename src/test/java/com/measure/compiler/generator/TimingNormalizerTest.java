package com.measure.compiler.generator;

import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.TimingDirection;
import com.measure.compiler.model.TimingRequirement;
import com.measure.compiler.model.TimingUnit;
import com.measure.compiler.model.ValueSetReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimingNormalizer
 */
public class TimingNormalizerTest {

    private TimingNormalizer normalizer;

    @BeforeEach
    public void setUp() {
        normalizer = new TimingNormalizer();
    }

    // ========== Lookback Table Tests ==========

    @Test
    public void testNormalize_ColonoscopyLookback() {
        DataElement element = DataElement.builder("colonoscopy", ClinicalType.PROCEDURE)
                .description("Colonoscopy performed")
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(TimingKind.BEFORE_PERIOD_END, timing.getKind());
        assertEquals(10, timing.getAmount());
        assertEquals(TimingUnit.YEARS, timing.getUnit());
        assertEquals("colonoscopy", timing.getMatchedKeyword());
    }

    @Test
    public void testNormalize_LookbackFromValueSetName() {
        DataElement element = DataElement.builder("screening", ClinicalType.PROCEDURE)
                .description("Screening test")
                .valueSet(new ValueSetReference("vs_1", "Mammography", "2.16.840.1.113883.3.464.1003.108.12.1018", null, List.of(), null))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(2, timing.getAmount());
        assertEquals("mammography", timing.getMatchedKeyword());
    }

    @Test
    public void testNormalize_LookbackTableWinsOverWindow() {
        DataElement element = DataElement.builder("fobt", ClinicalType.OBSERVATION)
                .description("Fecal occult blood test")
                .timing(TimingRequirement.within(3, TimingUnit.YEARS, TimingDirection.BEFORE, null))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(1, timing.getAmount());
        assertEquals("fecal occult", timing.getMatchedKeyword());
    }

    @Test
    public void testNormalize_DemographicSkipsLookup() {
        DataElement element = DataElement.builder("age", ClinicalType.DEMOGRAPHIC)
                .description("Age at colonoscopy eligibility")
                .build();

        assertEquals(TimingKind.DURING_MEASUREMENT_PERIOD, normalizer.normalize(element).getKind());
    }

    // ========== Window and Description Tests ==========

    @Test
    public void testNormalize_StructuredWindow() {
        DataElement element = DataElement.builder("a1c", ClinicalType.OBSERVATION)
                .description("HbA1c test")
                .timing(TimingRequirement.within(6, TimingUnit.MONTHS, TimingDirection.AFTER, null))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(TimingKind.AFTER_PERIOD_START, timing.getKind());
        assertEquals(6, timing.getAmount());
        assertEquals(TimingUnit.MONTHS, timing.getUnit());
    }

    @Test
    public void testNormalize_QuantityInDescription() {
        DataElement element = DataElement.builder("bp", ClinicalType.OBSERVATION)
                .description("Blood pressure reading")
                .timing(new TimingRequirement("Within 12 months prior to the end of the period", null, null))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(TimingKind.BEFORE_PERIOD_END, timing.getKind());
        assertEquals(12, timing.getAmount());
        assertEquals(TimingUnit.MONTHS, timing.getUnit());
    }

    @Test
    public void testNormalize_DefaultsToMeasurementPeriod() {
        DataElement element = DataElement.builder("visit", ClinicalType.ENCOUNTER)
                .description("Office visit")
                .timing(TimingRequirement.duringMeasurementPeriod())
                .build();

        assertSame(NormalizedTiming.duringMeasurementPeriod(), normalizer.normalize(element));
    }

    @Test
    public void testNormalize_OversizedQuantityIgnored() {
        DataElement element = DataElement.builder("visit", ClinicalType.ENCOUNTER)
                .description("Office visit")
                .timing(new TimingRequirement("Within 99999999999 days before the end of the period", null, null))
                .build();

        assertEquals(TimingKind.DURING_MEASUREMENT_PERIOD, normalizer.normalize(element).getKind());
    }

    @Test
    public void testNormalize_OversizedIndexDaysIgnored() {
        DataElement element = DataElement.builder("dx", ClinicalType.DIAGNOSIS)
                .description("Major depression")
                .timing(new TimingRequirement("Within 99999999999 days of the IPSD", null, null))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(TimingKind.INDEX_EVENT, timing.getKind());
        assertNull(timing.getDaysBeforeIndex());
        assertNull(timing.getDaysAfterIndex());
    }

    // ========== Index Event Tests ==========

    @Test
    public void testNormalize_IndexEventBothSides() {
        DataElement element = DataElement.builder("dx", ClinicalType.DIAGNOSIS)
                .description("Major depression")
                .timing(new TimingRequirement("Within 60 days of the IPSD", null, null))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertTrue(normalizer.isIndexRelative(element));
        assertEquals(TimingKind.INDEX_EVENT, timing.getKind());
        assertEquals(60, timing.getDaysBeforeIndex());
        assertEquals(60, timing.getDaysAfterIndex());
    }

    @Test
    public void testNormalize_IndexEventWindowFromAnchor() {
        DataElement element = DataElement.builder("rx", ClinicalType.MEDICATION)
                .description("Antidepressant dispensing")
                .timing(TimingRequirement.within(105, TimingUnit.DAYS, TimingDirection.BEFORE, "Index Prescription Start Date"))
                .build();

        NormalizedTiming timing = normalizer.normalize(element);

        assertEquals(105, timing.getDaysBeforeIndex());
        assertNull(timing.getDaysAfterIndex());
    }

    @Test
    public void testNormalize_CustomStrategy() {
        TimingNormalizer custom = new TimingNormalizer(KeywordLookbackTable.builder()
                .add("retinal exam", 2, TimingUnit.YEARS)
                .build());
        DataElement element = DataElement.builder("eye", ClinicalType.PROCEDURE)
                .description("Retinal exam by an eye care professional")
                .build();

        assertEquals(2, custom.normalize(element).getAmount());
        assertEquals(TimingKind.DURING_MEASUREMENT_PERIOD, normalizer.normalize(element).getKind());
    }
}
