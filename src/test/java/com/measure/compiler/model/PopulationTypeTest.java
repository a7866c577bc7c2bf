package com.measure.compiler.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PopulationType and ConfidenceLevel parsing
 */
public class PopulationTypeTest {

    @Test
    public void testFromValue_Spellings() {
        assertEquals(PopulationType.INITIAL_POPULATION, PopulationType.fromValue("initial_population"));
        assertEquals(PopulationType.INITIAL_POPULATION, PopulationType.fromValue("initial-population"));
        assertEquals(PopulationType.INITIAL_POPULATION, PopulationType.fromValue("Initial Population"));
        assertEquals(PopulationType.DENOMINATOR_EXCEPTION, PopulationType.fromValue("DENOMINATOR-EXCEPTION"));
    }

    @Test
    public void testFromValue_Unknown() {
        assertThrows(IllegalArgumentException.class, () -> PopulationType.fromValue("stratifier"));
        assertThrows(IllegalArgumentException.class, () -> PopulationType.fromValue(null));
    }

    @Test
    public void testCodes() {
        assertEquals("numerator-exclusion", PopulationType.NUMERATOR_EXCLUSION.getFhirCode());
        assertEquals("Denominator Exclusion", PopulationType.DENOMINATOR_EXCLUSION.getDisplayName());
    }

    @Test
    public void testConfidenceLevel_NullIsMedium() {
        assertEquals(ConfidenceLevel.MEDIUM, ConfidenceLevel.fromValue(null));
    }
}
