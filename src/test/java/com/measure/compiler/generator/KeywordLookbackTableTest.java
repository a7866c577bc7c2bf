package com.measure.compiler.generator;

import com.measure.compiler.model.TimingUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeywordLookbackTable
 */
public class KeywordLookbackTableTest {

    private final KeywordLookbackTable table = KeywordLookbackTable.standard();

    @Test
    public void testFind_FirstMatchWins() {
        LookbackPeriod period = table.find("Flexible sigmoidoscopy within 5 years").orElseThrow();

        assertEquals("flexible sigmoidoscopy", period.getKeyword());
        assertEquals(5, period.getAmount());
        assertEquals(TimingUnit.YEARS, period.getUnit());
    }

    @Test
    public void testFind_FitDnaBeforeFit() {
        assertEquals(3, table.find("FIT-DNA test").orElseThrow().getAmount());
        assertEquals(1, table.find("FIT test").orElseThrow().getAmount());
    }

    @Test
    public void testFind_WholeWordsOnly() {
        assertTrue(table.find("Patients who benefit from counseling").isEmpty());
        assertTrue(table.find("Papular rash").isEmpty());
    }

    @Test
    public void testFind_CervicalAndBreast() {
        assertEquals(3, table.find("Cervical cytology (Pap) test").orElseThrow().getAmount());
        assertEquals(5, table.find("HPV test").orElseThrow().getAmount());
        assertEquals(2, table.find("Screening mammogram").orElseThrow().getAmount());
    }

    @Test
    public void testFind_BlankText() {
        assertTrue(table.find(null).isEmpty());
        assertTrue(table.find("  ").isEmpty());
    }

    @Test
    public void testKeywords_Ordered() {
        assertEquals("colonoscopy", table.keywords().get(0));
        assertTrue(table.keywords().indexOf("fit-dna") < table.keywords().indexOf("fit"));
    }
}
