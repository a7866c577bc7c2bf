package com.measure.compiler.generator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GeneratedCodeCheck
 */
public class GeneratedCodeCheckTest {

    private static final String LIBRARY = "library CMS122v12 version '12.0.0'\n"
            + "using FHIR version '4.0.1'\n"
            + "context Patient\n"
            + "define \"Initial Population\":\n"
            + "  exists ([Encounter: \"Office Visit\"] E where E.status = 'finished')\n";

    // ========== Delimiter Tests ==========

    @Test
    public void testCheckDelimiters_Balanced() {
        assertTrue(GeneratedCodeCheck.checkDelimiters(LIBRARY, "//").isEmpty());
    }

    @Test
    public void testCheckDelimiters_UnclosedParenthesis() {
        List<String> problems = GeneratedCodeCheck.checkDelimiters("define \"X\":\n  exists (\"Visit\"", "//");

        assertEquals(List.of("Unclosed parenthesis at line 2"), problems);
    }

    @Test
    public void testCheckDelimiters_UnexpectedClosers() {
        List<String> problems = GeneratedCodeCheck.checkDelimiters("a)\nb]", "//");

        assertEquals(List.of("Unexpected closing parenthesis at line 1", "Unexpected closing bracket at line 2"), problems);
    }

    @Test
    public void testCheckDelimiters_UnclosedString() {
        List<String> problems = GeneratedCodeCheck.checkDelimiters("select 'open\nfrom DEMOG", "--");

        assertEquals(List.of("Unclosed string literal (') at line 1"), problems);
    }

    @Test
    public void testCheckDelimiters_IgnoresCommentsAndStrings() {
        String sql = "-- patient's first (visit\n"
                + "/* block ( comment\n spanning lines */\n"
                + "select empi_id from DEMOG where note = 'it''s (fine'\n";

        assertTrue(GeneratedCodeCheck.checkDelimiters(sql, "--").isEmpty());
        assertTrue(GeneratedCodeCheck.checkDelimiters("define \"A \\\"(quoted\\\"\": true", "//").isEmpty());
    }

    @Test
    public void testCheckDelimiters_UnclosedBlockComment() {
        List<String> problems = GeneratedCodeCheck.checkDelimiters("true\n/* never closed", "//");

        assertEquals(List.of("Unclosed block comment at line 2"), problems);
    }

    // ========== Structure Tests ==========

    @Test
    public void testCheckCqlLibrary_Complete() {
        assertTrue(GeneratedCodeCheck.checkCqlLibrary(LIBRARY).isEmpty());
    }

    @Test
    public void testCheckCqlLibrary_MissingDeclarations() {
        List<String> problems = GeneratedCodeCheck.checkCqlLibrary("library  version '1.0.0'\ndefine \"X\": true\n");

        assertTrue(problems.contains("Missing library declaration"));
        assertTrue(problems.contains("Missing FHIR using declaration"));
        assertTrue(problems.contains("Missing context declaration"));
        assertFalse(problems.contains("No define statements found"));
    }

    @Test
    public void testCheckSqlQuery() {
        String sql = "with DEMOG as (\n  select empi_id from person\n),\n"
                + "MEASURE_RESULT as (\n  select 'Initial Population' as population, count(*) from DEMOG\n)\n"
                + "select * from MEASURE_RESULT";

        assertTrue(GeneratedCodeCheck.checkSqlQuery(sql).isEmpty());
        assertEquals(List.of("Missing DEMOG (demographics) CTE", "Missing MEASURE_RESULT CTE", "No SELECT statement found"),
                GeneratedCodeCheck.checkSqlQuery("with X as (1)"));
    }
}
