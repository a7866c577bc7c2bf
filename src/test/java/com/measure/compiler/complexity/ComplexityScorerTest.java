package com.measure.compiler.complexity;

import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.ComplexityFactors;
import com.measure.compiler.model.ComplexityLevel;
import com.measure.compiler.model.ComponentComplexity;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.TimingDirection;
import com.measure.compiler.model.TimingRequirement;
import com.measure.compiler.model.TimingUnit;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ComplexityScorer
 */
public class ComplexityScorerTest {

    // ========== Atomic Tests ==========

    @Test
    public void testScoreAtomic_Plain() {
        DataElement element = DataElement.builder("dm", ClinicalType.DIAGNOSIS).description("Diabetes").build();

        ComponentComplexity complexity = ComplexityScorer.scoreAtomic(element);

        assertEquals(2, complexity.getScore());
        assertEquals(ComplexityLevel.LOW, complexity.getLevel());
        assertFalse(complexity.isComposite());
        assertEquals(1, complexity.getFactors().getTimingClauses());
    }

    @Test
    public void testScoreAtomic_MeasurementPeriodTimingCountsOnce() {
        DataElement element = DataElement.builder("visit", ClinicalType.ENCOUNTER)
                .timing(TimingRequirement.duringMeasurementPeriod())
                .build();

        assertEquals(2, ComplexityScorer.scoreAtomic(element).getScore());
    }

    @Test
    public void testScoreAtomic_WindowCapsAtTwoClauses() {
        DataElement element = DataElement.builder("colonoscopy", ClinicalType.PROCEDURE)
                .timing(TimingRequirement.within(10, TimingUnit.YEARS, TimingDirection.BEFORE, "Measurement Period End"))
                .timing(TimingRequirement.within(1, TimingUnit.YEARS, TimingDirection.BEFORE, null))
                .build();

        assertEquals(3, ComplexityScorer.scoreAtomic(element).getScore());
    }

    @Test
    public void testScoreAtomic_RelativePositionWithoutWindow() {
        DataElement element = DataElement.builder("pdc", ClinicalType.MEDICATION)
                .timing(new TimingRequirement("After the index prescription", null, "Index Prescription Start Date"))
                .build();

        assertEquals(3, ComplexityScorer.scoreAtomic(element).getScore());
    }

    @Test
    public void testScoreAtomic_Negation() {
        DataElement element = DataElement.builder("no_hospice", ClinicalType.ENCOUNTER)
                .negation(true)
                .timing(TimingRequirement.within(6, TimingUnit.MONTHS, TimingDirection.BEFORE, null))
                .build();

        ComponentComplexity complexity = ComplexityScorer.scoreAtomic(element);

        assertEquals(5, complexity.getScore());
        assertEquals(ComplexityLevel.MEDIUM, complexity.getLevel());
        assertEquals(1, complexity.getFactors().getNegations());
    }

    @Test
    public void testScoreAtomic_AddingTimingNeverDecreases() {
        DataElement plain = DataElement.builder("a1c", ClinicalType.OBSERVATION).build();
        DataElement timed = plain.toBuilder()
                .timing(TimingRequirement.within(12, TimingUnit.MONTHS, TimingDirection.BEFORE, null))
                .build();

        assertTrue(ComplexityScorer.scoreAtomic(timed).getScore() >= ComplexityScorer.scoreAtomic(plain).getScore());
    }

    // ========== Composite Tests ==========

    @Test
    public void testScoreComposite_AndAddsConnections() {
        LogicalClause clause = LogicalClause.and("root", leaf("a"), leaf("b"), leaf("c"));

        ComponentComplexity complexity = ComplexityScorer.score(clause);

        // 3 x 2 for the leaves, 2 AND connections
        assertEquals(8, complexity.getScore());
        assertEquals(ComplexityLevel.HIGH, complexity.getLevel());
        assertEquals(2, complexity.getFactors().getAndOperators());
    }

    @Test
    public void testScoreComposite_OrHasNoConnectionCost() {
        LogicalClause clause = LogicalClause.or("root", leaf("a"), leaf("b"));

        assertEquals(4, ComplexityScorer.score(clause).getScore());
    }

    @Test
    public void testScoreComposite_NestingPenalty() {
        LogicalClause inner = LogicalClause.and("inner", leaf("a"), leaf("b"));
        LogicalClause outer = LogicalClause.and("outer", CriteriaNode.of(inner), leaf("c"));

        ComponentComplexity innerScore = ComplexityScorer.score(inner);
        ComponentComplexity outerScore = ComplexityScorer.score(outer);

        assertEquals(5, innerScore.getScore());
        // 5 + 2 children, 1 AND connection, 2 for one nested level
        assertEquals(10, outerScore.getScore());
        assertEquals(1, outerScore.getFactors().getNestingDepth());
        assertTrue(outerScore.getScore() >= innerScore.getScore() + 1);
    }

    @Test
    public void testScoreComposite_UnresolvedChildrenSkipped() {
        LogicalClause clause = LogicalClause.and("root", leaf("a"), leaf("missing"));
        Map<String, ComponentComplexity> scores = Map.of("a", new ComponentComplexity(2, false, ComplexityFactors.atomic(1, 1, 0)));

        ComponentComplexity complexity = ComplexityScorer.scoreComposite(clause, scores::get);

        // only resolved children count toward AND connections
        assertEquals(2, complexity.getScore());
        assertEquals(0, complexity.getFactors().getAndOperators());
    }

    @Test
    public void testScoreComposite_OnlyResolvedChildrenJoined() {
        LogicalClause clause = LogicalClause.and("root", leaf("a"), leaf("b"), leaf("gone"));
        Map<String, ComponentComplexity> scores = Map.of(
                "a", new ComponentComplexity(2, false, ComplexityFactors.atomic(1, 1, 0)),
                "b", new ComponentComplexity(2, false, ComplexityFactors.atomic(1, 1, 0)));

        assertEquals(5, ComplexityScorer.scoreComposite(clause, scores::get).getScore());
    }

    @Test
    public void testScorePopulation() {
        PopulationDefinition empty = new PopulationDefinition("pop_num", PopulationType.NUMERATOR, "", null);
        PopulationDefinition scored = new PopulationDefinition("pop_ip", PopulationType.INITIAL_POPULATION, "",
                LogicalClause.and("ip", leaf("a"), leaf("b")));

        assertNull(ComplexityScorer.scorePopulation(empty));
        assertEquals(5, ComplexityScorer.scorePopulation(scored).getScore());
    }

    // ========== Level Tests ==========

    @Test
    public void testLevel_Boundaries() {
        assertEquals(ComplexityLevel.LOW, ComplexityScorer.level(3));
        assertEquals(ComplexityLevel.MEDIUM, ComplexityScorer.level(4));
        assertEquals(ComplexityLevel.MEDIUM, ComplexityScorer.level(7));
        assertEquals(ComplexityLevel.HIGH, ComplexityScorer.level(8));
    }

    private static CriteriaNode leaf(String id) {
        return CriteriaNode.of(DataElement.builder(id, ClinicalType.OBSERVATION).description(id).build());
    }
}
