package com.measure.compiler.complexity;

import com.measure.compiler.model.ComplexityFactors;
import com.measure.compiler.model.ComplexityLevel;
import com.measure.compiler.model.ComponentComplexity;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.TimingRequirement;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Scores criteria for authoring complexity.
 * Atomic: base 1 + timing clauses + 2 when negated.
 * Composite: children sum + one per AND connection + 2 per nesting level.
 */
public final class ComplexityScorer {
    private static final int BASE_SCORE = 1;
    private static final int NEGATION_PENALTY = 2;
    private static final int NESTING_PENALTY = 2;
    private static final int MAX_TIMING_CLAUSES = 2;

    private ComplexityScorer() {
    }

    public static ComplexityLevel level(int score) {
        return ComplexityLevel.fromScore(score);
    }

    /**
     * Score a single data element.
     * @param element The element
     * @return Its complexity
     */
    public static ComponentComplexity scoreAtomic(DataElement element) {
        int timingClauses = countTimingClauses(element.getTimingRequirements());
        int negations = element.isNegation() ? 1 : 0;
        int score = BASE_SCORE + timingClauses + (element.isNegation() ? NEGATION_PENALTY : 0);
        return new ComponentComplexity(score, false, ComplexityFactors.atomic(BASE_SCORE, timingClauses, negations));
    }

    /**
     * One clause by default; two when any requirement carries a quantity or a position
     * relative to something other than the measurement period.
     */
    static int countTimingClauses(List<TimingRequirement> requirements) {
        int count = 1;
        for (TimingRequirement requirement : requirements) {
            boolean hasQuantity = requirement.hasWindow();
            boolean hasPosition = !requirement.isMeasurementPeriodAnchored();
            if (hasQuantity || hasPosition) {
                count = MAX_TIMING_CLAUSES;
            }
        }
        return count;
    }

    /**
     * Score a clause from its children's scores.
     * @param clause The clause
     * @param resolveChild Looks up a child's complexity by child id; null results are skipped
     * @return The composite complexity
     */
    public static ComponentComplexity scoreComposite(LogicalClause clause,
                                                     Function<String, ComponentComplexity> resolveChild) {
        int childrenSum = 0;
        int maxChildNesting = 0;
        int childCount = 0;
        for (CriteriaNode child : clause.getChildren()) {
            ComponentComplexity childComplexity = resolveChild.apply(child.getId());
            if (childComplexity == null) {
                continue;
            }
            childCount++;
            childrenSum += childComplexity.getScore();
            if (childComplexity.isComposite()) {
                maxChildNesting = Math.max(maxChildNesting, childComplexity.getFactors().getNestingDepth() + 1);
            }
        }
        int andOperators = clause.getOperator() == LogicalOperator.AND && childCount > 1 ? childCount - 1 : 0;
        int score = childrenSum + andOperators + NESTING_PENALTY * maxChildNesting;
        return new ComponentComplexity(score, true, ComplexityFactors.composite(childrenSum, andOperators, maxChildNesting));
    }

    /**
     * Score a whole subtree, resolving each child from the tree itself.
     */
    public static ComponentComplexity score(CriteriaNode node) {
        if (!node.isClause()) {
            return scoreAtomic(node.asElement());
        }
        LogicalClause clause = node.asClause();
        Map<String, ComponentComplexity> childScores = new HashMap<>();
        for (CriteriaNode child : clause.getChildren()) {
            childScores.putIfAbsent(child.getId(), score(child));
        }
        return scoreComposite(clause, childScores::get);
    }

    public static ComponentComplexity score(LogicalClause clause) {
        return score(CriteriaNode.of(clause));
    }

    /**
     * Complexity of a population's criteria, or null when it has none.
     */
    public static ComponentComplexity scorePopulation(PopulationDefinition population) {
        if (population.getCriteria() == null) {
            return null;
        }
        return score(population.getCriteria());
    }
}
