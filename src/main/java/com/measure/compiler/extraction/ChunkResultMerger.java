package com.measure.compiler.extraction;

import com.measure.compiler.model.CodeReference;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.ValueSetReference;
import com.measure.compiler.tree.LogicTrees;
import com.measure.compiler.tree.TreeVisit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines the per-chunk results of a long document into one result per population type.
 * <p>
 * A type seen in one chunk passes through. A type seen in several chunks keeps the first successful
 * population, takes the union of top-level criteria deduplicated by description (id when blank) in
 * first-seen order, and keeps the longest narrative. Ids that collide across chunks get a numeric suffix.
 * Value sets are grouped by {@link ValueSetReference#dedupKey()} and their codes merged by (code, system).
 */
public class ChunkResultMerger {
    private static final Logger logger = LoggerFactory.getLogger(ChunkResultMerger.class);

    public MergedExtraction merge(List<PartialExtraction> partials) {
        if (partials.isEmpty()) {
            return new MergedExtraction(null, List.of(), List.of());
        }

        MeasureSkeleton skeleton = partials.stream()
                .flatMap(p -> p.getSkeleton().stream())
                .findFirst()
                .orElse(null);

        Map<PopulationType, List<PopulationExtractionResult>> byType = new LinkedHashMap<>();
        List<ValueSetReference> allValueSets = new ArrayList<>();
        for (PartialExtraction partial : partials) {
            for (PopulationExtractionResult result : partial.getPopulationResults()) {
                byType.computeIfAbsent(result.getPopulationType(), t -> new ArrayList<>()).add(result);
            }
            allValueSets.addAll(partial.getValueSets());
        }

        List<PopulationExtractionResult> merged = new ArrayList<>();
        for (Map.Entry<PopulationType, List<PopulationExtractionResult>> entry : byType.entrySet()) {
            List<PopulationExtractionResult> results = entry.getValue();
            merged.add(results.size() == 1 ? results.get(0) : mergePopulationResults(results));
        }

        List<ValueSetReference> valueSets = mergeValueSets(allValueSets);
        logger.debug("Merged {} chunk results into {} populations and {} value sets",
                partials.size(), merged.size(), valueSets.size());
        return new MergedExtraction(skeleton, merged, valueSets);
    }

    /**
     * Merge several results for the same population type.
     */
    PopulationExtractionResult mergePopulationResults(List<PopulationExtractionResult> results) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<PopulationExtractionResult> successful = new ArrayList<>();
        for (PopulationExtractionResult result : results) {
            errors.addAll(result.getErrors());
            warnings.addAll(result.getWarnings());
            if (result.isSuccess() && result.getPopulation().isPresent()) {
                successful.add(result);
            }
        }

        PopulationType type = results.get(0).getPopulationType();
        if (successful.isEmpty()) {
            return PopulationExtractionResult.failure(type, errors, warnings);
        }

        PopulationDefinition base = successful.get(0).getPopulation().orElseThrow();
        LogicalClause criteria = base.getCriteria();
        Set<String> seenKeys = new HashSet<>();
        Set<String> usedIds = new HashSet<>();
        if (criteria != null) {
            usedIds.add(criteria.getId());
        }
        List<CriteriaNode> children = new ArrayList<>();
        String narrative = "";
        List<ValueSetReference> valueSets = new ArrayList<>();
        List<OidValidationResult> oidValidations = new ArrayList<>();

        for (PopulationExtractionResult result : successful) {
            PopulationDefinition population = result.getPopulation().orElseThrow();
            if (population.getNarrative().length() > narrative.length()) {
                narrative = population.getNarrative();
            }
            valueSets.addAll(result.getValueSets());
            oidValidations.addAll(result.getOidValidations());
            if (!population.hasCriteria()) {
                continue;
            }
            for (CriteriaNode child : population.getCriteria().getChildren()) {
                String key = StringUtils.isNotBlank(child.getDescription()) ? child.getDescription() : child.getId();
                if (seenKeys.add(key)) {
                    children.add(withUniqueIds(child, usedIds));
                }
            }
        }

        if (criteria == null && !children.isEmpty()) {
            criteria = new LogicalClause(uniqueId(base.getId() + "_criteria", usedIds), LogicalOperator.AND, children);
        } else if (criteria != null && !criteria.getChildren().equals(children)) {
            criteria = criteria.withChildren(children, List.of());
        }

        PopulationDefinition mergedPopulation = base.withCriteria(criteria).withNarrative(narrative);
        return new PopulationExtractionResult(type, true, mergedPopulation, valueSets, oidValidations, errors, warnings);
    }

    /**
     * Group by dedup key; groups of more than one keep the first reference with the union of codes.
     */
    List<ValueSetReference> mergeValueSets(List<ValueSetReference> valueSets) {
        Map<String, List<ValueSetReference>> byKey = new LinkedHashMap<>();
        for (ValueSetReference valueSet : valueSets) {
            byKey.computeIfAbsent(valueSet.dedupKey(), k -> new ArrayList<>()).add(valueSet);
        }

        List<ValueSetReference> merged = new ArrayList<>();
        for (List<ValueSetReference> group : byKey.values()) {
            if (group.size() == 1) {
                merged.add(group.get(0));
                continue;
            }
            Set<String> codeKeys = new HashSet<>();
            List<CodeReference> codes = new ArrayList<>();
            for (ValueSetReference valueSet : group) {
                for (CodeReference code : valueSet.getCodes()) {
                    if (codeKeys.add(code.dedupKey())) {
                        codes.add(code);
                    }
                }
            }
            merged.add(group.get(0).withCodes(codes));
        }
        return merged;
    }

    /**
     * Rename any id in the subtree already present in {@code usedIds}, then record the subtree's ids.
     */
    private static CriteriaNode withUniqueIds(CriteriaNode node, Set<String> usedIds) {
        boolean collides = false;
        if (node.isClause()) {
            for (TreeVisit visit : LogicTrees.walk(node.asClause())) {
                collides |= usedIds.contains(visit.getNode().getId());
            }
        } else {
            collides = usedIds.contains(node.getId());
        }
        CriteriaNode result = collides ? renamed(node, usedIds) : node;
        if (result.isClause()) {
            for (TreeVisit visit : LogicTrees.walk(result.asClause())) {
                usedIds.add(visit.getNode().getId());
            }
        } else {
            usedIds.add(result.getId());
        }
        return result;
    }

    private static CriteriaNode renamed(CriteriaNode node, Set<String> usedIds) {
        String id = uniqueId(node.getId(), usedIds);
        usedIds.add(id);
        if (node.isElement()) {
            DataElement element = node.asElement();
            return CriteriaNode.of(element.toBuilder().id(id).build());
        }
        LogicalClause clause = node.asClause();
        List<CriteriaNode> children = new ArrayList<>();
        for (CriteriaNode child : clause.getChildren()) {
            children.add(usedIds.contains(child.getId()) || child.isClause() ? renamed(child, usedIds) : child);
        }
        return CriteriaNode.of(clause.withId(id).withChildren(children, clause.getSiblingConnections()));
    }

    private static String uniqueId(String id, Set<String> usedIds) {
        if (!usedIds.contains(id)) {
            return id;
        }
        int suffix = 2;
        while (usedIds.contains(id + "_" + suffix)) {
            suffix++;
        }
        return id + "_" + suffix;
    }
}
