package com.measure.compiler.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.CodeReference;
import com.measure.compiler.model.ConfidenceLevel;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.ReviewStatus;
import com.measure.compiler.model.SiblingConnection;
import com.measure.compiler.model.Thresholds;
import com.measure.compiler.model.TimingDirection;
import com.measure.compiler.model.TimingRequirement;
import com.measure.compiler.model.TimingUnit;
import com.measure.compiler.model.TimingWindow;
import com.measure.compiler.model.ValueSetReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds criteria trees and value sets from the JSON returned by a detail pass.
 * Lenient: unknown enum spellings fall back to defaults and malformed parts are dropped.
 * Nodes without an id get {@code <prefix>_clause_<n>} or {@code <prefix>_elem_<n>}, numbered per reader.
 */
class CriteriaTreeReader {
    private static final Logger logger = LoggerFactory.getLogger(CriteriaTreeReader.class);

    private final String idPrefix;
    private int clauseCounter;
    private int elementCounter;
    private int valueSetCounter;

    CriteriaTreeReader(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    /**
     * A missing criteria object yields an empty AND clause with LOW confidence.
     */
    LogicalClause readClause(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new LogicalClause(nextClauseId(), LogicalOperator.AND, "Empty criteria", List.of(), List.of(),
                    ConfidenceLevel.LOW, ReviewStatus.PENDING);
        }

        String id = text(node, "id");
        List<CriteriaNode> children = new ArrayList<>();
        for (JsonNode child : node.path("children")) {
            children.add(readNode(child));
        }
        return new LogicalClause(
                id != null ? id : nextClauseId(),
                operator(text(node, "operator")),
                text(node, "description"),
                children,
                siblingConnections(node.path("siblingConnections"), children.size()),
                ConfidenceLevel.fromValue(text(node, "confidence")),
                ReviewStatus.PENDING);
    }

    CriteriaNode readNode(JsonNode node) {
        if (node.has("operator") && node.has("children")) {
            return CriteriaNode.of(readClause(node));
        }
        return CriteriaNode.of(readElement(node));
    }

    DataElement readElement(JsonNode node) {
        String id = text(node, "id");
        DataElement.Builder builder = DataElement.builder(id != null ? id : nextElementId(),
                        clinicalType(text(node, "type") != null ? text(node, "type") : text(node, "clinicalType")))
                .description(text(node, "description") != null ? text(node, "description") : "")
                .negation(node.path("negation").asBoolean(false))
                .confidence(ConfidenceLevel.fromValue(text(node, "confidence")))
                .reviewStatus(ReviewStatus.PENDING);

        JsonNode valueSet = node.get("valueSet");
        if (valueSet != null && valueSet.isObject()) {
            builder.valueSet(readValueSet(valueSet));
        }
        for (JsonNode timing : node.path("timingRequirements")) {
            builder.timing(readTiming(timing));
        }
        JsonNode thresholds = node.get("thresholds");
        if (thresholds != null && thresholds.isObject()) {
            builder.thresholds(new Thresholds(
                    intOrNull(thresholds, "ageMin"),
                    intOrNull(thresholds, "ageMax"),
                    doubleOrNull(thresholds, "valueMin"),
                    doubleOrNull(thresholds, "valueMax"),
                    text(thresholds, "unit")));
        }
        return builder.build();
    }

    ValueSetReference readValueSet(JsonNode node) {
        String id = text(node, "id");
        List<CodeReference> codes = new ArrayList<>();
        for (JsonNode code : node.path("codes")) {
            String value = text(code, "code");
            if (value != null) {
                codes.add(new CodeReference(value, text(code, "system"), text(code, "display")));
            }
        }
        String name = text(node, "name");
        return new ValueSetReference(
                id != null ? id : nextValueSetId(),
                name != null ? name : "",
                text(node, "oid"),
                text(node, "url"),
                codes,
                ConfidenceLevel.fromValue(text(node, "confidence")));
    }

    List<ValueSetReference> readValueSets(JsonNode array) {
        List<ValueSetReference> valueSets = new ArrayList<>();
        for (JsonNode node : array) {
            if (node.isObject()) {
                valueSets.add(readValueSet(node));
            }
        }
        return valueSets;
    }

    private TimingRequirement readTiming(JsonNode node) {
        String anchor = text(node, "relativeTo") != null ? text(node, "relativeTo") : text(node, "anchor");
        JsonNode windowNode = node.has("window") ? node.get("window") : node;
        TimingWindow window = null;
        if (windowNode.hasNonNull("value") && windowNode.hasNonNull("unit")) {
            try {
                String direction = text(windowNode, "direction");
                window = window(windowNode.get("value").asDouble(),
                        TimingUnit.fromValue(text(windowNode, "unit")),
                        direction != null ? TimingDirection.fromValue(direction) : TimingDirection.BEFORE);
            } catch (IllegalArgumentException e) {
                logger.debug("Ignoring unreadable timing window {}: {}", windowNode, e.getMessage());
            }
        }
        return new TimingRequirement(text(node, "description"), window, anchor);
    }

    /**
     * Fractional windows move to the next finer unit and round up, e.g. 1.5 years becomes 18 months.
     */
    static TimingWindow window(double value, TimingUnit unit, TimingDirection direction) {
        if (value == Math.rint(value)) {
            return new TimingWindow((int) value, unit, direction);
        }
        TimingWindow converted = switch (unit) {
            case YEARS -> new TimingWindow((int) Math.ceil(value * 12), TimingUnit.MONTHS, direction);
            case MONTHS -> new TimingWindow((int) Math.ceil(value * 30), TimingUnit.DAYS, direction);
            case DAYS -> new TimingWindow((int) Math.ceil(value), TimingUnit.DAYS, direction);
        };
        logger.debug("Converted fractional timing window {} {} to {}", value, unit, converted);
        return converted;
    }

    private List<SiblingConnection> siblingConnections(JsonNode array, int childCount) {
        List<SiblingConnection> connections = new ArrayList<>();
        for (JsonNode node : array) {
            try {
                SiblingConnection connection = new SiblingConnection(
                        node.path("fromIndex").asInt(-1),
                        node.path("toIndex").asInt(-1),
                        LogicalOperator.fromValue(text(node, "operator")));
                if (connection.getToIndex() < childCount) {
                    connections.add(connection);
                }
            } catch (IllegalArgumentException e) {
                logger.debug("Dropping invalid sibling connection {}: {}", node, e.getMessage());
            }
        }
        return connections;
    }

    private static LogicalOperator operator(String value) {
        if (value == null) {
            return LogicalOperator.AND;
        }
        try {
            return LogicalOperator.fromValue(value);
        } catch (IllegalArgumentException e) {
            logger.debug("Unknown operator '{}', using AND", value);
            return LogicalOperator.AND;
        }
    }

    private static ClinicalType clinicalType(String value) {
        if (value == null) {
            return ClinicalType.OBSERVATION;
        }
        try {
            return ClinicalType.fromValue(value);
        } catch (IllegalArgumentException e) {
            logger.debug("Unknown clinical type '{}', using observation", value);
            return ClinicalType.OBSERVATION;
        }
    }

    private String nextClauseId() {
        return idPrefix + "_clause_" + (++clauseCounter);
    }

    private String nextElementId() {
        return idPrefix + "_elem_" + (++elementCounter);
    }

    private String nextValueSetId() {
        return idPrefix + "_vs_" + (++valueSetCounter);
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) && node.get(field).isNumber() ? node.get(field).asInt() : null;
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) && node.get(field).isNumber() ? node.get(field).asDouble() : null;
    }
}
