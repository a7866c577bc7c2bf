package com.measure.compiler.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.measure.compiler.model.ConfidenceLevel;
import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.measure.compiler.extraction.CriteriaTreeReader.text;

/**
 * Pulls the JSON object out of free-form oracle text and maps the skeleton and validation payloads.
 */
class OracleResponseParser {
    private static final Logger logger = LoggerFactory.getLogger(OracleResponseParser.class);

    private final ObjectMapper mapper;

    OracleResponseParser() {
        this(new ObjectMapper());
    }

    OracleResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * The span from the first '{' to the last '}', parsed as JSON.
     * @param response Raw completion text, possibly wrapped in prose or code fences
     * @return The object, or empty when there is none or it does not parse
     */
    Optional<JsonNode> extractJsonObject(String response) {
        if (response == null) {
            return Optional.empty();
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(response.substring(start, end + 1));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            logger.debug("Oracle response is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    Optional<MeasureSkeleton> parseSkeleton(String response) {
        Optional<JsonNode> parsed = extractJsonObject(response);
        if (parsed.isEmpty()) {
            logger.error("Failed to parse skeleton: no JSON object in response");
            return Optional.empty();
        }
        JsonNode root = parsed.get();

        MeasurementPeriod period = null;
        JsonNode periodNode = root.get("measurementPeriod");
        if (periodNode != null && periodNode.isObject()) {
            try {
                period = new MeasurementPeriod(date(text(periodNode, "start")), date(text(periodNode, "end")));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring measurement period: {}", e.getMessage());
            }
        }

        MeasureMetadata metadata = MeasureMetadata.builder()
                .measureId(text(root, "measureId"))
                .title(text(root, "title"))
                .version(text(root, "version"))
                .program(text(root, "programType"))
                .measureType(text(root, "measureType"))
                .scoring(text(root, "scoring"))
                .steward(text(root, "steward"))
                .description(text(root, "description"))
                .measurementPeriod(period)
                .build();

        List<PopulationSkeleton> populations = new ArrayList<>();
        for (JsonNode node : root.path("populations")) {
            String type = text(node, "type");
            try {
                populations.add(new PopulationSkeleton(
                        PopulationType.fromValue(type),
                        text(node, "name"),
                        text(node, "briefDescription"),
                        text(node, "specSection"),
                        node.path("estimatedCriteriaCount").asInt(0)));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping skeleton population with unknown type '{}'", type);
            }
        }

        return Optional.of(new MeasureSkeleton(metadata, populations,
                ConfidenceLevel.fromValue(text(root, "confidence"))));
    }

    Optional<CrossReferenceResult> parseCrossReference(String response) {
        Optional<JsonNode> parsed = extractJsonObject(response);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root = parsed.get();

        List<MissingCriterion> missing = new ArrayList<>();
        for (JsonNode node : root.path("missingCriteria")) {
            missing.add(new MissingCriterion(text(node, "specText"), text(node, "populationType"),
                    ConfidenceLevel.fromValue(text(node, "confidence"))));
        }
        List<PossibleHallucination> hallucinations = new ArrayList<>();
        for (JsonNode node : root.path("possibleHallucinations")) {
            hallucinations.add(new PossibleHallucination(text(node, "criterionDescription"),
                    text(node, "populationType"), text(node, "reason")));
        }
        return Optional.of(new CrossReferenceResult(
                root.path("valid").asBoolean(true),
                strings(root.path("missingPopulations")),
                missing,
                hallucinations,
                strings(root.path("suggestions"))));
    }

    String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize extraction summary", e);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isNull()) {
                values.add(node.asText());
            }
        }
        return values;
    }

    private static LocalDate date(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable measurement period date '{}'", value);
            return null;
        }
    }
}
