package com.measure.compiler.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.measure.compiler.model.ConfidenceLevel;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.ReviewStatus;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * MultiPassExtractor turns measure document text into a {@link UniversalMeasureSpec} with three oracle passes:
 * a skeleton pass for metadata and the population list, one detail pass per population, and an optional
 * cross-reference validation pass. Documents above the chunking threshold are split and the per-chunk
 * results merged.
 * <p>
 * Only a failed skeleton pass is fatal. Detail and validation failures are recorded and the run continues.
 */
public class MultiPassExtractor {
    private static final Logger logger = LoggerFactory.getLogger(MultiPassExtractor.class);

    static final String SKELETON_FAILURE = "Failed to extract measure skeleton";
    private static final int SKELETON_MAX_CHARS = 50_000;
    private static final int SKELETON_MAX_TOKENS = 4_000;
    private static final int DETAIL_MAX_CHARS = 40_000;
    private static final int DETAIL_MAX_TOKENS = 8_000;
    private static final int VALIDATION_MAX_CHARS = 30_000;
    private static final int VALIDATION_MAX_TOKENS = 4_000;

    private final OracleClient oracle;
    private final OidValidator oidValidator;
    private final ExtractionOptions options;
    private final OracleResponseParser parser;
    private final ChunkResultMerger merger;
    private final MeasureSpecAssembler assembler;

    /**
     * Create an extractor with catalog OID validation and default options
     * @param oracle The completion capability
     */
    public MultiPassExtractor(OracleClient oracle) {
        this(oracle, new CatalogOidValidator(), ExtractionOptions.defaults());
    }

    public MultiPassExtractor(OracleClient oracle, OidValidator oidValidator, ExtractionOptions options) {
        this.oracle = oracle;
        this.oidValidator = oidValidator;
        this.options = options;
        this.parser = new OracleResponseParser();
        this.merger = new ChunkResultMerger();
        this.assembler = new MeasureSpecAssembler();
    }

    /**
     * Run the full pipeline over the document text.
     * @param documentText Combined text of the measure documents
     * @return The extraction outcome; never null
     */
    public ExtractionResult extractWithMultiPass(String documentText) {
        String text = documentText != null ? documentText : "";
        if (text.length() > options.getChunkingThreshold()) {
            logger.info("Document has {} characters, using chunked extraction", text.length());
            return extractWithChunking(text);
        }

        long startTotal = System.nanoTime();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // Pass 1: skeleton
        progress(ExtractionPhase.SKELETON, 1, 3, "Extracting measure structure...", null);
        long startSkeleton = System.nanoTime();
        Optional<MeasureSkeleton> parsedSkeleton;
        try {
            parsedSkeleton = extractSkeleton(text);
        } catch (OracleException e) {
            logger.error("Skeleton pass failed: {}", e.getMessage());
            return ExtractionResult.failed(List.of(SKELETON_FAILURE + ": " + e.getMessage()), warnings,
                    new StageTimings(since(startSkeleton), null, null, since(startTotal)));
        }
        Duration skeletonTime = since(startSkeleton);
        if (parsedSkeleton.isEmpty()) {
            return ExtractionResult.failed(List.of(SKELETON_FAILURE), warnings,
                    new StageTimings(skeletonTime, null, null, since(startTotal)));
        }
        MeasureSkeleton skeleton = parsedSkeleton.get();
        logger.info("Skeleton for {} lists {} populations", skeleton.getMeasureId(), skeleton.getPopulations().size());

        // Pass 2: one detail call per population
        long startPopulations = System.nanoTime();
        List<PopulationSkeleton> populations = skeleton.getPopulations();
        List<String> populationIds = populationIds(populations);
        List<CompletableFuture<PopulationExtractionResult>> futures = new ArrayList<>();
        for (int i = 0; i < populations.size(); i++) {
            PopulationSkeleton population = populations.get(i);
            progress(ExtractionPhase.POPULATIONS, i + 1, populations.size(),
                    "Extracting " + population.getName() + "...", population.getBriefDescription());
            futures.add(submitDetail(text, skeleton, population, populationIds.get(i), population.getType().getValue()));
        }
        List<PopulationExtractionResult> populationResults = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            populationResults.add(await(futures.get(i), populations.get(i).getType()));
        }
        List<ValueSetReference> valueSets = new ArrayList<>();
        for (PopulationExtractionResult result : populationResults) {
            valueSets.addAll(result.getValueSets());
            recordOutcome(result, errors, warnings);
        }
        Duration populationsTime = since(startPopulations);

        // Pass 3: validation
        long startValidation = System.nanoTime();
        CrossReferenceResult crossReference = validationPass(text, skeleton, populationResults, warnings);
        Duration validationTime = crossReference != null ? since(startValidation) : Duration.ZERO;

        progress(ExtractionPhase.COMPLETE, 1, 1, "Assembling measure specification...", null);
        UniversalMeasureSpec spec = assembler.assemble(skeleton, populationResults, valueSets);

        StageTimings timings = new StageTimings(skeletonTime, populationsTime, validationTime, since(startTotal));
        logger.info("Extraction of {} finished with {} errors and {} warnings ({})",
                skeleton.getMeasureId(), errors.size(), warnings.size(), timings);
        return new ExtractionResult(errors.isEmpty(), spec, skeleton, populationResults, crossReference,
                errors, warnings, timings);
    }

    private ExtractionResult extractWithChunking(String text) {
        long startTotal = System.nanoTime();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<DocumentChunk> chunks = new DocumentChunker(options.getChunkingOptions()).chunk(text);
        warnings.add("Document chunked into " + chunks.size() + " parts for processing");

        DocumentChunk first = chunks.get(0);
        progress(ExtractionPhase.SKELETON, 1, chunks.size(),
                "Processing chunk 1 of " + chunks.size() + "...", sectionList(first));
        long startSkeleton = System.nanoTime();
        Optional<MeasureSkeleton> parsedSkeleton;
        try {
            parsedSkeleton = extractSkeleton(first.getContent());
        } catch (OracleException e) {
            logger.error("Skeleton pass failed on first chunk: {}", e.getMessage());
            return ExtractionResult.failed(List.of(SKELETON_FAILURE + ": " + e.getMessage()), warnings,
                    new StageTimings(since(startSkeleton), null, null, since(startTotal)));
        }
        Duration skeletonTime = since(startSkeleton);
        if (parsedSkeleton.isEmpty()) {
            return ExtractionResult.failed(List.of(SKELETON_FAILURE), warnings,
                    new StageTimings(skeletonTime, null, null, since(startTotal)));
        }
        MeasureSkeleton skeleton = parsedSkeleton.get();

        long startPopulations = System.nanoTime();
        List<PopulationSkeleton> populations = skeleton.getPopulations();
        List<String> populationIds = populationIds(populations);
        Map<Integer, List<CompletableFuture<PopulationExtractionResult>>> futuresByChunk = new LinkedHashMap<>();
        Map<Integer, List<PopulationType>> typesByChunk = new LinkedHashMap<>();
        Set<PopulationType> located = new HashSet<>();

        for (DocumentChunk chunk : chunks) {
            if (chunk.getIndex() > 0) {
                progress(ExtractionPhase.SKELETON, chunk.getIndex() + 1, chunks.size(),
                        "Processing chunk " + (chunk.getIndex() + 1) + " of " + chunks.size() + "...",
                        sectionList(chunk));
            }
            List<CompletableFuture<PopulationExtractionResult>> futures = new ArrayList<>();
            List<PopulationType> types = new ArrayList<>();
            for (int i = 0; i < populations.size(); i++) {
                PopulationSkeleton population = populations.get(i);
                if (chunk.containsSection(population.getType())) {
                    located.add(population.getType());
                    types.add(population.getType());
                    futures.add(submitDetail(chunk.getContent(), skeleton, population, populationIds.get(i),
                            population.getType().getValue() + "_c" + (chunk.getIndex() + 1)));
                }
            }
            futuresByChunk.put(chunk.getIndex(), futures);
            typesByChunk.put(chunk.getIndex(), types);
        }

        // Populations without a heading anywhere are tried against the opening chunk
        for (int i = 0; i < populations.size(); i++) {
            PopulationSkeleton population = populations.get(i);
            if (!located.contains(population.getType())) {
                warnings.add("No " + population.getType().getDisplayName()
                        + " section found in any chunk; extracting it from the first chunk");
                futuresByChunk.get(0).add(submitDetail(first.getContent(), skeleton, population, populationIds.get(i),
                        population.getType().getValue() + "_c1"));
                typesByChunk.get(0).add(population.getType());
                located.add(population.getType());
            }
        }

        List<PartialExtraction> partials = new ArrayList<>();
        for (DocumentChunk chunk : chunks) {
            List<CompletableFuture<PopulationExtractionResult>> futures = futuresByChunk.get(chunk.getIndex());
            List<PopulationType> types = typesByChunk.get(chunk.getIndex());
            List<PopulationExtractionResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), types.get(i)));
            }
            partials.add(new PartialExtraction(chunk, chunk.getIndex() == 0 ? skeleton : null, results));
        }

        MergedExtraction merged = merger.merge(partials);
        for (PopulationExtractionResult result : merged.getPopulationResults()) {
            recordOutcome(result, errors, warnings);
        }
        Duration populationsTime = since(startPopulations);

        long startValidation = System.nanoTime();
        CrossReferenceResult crossReference = validationPass(text, skeleton, merged.getPopulationResults(), warnings);
        Duration validationTime = crossReference != null ? since(startValidation) : Duration.ZERO;

        progress(ExtractionPhase.COMPLETE, 1, 1, "Assembling measure specification...", null);
        UniversalMeasureSpec spec = assembler.assemble(skeleton, merged.getPopulationResults(), merged.getValueSets());

        StageTimings timings = new StageTimings(skeletonTime, populationsTime, validationTime, since(startTotal));
        logger.info("Chunked extraction of {} over {} chunks finished with {} errors ({})",
                skeleton.getMeasureId(), chunks.size(), errors.size(), timings);
        return new ExtractionResult(errors.isEmpty(), spec, skeleton, merged.getPopulationResults(), crossReference,
                errors, warnings, timings);
    }

    // ========== Passes ==========

    private Optional<MeasureSkeleton> extractSkeleton(String text) {
        String response = oracle.complete(ExtractionPrompts.SKELETON,
                List.of(OracleMessage.user("Extract the structural overview from this measure specification:\n\n"
                        + truncate(text, SKELETON_MAX_CHARS))),
                SKELETON_MAX_TOKENS);
        return parser.parseSkeleton(response);
    }

    private CompletableFuture<PopulationExtractionResult> submitDetail(String text, MeasureSkeleton skeleton,
                                                                      PopulationSkeleton population,
                                                                      String populationId, String idPrefix) {
        return CompletableFuture.supplyAsync(
                () -> extractPopulationDetail(text, skeleton, population, populationId, idPrefix),
                options.getDetailExecutor());
    }

    PopulationExtractionResult extractPopulationDetail(String text, MeasureSkeleton skeleton,
                                                       PopulationSkeleton population, String populationId,
                                                       String idPrefix) {
        PopulationType type = population.getType();
        List<String> warnings = new ArrayList<>();
        try {
            String response = oracle.complete(ExtractionPrompts.populationDetail(skeleton, population),
                    List.of(OracleMessage.user("Extract detailed criteria for the " + type.getFhirCode()
                            + " population from this spec:\n\n" + truncate(text, DETAIL_MAX_CHARS))),
                    DETAIL_MAX_TOKENS);

            Optional<JsonNode> parsed = parser.extractJsonObject(response);
            if (parsed.isEmpty()) {
                return PopulationExtractionResult.failure(type, List.of("No JSON found in response"), warnings);
            }
            JsonNode root = parsed.get();
            CriteriaTreeReader reader = new CriteriaTreeReader(idPrefix);

            List<ValueSetReference> valueSets = reader.readValueSets(root.path("valueSets"));
            List<OidValidationResult> validations = new ArrayList<>();
            for (ValueSetReference valueSet : valueSets) {
                if (valueSet.getOid() == null) {
                    continue;
                }
                OidValidationResult validation = oidValidator.validate(valueSet.getOid(), valueSet.getName());
                validations.add(validation);
                if (!validation.isValid()) {
                    warnings.add("OID validation failed for \"" + valueSet.getName() + "\": "
                            + validation.errorSummary());
                }
            }

            JsonNode criteriaNode = root.get("criteria");
            LogicalClause criteria = reader.readClause(criteriaNode);
            String narrative = CriteriaTreeReader.text(root, "narrative");
            PopulationDefinition definition = new PopulationDefinition(
                    populationId,
                    type,
                    population.getBriefDescription(),
                    narrative != null ? narrative : population.getBriefDescription(),
                    criteria,
                    criteriaNode != null ? ConfidenceLevel.fromValue(CriteriaTreeReader.text(criteriaNode, "confidence"))
                            : ConfidenceLevel.LOW,
                    ReviewStatus.PENDING);

            for (JsonNode warning : root.path("warnings")) {
                warnings.add(warning.asText());
            }
            return PopulationExtractionResult.success(definition, valueSets, validations, warnings);
        } catch (OracleException | IllegalArgumentException e) {
            logger.warn("Detail pass for {} failed: {}", type.getValue(), e.getMessage());
            return PopulationExtractionResult.failure(type, List.of(StringUtils.defaultIfBlank(e.getMessage(),
                    e.getClass().getSimpleName())), warnings);
        }
    }

    /**
     * @return The cross-reference findings, or null when the pass is skipped
     */
    private CrossReferenceResult validationPass(String text, MeasureSkeleton skeleton,
                                                List<PopulationExtractionResult> populationResults,
                                                List<String> warnings) {
        if (options.isSkipValidationPass()) {
            return null;
        }
        progress(ExtractionPhase.VALIDATION, 1, 1, "Validating extraction completeness...", null);

        CrossReferenceResult result;
        try {
            String response = oracle.complete(ExtractionPrompts.VALIDATION,
                    List.of(OracleMessage.user("Original Specification:\n" + truncate(text, VALIDATION_MAX_CHARS)
                            + "\n\n---\n\nExtracted Data:\n" + parser.toJson(summary(skeleton, populationResults))
                            + "\n\nValidate the extraction and identify any gaps or errors.")),
                    VALIDATION_MAX_TOKENS);
            result = parser.parseCrossReference(response)
                    .orElseGet(() -> CrossReferenceResult.inconclusive("Could not parse validation response"));
        } catch (OracleException e) {
            logger.warn("Validation pass failed: {}", e.getMessage());
            result = CrossReferenceResult.inconclusive("Validation error: " + e.getMessage());
        }

        if (!result.isValid()) {
            warnings.add("Validation found potential issues: " + String.join("; ", result.getSuggestions()));
        }
        return result;
    }

    // ========== Helpers ==========

    private static Map<String, Object> summary(MeasureSkeleton skeleton, List<PopulationExtractionResult> results) {
        List<Map<String, Object>> populations = new ArrayList<>();
        for (PopulationExtractionResult result : results) {
            List<String> criteria = result.getPopulation()
                    .filter(PopulationDefinition::hasCriteria)
                    .map(p -> p.getCriteria().getChildren().stream()
                            .map(CriteriaNode::getDescription)
                            .collect(Collectors.toList()))
                    .orElse(List.of());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", result.getPopulationType().getFhirCode());
            entry.put("criteriaCount", criteria.size());
            entry.put("criteria", criteria);
            populations.add(entry);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("measureId", skeleton.getMeasureId());
        summary.put("populations", populations);
        return summary;
    }

    private static void recordOutcome(PopulationExtractionResult result, List<String> errors, List<String> warnings) {
        if (!result.isSuccess()) {
            errors.add("Failed to extract " + result.getPopulationType().getFhirCode() + ": "
                    + String.join(", ", result.getErrors()));
        }
        warnings.addAll(result.getWarnings());
    }

    private static PopulationExtractionResult await(CompletableFuture<PopulationExtractionResult> future,
                                                    PopulationType type) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Detail pass for {} did not complete: {}", type.getValue(), cause.getMessage(), cause);
            return PopulationExtractionResult.failure(type,
                    List.of(StringUtils.defaultIfBlank(cause.getMessage(), cause.getClass().getSimpleName())),
                    List.of());
        }
    }

    private static List<String> populationIds(List<PopulationSkeleton> populations) {
        List<String> ids = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < populations.size(); i++) {
            String id = "pop_" + populations.get(i).getType().getValue();
            ids.add(used.add(id) ? id : id + "_" + (i + 1));
        }
        return ids;
    }

    private static String sectionList(DocumentChunk chunk) {
        return "Sections: " + chunk.getSections().stream()
                .map(s -> s.getType().getValue())
                .collect(Collectors.joining(", "));
    }

    private void progress(ExtractionPhase phase, int step, int total, String message, String details) {
        try {
            options.getProgressListener().accept(new ExtractionProgress(phase, step, total, message, details));
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed during {}: {}", phase, e.getMessage(), e);
        }
    }

    private static String truncate(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
