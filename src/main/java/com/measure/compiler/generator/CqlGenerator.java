package com.measure.compiler.generator;

import com.measure.compiler.complexity.ComplexityScorer;
import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.ComplexityLevel;
import com.measure.compiler.model.ComponentComplexity;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.Gender;
import com.measure.compiler.model.GlobalConstraints;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.MeasureMetadata;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.Thresholds;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import com.measure.compiler.tree.LogicTrees;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowers a measure into a CQL library targeting FHIR R4 / QI-Core.
 */
public class CqlGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CqlGenerator.class);

    private static final String DEFAULT_VERSION = "1.0.0";
    private static final int NARRATIVE_LIMIT = 200;
    private static final String UNSPECIFIED_URL = "urn:oid:UNSPECIFIED";
    private static final String AGE_AT_END = "AgeInYearsAt(date from end of \"Measurement Period\")";

    private final MeasureFamilies families;
    private final TimingNormalizer timingNormalizer;
    private final Clock clock;

    public CqlGenerator() {
        this(MeasureFamilies.standard(), new TimingNormalizer(), Clock.systemUTC());
    }

    public CqlGenerator(MeasureFamilies families, TimingNormalizer timingNormalizer, Clock clock) {
        this.families = families;
        this.timingNormalizer = timingNormalizer;
        this.clock = clock;
    }

    public GenerationResult generate(UniversalMeasureSpec measure) {
        return generate(measure, Map.of());
    }

    /**
     * Generate the full library.
     * @param measure Measure to lower
     * @param overrides Manual overrides keyed by element or population id
     * @return Library text with warnings, or a failure when required identifiers are missing
     */
    public GenerationResult generate(UniversalMeasureSpec measure, Map<String, CodeOverride> overrides) {
        List<String> errors = MeasureStructure.check(measure);
        if (!errors.isEmpty()) {
            logger.warn("CQL generation rejected: {}", errors);
            return GenerationResult.failure(errors);
        }

        MeasureMetadata metadata = measure.getMetadata();
        String libraryName = sanitizeLibraryName(metadata.getMeasureId());
        if (libraryName.isEmpty()) {
            logger.warn("CQL generation rejected: measure ID {} has no usable characters", metadata.getMeasureId());
            return GenerationResult.failure(List.of("Measure ID is required"));
        }
        Run run = new Run(measure, overrides != null ? overrides : Map.of());
        String version = StringUtils.defaultIfBlank(metadata.getVersion(), DEFAULT_VERSION);

        List<String> sections = new ArrayList<>();
        sections.add(header(metadata, libraryName, version));
        sections.add(valueSetDeclarations(measure.getValueSets(), run.warnings));
        sections.add(parameters(metadata.getMeasurementPeriod()));
        sections.add("context Patient\n");
        sections.add(helperDefinitions(run));
        sections.add(populationDefinitions(run));
        sections.add(supplementalData());

        run.warnings.addAll(MeasureStructure.highComplexityWarnings(measure));
        String cql = String.join("\n", sections);
        for (String problem : GeneratedCodeCheck.checkCqlLibrary(cql)) {
            run.warnings.add("Generated CQL check: " + problem);
        }
        logger.info("Generated CQL library {} version {} with {} warnings", libraryName, version,
                run.warnings.size());
        return GenerationResult.success(cql, run.warnings);
    }

    /**
     * Lower a single data element to a boolean CQL expression.
     */
    public GenerationResult generateComponent(DataElement element, CodeOverride override) {
        if (override != null && override.appliesTo(CodeOutputFormat.CQL)) {
            return GenerationResult.success(override.render(), List.of());
        }
        Run run = new Run(null, Map.of());
        String expression = lowerElement(element, run);
        return GenerationResult.success(expression, run.warnings);
    }

    /**
     * Lower a logical clause to a boolean CQL expression.
     */
    public GenerationResult generateComponent(LogicalClause clause, CodeOverride override) {
        if (override != null && override.appliesTo(CodeOutputFormat.CQL)) {
            return GenerationResult.success(override.render(), List.of());
        }
        Run run = new Run(null, Map.of());
        String expression = LogicTrees.toExpression(clause, element -> lowerElement(element, run));
        ComponentComplexity complexity = ComplexityScorer.score(clause);
        if (complexity.getLevel() == ComplexityLevel.HIGH) {
            run.warnings.add(String.format("Clause \"%s\" has HIGH complexity (score %d); review the generated logic",
                    clause.getId(), complexity.getScore()));
        }
        return GenerationResult.success(expression, run.warnings);
    }

    // ========== Library sections ==========

    private String header(MeasureMetadata metadata, String libraryName, String version) {
        StringBuilder sb = new StringBuilder();
        sb.append("/*\n");
        sb.append(" * Library: ").append(libraryName).append("\n");
        sb.append(" * Title: ").append(commentSafe(metadata.getTitle())).append("\n");
        sb.append(" * Measure ID: ").append(metadata.getMeasureId()).append("\n");
        sb.append(" * Version: ").append(version).append("\n");
        sb.append(" * Steward: ").append(StringUtils.defaultIfBlank(commentSafe(metadata.getSteward()),
                "Not specified")).append("\n");
        sb.append(" * Type: ").append(StringUtils.defaultIfBlank(metadata.getMeasureType(), "process")).append("\n");
        sb.append(" * Scoring: ").append(StringUtils.defaultIfBlank(metadata.getScoring(), "proportion")).append("\n");
        sb.append(" *\n");
        sb.append(" * Description: ").append(StringUtils.defaultIfBlank(commentSafe(metadata.getDescription()),
                "No description provided")).append("\n");
        sb.append(" *\n");
        sb.append(" * Generated: ").append(Instant.now(clock)).append("\n");
        sb.append(" */\n\n");
        sb.append("library ").append(libraryName).append(" version '").append(version).append("'\n\n");
        sb.append("using FHIR version '4.0.1'\n\n");
        sb.append("include FHIRHelpers version '4.0.1' called FHIRHelpers\n");
        sb.append("include QICoreCommon version '2.0.0' called QICoreCommon\n");
        sb.append("include MATGlobalCommonFunctions version '7.0.000' called Global\n");
        sb.append("include SupplementalDataElements version '3.4.000' called SDE\n");
        sb.append("include Hospice version '6.9.000' called Hospice\n\n");
        sb.append("// Code Systems\n");
        sb.append("codesystem \"LOINC\": 'http://loinc.org'\n");
        sb.append("codesystem \"SNOMEDCT\": 'http://snomed.info/sct'\n");
        sb.append("codesystem \"ICD10CM\": 'http://hl7.org/fhir/sid/icd-10-cm'\n");
        sb.append("codesystem \"CPT\": 'http://www.ama-assn.org/go/cpt'\n");
        sb.append("codesystem \"HCPCS\": 'https://www.cms.gov/Medicare/Coding/HCPCSReleaseCodeSets'\n");
        sb.append("codesystem \"RxNorm\": 'http://www.nlm.nih.gov/research/umls/rxnorm'\n");
        sb.append("codesystem \"CVX\": 'http://hl7.org/fhir/sid/cvx'\n");
        return sb.toString();
    }

    private String valueSetDeclarations(List<ValueSetReference> valueSets, List<String> warnings) {
        if (valueSets.isEmpty()) {
            return "// No value sets defined\n";
        }
        StringBuilder sb = new StringBuilder("// Value Sets\n");
        for (ValueSetReference valueSet : valueSets) {
            String name = sanitizeIdentifier(valueSet.getName());
            String url = valueSet.resolvedUrl();
            sb.append("valueset \"").append(name).append("\": '").append(url != null ? url : UNSPECIFIED_URL).append("'\n");
            if (url == null) {
                sb.append("  /* WARNING: Value set \"").append(name).append("\" has no OID or URL specified */\n");
                warnings.add(String.format("Value set \"%s\" has no OID or URL specified", valueSet.getName()));
            }
            if (valueSet.getCodes().isEmpty()) {
                sb.append("  /* WARNING: Value set \"").append(name)
                        .append("\" has no codes defined - may need expansion */\n");
                warnings.add(String.format("Value set \"%s\" has no codes defined", valueSet.getName()));
            }
        }
        return sb.toString();
    }

    private String parameters(MeasurementPeriod period) {
        MeasurementPeriod effective = period != null ? period : new MeasurementPeriod(null, null);
        return "// Parameters\n"
                + "parameter \"Measurement Period\" Interval<DateTime>\n"
                + "  default Interval[@" + effective.startOrDefault() + "T00:00:00.0, @"
                + effective.endOrDefault() + "T23:59:59.999]\n";
    }

    private String helperDefinitions(Run run) {
        List<String> blocks = new ArrayList<>();
        blocks.add("// Helper Definitions");
        GlobalConstraints constraints = run.measure.getGlobalConstraints();

        if (constraints.hasAgeRange()) {
            blocks.add("\ndefine \"Age at End of Measurement Period\":\n  " + AGE_AT_END + "\n\n"
                    + "define \"Patient Age Valid\":\n  \"Age at End of Measurement Period\" in Interval["
                    + ageBound(constraints.getAgeMin(), 0) + ", " + ageBound(constraints.getAgeMax(), 999) + "]");
        }
        if (constraints.getGender() != null && constraints.getGender() != Gender.ALL) {
            blocks.add("\ndefine \"Patient Gender Valid\":\n  Patient.gender = '"
                    + constraints.getGender().getValue() + "'");
        }
        if (hasEncounterCriteria(run.measure)) {
            blocks.add("\ndefine \"Qualifying Encounter During Measurement Period\":\n"
                    + "  ( [Encounter: \"Office Visit\"]\n"
                    + "    union [Encounter: \"Annual Wellness Visit\"]\n"
                    + "    union [Encounter: \"Preventive Care Services Established Office Visit, 18 and Up\"]\n"
                    + "    union [Encounter: \"Home Healthcare Services\"]\n"
                    + "    union [Encounter: \"Online Assessments\"]\n"
                    + "    union [Encounter: \"Telephone Visits\"]\n"
                    + "  ) Encounter\n"
                    + "    where Encounter.status = 'finished'\n"
                    + "      and Encounter.period during \"Measurement Period\"");
        }
        blocks.add("\ndefine \"Has Hospice Services\":\n  Hospice.\"Has Hospice Services\"");
        run.family.ifPresent(family -> blocks.add("\n" + family.getHelperDefinitions()));
        blocks.add("");
        return String.join("\n", blocks);
    }

    private String populationDefinitions(Run run) {
        UniversalMeasureSpec measure = run.measure;
        List<String> blocks = new ArrayList<>();
        blocks.add("// Population Definitions");

        Optional<PopulationDefinition> initial = measure.findPopulation(PopulationType.INITIAL_POPULATION);
        if (initial.isPresent()) {
            blocks.add(initialPopulation(initial.get(), run));
        } else {
            run.warnings.add("No initial population defined; \"Initial Population\" evaluates to true");
            blocks.add("\ndefine \"Initial Population\":\n  /* WARNING: No initial population defined */\n  true");
        }

        Optional<PopulationDefinition> denominator = measure.findPopulation(PopulationType.DENOMINATOR);
        if (denominator.isPresent() && denominator.get().hasCriteria()) {
            blocks.add(populationDefine(denominator.get(), run));
        } else {
            blocks.add("\n/*\n * Denominator\n * Equals Initial Population\n */\n"
                    + "define \"Denominator\":\n  \"Initial Population\"");
        }

        blocks.add(denominatorExclusion(measure.findPopulation(PopulationType.DENOMINATOR_EXCLUSION), run));
        measure.findPopulation(PopulationType.DENOMINATOR_EXCEPTION)
                .ifPresent(population -> blocks.add(populationDefine(population, run)));
        blocks.add(numerator(measure.findPopulation(PopulationType.NUMERATOR), run));
        measure.findPopulation(PopulationType.NUMERATOR_EXCLUSION)
                .ifPresent(population -> blocks.add(populationDefine(population, run)));
        blocks.add("");
        return String.join("\n", blocks);
    }

    private String initialPopulation(PopulationDefinition population, Run run) {
        String name = PopulationType.INITIAL_POPULATION.getDisplayName();
        Optional<String> overridden = overriddenDefine(population, name, run);
        if (overridden.isPresent()) {
            return overridden.get();
        }
        List<String> terms = new ArrayList<>();
        GlobalConstraints constraints = run.measure.getGlobalConstraints();
        if (constraints.hasAgeRange()) {
            terms.add("\"Patient Age Valid\"");
        }
        if (constraints.getGender() != null && constraints.getGender() != Gender.ALL) {
            terms.add("\"Patient Gender Valid\"");
        }
        if (population.hasCriteria() || terms.isEmpty()) {
            terms.add(criteriaExpression(population.getCriteria(), run));
        }
        return narrativeComment(name, population.getNarrative())
                + "define \"" + name + "\":\n  " + String.join("\n    and ", terms);
    }

    private String populationDefine(PopulationDefinition population, Run run) {
        String name = population.getPopulationType().getDisplayName();
        return overriddenDefine(population, name, run)
                .orElseGet(() -> narrativeComment(name, population.getNarrative())
                        + "define \"" + name + "\":\n  " + criteriaExpression(population.getCriteria(), run));
    }

    private String denominatorExclusion(Optional<PopulationDefinition> population, Run run) {
        String name = PopulationType.DENOMINATOR_EXCLUSION.getDisplayName();
        if (population.isPresent()) {
            Optional<String> overridden = overriddenDefine(population.get(), name, run);
            if (overridden.isPresent()) {
                return overridden.get();
            }
        }
        List<String> terms = new ArrayList<>();
        terms.add("\"Has Hospice Services\"");
        run.family.ifPresent(family -> terms.addAll(family.getExclusionExpressions()));
        if (population.isPresent() && population.get().hasCriteria()) {
            String custom = criteriaExpression(population.get().getCriteria(), run);
            if (!"true".equals(custom) && !"false".equals(custom)) {
                terms.add("(" + custom + ")");
            }
        }
        String narrative = population.map(PopulationDefinition::getNarrative).orElse(null);
        return "\n/*\n * " + name + "\n * "
                + StringUtils.defaultIfBlank(truncateNarrative(narrative), "Patients meeting exclusion criteria")
                + "\n */\ndefine \"" + name + "\":\n  " + String.join("\n    or ", terms);
    }

    private String numerator(Optional<PopulationDefinition> population, Run run) {
        String name = PopulationType.NUMERATOR.getDisplayName();
        if (population.isPresent()) {
            Optional<String> overridden = overriddenDefine(population.get(), name, run);
            if (overridden.isPresent()) {
                return overridden.get();
            }
        }
        String narrative = population.map(PopulationDefinition::getNarrative).orElse(null);
        String head = "\n/*\n * " + name + "\n * "
                + StringUtils.defaultIfBlank(truncateNarrative(narrative), "Patients meeting numerator criteria")
                + "\n */\ndefine \"" + name + "\":\n  ";
        if (run.family.isPresent()) {
            return head + run.family.get().getNumeratorExpression();
        }
        if (population.isPresent() && population.get().getCriteria() != null) {
            return head + criteriaExpression(population.get().getCriteria(), run);
        }
        run.warnings.add("No numerator criteria defined; \"Numerator\" evaluates to true");
        return head + "/* WARNING: No numerator criteria defined in measure specification */\n  true";
    }

    private Optional<String> overriddenDefine(PopulationDefinition population, String name, Run run) {
        CodeOverride override = run.overrides.get(population.getId());
        if (override == null || !override.appliesTo(CodeOutputFormat.CQL)) {
            return Optional.empty();
        }
        logger.debug("Using locked CQL override for population {}", population.getId());
        StringBuilder sb = new StringBuilder("\n");
        for (EditNote note : override.getNotes()) {
            sb.append(note.toComment(CodeOutputFormat.CQL)).append("\n");
        }
        sb.append("define \"").append(name).append("\":\n  ").append(override.getCode());
        return Optional.of(sb.toString());
    }

    private String supplementalData() {
        return "\n// Supplemental Data Elements\n"
                + "define \"SDE Ethnicity\":\n  SDE.\"SDE Ethnicity\"\n\n"
                + "define \"SDE Payer\":\n  SDE.\"SDE Payer\"\n\n"
                + "define \"SDE Race\":\n  SDE.\"SDE Race\"\n\n"
                + "define \"SDE Sex\":\n  SDE.\"SDE Sex\"\n";
    }

    // ========== Element lowering ==========

    private String criteriaExpression(LogicalClause criteria, Run run) {
        if (criteria == null) {
            return "true";
        }
        return LogicTrees.toExpression(criteria, element -> lowerElement(element, run));
    }

    private String lowerElement(DataElement element, Run run) {
        CodeOverride override = run.overrides.get(element.getId());
        if (override != null && override.appliesTo(CodeOutputFormat.CQL)) {
            return override.render();
        }

        if (element.getClinicalType() == ClinicalType.DEMOGRAPHIC) {
            return negate(element, demographicExpression(element, run));
        }
        if (!element.hasValueSet()) {
            String description = StringUtils.defaultIfBlank(element.getDescription(),
                    element.getClinicalType().getValue() + " criterion");
            run.warnings.add(String.format("No value set defined for \"%s\"", description));
            return "/* WARNING: No value set defined for \"" + commentSafe(description) + "\" */ true";
        }

        DataFamily family = DataFamily.of(element.getClinicalType());
        String alias = family.getCqlAlias();
        String valueSetName = StringUtils.defaultIfBlank(element.getValueSet().getName(), element.getValueSet().getId());

        StringBuilder sb = new StringBuilder();
        sb.append("exists ([").append(family.getFhirResource()).append(": \"")
                .append(sanitizeIdentifier(valueSetName)).append("\"] ").append(alias);
        sb.append("\n      where ").append(family.getCqlStatusFilter());
        if (family == DataFamily.RESULT) {
            sb.append("\n        and ").append(alias).append(".value is not null");
            appendValueBounds(sb, alias, element.getThresholds());
        }
        sb.append("\n        and ").append(alias).append('.').append(family.getCqlTimingPath()).append(' ')
                .append(timingPhrase(element, run));
        sb.append(')');
        return negate(element, sb.toString());
    }

    private String demographicExpression(DataElement element, Run run) {
        Thresholds thresholds = element.getThresholds();
        if (thresholds != null && thresholds.hasAgeBounds()) {
            return AGE_AT_END + " in Interval[" + ageBound(thresholds.getAgeMin(), 0) + ", "
                    + ageBound(thresholds.getAgeMax(), 999) + "]";
        }
        if (run.measure != null && run.measure.getGlobalConstraints().hasAgeRange()) {
            return "\"Patient Age Valid\"";
        }
        run.warnings.add(String.format("Demographic criterion \"%s\" has no age bounds",
                StringUtils.defaultIfBlank(element.getDescription(), element.getId())));
        return "/* WARNING: Demographic criterion without age bounds */ true";
    }

    private String timingPhrase(DataElement element, Run run) {
        NormalizedTiming timing = timingNormalizer.normalize(element);
        return switch (timing.getKind()) {
            case DURING_MEASUREMENT_PERIOD -> "during \"Measurement Period\"";
            case BEFORE_PERIOD_END -> "ends " + timing.getAmount() + " " + timing.getUnit().label(timing.getAmount())
                    + " or less before end of \"Measurement Period\"";
            case AFTER_PERIOD_START -> "starts " + timing.getAmount() + " "
                    + timing.getUnit().label(timing.getAmount()) + " or less after start of \"Measurement Period\"";
            case INDEX_EVENT -> {
                run.warnings.add(String.format(
                        "Index-event timing for \"%s\" is approximated by the measurement period in CQL",
                        StringUtils.defaultIfBlank(element.getDescription(), element.getId())));
                yield "during \"Measurement Period\"";
            }
        };
    }

    private static void appendValueBounds(StringBuilder sb, String alias, Thresholds thresholds) {
        if (thresholds == null || !thresholds.hasValueBounds()) {
            return;
        }
        if (thresholds.getValueMin() != null) {
            sb.append("\n        and ").append(alias).append(".value >= ").append(formatNumber(thresholds.getValueMin()));
        }
        if (thresholds.getValueMax() != null) {
            sb.append("\n        and ").append(alias).append(".value <= ").append(formatNumber(thresholds.getValueMax()));
        }
    }

    private static String negate(DataElement element, String expression) {
        return element.isNegation() ? "not (" + expression + ")" : expression;
    }

    // ========== Helpers ==========

    private static boolean hasEncounterCriteria(UniversalMeasureSpec measure) {
        return measure.getPopulations().stream()
                .filter(PopulationDefinition::hasCriteria)
                .flatMap(population -> LogicTrees.criteria(population.getCriteria()).stream())
                .anyMatch(element -> element.getClinicalType() == ClinicalType.ENCOUNTER);
    }

    private static String narrativeComment(String name, String narrative) {
        String text = truncateNarrative(narrative);
        if (StringUtils.isBlank(text)) {
            return "\n";
        }
        return "\n/*\n * " + name + "\n * " + text + "\n */\n";
    }

    private static String truncateNarrative(String narrative) {
        if (StringUtils.isBlank(narrative)) {
            return null;
        }
        String flat = commentSafe(narrative).replaceAll("\\s+", " ").trim();
        return flat.length() > NARRATIVE_LIMIT ? flat.substring(0, NARRATIVE_LIMIT) + "..." : flat;
    }

    private static String commentSafe(String text) {
        return text == null ? null : text.replace("*/", "* /");
    }

    private static int ageBound(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    /**
     * Library names keep only letters and digits and may not start with a digit.
     */
    static String sanitizeLibraryName(String measureId) {
        String stripped = measureId.replaceAll("[^a-zA-Z0-9]", "");
        return !stripped.isEmpty() && Character.isDigit(stripped.charAt(0)) ? "_" + stripped : stripped;
    }

    static String sanitizeIdentifier(String name) {
        return name == null ? "" : name.replace("\"", "\\\"").trim();
    }

    /**
     * Mutable state of one generation run.
     */
    private final class Run {
        private final UniversalMeasureSpec measure;
        private final Map<String, CodeOverride> overrides;
        private final Optional<MeasureFamily> family;
        private final List<String> warnings = new ArrayList<>();

        private Run(UniversalMeasureSpec measure, Map<String, CodeOverride> overrides) {
            this.measure = measure;
            this.overrides = overrides;
            this.family = measure != null ? families.detect(measure.getMetadata()) : Optional.empty();
        }
    }
}
