package com.measure.compiler.generator;

import com.measure.compiler.model.ClinicalType;
import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.Gender;
import com.measure.compiler.model.GlobalConstraints;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.MeasurementPeriod;
import com.measure.compiler.model.PopulationDefinition;
import com.measure.compiler.model.PopulationType;
import com.measure.compiler.model.Thresholds;
import com.measure.compiler.model.TimingUnit;
import com.measure.compiler.model.UniversalMeasureSpec;
import com.measure.compiler.model.ValueSetReference;
import com.measure.compiler.tree.LogicTrees;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowers a measure into CTE-style warehouse SQL: a DEMOG anchor, one predicate CTE per
 * criterion, set-operation population CTEs and a MEASURE_RESULT count table.
 */
public class SqlGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SqlGenerator.class);

    private static final String INDEX_CTE = "IPSD";
    private static final String INDEX_DATE = "index_prescription_start_date";
    private static final String UNSPECIFIED_OID = "UNSPECIFIED";

    private final SqlGenerationConfig config;
    private final SchemaBinding schema;
    private final TimingNormalizer timingNormalizer;
    private final Clock clock;

    public SqlGenerator() {
        this(SqlGenerationConfig.defaults());
    }

    public SqlGenerator(SqlGenerationConfig config) {
        this(config, SchemaBinding.loadDefault(), new TimingNormalizer(), Clock.systemUTC());
    }

    public SqlGenerator(SqlGenerationConfig config, SchemaBinding schema, TimingNormalizer timingNormalizer,
                        Clock clock) {
        this.config = config;
        this.schema = schema;
        this.timingNormalizer = timingNormalizer;
        this.clock = clock;
    }

    public GenerationResult generate(UniversalMeasureSpec measure) {
        return generate(measure, Map.of());
    }

    /**
     * Generate the full population query.
     * @param measure Measure to lower
     * @param overrides Manual overrides keyed by element or population id
     * @return SQL text with warnings, or a failure when required identifiers are missing
     */
    public GenerationResult generate(UniversalMeasureSpec measure, Map<String, CodeOverride> overrides) {
        List<String> errors = MeasureStructure.check(measure);
        if (!errors.isEmpty()) {
            logger.warn("SQL generation rejected: {}", errors);
            return GenerationResult.failure(errors);
        }

        Run run = new Run(measure, overrides != null ? overrides : Map.of());
        Map<String, String> populationCtes = new LinkedHashMap<>();
        Map<String, String> counted = new LinkedHashMap<>();

        populationCtes.put("INITIAL_POPULATION", initialPopulation(run));
        counted.put(PopulationType.INITIAL_POPULATION.getDisplayName(), "INITIAL_POPULATION");

        Optional<PopulationDefinition> denominator = measure.findPopulation(PopulationType.DENOMINATOR);
        if (denominator.isPresent() && (denominator.get().hasCriteria() || hasOverride(denominator.get(), run))) {
            populationCtes.put("DENOMINATOR", populationCte("DENOMINATOR", denominator.get(), run));
        } else {
            populationCtes.put("DENOMINATOR", comment("Denominator: Equals Initial Population")
                    + "DENOMINATOR as (\n  select empi_id from INITIAL_POPULATION\n)");
        }
        counted.put(PopulationType.DENOMINATOR.getDisplayName(), "DENOMINATOR");

        addOptional(PopulationType.DENOMINATOR_EXCLUSION, "DENOM_EXCLUSION", run, populationCtes, counted);
        addOptional(PopulationType.DENOMINATOR_EXCEPTION, "DENOM_EXCEPTION", run, populationCtes, counted);

        Optional<PopulationDefinition> numerator = measure.findPopulation(PopulationType.NUMERATOR);
        if (numerator.isPresent() && (numerator.get().hasCriteria() || hasOverride(numerator.get(), run))) {
            populationCtes.put("NUMERATOR", populationCte("NUMERATOR", numerator.get(), run));
        } else {
            run.warnings.add("No numerator criteria defined; NUMERATOR includes all patients");
            populationCtes.put("NUMERATOR", comment("Numerator")
                    + "NUMERATOR as (\n  -- WARNING: No numerator criteria defined\n  select empi_id from DEMOG\n)");
        }
        counted.put(PopulationType.NUMERATOR.getDisplayName(), "NUMERATOR");

        addOptional(PopulationType.NUMERATOR_EXCLUSION, "NUM_EXCLUSION", run, populationCtes, counted);

        List<String> ctes = new ArrayList<>();
        ctes.add(demographicsCte(run));
        ctes.addAll(supportingCtes(run));
        ctes.addAll(run.predicateCtes);
        ctes.addAll(populationCtes.values());
        ctes.add(measureResultCte(counted));

        run.warnings.addAll(MeasureStructure.highComplexityWarnings(measure));
        String sql = header(measure.getMetadata().getMeasureId(), run) + "with " + String.join(",\n--\n", ctes)
                + "\nselect * from MEASURE_RESULT";
        for (String problem : GeneratedCodeCheck.checkSqlQuery(sql)) {
            run.warnings.add("Generated SQL check: " + problem);
        }
        logger.info("Generated {} SQL for {} with {} predicates and {} warnings", config.getDialect().getValue(),
                measure.getMetadata().getMeasureId(), run.predicateCtes.size(), run.warnings.size());
        return GenerationResult.success(sql, run.warnings);
    }

    /**
     * Query returning the patients that satisfy a single element.
     */
    public GenerationResult generateComponent(DataElement element, CodeOverride override) {
        if (override != null && override.appliesTo(CodeOutputFormat.SQL)) {
            return GenerationResult.success(override.render(), List.of());
        }
        Run run = new Run(null, Map.of());
        SqlSet set = nodeSet(CriteriaNode.of(element), run);
        return GenerationResult.success(componentQuery(run, set.sql), run.warnings);
    }

    /**
     * Query returning the patients that satisfy a clause.
     */
    public GenerationResult generateComponent(LogicalClause clause, CodeOverride override) {
        if (override != null && override.appliesTo(CodeOutputFormat.SQL)) {
            return GenerationResult.success(override.render(), List.of());
        }
        Run run = new Run(null, Map.of());
        SqlSet set = setExpression(clause, run);
        return GenerationResult.success(componentQuery(run, set.sql), run.warnings);
    }

    private String componentQuery(Run run, String select) {
        List<String> ctes = new ArrayList<>();
        ctes.add(demographicsCte(run));
        ctes.addAll(supportingCtes(run));
        ctes.addAll(run.predicateCtes);
        return "with " + String.join(",\n--\n", ctes) + "\n" + select;
    }

    // ========== Populations ==========

    private String initialPopulation(Run run) {
        Optional<PopulationDefinition> initial = run.measure.findPopulation(PopulationType.INITIAL_POPULATION);
        if (initial.isPresent() && hasOverride(initial.get(), run)) {
            return populationCte("INITIAL_POPULATION", initial.get(), run);
        }

        List<SqlSet> parts = new ArrayList<>();
        globalDemographicPredicate(run).ifPresent(alias -> parts.add(SqlSet.simple("select empi_id from " + alias)));
        if (initial.isPresent() && initial.get().hasCriteria()) {
            parts.add(setExpression(initial.get().getCriteria(), run));
        } else if (initial.isEmpty()) {
            run.warnings.add("No initial population defined; INITIAL_POPULATION includes all patients");
        }

        String body;
        if (parts.isEmpty()) {
            body = "select distinct empi_id from DEMOG";
        } else if (parts.size() == 1) {
            body = parts.get(0).sql;
        } else {
            List<String> operands = new ArrayList<>();
            for (SqlSet part : parts) {
                operands.add(operand(part, run));
            }
            body = String.join("\nintersect\n", operands);
        }
        return comment("Initial Population: Patients meeting all baseline criteria")
                + "INITIAL_POPULATION as (\n" + indent(body) + "\n)";
    }

    private void addOptional(PopulationType type, String alias, Run run, Map<String, String> populationCtes,
                             Map<String, String> counted) {
        Optional<PopulationDefinition> population = run.measure.findPopulation(type);
        if (population.isEmpty() || !(population.get().hasCriteria() || hasOverride(population.get(), run))) {
            return;
        }
        populationCtes.put(alias, populationCte(alias, population.get(), run));
        counted.put(type.getDisplayName(), alias);
    }

    private String populationCte(String alias, PopulationDefinition population, Run run) {
        String name = population.getPopulationType().getDisplayName();
        CodeOverride override = run.overrides.get(population.getId());
        if (override != null && override.appliesTo(CodeOutputFormat.SQL)) {
            logger.debug("Using locked SQL override for population {}", population.getId());
            return noteComments(override) + alias + " as (\n" + indent(override.getCode()) + "\n)";
        }
        return comment(name) + alias + " as (\n" + indent(setExpression(population.getCriteria(), run).sql) + "\n)";
    }

    private boolean hasOverride(PopulationDefinition population, Run run) {
        CodeOverride override = run.overrides.get(population.getId());
        return override != null && override.appliesTo(CodeOutputFormat.SQL);
    }

    private String measureResultCte(Map<String, String> counted) {
        List<String> selects = new ArrayList<>();
        counted.forEach((label, alias) -> selects.add("  select\n    " + quote(label) + " as population_type\n"
                + "    , count(distinct empi_id) as patient_count\n  from " + alias));
        return comment("Final Measure Calculation")
                + "MEASURE_RESULT as (\n" + String.join("\n  union all\n", selects) + "\n)";
    }

    // ========== Set expressions ==========

    private SqlSet setExpression(LogicalClause clause, Run run) {
        List<CriteriaNode> children = clause.getChildren();
        if (children.isEmpty()) {
            return SqlSet.simple("select empi_id from DEMOG");
        }
        if (clause.getOperator() == LogicalOperator.NOT) {
            return SqlSet.compound("select empi_id from DEMOG\nexcept\n" + operand(nodeSet(children.get(0), run), run));
        }

        List<SqlSet> parts = new ArrayList<>();
        for (CriteriaNode child : children) {
            parts.add(nodeSet(child, run));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        if (!clause.hasSiblingConnections()) {
            List<String> operands = new ArrayList<>();
            for (SqlSet part : parts) {
                operands.add(operand(part, run));
            }
            return SqlSet.compound(String.join("\n" + setKeyword(clause.getOperator()) + "\n", operands));
        }
        // mixed operators fold left so each step is evaluated before the next
        SqlSet accumulated = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            String keyword = setKeyword(clause.operatorBetween(i - 1, i));
            accumulated = SqlSet.compound(operand(accumulated, run) + "\n" + keyword + "\n" + operand(parts.get(i), run));
        }
        return accumulated;
    }

    private SqlSet nodeSet(CriteriaNode node, Run run) {
        if (node.isClause()) {
            return setExpression(node.asClause(), run);
        }
        DataElement element = node.asElement();
        String alias = lowerElement(element, run);
        if (element.isNegation()) {
            return SqlSet.compound("select empi_id from DEMOG\nexcept\nselect empi_id from " + alias);
        }
        return SqlSet.simple("select empi_id from " + alias);
    }

    private String operand(SqlSet set, Run run) {
        if (!set.compound) {
            return set.sql;
        }
        return "select empi_id from (\n" + indent(set.sql) + "\n) S" + (++run.subqueryCounter);
    }

    private static String setKeyword(LogicalOperator operator) {
        return operator == LogicalOperator.OR ? "union" : "intersect";
    }

    // ========== Predicates ==========

    private String lowerElement(DataElement element, Run run) {
        String existing = run.aliasByElement.get(element.getId());
        if (existing != null) {
            return existing;
        }
        DataFamily family = DataFamily.of(element.getClinicalType());
        String alias = "PRED_" + family.getPredicatePrefix() + "_" + (++run.predicateCounter);
        run.aliasByElement.put(element.getId(), alias);

        String description = StringUtils.defaultIfBlank(element.getDescription(),
                element.hasValueSet() ? element.getValueSet().getName() : null);
        CodeOverride override = run.overrides.get(element.getId());
        String cte;
        if (override != null && override.appliesTo(CodeOutputFormat.SQL)) {
            cte = noteComments(override) + alias + " as (\n" + indent(override.getCode()) + "\n)";
        } else {
            cte = (description != null ? comment(description) : "")
                    + alias + " as (\n" + indent(predicateBody(element, family, run)) + "\n)";
        }
        run.predicateCtes.add(cte);
        return alias;
    }

    private String predicateBody(DataElement element, DataFamily family, Run run) {
        if (family == DataFamily.DEMOGRAPHICS) {
            return demographicBody(element, run);
        }
        if (!element.hasValueSet()) {
            String description = StringUtils.defaultIfBlank(element.getDescription(),
                    element.getClinicalType().getValue() + " criterion");
            run.warnings.add(String.format("No value set defined for \"%s\"", description));
            return "-- WARNING: No value set defined for \"" + description.replace('\n', ' ') + "\"\n"
                    + "select distinct\n  D.population_id\n  , D.empi_id\nfrom DEMOG D";
        }
        if (family == DataFamily.MEDICATION) {
            Optional<CumulativeDaysSupplyRule> rule = config.ruleFor(element.getId())
                    .or(() -> CumulativeDaysSupplyRule.detect(element));
            if (rule.isPresent()) {
                return cumulativeDaysSupplyBody(element, rule.get(), run);
            }
        }

        TableBinding table = schema.table(family);
        String oid = resolveOid(element.getValueSet(), run);
        NormalizedTiming timing = timingNormalizer.normalize(element);
        boolean indexJoin = timing.getKind() == TimingKind.INDEX_EVENT;
        if (indexJoin) {
            run.needsIndex = true;
            run.indexCandidates.add(element);
        }

        List<String> conditions = new ArrayList<>();
        conditions.add(table.qualified(ColumnRole.POPULATION_ID) + " = " + quote(config.getPopulationId()));
        conditions.add(valueSetExists(oid, table.qualified(ColumnRole.CODE)));
        conditions.addAll(timingConditions(table.qualified(ColumnRole.DATE), timing, run));
        if (family == DataFamily.RESULT) {
            conditions.addAll(valueConditions(table, element.getThresholds()));
        }

        StringBuilder sb = new StringBuilder();
        sb.append("select distinct\n");
        sb.append("  ").append(table.qualified(ColumnRole.POPULATION_ID)).append(" as population_id\n");
        sb.append("  , ").append(table.qualified(ColumnRole.PATIENT_ID)).append(" as empi_id\n");
        sb.append("from ").append(table.getTable()).append(' ').append(table.getAlias());
        if (indexJoin) {
            sb.append("\ninner join ").append(INDEX_CTE).append(" I\n");
            sb.append("  on ").append(table.qualified(ColumnRole.PATIENT_ID)).append(" = I.empi_id\n");
            sb.append("  and ").append(table.qualified(ColumnRole.POPULATION_ID)).append(" = I.population_id");
        }
        sb.append("\nwhere\n  ").append(String.join("\n  and ", conditions));
        return sb.toString();
    }

    private List<String> timingConditions(String dateColumn, NormalizedTiming timing, Run run) {
        SqlDialect dialect = config.getDialect();
        String start = dialect.dateLiteral(run.periodStart);
        String end = dialect.dateLiteral(run.periodEnd);
        List<String> conditions = new ArrayList<>();
        switch (timing.getKind()) {
            case DURING_MEASUREMENT_PERIOD -> {
                conditions.add(dateColumn + " >= " + start);
                conditions.add(dateColumn + " <= " + end);
            }
            case BEFORE_PERIOD_END -> {
                conditions.add(dateColumn + " >= " + dialect.dateAdd(timing.getUnit(), -timing.getAmount(), end));
                conditions.add(dateColumn + " <= " + end);
            }
            case AFTER_PERIOD_START -> {
                conditions.add(dateColumn + " >= " + start);
                conditions.add(dateColumn + " <= " + dialect.dateAdd(timing.getUnit(), timing.getAmount(), start));
            }
            case INDEX_EVENT -> {
                String indexDate = "I." + INDEX_DATE;
                if (timing.getDaysBeforeIndex() != null) {
                    conditions.add(dateColumn + " >= "
                            + dialect.dateAdd(TimingUnit.DAYS, -timing.getDaysBeforeIndex(), indexDate));
                }
                if (timing.getDaysAfterIndex() != null) {
                    conditions.add(dateColumn + " <= "
                            + dialect.dateAdd(TimingUnit.DAYS, timing.getDaysAfterIndex(), indexDate));
                }
            }
        }
        return conditions;
    }

    private static List<String> valueConditions(TableBinding table, Thresholds thresholds) {
        List<String> conditions = new ArrayList<>();
        if (thresholds == null || !thresholds.hasValueBounds() || !table.hasColumn(ColumnRole.VALUE)) {
            return conditions;
        }
        if (thresholds.getValueMin() != null) {
            conditions.add(table.qualified(ColumnRole.VALUE) + " >= " + formatNumber(thresholds.getValueMin()));
        }
        if (thresholds.getValueMax() != null) {
            conditions.add(table.qualified(ColumnRole.VALUE) + " <= " + formatNumber(thresholds.getValueMax()));
        }
        return conditions;
    }

    private String demographicBody(DataElement element, Run run) {
        Thresholds thresholds = element.getThresholds();
        Integer ageMin = null;
        Integer ageMax = null;
        if (thresholds != null && thresholds.hasAgeBounds()) {
            ageMin = thresholds.getAgeMin();
            ageMax = thresholds.getAgeMax();
        } else if (run.measure != null && run.measure.getGlobalConstraints().hasAgeRange()) {
            ageMin = run.measure.getGlobalConstraints().getAgeMin();
            ageMax = run.measure.getGlobalConstraints().getAgeMax();
        } else {
            run.warnings.add(String.format("Demographic criterion \"%s\" has no age bounds",
                    StringUtils.defaultIfBlank(element.getDescription(), element.getId())));
        }
        return demographicSelect(ageConditions(ageMin, ageMax));
    }

    private Optional<String> globalDemographicPredicate(Run run) {
        GlobalConstraints constraints = run.measure.getGlobalConstraints();
        List<String> conditions = ageConditions(constraints.getAgeMin(), constraints.getAgeMax());
        if (constraints.getGender() == Gender.MALE) {
            conditions.add("lower(D.gender_code) in ('male', 'm')");
        } else if (constraints.getGender() == Gender.FEMALE) {
            conditions.add("lower(D.gender_code) in ('female', 'f')");
        }
        if (conditions.isEmpty()) {
            return Optional.empty();
        }
        String alias = "PRED_" + DataFamily.DEMOGRAPHICS.getPredicatePrefix() + "_" + (++run.predicateCounter);
        run.predicateCtes.add(comment("Global demographic constraints")
                + alias + " as (\n" + indent(demographicSelect(conditions)) + "\n)");
        return Optional.of(alias);
    }

    private static List<String> ageConditions(Integer ageMin, Integer ageMax) {
        List<String> conditions = new ArrayList<>();
        if (ageMin != null) {
            conditions.add("D.age_in_years >= " + ageMin);
        }
        if (ageMax != null) {
            conditions.add("D.age_in_years <= " + ageMax);
        }
        return conditions;
    }

    private static String demographicSelect(List<String> conditions) {
        String select = "select distinct\n  D.population_id\n  , D.empi_id\nfrom DEMOG D";
        return conditions.isEmpty() ? select : select + "\nwhere\n  " + String.join("\n  and ", conditions);
    }

    // ========== Medication adherence ==========

    private String cumulativeDaysSupplyBody(DataElement element, CumulativeDaysSupplyRule rule, Run run) {
        run.needsIndex = true;
        run.indexCandidates.add(0, element);
        String oid = resolveOid(element.getValueSet(), run);
        String coverage = run.coverageByOid.computeIfAbsent(oid,
                key -> "MED_COVERAGE_" + (run.coverageByOid.size() + 1));
        return "select\n  MC.population_id\n  , MC.empi_id\n"
                + "from " + coverage + " MC\n"
                + "where\n  MC.days_from_ipsd <= " + rule.getWindowDays() + "\n"
                + "group by MC.population_id, MC.empi_id\n"
                + "having sum(MC.days_supply) >= " + rule.getRequiredDaysSupply();
    }

    private List<String> supportingCtes(Run run) {
        List<String> ctes = new ArrayList<>();
        if (!run.needsIndex) {
            return ctes;
        }
        ctes.add(indexCte(run));
        run.coverageByOid.forEach((oid, alias) -> ctes.add(coverageCte(alias, oid)));
        return ctes;
    }

    private String indexCte(Run run) {
        TableBinding med = schema.table(DataFamily.MEDICATION);
        String oid = indexValueSetOid(run);
        MeasurementPeriod intake = config.getIntakePeriod();
        LocalDate intakeStart = intake != null ? intake.startOrDefault() : run.periodStart;
        LocalDate intakeEnd = intake != null ? intake.endOrDefault() : run.periodEnd;
        SqlDialect dialect = config.getDialect();
        String date = med.qualified(ColumnRole.DATE);
        return comment("Index Prescription Start Date: first qualifying dispensing in the intake period")
                + INDEX_CTE + " as (\n"
                + "  select\n"
                + "    " + med.qualified(ColumnRole.POPULATION_ID) + " as population_id\n"
                + "    , " + med.qualified(ColumnRole.PATIENT_ID) + " as empi_id\n"
                + "    , min(" + date + ") as " + INDEX_DATE + "\n"
                + "  from " + med.getTable() + " " + med.getAlias() + "\n"
                + "  where\n"
                + "    " + med.qualified(ColumnRole.POPULATION_ID) + " = " + quote(config.getPopulationId()) + "\n"
                + "    and " + valueSetExists(oid, med.qualified(ColumnRole.CODE)).replace("\n", "\n    ") + "\n"
                + "    and " + date + " >= " + dialect.dateLiteral(intakeStart) + "\n"
                + "    and " + date + " <= " + dialect.dateLiteral(intakeEnd) + "\n"
                + "  group by " + med.qualified(ColumnRole.POPULATION_ID) + ", "
                + med.qualified(ColumnRole.PATIENT_ID) + "\n"
                + ")";
    }

    private String coverageCte(String alias, String oid) {
        TableBinding med = schema.table(DataFamily.MEDICATION);
        SqlDialect dialect = config.getDialect();
        String date = med.qualified(ColumnRole.DATE);
        String indexDate = "I." + INDEX_DATE;
        return comment("Medication coverage: dispensings from the index date forward with days supply")
                + alias + " as (\n"
                + "  select\n"
                + "    " + med.qualified(ColumnRole.POPULATION_ID) + " as population_id\n"
                + "    , " + med.qualified(ColumnRole.PATIENT_ID) + " as empi_id\n"
                + "    , " + date + " as dispense_date\n"
                + "    , coalesce(" + med.qualified(ColumnRole.DAYS_SUPPLY) + ", "
                + dialect.daysBetween(date, med.qualified(ColumnRole.END_DATE)) + ") as days_supply\n"
                + "    , " + dialect.daysBetween(indexDate, date) + " as days_from_ipsd\n"
                + "  from " + med.getTable() + " " + med.getAlias() + "\n"
                + "  inner join " + INDEX_CTE + " I\n"
                + "    on " + med.qualified(ColumnRole.PATIENT_ID) + " = I.empi_id\n"
                + "    and " + med.qualified(ColumnRole.POPULATION_ID) + " = I.population_id\n"
                + "  where\n"
                + "    " + med.qualified(ColumnRole.POPULATION_ID) + " = " + quote(config.getPopulationId()) + "\n"
                + "    and " + valueSetExists(oid, med.qualified(ColumnRole.CODE)).replace("\n", "\n    ") + "\n"
                + "    and " + date + " >= " + indexDate + "\n"
                + ")";
    }

    /**
     * The index event is the first dispensing of the adherence medication, else of any medication criterion.
     */
    private String indexValueSetOid(Run run) {
        for (DataElement candidate : run.indexCandidates) {
            if (candidate.getClinicalType() == ClinicalType.MEDICATION && candidate.hasValueSet()) {
                return resolveOid(candidate.getValueSet(), run);
            }
        }
        if (run.measure != null) {
            for (PopulationDefinition population : run.measure.getPopulations()) {
                if (!population.hasCriteria()) {
                    continue;
                }
                for (DataElement element : LogicTrees.criteria(population.getCriteria())) {
                    if (element.getClinicalType() == ClinicalType.MEDICATION && element.hasValueSet()) {
                        return resolveOid(element.getValueSet(), run);
                    }
                }
            }
        }
        run.warnings.add("Index event timing requires a medication value set; IPSD matches no codes");
        return UNSPECIFIED_OID;
    }

    // ========== Shared fragments ==========

    private String demographicsCte(Run run) {
        TableBinding person = schema.table(DataFamily.DEMOGRAPHICS);
        String birthDate = person.qualified(ColumnRole.BIRTH_DATE);
        String asOf = config.getDialect().dateLiteral(run.periodEnd);
        return comment("All persons in the population with age at the end of the measurement period")
                + "DEMOG as (\n"
                + "  select\n"
                + "    " + person.qualified(ColumnRole.POPULATION_ID) + " as population_id\n"
                + "    , " + person.qualified(ColumnRole.PATIENT_ID) + " as empi_id\n"
                + "    , " + person.qualified(ColumnRole.GENDER) + " as gender_code\n"
                + "    , " + birthDate + " as birth_date\n"
                + "    , " + config.getDialect().ageInYears(birthDate, asOf) + " as age_in_years\n"
                + "  from " + person.getTable() + " " + person.getAlias() + "\n"
                + "  where\n"
                + "    " + person.qualified(ColumnRole.POPULATION_ID) + " = " + quote(config.getPopulationId()) + "\n"
                + ")";
    }

    private String valueSetExists(String oid, String codeColumn) {
        ValueSetTable vs = schema.getValueSetTable();
        return "exists (\n"
                + "  select 1 from " + vs.getTable() + " VS\n"
                + "  where VS." + vs.getOidColumn() + " = " + quote(oid) + "\n"
                + "    and VS." + vs.getCodeColumn() + " = " + codeColumn + "\n"
                + ")";
    }

    private String resolveOid(ValueSetReference reference, Run run) {
        if (StringUtils.isNotBlank(reference.getOid())) {
            return reference.getOid();
        }
        if (run.measure != null) {
            for (ValueSetReference declared : run.measure.getValueSets()) {
                boolean sameId = reference.getId() != null && reference.getId().equals(declared.getId());
                boolean sameName = reference.getName() != null && reference.getName().equalsIgnoreCase(declared.getName());
                if ((sameId || sameName) && StringUtils.isNotBlank(declared.getOid())) {
                    return declared.getOid();
                }
            }
        }
        String warning = String.format("Value set \"%s\" has no OID; its predicate matches no codes",
                StringUtils.defaultIfBlank(reference.getName(), reference.getId()));
        if (!run.warnings.contains(warning)) {
            run.warnings.add(warning);
        }
        return UNSPECIFIED_OID;
    }

    private String header(String measureId, Run run) {
        if (!config.isIncludeComments()) {
            return "";
        }
        String rule = "-- ============================================================================\n";
        return rule
                + "-- Generated SQL for measure " + measureId + "\n"
                + "-- Population ID: " + config.getPopulationId() + "\n"
                + "-- Dialect: " + config.getDialect().getValue() + "\n"
                + "-- Measurement Period: " + run.periodStart + " to " + run.periodEnd + "\n"
                + "-- Generated: " + Instant.now(clock) + "\n"
                + rule;
    }

    private String comment(String text) {
        return config.isIncludeComments() ? "-- " + text.replace('\n', ' ') + "\n" : "";
    }

    private static String noteComments(CodeOverride override) {
        StringBuilder sb = new StringBuilder();
        for (EditNote note : override.getNotes()) {
            sb.append(note.toComment(CodeOutputFormat.SQL)).append('\n');
        }
        return sb.toString();
    }

    private static String quote(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }

    private static String indent(String sql) {
        return "  " + sql.replace("\n", "\n  ");
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    /**
     * A select yielding {@code empi_id}; compound sets must be wrapped before combination.
     */
    private static final class SqlSet {
        private final String sql;
        private final boolean compound;

        private SqlSet(String sql, boolean compound) {
            this.sql = sql;
            this.compound = compound;
        }

        static SqlSet simple(String sql) {
            return new SqlSet(sql, false);
        }

        static SqlSet compound(String sql) {
            return new SqlSet(sql, true);
        }
    }

    /**
     * Mutable state of one generation run.
     */
    private final class Run {
        private final UniversalMeasureSpec measure;
        private final Map<String, CodeOverride> overrides;
        private final LocalDate periodStart;
        private final LocalDate periodEnd;
        private final List<String> warnings = new ArrayList<>();
        private final List<String> predicateCtes = new ArrayList<>();
        private final Map<String, String> aliasByElement = new HashMap<>();
        private final Map<String, String> coverageByOid = new LinkedHashMap<>();
        private final List<DataElement> indexCandidates = new ArrayList<>();
        private boolean needsIndex;
        private int predicateCounter;
        private int subqueryCounter;

        private Run(UniversalMeasureSpec measure, Map<String, CodeOverride> overrides) {
            this.measure = measure;
            this.overrides = overrides;
            MeasurementPeriod period = config.getMeasurementPeriod();
            if (period == null && measure != null) {
                period = measure.getMetadata().getMeasurementPeriod();
            }
            if (period == null) {
                period = new MeasurementPeriod(null, null);
            }
            this.periodStart = period.startOrDefault();
            this.periodEnd = period.endOrDefault();
        }
    }
}
