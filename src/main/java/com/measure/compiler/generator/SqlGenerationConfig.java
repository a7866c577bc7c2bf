package com.measure.compiler.generator;

import com.measure.compiler.model.MeasurementPeriod;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Options for {@link SqlGenerator}.
 */
public final class SqlGenerationConfig {
    public static final String DEFAULT_POPULATION_ID = "${POPULATION_ID}";

    private final String populationId;
    private final SqlDialect dialect;
    private final boolean includeComments;
    private final MeasurementPeriod measurementPeriod;
    private final MeasurementPeriod intakePeriod;
    private final List<CumulativeDaysSupplyRule> rules;

    private SqlGenerationConfig(Builder builder) {
        this.populationId = builder.populationId;
        this.dialect = builder.dialect;
        this.includeComments = builder.includeComments;
        this.measurementPeriod = builder.measurementPeriod;
        this.intakePeriod = builder.intakePeriod;
        this.rules = List.copyOf(builder.rules);
    }

    public static SqlGenerationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPopulationId() {
        return populationId;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public boolean isIncludeComments() {
        return includeComments;
    }

    /**
     * Overrides the measure's own measurement period when set.
     */
    public MeasurementPeriod getMeasurementPeriod() {
        return measurementPeriod;
    }

    /**
     * Window in which the index prescription is sought; the measurement period when unset.
     */
    public MeasurementPeriod getIntakePeriod() {
        return intakePeriod;
    }

    public List<CumulativeDaysSupplyRule> getRules() {
        return rules;
    }

    public Optional<CumulativeDaysSupplyRule> ruleFor(String elementId) {
        return rules.stream().filter(rule -> rule.getElementId().equals(elementId)).findFirst();
    }

    public static final class Builder {
        private String populationId = DEFAULT_POPULATION_ID;
        private SqlDialect dialect = SqlDialect.SNOWFLAKE;
        private boolean includeComments = true;
        private MeasurementPeriod measurementPeriod;
        private MeasurementPeriod intakePeriod;
        private final List<CumulativeDaysSupplyRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder populationId(String populationId) {
            this.populationId = populationId;
            return this;
        }

        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder includeComments(boolean includeComments) {
            this.includeComments = includeComments;
            return this;
        }

        public Builder measurementPeriod(MeasurementPeriod measurementPeriod) {
            this.measurementPeriod = measurementPeriod;
            return this;
        }

        public Builder intakePeriod(MeasurementPeriod intakePeriod) {
            this.intakePeriod = intakePeriod;
            return this;
        }

        public Builder rule(CumulativeDaysSupplyRule rule) {
            this.rules.add(rule);
            return this;
        }

        public SqlGenerationConfig build() {
            return new SqlGenerationConfig(this);
        }
    }
}
