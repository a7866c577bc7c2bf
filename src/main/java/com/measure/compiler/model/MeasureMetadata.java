package com.measure.compiler.model;

import java.util.Objects;

/**
 * Identifying and descriptive information of a measure.
 */
public final class MeasureMetadata {
    private final String measureId;
    private final String title;
    private final String version;
    private final String steward;
    private final String description;
    private final String program;
    private final String measureType;
    private final String scoring;
    private final MeasurementPeriod measurementPeriod;

    private MeasureMetadata(Builder builder) {
        this.measureId = builder.measureId;
        this.title = builder.title;
        this.version = builder.version;
        this.steward = builder.steward;
        this.description = builder.description;
        this.program = builder.program;
        this.measureType = builder.measureType;
        this.scoring = builder.scoring;
        this.measurementPeriod = builder.measurementPeriod;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .measureId(measureId)
                .title(title)
                .version(version)
                .steward(steward)
                .description(description)
                .program(program)
                .measureType(measureType)
                .scoring(scoring)
                .measurementPeriod(measurementPeriod);
    }

    public String getMeasureId() {
        return measureId;
    }

    public String getTitle() {
        return title;
    }

    public String getVersion() {
        return version;
    }

    public String getSteward() {
        return steward;
    }

    public String getDescription() {
        return description;
    }

    public String getProgram() {
        return program;
    }

    public String getMeasureType() {
        return measureType;
    }

    public String getScoring() {
        return scoring;
    }

    public MeasurementPeriod getMeasurementPeriod() {
        return measurementPeriod;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasureMetadata that)) return false;
        return Objects.equals(measureId, that.measureId) && Objects.equals(title, that.title)
                && Objects.equals(version, that.version) && Objects.equals(steward, that.steward)
                && Objects.equals(description, that.description) && Objects.equals(program, that.program)
                && Objects.equals(measureType, that.measureType) && Objects.equals(scoring, that.scoring)
                && Objects.equals(measurementPeriod, that.measurementPeriod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measureId, title, version, steward, description, program, measureType, scoring,
                measurementPeriod);
    }

    public static final class Builder {
        private String measureId;
        private String title;
        private String version;
        private String steward;
        private String description;
        private String program;
        private String measureType;
        private String scoring;
        private MeasurementPeriod measurementPeriod;

        private Builder() {
        }

        public Builder measureId(String measureId) {
            this.measureId = measureId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder steward(String steward) {
            this.steward = steward;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder program(String program) {
            this.program = program;
            return this;
        }

        public Builder measureType(String measureType) {
            this.measureType = measureType;
            return this;
        }

        public Builder scoring(String scoring) {
            this.scoring = scoring;
            return this;
        }

        public Builder measurementPeriod(MeasurementPeriod measurementPeriod) {
            this.measurementPeriod = measurementPeriod;
            return this;
        }

        public MeasureMetadata build() {
            return new MeasureMetadata(this);
        }
    }
}
