package com.measure.compiler.model;

import java.util.Objects;

/**
 * Numeric bounds on a data element. Every bound is optional.
 */
public final class Thresholds {
    private final Integer ageMin;
    private final Integer ageMax;
    private final Double valueMin;
    private final Double valueMax;
    private final String unit;

    public Thresholds(Integer ageMin, Integer ageMax, Double valueMin, Double valueMax, String unit) {
        this.ageMin = ageMin;
        this.ageMax = ageMax;
        this.valueMin = valueMin;
        this.valueMax = valueMax;
        this.unit = unit;
    }

    public static Thresholds age(Integer min, Integer max) {
        return new Thresholds(min, max, null, null, null);
    }

    public Integer getAgeMin() {
        return ageMin;
    }

    public Integer getAgeMax() {
        return ageMax;
    }

    public Double getValueMin() {
        return valueMin;
    }

    public Double getValueMax() {
        return valueMax;
    }

    public String getUnit() {
        return unit;
    }

    public boolean hasAgeBounds() {
        return ageMin != null || ageMax != null;
    }

    public boolean hasValueBounds() {
        return valueMin != null || valueMax != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Thresholds that)) return false;
        return Objects.equals(ageMin, that.ageMin) && Objects.equals(ageMax, that.ageMax)
                && Objects.equals(valueMin, that.valueMin) && Objects.equals(valueMax, that.valueMax)
                && Objects.equals(unit, that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ageMin, ageMax, valueMin, valueMax, unit);
    }
}
