package com.measure.compiler.model;

import java.util.Objects;

/**
 * Measure-wide constraints applied to every population: an age range and a gender.
 */
public final class GlobalConstraints {
    private final Integer ageMin;
    private final Integer ageMax;
    private final Gender gender;

    public GlobalConstraints(Integer ageMin, Integer ageMax, Gender gender) {
        this.ageMin = ageMin;
        this.ageMax = ageMax;
        this.gender = gender != null ? gender : Gender.ALL;
    }

    public static GlobalConstraints none() {
        return new GlobalConstraints(null, null, Gender.ALL);
    }

    public Integer getAgeMin() {
        return ageMin;
    }

    public Integer getAgeMax() {
        return ageMax;
    }

    public Gender getGender() {
        return gender;
    }

    public boolean hasAgeRange() {
        return ageMin != null || ageMax != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlobalConstraints that)) return false;
        return Objects.equals(ageMin, that.ageMin) && Objects.equals(ageMax, that.ageMax) && gender == that.gender;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ageMin, ageMax, gender);
    }
}
