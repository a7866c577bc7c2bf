package com.measure.compiler.generator;

/**
 * Abstract column meaning, bound to a concrete column name per table.
 */
public enum ColumnRole {
    POPULATION_ID,
    PATIENT_ID,
    RECORD_ID,
    CODE,
    DATE,
    END_DATE,
    DAYS_SUPPLY,
    VALUE,
    STATUS,
    BIRTH_DATE,
    GENDER
}
