package com.measure.compiler.model;

/**
 * Discriminant of {@link CriteriaNode}.
 */
public enum NodeKind {
    ELEMENT,
    CLAUSE
}
