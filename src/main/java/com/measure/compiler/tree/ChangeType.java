package com.measure.compiler.tree;

public enum ChangeType {
    ADDED,
    REMOVED,
    MODIFIED,
    UNCHANGED
}
