package com.measure.compiler.extraction;

public enum ExtractionPhase {
    SKELETON,
    POPULATIONS,
    VALIDATION,
    COMPLETE
}
