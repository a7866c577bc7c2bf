package com.measure.compiler.extraction;

public enum OidIssueCode {
    MALFORMED_FORMAT,
    NAME_MISMATCH,
    NOT_IN_CATALOG,
    SIMILAR_OID_EXISTS,
    TERMINOLOGY_NOT_FOUND,
    TERMINOLOGY_UNAVAILABLE
}
