package com.measure.compiler.extraction;

import java.util.Objects;

/**
 * One finding of an OID check. The suggestion is optional.
 */
public final class OidIssue {
    private final OidIssueCode code;
    private final String message;
    private final String suggestion;

    public OidIssue(OidIssueCode code, String message, String suggestion) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = message;
        this.suggestion = suggestion;
    }

    public OidIssue(OidIssueCode code, String message) {
        this(code, message, null);
    }

    public OidIssueCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
