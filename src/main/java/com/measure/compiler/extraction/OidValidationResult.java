package com.measure.compiler.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of validating one value-set OID. Valid means no errors; warnings never invalidate.
 */
public final class OidValidationResult {
    private final String oid;
    private final CatalogMatch catalogMatch;
    private final List<OidIssue> errors;
    private final List<OidIssue> warnings;

    public OidValidationResult(String oid, CatalogMatch catalogMatch, List<OidIssue> errors, List<OidIssue> warnings) {
        this.oid = oid;
        this.catalogMatch = catalogMatch;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public String getOid() {
        return oid;
    }

    public Optional<CatalogMatch> getCatalogMatch() {
        return Optional.ofNullable(catalogMatch);
    }

    public List<OidIssue> getErrors() {
        return errors;
    }

    public List<OidIssue> getWarnings() {
        return warnings;
    }

    public boolean hasError(OidIssueCode code) {
        return errors.stream().anyMatch(e -> e.getCode() == code);
    }

    public boolean hasWarning(OidIssueCode code) {
        return warnings.stream().anyMatch(w -> w.getCode() == code);
    }

    /**
     * Error messages joined with ", ".
     */
    public String errorSummary() {
        return errors.stream().map(OidIssue::getMessage).collect(Collectors.joining(", "));
    }

    public OidValidationResult withCatalogMatch(CatalogMatch match) {
        return new OidValidationResult(oid, match, errors, warnings);
    }

    public OidValidationResult withError(OidIssue error) {
        List<OidIssue> combined = new ArrayList<>(errors);
        combined.add(error);
        return new OidValidationResult(oid, catalogMatch, combined, warnings);
    }

    public OidValidationResult withWarning(OidIssue warning) {
        List<OidIssue> combined = new ArrayList<>(warnings);
        combined.add(warning);
        return new OidValidationResult(oid, catalogMatch, errors, combined);
    }
}
