package com.measure.compiler.tree;

import java.util.List;

public final class TreeValidationResult {
    private final List<TreeIssue> errors;
    private final List<TreeIssue> warnings;
    private final TreeStats stats;

    public TreeValidationResult(List<TreeIssue> errors, List<TreeIssue> warnings, TreeStats stats) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.stats = stats;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<TreeIssue> getErrors() {
        return errors;
    }

    public List<TreeIssue> getWarnings() {
        return warnings;
    }

    public TreeStats getStats() {
        return stats;
    }

    public boolean hasError(TreeIssueCode code) {
        return errors.stream().anyMatch(e -> e.getCode() == code);
    }

    public boolean hasWarning(TreeIssueCode code) {
        return warnings.stream().anyMatch(w -> w.getCode() == code);
    }
}
