package com.measure.compiler.generator;

import java.util.List;

/**
 * Output of a code generation run. Failed runs carry errors and no code.
 */
public final class GenerationResult {
    private final String code;
    private final boolean success;
    private final List<String> warnings;
    private final List<String> errors;

    private GenerationResult(String code, boolean success, List<String> warnings, List<String> errors) {
        this.code = code;
        this.success = success;
        this.warnings = List.copyOf(warnings);
        this.errors = List.copyOf(errors);
    }

    public static GenerationResult success(String code, List<String> warnings) {
        return new GenerationResult(code, true, warnings, List.of());
    }

    public static GenerationResult failure(List<String> errors) {
        return new GenerationResult("", false, List.of(), errors);
    }

    public String getCode() {
        return code;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getErrors() {
        return errors;
    }
}
