package com.measure.compiler.model;

import java.util.Objects;

public final class CodeReference {
    private final String code;
    private final String system;
    private final String display;

    public CodeReference(String code, String system, String display) {
        this.code = Objects.requireNonNull(code, "code");
        this.system = system;
        this.display = display;
    }

    public String getCode() {
        return code;
    }

    public String getSystem() {
        return system;
    }

    public String getDisplay() {
        return display;
    }

    /**
     * Identity of a code across merges: the (code, system) pair.
     */
    public String dedupKey() {
        return code + "|" + (system == null ? "" : system);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeReference that)) return false;
        return code.equals(that.code) && Objects.equals(system, that.system)
                && Objects.equals(display, that.display);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, system, display);
    }
}
