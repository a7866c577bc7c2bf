package com.measure.compiler.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hand-written replacement for the generated code of one component. A locked override
 * is emitted verbatim and never regenerated.
 */
public final class CodeOverride {
    private final String componentId;
    private final CodeOutputFormat format;
    private final String code;
    private final boolean locked;
    private final List<EditNote> notes;

    public CodeOverride(String componentId, CodeOutputFormat format, String code, boolean locked,
                        List<EditNote> notes) {
        this.componentId = Objects.requireNonNull(componentId, "componentId");
        this.format = Objects.requireNonNull(format, "format");
        this.code = Objects.requireNonNull(code, "code");
        this.locked = locked;
        this.notes = notes != null ? List.copyOf(notes) : List.of();
    }

    public String getComponentId() {
        return componentId;
    }

    public CodeOutputFormat getFormat() {
        return format;
    }

    public String getCode() {
        return code;
    }

    public boolean isLocked() {
        return locked;
    }

    public List<EditNote> getNotes() {
        return notes;
    }

    public boolean appliesTo(CodeOutputFormat target) {
        return locked && format == target;
    }

    /**
     * Edit notes as comments in this override's syntax, followed by the code.
     */
    public String render() {
        List<String> lines = new ArrayList<>();
        for (EditNote note : notes) {
            lines.add(note.toComment(format));
        }
        lines.add(code);
        return String.join("\n", lines);
    }
}
