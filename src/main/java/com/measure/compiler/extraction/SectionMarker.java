package com.measure.compiler.extraction;

import com.measure.compiler.model.PopulationType;

import java.util.Objects;

/**
 * A population heading found in the document, with its character offset in the full text.
 */
public final class SectionMarker {
    private final PopulationType type;
    private final int offset;
    private final String heading;

    public SectionMarker(PopulationType type, int offset, String heading) {
        this.type = Objects.requireNonNull(type, "type");
        this.offset = offset;
        this.heading = heading;
    }

    public PopulationType getType() {
        return type;
    }

    public int getOffset() {
        return offset;
    }

    public String getHeading() {
        return heading;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectionMarker that)) return false;
        return offset == that.offset && type == that.type && Objects.equals(heading, that.heading);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, offset, heading);
    }

    @Override
    public String toString() {
        return type.getValue() + "@" + offset;
    }
}
