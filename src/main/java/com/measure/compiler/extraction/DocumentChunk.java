package com.measure.compiler.extraction;

import com.measure.compiler.model.PopulationType;

import java.util.List;

/**
 * One slice of a long document. Offsets refer to the original text; the content may start with a
 * repeated section heading.
 */
public final class DocumentChunk {
    private final int index;
    private final String content;
    private final int startOffset;
    private final int endOffset;
    private final List<SectionMarker> sections;

    public DocumentChunk(int index, String content, int startOffset, int endOffset, List<SectionMarker> sections) {
        this.index = index;
        this.content = content;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.sections = sections != null ? List.copyOf(sections) : List.of();
    }

    public int getIndex() {
        return index;
    }

    public String getContent() {
        return content;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    /**
     * Population sections present in this chunk, including the one it starts inside.
     */
    public List<SectionMarker> getSections() {
        return sections;
    }

    public boolean containsSection(PopulationType type) {
        return sections.stream().anyMatch(s -> s.getType() == type);
    }

    public boolean isFirst() {
        return startOffset == 0;
    }

    @Override
    public String toString() {
        return "DocumentChunk[" + index + ", " + startOffset + ".." + endOffset + ", " + sections + "]";
    }
}
