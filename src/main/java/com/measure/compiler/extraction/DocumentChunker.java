package com.measure.compiler.extraction;

import com.measure.compiler.model.PopulationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits long measure documents into overlapping chunks that end on paragraph or sentence
 * boundaries, and tags each chunk with the population sections it covers.
 */
public class DocumentChunker {
    private static final Logger logger = LoggerFactory.getLogger(DocumentChunker.class);

    // Longer alternatives first so "Denominator Exclusions" is not read as "Denominator"
    private static final Pattern SECTION_HEADING = Pattern.compile(
            "^[ \\t#*>\\-\\d.)]*(initial population|denominator exclusions?|denominator exceptions?"
                    + "|numerator exclusions?|denominator|numerator)\\b[^\\n]*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private final ChunkingOptions options;

    public DocumentChunker() {
        this(ChunkingOptions.defaults());
    }

    public DocumentChunker(ChunkingOptions options) {
        this.options = options;
    }

    /**
     * Split the text. A text no longer than the maximum chunk size yields a single chunk.
     * @param text The full document text
     * @return Chunks in document order
     */
    public List<DocumentChunk> chunk(String text) {
        String source = text != null ? text : "";
        List<SectionMarker> markers = findSections(source);
        List<DocumentChunk> chunks = new ArrayList<>();

        int length = source.length();
        int start = 0;
        while (start < length || chunks.isEmpty()) {
            int end = chunkEnd(source, start);
            chunks.add(buildChunk(chunks.size(), source, start, end, markers));
            if (end >= length) {
                break;
            }
            start = Math.max(end - options.getOverlapSize(), start + 1);
        }

        logger.debug("Split document of {} characters into {} chunks", length, chunks.size());
        return chunks;
    }

    /**
     * Every population heading in the text, in document order.
     */
    public List<SectionMarker> findSections(String text) {
        List<SectionMarker> markers = new ArrayList<>();
        Matcher matcher = SECTION_HEADING.matcher(text);
        while (matcher.find()) {
            markers.add(new SectionMarker(sectionType(matcher.group(1)), matcher.start(), matcher.group().trim()));
        }
        return markers;
    }

    private int chunkEnd(String text, int start) {
        int length = text.length();
        int hardEnd = Math.min(start + options.getMaxChunkSize(), length);
        if (hardEnd >= length) {
            return length;
        }
        // A short tail is folded into this chunk rather than emitted on its own
        if (length - hardEnd < options.getMinChunkSize()) {
            return length;
        }

        int floor = start + Math.max(options.getMinChunkSize(), options.getMaxChunkSize() / 2);
        int paragraph = text.lastIndexOf("\n\n", hardEnd - 2);
        if (paragraph >= floor) {
            return paragraph + 2;
        }
        int sentence = text.lastIndexOf(". ", hardEnd - 2);
        if (sentence >= floor) {
            return sentence + 2;
        }
        int line = text.lastIndexOf('\n', hardEnd - 1);
        if (line >= floor) {
            return line + 1;
        }
        return hardEnd;
    }

    private DocumentChunk buildChunk(int index, String text, int start, int end, List<SectionMarker> markers) {
        List<SectionMarker> sections = new ArrayList<>();
        SectionMarker enclosing = null;
        for (SectionMarker marker : markers) {
            if (marker.getOffset() < start) {
                enclosing = marker;
            } else if (marker.getOffset() < end) {
                sections.add(marker);
            }
        }

        String content = text.substring(start, end);
        if (enclosing != null) {
            sections.add(0, enclosing);
            if (options.isPreserveHeaders()) {
                content = enclosing.getHeading() + "\n" + content;
            }
        }
        return new DocumentChunk(index, content, start, end, sections);
    }

    private static PopulationType sectionType(String heading) {
        String normalized = heading.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("initial population")) {
            return PopulationType.INITIAL_POPULATION;
        }
        if (normalized.startsWith("denominator exclusion")) {
            return PopulationType.DENOMINATOR_EXCLUSION;
        }
        if (normalized.startsWith("denominator exception")) {
            return PopulationType.DENOMINATOR_EXCEPTION;
        }
        if (normalized.startsWith("numerator exclusion")) {
            return PopulationType.NUMERATOR_EXCLUSION;
        }
        return normalized.startsWith("denominator") ? PopulationType.DENOMINATOR : PopulationType.NUMERATOR;
    }
}
