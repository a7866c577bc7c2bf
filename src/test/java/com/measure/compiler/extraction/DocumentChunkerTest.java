package com.measure.compiler.extraction;

import com.measure.compiler.model.PopulationType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DocumentChunker
 */
public class DocumentChunkerTest {

    private final DocumentChunker chunker = new DocumentChunker();

    // ========== Chunk Boundary Tests ==========

    @Test
    public void testChunk_ShortTextSingleChunk() {
        List<DocumentChunk> chunks = chunker.chunk("Initial Population: adults 18-75 with diabetes.");

        assertEquals(1, chunks.size());
        assertTrue(chunks.get(0).isFirst());
        assertEquals("Initial Population: adults 18-75 with diabetes.", chunks.get(0).getContent());
    }

    @Test
    public void testChunk_NullText() {
        List<DocumentChunk> chunks = chunker.chunk(null);

        assertEquals(1, chunks.size());
        assertEquals("", chunks.get(0).getContent());
    }

    @Test
    public void testChunk_SplitsOnParagraphWithOverlap() {
        String text = paragraphs(250);

        List<DocumentChunk> chunks = chunker.chunk(text);

        assertEquals(2, chunks.size());
        assertEquals(16_000, chunks.get(0).getEndOffset());
        assertTrue(chunks.get(0).getContent().endsWith("\n\n"));
        assertEquals(ChunkingOptions.DEFAULT_OVERLAP_SIZE, chunks.get(0).getEndOffset() - chunks.get(1).getStartOffset());
        assertEquals(text.length(), chunks.get(1).getEndOffset());
        assertFalse(chunks.get(1).isFirst());
    }

    @Test
    public void testChunk_ShortTailFolded() {
        List<DocumentChunk> chunks = chunker.chunk(paragraphs(170));

        assertEquals(1, chunks.size());
        assertEquals(17_000, chunks.get(0).getContent().length());
    }

    @Test
    public void testChunk_HardCutWithoutBoundaries() {
        List<DocumentChunk> chunks = chunker.chunk("a".repeat(40_000));

        assertEquals(3, chunks.size());
        for (DocumentChunk chunk : chunks) {
            assertTrue(chunk.getContent().length() <= ChunkingOptions.DEFAULT_MAX_CHUNK_SIZE);
        }
        assertEquals(40_000, chunks.get(2).getEndOffset());
    }

    // ========== Section Tests ==========

    @Test
    public void testFindSections() {
        String text = "Initial Population\nAdults\n\nDenominator Exclusions: hospice\n\n3. Numerator\nHbA1c > 9%\n";

        List<SectionMarker> markers = chunker.findSections(text);

        assertEquals(3, markers.size());
        assertEquals(PopulationType.INITIAL_POPULATION, markers.get(0).getType());
        assertEquals(PopulationType.DENOMINATOR_EXCLUSION, markers.get(1).getType());
        assertEquals("Denominator Exclusions: hospice", markers.get(1).getHeading());
        assertEquals(PopulationType.NUMERATOR, markers.get(2).getType());
        assertEquals(text.indexOf("3. Numerator"), markers.get(2).getOffset());
    }

    @Test
    public void testChunk_RepeatsEnclosingHeading() {
        String text = sectionedDocument();

        List<DocumentChunk> chunks = chunker.chunk(text);

        assertEquals(2, chunks.size());
        assertTrue(chunks.get(0).containsSection(PopulationType.INITIAL_POPULATION));
        assertTrue(chunks.get(0).containsSection(PopulationType.NUMERATOR));
        DocumentChunk second = chunks.get(1);
        assertTrue(second.getContent().startsWith("Numerator\n"));
        assertTrue(second.containsSection(PopulationType.NUMERATOR));
        assertFalse(second.containsSection(PopulationType.INITIAL_POPULATION));
    }

    @Test
    public void testChunk_WithoutHeaderRepeat() {
        DocumentChunker plain = new DocumentChunker(ChunkingOptions.builder().preserveHeaders(false).build());

        List<DocumentChunk> chunks = plain.chunk(sectionedDocument());

        DocumentChunk second = chunks.get(1);
        assertFalse(second.getContent().startsWith("Numerator"));
        assertTrue(second.containsSection(PopulationType.NUMERATOR));
    }

    // ========== Options Tests ==========

    @Test
    public void testOptions_Defaults() {
        ChunkingOptions options = ChunkingOptions.defaults();

        assertEquals(16_000, options.getMaxChunkSize());
        assertEquals(2_000, options.getOverlapSize());
        assertEquals(4_000, options.getMinChunkSize());
        assertTrue(options.isPreserveHeaders());
    }

    @Test
    public void testOptions_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> ChunkingOptions.builder().maxChunkSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ChunkingOptions.builder().maxChunkSize(100).minChunkSize(20).overlapSize(60).build());
        assertThrows(IllegalArgumentException.class,
                () -> ChunkingOptions.builder().maxChunkSize(100).minChunkSize(200).overlapSize(10).build());
    }

    private static String sectionedDocument() {
        return "Initial Population\n" + paragraphs(120) + "Numerator\n" + paragraphs(130);
    }

    /**
     * Paragraphs of exactly 100 characters each, separated by blank lines.
     */
    private static String paragraphs(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append("x".repeat(97)).append(".\n\n");
        }
        return sb.toString();
    }
}
