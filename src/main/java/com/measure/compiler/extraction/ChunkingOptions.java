package com.measure.compiler.extraction;

/**
 * Size limits for splitting a long document. All sizes are in characters.
 */
public final class ChunkingOptions {
    public static final int DEFAULT_MAX_CHUNK_SIZE = 16_000;
    public static final int DEFAULT_OVERLAP_SIZE = 2_000;
    public static final int DEFAULT_MIN_CHUNK_SIZE = 4_000;

    private final int maxChunkSize;
    private final int overlapSize;
    private final int minChunkSize;
    private final boolean preserveHeaders;

    private ChunkingOptions(Builder builder) {
        if (builder.maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        if (builder.minChunkSize < 0 || builder.minChunkSize > builder.maxChunkSize) {
            throw new IllegalArgumentException("minChunkSize must be between 0 and maxChunkSize");
        }
        if (builder.overlapSize < 0 || builder.overlapSize >= builder.maxChunkSize / 2) {
            throw new IllegalArgumentException("overlapSize must be non-negative and below half of maxChunkSize");
        }
        this.maxChunkSize = builder.maxChunkSize;
        this.overlapSize = builder.overlapSize;
        this.minChunkSize = builder.minChunkSize;
        this.preserveHeaders = builder.preserveHeaders;
    }

    public static ChunkingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public int getOverlapSize() {
        return overlapSize;
    }

    public int getMinChunkSize() {
        return minChunkSize;
    }

    /**
     * When set, a chunk that starts inside a population section repeats that section's heading line.
     */
    public boolean isPreserveHeaders() {
        return preserveHeaders;
    }

    public static final class Builder {
        private int maxChunkSize = DEFAULT_MAX_CHUNK_SIZE;
        private int overlapSize = DEFAULT_OVERLAP_SIZE;
        private int minChunkSize = DEFAULT_MIN_CHUNK_SIZE;
        private boolean preserveHeaders = true;

        private Builder() {
        }

        public Builder maxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
            return this;
        }

        public Builder overlapSize(int overlapSize) {
            this.overlapSize = overlapSize;
            return this;
        }

        public Builder minChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
            return this;
        }

        public Builder preserveHeaders(boolean preserveHeaders) {
            this.preserveHeaders = preserveHeaders;
            return this;
        }

        public ChunkingOptions build() {
            return new ChunkingOptions(this);
        }
    }
}
