package com.measure.compiler.extraction;

import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Knobs for one extraction run.
 */
public final class ExtractionOptions {
    public static final int DEFAULT_CHUNKING_THRESHOLD = 20_000;

    private final boolean skipValidationPass;
    private final Consumer<ExtractionProgress> progressListener;
    private final Executor detailExecutor;
    private final int chunkingThreshold;
    private final ChunkingOptions chunkingOptions;

    private ExtractionOptions(Builder builder) {
        this.skipValidationPass = builder.skipValidationPass;
        this.progressListener = builder.progressListener;
        this.detailExecutor = builder.detailExecutor;
        this.chunkingThreshold = builder.chunkingThreshold;
        this.chunkingOptions = builder.chunkingOptions;
    }

    public static ExtractionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSkipValidationPass() {
        return skipValidationPass;
    }

    public Consumer<ExtractionProgress> getProgressListener() {
        return progressListener;
    }

    /**
     * Executor for the detail passes. The default runs each call on the calling thread.
     */
    public Executor getDetailExecutor() {
        return detailExecutor;
    }

    public int getChunkingThreshold() {
        return chunkingThreshold;
    }

    public ChunkingOptions getChunkingOptions() {
        return chunkingOptions;
    }

    public static final class Builder {
        private boolean skipValidationPass;
        private Consumer<ExtractionProgress> progressListener = progress -> { };
        private Executor detailExecutor = Runnable::run;
        private int chunkingThreshold = DEFAULT_CHUNKING_THRESHOLD;
        private ChunkingOptions chunkingOptions = ChunkingOptions.defaults();

        private Builder() {
        }

        public Builder skipValidationPass(boolean skipValidationPass) {
            this.skipValidationPass = skipValidationPass;
            return this;
        }

        public Builder progressListener(Consumer<ExtractionProgress> progressListener) {
            this.progressListener = progressListener != null ? progressListener : progress -> { };
            return this;
        }

        public Builder detailExecutor(Executor detailExecutor) {
            this.detailExecutor = detailExecutor != null ? detailExecutor : Runnable::run;
            return this;
        }

        public Builder chunkingThreshold(int chunkingThreshold) {
            this.chunkingThreshold = chunkingThreshold;
            return this;
        }

        public Builder chunkingOptions(ChunkingOptions chunkingOptions) {
            this.chunkingOptions = chunkingOptions != null ? chunkingOptions : ChunkingOptions.defaults();
            return this;
        }

        public ExtractionOptions build() {
            return new ExtractionOptions(this);
        }
    }
}
