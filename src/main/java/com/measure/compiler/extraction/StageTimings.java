package com.measure.compiler.extraction;

import java.time.Duration;

/**
 * Wall-clock time spent in each extraction stage.
 */
public final class StageTimings {
    private final Duration skeleton;
    private final Duration populations;
    private final Duration validation;
    private final Duration total;

    public StageTimings(Duration skeleton, Duration populations, Duration validation, Duration total) {
        this.skeleton = skeleton != null ? skeleton : Duration.ZERO;
        this.populations = populations != null ? populations : Duration.ZERO;
        this.validation = validation != null ? validation : Duration.ZERO;
        this.total = total != null ? total : Duration.ZERO;
    }

    public Duration getSkeleton() {
        return skeleton;
    }

    public Duration getPopulations() {
        return populations;
    }

    public Duration getValidation() {
        return validation;
    }

    public Duration getTotal() {
        return total;
    }

    @Override
    public String toString() {
        return "skeleton=" + skeleton.toMillis() + "ms, populations=" + populations.toMillis()
                + "ms, validation=" + validation.toMillis() + "ms, total=" + total.toMillis() + "ms";
    }
}
