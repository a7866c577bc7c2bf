package com.measure.compiler.extraction;

/**
 * Progress notification delivered between extraction steps.
 */
public final class ExtractionProgress {
    private final ExtractionPhase phase;
    private final int currentStep;
    private final int totalSteps;
    private final String message;
    private final String details;

    public ExtractionProgress(ExtractionPhase phase, int currentStep, int totalSteps, String message, String details) {
        this.phase = phase;
        this.currentStep = currentStep;
        this.totalSteps = totalSteps;
        this.message = message;
        this.details = details;
    }

    public ExtractionPhase getPhase() {
        return phase;
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public String getMessage() {
        return message;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return phase + " " + currentStep + "/" + totalSteps + ": " + message;
    }
}
