package com.measure.compiler.model;

import java.time.LocalDate;
import java.util.Objects;

public final class MeasurementPeriod {
    public static final LocalDate DEFAULT_START = LocalDate.of(2025, 1, 1);
    public static final LocalDate DEFAULT_END = LocalDate.of(2025, 12, 31);

    private final LocalDate start;
    private final LocalDate end;

    public MeasurementPeriod(LocalDate start, LocalDate end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("Measurement period ends before it starts: " + start + " to " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static MeasurementPeriod calendarYear(int year) {
        return new MeasurementPeriod(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public LocalDate startOrDefault() {
        return start != null ? start : DEFAULT_START;
    }

    public LocalDate endOrDefault() {
        return end != null ? end : DEFAULT_END;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasurementPeriod that)) return false;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }
}
