package com.flaretrack.api.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Flares per 90-day period, or the "insufficient data" marker when a region
 * has too few flares to estimate recurrence.
 */
public final class RecurrenceRate {

    public static final String INSUFFICIENT_DATA_LABEL = "insufficient data";

    private static final RecurrenceRate INSUFFICIENT_DATA = new RecurrenceRate(null);

    private final Double flaresPer90Days;

    private RecurrenceRate(Double flaresPer90Days) {
        this.flaresPer90Days = flaresPer90Days;
    }

    public static RecurrenceRate of(double flaresPer90Days) {
        if (Double.isNaN(flaresPer90Days) || Double.isInfinite(flaresPer90Days) || flaresPer90Days < 0) {
            throw new IllegalArgumentException("Recurrence rate must be a finite, non-negative number");
        }
        return new RecurrenceRate(flaresPer90Days);
    }

    public static RecurrenceRate insufficientData() {
        return INSUFFICIENT_DATA;
    }

    public boolean isInsufficientData() {
        return flaresPer90Days == null;
    }

    public OptionalDouble value() {
        return flaresPer90Days == null ? OptionalDouble.empty() : OptionalDouble.of(flaresPer90Days);
    }

    @JsonValue
    public Object toJson() {
        return flaresPer90Days == null ? INSUFFICIENT_DATA_LABEL : flaresPer90Days;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecurrenceRate that = (RecurrenceRate) o;
        return Objects.equals(flaresPer90Days, that.flaresPer90Days);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(flaresPer90Days);
    }

    @Override
    public String toString() {
        return flaresPer90Days == null ? INSUFFICIENT_DATA_LABEL : String.valueOf(flaresPer90Days);
    }
}
