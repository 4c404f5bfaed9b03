package com.flaretrack.api.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Descriptive statistics of one body region over all time.
 *
 * {@code averageDuration} is null when no flare in the region has resolved yet.
 * {@code averageSeverity} keeps full precision; {@link #averageSeverityRounded()}
 * is for display.
 */
public record RegionStatistics(
        String bodyRegionId,
        long totalCount,
        Double averageDuration,
        double averageSeverity,
        RecurrenceRate recurrenceRate
) {

    public BigDecimal averageSeverityRounded() {
        return BigDecimal.valueOf(averageSeverity).setScale(1, RoundingMode.HALF_UP);
    }
}
