package com.flaretrack.api.analytics;

import com.flaretrack.core.domain.Flare.FlareStatus;
import com.flaretrack.core.domain.FlareTrend;

import java.time.Instant;
import java.util.UUID;

/**
 * One flare of a region as shown in the region detail view.
 * {@code trendOutcome} is null when the flare never reported a trend.
 */
public record RegionFlareSummary(
        UUID flareId,
        Instant startDate,
        Instant endDate,
        FlareStatus status,
        long durationDays,
        int peakSeverity,
        FlareTrend trendOutcome
) {}
