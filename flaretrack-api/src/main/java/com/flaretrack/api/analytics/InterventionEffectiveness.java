package com.flaretrack.api.analytics;

import com.flaretrack.core.domain.FlareEvent.InterventionType;

/**
 * How well one kind of intervention worked, judged by the severity change from
 * the time it was applied to a follow-up reading about two days later.
 *
 * A positive {@code averageSeverityChange} means severity went down.
 * Both averages are null when no use of the intervention had a follow-up reading.
 */
public record InterventionEffectiveness(
        InterventionType interventionType,
        String displayName,
        int usageCount,
        int measuredCount,
        Double averageSeverityChange,
        Double successRate,
        boolean hasSufficientData
) {}
