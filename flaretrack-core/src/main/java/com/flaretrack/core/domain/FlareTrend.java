package com.flaretrack.core.domain;

/**
 * Trend reported by a trend_change event.
 * Independent of the caller-maintained {@link Flare.FlareStatus}.
 */
public enum FlareTrend {
    IMPROVING,
    STABLE,
    WORSENING
}
