package com.flaretrack.api.analytics;

import java.time.Instant;
import java.util.List;

/**
 * Flare frequency per calendar month (UTC) with a least-squares trend line
 * over the month index.
 */
public record MonthlyTrend(
        List<DataPoint> dataPoints,
        TrendLine trendLine,
        TrendDirection trendDirection
) {

    public record DataPoint(String month, Instant monthStart, int flareCount, double averageSeverity) {}

    public record TrendLine(double slope, double intercept) {}

    /**
     * More flares over time is DECLINING health, fewer is IMPROVING.
     */
    public enum TrendDirection {
        IMPROVING,
        STABLE,
        DECLINING,
        INSUFFICIENT_DATA
    }
}
