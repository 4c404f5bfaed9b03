package com.flaretrack.api.analytics;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Look-back windows for analytics queries, anchored at "now".
 */
public enum TimeRange {

    LAST_30D("last30d", Duration.ofDays(30)),
    LAST_90D("last90d", Duration.ofDays(90)),
    LAST_YEAR("lastYear", Duration.ofDays(365)),
    ALL_TIME("allTime", null);

    private final String key;
    private final Duration window;

    TimeRange(String key, Duration window) {
        this.key = key;
        this.window = window;
    }

    /**
     * Resolves either the short key ("last90d") or the constant name ("LAST_90D").
     */
    public static TimeRange fromKey(String value) {
        if (value == null || value.isBlank()) {
            return ALL_TIME;
        }
        for (TimeRange range : values()) {
            if (range.key.equalsIgnoreCase(value) || range.name().equalsIgnoreCase(value)) {
                return range;
            }
        }
        throw new IllegalArgumentException("Unknown time range: " + value);
    }

    /**
     * Lower bound of the window, empty for {@link #ALL_TIME}.
     */
    public Optional<Instant> since(Instant now) {
        return window == null ? Optional.empty() : Optional.of(now.minus(window));
    }

    /**
     * True if the instant lies in [now - window, now]; always true for ALL_TIME.
     */
    public boolean contains(Instant instant, Instant now) {
        if (window == null) {
            return true;
        }
        return !instant.isBefore(now.minus(window)) && !instant.isAfter(now);
    }
}
