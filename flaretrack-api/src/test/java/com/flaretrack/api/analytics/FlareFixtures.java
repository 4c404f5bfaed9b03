package com.flaretrack.api.analytics;

import com.flaretrack.core.domain.Flare;
import com.flaretrack.core.domain.FlareEvent;
import com.flaretrack.core.domain.FlareTimeline;
import com.flaretrack.core.domain.NewFlareEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory flares with their logs, for analytics tests that need no database.
 */
final class FlareFixtures {

    static final Instant NOW = Instant.parse("2026-06-30T12:00:00Z");

    private final Flare flare;
    private final List<FlareEvent> log = new ArrayList<>();

    private FlareFixtures(String userId, String region, int severity, Instant start) {
        this.flare = Flare.create(userId, region, severity, start, start);
        log.add(flare.recordCreated(null, start));
    }

    static FlareFixtures flare(String userId, String region, int severity, Instant start) {
        return new FlareFixtures(userId, region, severity, start);
    }

    static FlareFixtures flare(String userId, String region, int severity, int daysAgo) {
        return new FlareFixtures(userId, region, severity, NOW.minus(Duration.ofDays(daysAgo)));
    }

    FlareFixtures then(NewFlareEvent event, Duration afterStart) {
        log.add(flare.append(event.at(flare.getStartDate().plus(afterStart)), NOW));
        return this;
    }

    FlareFixtures resolvedAfter(Duration afterStart) {
        log.add(flare.append(NewFlareEvent.resolved(flare.getStartDate().plus(afterStart), null), NOW));
        return this;
    }

    Flare flare() {
        return flare;
    }

    FlareTimeline timeline() {
        return FlareTimeline.of(flare, log);
    }
}
