package com.flaretrack.core.domain;

import com.flaretrack.core.domain.FlareEvent.EventType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A flare together with its full event log, in chronological order.
 * Read-only view used by history queries and analytics; every value is
 * derived by scanning the log on demand.
 */
public final class FlareTimeline {

    private final Flare flare;
    private final List<FlareEvent> events;

    private FlareTimeline(Flare flare, List<FlareEvent> events) {
        this.flare = flare;
        this.events = events;
    }

    public static FlareTimeline of(Flare flare, Collection<FlareEvent> events) {
        for (FlareEvent event : events) {
            if (!flare.getId().equals(event.getFlareId())) {
                throw new IllegalArgumentException(
                        "Event " + event.getId() + " does not belong to flare " + flare.getId());
            }
        }
        List<FlareEvent> ordered = events.stream()
                .sorted(FlareEvent.CHRONOLOGICAL)
                .toList();
        return new FlareTimeline(flare, ordered);
    }

    /**
     * Highest of the initial severity and every recorded severity update.
     */
    public int peakSeverity() {
        int peak = flare.getInitialSeverity();
        for (FlareEvent event : events) {
            if (event.getEventType() == EventType.SEVERITY_UPDATE && event.getSeverity() != null) {
                peak = Math.max(peak, event.getSeverity());
            }
        }
        return peak;
    }

    /**
     * Trend of the latest trend change, ties broken by insertion order.
     */
    public Optional<FlareTrend> trendOutcome() {
        FlareEvent latest = null;
        for (FlareEvent event : events) {
            if (event.getEventType() == EventType.TREND_CHANGE) {
                latest = event;
            }
        }
        return latest == null ? Optional.empty() : Optional.ofNullable(latest.getTrend());
    }

    /**
     * Whole days from start to end, or to {@code now} while the flare is open.
     */
    public long durationDays(Instant now) {
        Instant end = flare.getEndDate() != null ? flare.getEndDate() : now;
        if (!end.isAfter(flare.getStartDate())) {
            return 0;
        }
        return Duration.between(flare.getStartDate(), end).toDays();
    }

    public long daysInCurrentStage(Instant now) {
        return FlareLifecycle.getDaysInStage(flare, events, now);
    }

    public List<FlareEvent> eventsOfType(EventType type) {
        return events.stream()
                .filter(e -> e.getEventType() == type)
                .toList();
    }

    /**
     * Severity in force at {@code instant}: the last severity-bearing event at or
     * before it, else the initial severity.
     */
    public int severityAt(Instant instant) {
        int severity = flare.getInitialSeverity();
        for (FlareEvent event : events) {
            if (event.getTimestamp().isAfter(instant)) {
                break;
            }
            if (event.carriesSeverity()) {
                severity = event.getSeverity();
            }
        }
        return severity;
    }

    public Flare flare() { return flare; }
    public List<FlareEvent> events() { return events; }
}
