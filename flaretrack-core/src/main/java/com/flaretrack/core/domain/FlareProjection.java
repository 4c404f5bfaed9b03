package com.flaretrack.core.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Derived state of a flare, computed as a left fold over its event log.
 *
 * The fold is pure: the same log in the same append order always produces an
 * equal projection. A flare counts as resolved exactly when {@code endDate} is set.
 */
public record FlareProjection(
        int currentSeverity,
        FlareTrend trend,
        LifecycleStage lifecycleStage,
        Instant endDate,
        int eventCount
) {

    /**
     * State before any event has been applied.
     */
    public static FlareProjection seed(int initialSeverity) {
        return new FlareProjection(initialSeverity, null, null, null, 0);
    }

    /**
     * Replays a whole log from the seed, in append order.
     */
    public static FlareProjection replay(int initialSeverity, Collection<FlareEvent> events) {
        List<FlareEvent> ordered = events.stream()
                .sorted(FlareEvent.APPEND_ORDER)
                .toList();
        FlareProjection projection = seed(initialSeverity);
        for (FlareEvent event : ordered) {
            projection = projection.apply(event);
        }
        return projection;
    }

    /**
     * Folds one event into the projection. Validation happens before events are
     * written, so every stored event is applicable here.
     */
    public FlareProjection apply(FlareEvent event) {
        int count = eventCount + 1;
        return switch (event.getEventType()) {
            case CREATED, SEVERITY_UPDATE -> new FlareProjection(
                    event.getSeverity() != null ? event.getSeverity() : currentSeverity,
                    trend, lifecycleStage, endDate, count);
            case TREND_CHANGE -> new FlareProjection(
                    currentSeverity, event.getTrend(), lifecycleStage, endDate, count);
            case STAGE_CHANGE -> new FlareProjection(
                    currentSeverity, trend, event.getToStage(),
                    event.getToStage() == LifecycleStage.RESOLVED ? resolvedAt(event) : endDate,
                    count);
            case RESOLVED -> new FlareProjection(
                    currentSeverity, trend,
                    lifecycleStage != null ? LifecycleStage.RESOLVED : null,
                    event.getResolutionDate(), count);
            case INTERVENTION -> new FlareProjection(
                    currentSeverity, trend, lifecycleStage, endDate, count);
        };
    }

    private static Instant resolvedAt(FlareEvent event) {
        return event.getResolutionDate() != null ? event.getResolutionDate() : event.getTimestamp();
    }

    public boolean isResolved() {
        return endDate != null;
    }
}
