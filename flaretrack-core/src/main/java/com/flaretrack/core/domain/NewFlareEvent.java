package com.flaretrack.core.domain;

import com.flaretrack.core.domain.FlareEvent.EventType;
import com.flaretrack.core.domain.FlareEvent.InterventionType;

import java.time.Instant;

/**
 * Payload of an event the caller wants to append to a flare's log.
 * Identity, owner and sequence number are assigned by {@link Flare#append}.
 *
 * A null timestamp means "now" at append time.
 */
public record NewFlareEvent(
        EventType eventType,
        Instant timestamp,
        Integer severity,
        FlareTrend trend,
        InterventionType interventionType,
        String interventionDetails,
        Instant resolutionDate,
        LifecycleStage fromStage,
        LifecycleStage toStage,
        String notes
) {

    public static NewFlareEvent severityUpdate(int severity) {
        return new NewFlareEvent(EventType.SEVERITY_UPDATE, null, severity,
                null, null, null, null, null, null, null);
    }

    public static NewFlareEvent trendChange(FlareTrend trend) {
        return new NewFlareEvent(EventType.TREND_CHANGE, null, null,
                trend, null, null, null, null, null, null);
    }

    public static NewFlareEvent intervention(InterventionType type, String details) {
        return new NewFlareEvent(EventType.INTERVENTION, null, null,
                null, type, details, null, null, null, null);
    }

    public static NewFlareEvent stageChange(LifecycleStage fromStage, LifecycleStage toStage, String notes) {
        return new NewFlareEvent(EventType.STAGE_CHANGE, null, null,
                null, null, null, null, fromStage, toStage, notes);
    }

    public static NewFlareEvent resolved(Instant resolutionDate, String notes) {
        return new NewFlareEvent(EventType.RESOLVED, null, null,
                null, null, null, resolutionDate, null, null, notes);
    }

    public NewFlareEvent at(Instant eventTimestamp) {
        return new NewFlareEvent(eventType, eventTimestamp, severity, trend, interventionType,
                interventionDetails, resolutionDate, fromStage, toStage, notes);
    }

    /**
     * A stage change into RESOLVED, which closes the flare like a resolved event.
     */
    public boolean isStageResolution() {
        return eventType == EventType.STAGE_CHANGE && toStage == LifecycleStage.RESOLVED;
    }

    public NewFlareEvent withResolutionDate(Instant date) {
        return new NewFlareEvent(eventType, timestamp, severity, trend, interventionType,
                interventionDetails, date, fromStage, toStage, notes);
    }
}
