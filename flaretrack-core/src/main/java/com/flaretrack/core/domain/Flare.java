package com.flaretrack.core.domain;

import com.flaretrack.core.domain.FlareEvent.EventType;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * Aggregate root for a tracked flare.
 *
 * The severity, trend, lifecycle stage and resolution columns are a stored
 * snapshot of {@link FlareProjection}: they change only through {@link #append},
 * {@link #recordCreated} and {@link #replay}, each of which refolds the event log.
 * {@code status} is the one facet the caller sets directly, through
 * {@link #updateStatus}, and only while the flare is open.
 */
@Entity
@Table(name = "flares", indexes = {
    @Index(name = "idx_flare_user", columnList = "user_id"),
    @Index(name = "idx_flare_user_region", columnList = "user_id, body_region_id"),
    @Index(name = "idx_flare_user_status", columnList = "user_id, status"),
    @Index(name = "idx_flare_start_date", columnList = "start_date")
})
public class Flare {

    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 10;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @NotNull
    @Column(name = "body_region_id", nullable = false, updatable = false)
    private String bodyRegionId;

    @NotNull
    @Column(name = "start_date", nullable = false, updatable = false)
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FlareStatus status;

    @Min(MIN_SEVERITY)
    @Max(MAX_SEVERITY)
    @Column(name = "initial_severity", nullable = false, updatable = false)
    private int initialSeverity;

    @Min(MIN_SEVERITY)
    @Max(MAX_SEVERITY)
    @Column(name = "current_severity", nullable = false)
    private int currentSeverity;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_lifecycle_stage")
    private LifecycleStage currentLifecycleStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "trend")
    private FlareTrend trend;

    @Column(name = "event_count", nullable = false)
    private int eventCount;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public enum FlareStatus {
        ACTIVE,
        IMPROVING,
        WORSENING,
        RESOLVED;

        public boolean isOpen() {
            return this != RESOLVED;
        }
    }

    protected Flare() {}

    /**
     * Opens a new flare. The caller records the initial created event through
     * {@link #recordCreated} in the same unit of work.
     */
    public static Flare create(
            String userId,
            String bodyRegionId,
            int initialSeverity,
            Instant startDate,
            Instant now) {

        if (userId == null || userId.isBlank()) {
            throw new FlareValidationException("User ID is required");
        }
        if (bodyRegionId == null || bodyRegionId.isBlank()) {
            throw new FlareValidationException("Body region ID is required");
        }
        requireSeverity(initialSeverity, "Initial severity");
        Instant start = startDate != null ? startDate : now;
        if (start.isAfter(now)) {
            throw new FlareValidationException("Start date cannot be in the future");
        }

        var flare = new Flare();
        flare.id = UUID.randomUUID();
        flare.userId = userId;
        flare.bodyRegionId = bodyRegionId;
        flare.startDate = start;
        flare.status = FlareStatus.ACTIVE;
        flare.initialSeverity = initialSeverity;
        flare.currentSeverity = initialSeverity;
        flare.eventCount = 0;
        flare.createdAt = now;
        flare.updatedAt = now;
        return flare;
    }

    /**
     * Writes the first entry of the log. Valid only on a flare with an empty log.
     */
    public FlareEvent recordCreated(String notes, Instant now) {
        if (eventCount != 0) {
            throw new InvalidFlareStateException(id, "Flare " + id + " already has a created event");
        }
        NewFlareEvent payload = new NewFlareEvent(EventType.CREATED, startDate, initialSeverity,
                null, null, null, null, null, null, blankToNull(notes));
        FlareEvent event = FlareEvent.record(this, 0, startDate, payload);
        applyProjection(projection().apply(event), now);
        return event;
    }

    /**
     * Validates the payload against the current projection, then returns the
     * event to persist and folds it into this snapshot. On rejection nothing
     * about this flare changes.
     */
    public FlareEvent append(NewFlareEvent payload, Instant now) {
        Instant timestamp = validateAppend(payload, now);
        NewFlareEvent recorded = payload.isStageResolution() && payload.resolutionDate() == null
                ? payload.withResolutionDate(timestamp)
                : payload;
        FlareEvent event = FlareEvent.record(this, eventCount, timestamp, recorded);
        applyProjection(projection().apply(event), now);
        return event;
    }

    /**
     * Rebuilds the snapshot from scratch out of the full log.
     */
    public FlareProjection replay(Collection<FlareEvent> log, Instant now) {
        for (FlareEvent event : log) {
            if (!id.equals(event.getFlareId())) {
                throw new IllegalArgumentException(
                        "Event " + event.getId() + " belongs to flare " + event.getFlareId() + ", not " + id);
            }
        }
        FlareProjection replayed = FlareProjection.replay(initialSeverity, log);
        if (!replayed.equals(projection())) {
            applyProjection(replayed, now);
        }
        return replayed;
    }

    /**
     * Sets the caller-facing status of an open flare. Resolution goes through a
     * resolved event instead.
     */
    public void updateStatus(FlareStatus newStatus, Instant now) {
        if (newStatus == null) {
            throw new FlareValidationException("Status is required");
        }
        if (newStatus == FlareStatus.RESOLVED) {
            throw new FlareValidationException("Flares are resolved through a resolution, not a status update");
        }
        if (isResolved()) {
            throw new InvalidFlareStateException(id, "Flare " + id + " is resolved; status can no longer change");
        }
        this.status = newStatus;
        this.updatedAt = now;
    }

    public FlareProjection projection() {
        return new FlareProjection(currentSeverity, trend, currentLifecycleStage, endDate, eventCount);
    }

    public boolean isResolved() {
        return endDate != null;
    }

    private Instant validateAppend(NewFlareEvent payload, Instant now) {
        if (payload == null || payload.eventType() == null) {
            throw new FlareValidationException("Event type is required");
        }
        if (isResolved()) {
            throw new InvalidFlareStateException(id,
                    "Flare " + id + " is resolved; " + payload.eventType() + " events are no longer accepted");
        }
        switch (payload.eventType()) {
            case CREATED -> throw new FlareValidationException(
                    "Created events are written only when the flare is created");
            case SEVERITY_UPDATE -> {
                if (payload.severity() == null) {
                    throw new FlareValidationException("Severity is required for a severity update");
                }
                requireSeverity(payload.severity(), "Severity");
            }
            case TREND_CHANGE -> {
                if (payload.trend() == null) {
                    throw new FlareValidationException("Trend is required for a trend change");
                }
            }
            case INTERVENTION -> {
                if (payload.interventionType() == null) {
                    throw new FlareValidationException("Intervention type is required for an intervention");
                }
            }
            case STAGE_CHANGE -> validateStageChange(payload, now);
            case RESOLVED -> validateResolution(payload.resolutionDate(), now);
        }
        rejectForeignFields(payload);

        Instant timestamp = payload.timestamp() != null ? payload.timestamp() : now;
        if (timestamp.isBefore(startDate)) {
            throw new FlareValidationException("Event timestamp cannot precede the flare start date");
        }
        if (timestamp.isAfter(now)) {
            throw new FlareValidationException("Event timestamp cannot be in the future");
        }
        return timestamp;
    }

    /**
     * An untracked flare is implicitly in ONSET: it may record ONSET explicitly
     * or move on from there like any other flare.
     */
    private void validateStageChange(NewFlareEvent payload, Instant now) {
        LifecycleStage target = payload.toStage();
        if (target == null) {
            throw new FlareValidationException("Target stage is required for a stage change");
        }
        LifecycleStage current = currentLifecycleStage != null ? currentLifecycleStage : LifecycleStage.ONSET;
        if (payload.fromStage() != null && payload.fromStage() != current) {
            throw new InvalidFlareStateException(id,
                    "Stage change expected flare " + id + " in " + payload.fromStage()
                            + " but it is in " + current);
        }
        boolean recordsImplicitOnset = currentLifecycleStage == null && target == LifecycleStage.ONSET;
        if (!recordsImplicitOnset && !FlareLifecycle.isValidStageTransition(current, target)) {
            throw new FlareValidationException("Invalid stage transition " + current + " → " + target);
        }
        if (target == LifecycleStage.RESOLVED && payload.resolutionDate() != null) {
            validateResolution(payload.resolutionDate(), now);
        }
    }

    /**
     * Each event type carries only its own payload fields; notes are allowed on all.
     */
    private static void rejectForeignFields(NewFlareEvent payload) {
        EventType type = payload.eventType();
        requireAbsent(payload.severity(), "Severity", type, EventType.SEVERITY_UPDATE);
        requireAbsent(payload.trend(), "Trend", type, EventType.TREND_CHANGE);
        requireAbsent(payload.interventionType(), "Intervention type", type, EventType.INTERVENTION);
        requireAbsent(payload.interventionDetails(), "Intervention details", type, EventType.INTERVENTION);
        requireAbsent(payload.fromStage(), "From stage", type, EventType.STAGE_CHANGE);
        requireAbsent(payload.toStage(), "Target stage", type, EventType.STAGE_CHANGE);
        if (payload.resolutionDate() != null && type != EventType.RESOLVED && !payload.isStageResolution()) {
            throw new FlareValidationException("Resolution date is not accepted on " + type + " events");
        }
    }

    private static void requireAbsent(Object value, String field, EventType type, EventType owner) {
        if (value != null && type != owner) {
            throw new FlareValidationException(field + " is not accepted on " + type + " events");
        }
    }

    private void validateResolution(Instant resolutionDate, Instant now) {
        if (resolutionDate == null) {
            throw new FlareValidationException("Resolution date is required");
        }
        if (resolutionDate.isBefore(startDate)) {
            throw new FlareValidationException("Resolution date cannot precede the flare start date");
        }
        if (resolutionDate.isAfter(now)) {
            throw new FlareValidationException("Resolution date cannot be in the future");
        }
    }

    private void applyProjection(FlareProjection projection, Instant now) {
        this.currentSeverity = projection.currentSeverity();
        this.trend = projection.trend();
        this.currentLifecycleStage = projection.lifecycleStage();
        this.endDate = projection.endDate();
        this.eventCount = projection.eventCount();
        if (projection.isResolved()) {
            this.status = FlareStatus.RESOLVED;
        } else if (status == FlareStatus.RESOLVED) {
            this.status = FlareStatus.ACTIVE;
        }
        this.updatedAt = now;
    }

    private static void requireSeverity(int severity, String field) {
        if (severity < MIN_SEVERITY || severity > MAX_SEVERITY) {
            throw new FlareValidationException(
                    field + " must be between " + MIN_SEVERITY + " and " + MAX_SEVERITY + ", was " + severity);
        }
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    // Getters
    public UUID getId() { return id; }
    public String getUserId() { return userId; }
    public String getBodyRegionId() { return bodyRegionId; }
    public Instant getStartDate() { return startDate; }
    public Instant getEndDate() { return endDate; }
    public FlareStatus getStatus() { return status; }
    public int getInitialSeverity() { return initialSeverity; }
    public int getCurrentSeverity() { return currentSeverity; }
    public LifecycleStage getCurrentLifecycleStage() { return currentLifecycleStage; }
    public FlareTrend getTrend() { return trend; }
    public int getEventCount() { return eventCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Flare flare = (Flare) o;
        return Objects.equals(id, flare.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Flare{id=%s, region=%s, status=%s, severity=%d, stage=%s}",
                id, bodyRegionId, status, currentSeverity, currentLifecycleStage);
    }
}
