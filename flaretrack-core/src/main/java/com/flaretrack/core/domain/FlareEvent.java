package com.flaretrack.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry in a flare's append-only history.
 * Never updated or deleted once written; corrections are new events.
 *
 * Events of one flare are numbered by {@code sequenceNumber} in the order they
 * were appended. Chronological reads order by timestamp first and fall back to
 * the sequence number for ties.
 */
@Entity
@Immutable
@Table(name = "flare_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_flare_event_sequence", columnNames = {"flare_id", "sequence_number"}),
    indexes = {
        @Index(name = "idx_flare_event_flare", columnList = "flare_id"),
        @Index(name = "idx_flare_event_user", columnList = "user_id"),
        @Index(name = "idx_flare_event_type", columnList = "event_type")
    })
public class FlareEvent implements Persistable<UUID> {

    /**
     * Chronological order: timestamp, then insertion order.
     */
    public static final Comparator<FlareEvent> CHRONOLOGICAL = Comparator
            .comparing(FlareEvent::getTimestamp)
            .thenComparingInt(FlareEvent::getSequenceNumber);

    /**
     * Insertion order, the order the projection is folded in.
     */
    public static final Comparator<FlareEvent> APPEND_ORDER = Comparator
            .comparingInt(FlareEvent::getSequenceNumber);

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "flare_id", nullable = false, updatable = false)
    private UUID flareId;

    @NotNull
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    @NotNull
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "severity", updatable = false)
    private Integer severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "trend", updatable = false)
    private FlareTrend trend;

    @Enumerated(EnumType.STRING)
    @Column(name = "intervention_type", updatable = false)
    private InterventionType interventionType;

    @Column(name = "intervention_details", length = 2000, updatable = false)
    private String interventionDetails;

    @Column(name = "resolution_date", updatable = false)
    private Instant resolutionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_stage", updatable = false)
    private LifecycleStage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_stage", updatable = false)
    private LifecycleStage toStage;

    @Column(name = "notes", length = 4000, updatable = false)
    private String notes;

    @Transient
    private boolean persisted;

    public enum EventType {
        CREATED,
        SEVERITY_UPDATE,
        TREND_CHANGE,
        INTERVENTION,
        RESOLVED,
        STAGE_CHANGE
    }

    public enum InterventionType {
        ICE("Ice"),
        HEAT("Heat"),
        MEDICATION("Medication"),
        REST("Rest"),
        DRAINAGE("Drainage"),
        OTHER("Other");

        private final String displayName;

        InterventionType(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() { return displayName; }
    }

    protected FlareEvent() {}

    /**
     * Builds the event record. Only {@link Flare} calls this, after validating
     * the payload against its current projection.
     */
    static FlareEvent record(Flare flare, int sequenceNumber, Instant timestamp, NewFlareEvent payload) {
        var event = new FlareEvent();
        event.id = UUID.randomUUID();
        event.flareId = flare.getId();
        event.userId = flare.getUserId();
        event.sequenceNumber = sequenceNumber;
        event.eventType = payload.eventType();
        event.timestamp = timestamp;
        event.severity = payload.severity();
        event.trend = payload.trend();
        event.interventionType = payload.interventionType();
        event.interventionDetails = payload.interventionDetails();
        event.resolutionDate = payload.resolutionDate();
        event.fromStage = payload.fromStage();
        event.toStage = payload.toStage();
        event.notes = payload.notes();
        return event;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }

    /**
     * Events are only ever inserted, so anything not yet loaded or stored is new.
     */
    @Override
    @JsonIgnore
    public boolean isNew() {
        return !persisted;
    }

    public boolean carriesSeverity() {
        return severity != null
                && (eventType == EventType.CREATED || eventType == EventType.SEVERITY_UPDATE);
    }

    // Getters
    @Override
    public UUID getId() { return id; }
    public UUID getFlareId() { return flareId; }
    public String getUserId() { return userId; }
    public int getSequenceNumber() { return sequenceNumber; }
    public EventType getEventType() { return eventType; }
    public Instant getTimestamp() { return timestamp; }
    public Integer getSeverity() { return severity; }
    public FlareTrend getTrend() { return trend; }
    public InterventionType getInterventionType() { return interventionType; }
    public String getInterventionDetails() { return interventionDetails; }
    public Instant getResolutionDate() { return resolutionDate; }
    public LifecycleStage getFromStage() { return fromStage; }
    public LifecycleStage getToStage() { return toStage; }
    public String getNotes() { return notes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlareEvent that = (FlareEvent) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("FlareEvent{flareId=%s, seq=%d, type=%s, timestamp=%s}",
                flareId, sequenceNumber, eventType, timestamp);
    }
}
