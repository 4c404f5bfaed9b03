package com.flaretrack.core.domain;

import com.flaretrack.core.domain.Flare.FlareStatus;
import com.flaretrack.core.domain.FlareEvent.EventType;
import com.flaretrack.core.domain.FlareEvent.InterventionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Append validation and projection behaviour of the flare aggregate.
 */
class FlareTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");
    private static final Instant START = NOW.minus(Duration.ofDays(20));

    private Flare flare;
    private List<FlareEvent> log;

    @BeforeEach
    void setUp() {
        flare = Flare.create("user-1", "left-armpit", 5, START, NOW);
        log = new ArrayList<>();
        log.add(flare.recordCreated("  first one  ", NOW));
    }

    private FlareEvent append(NewFlareEvent event, Duration afterStart) {
        FlareEvent recorded = flare.append(event.at(START.plus(afterStart)), NOW);
        log.add(recorded);
        return recorded;
    }

    // ==================== Creation ====================

    @Test
    void create_startsActiveWithCreatedEvent() {
        FlareEvent created = log.get(0);

        assertThat(flare.getStatus()).isEqualTo(FlareStatus.ACTIVE);
        assertThat(flare.getCurrentSeverity()).isEqualTo(5);
        assertThat(flare.getEventCount()).isEqualTo(1);
        assertThat(flare.isResolved()).isFalse();
        assertThat(created.getEventType()).isEqualTo(EventType.CREATED);
        assertThat(created.getSequenceNumber()).isZero();
        assertThat(created.getTimestamp()).isEqualTo(START);
        assertThat(created.getSeverity()).isEqualTo(5);
        assertThat(created.getNotes()).isEqualTo("first one");
    }

    @Test
    void create_rejectsInvalidInput() {
        assertThatThrownBy(() -> Flare.create("user-1", "knee", 0, null, NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> Flare.create("user-1", "knee", 11, null, NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> Flare.create(" ", "knee", 5, null, NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> Flare.create("user-1", "", 5, null, NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> Flare.create("user-1", "knee", 5, NOW.plusSeconds(60), NOW))
                .isInstanceOf(FlareValidationException.class);
    }

    @Test
    void recordCreated_onlyOnce() {
        assertThatThrownBy(() -> flare.recordCreated(null, NOW))
                .isInstanceOf(InvalidFlareStateException.class);
    }

    // ==================== Scenario ====================

    @Test
    void severityUpdatesThenResolution() {
        append(NewFlareEvent.severityUpdate(8), Duration.ofDays(2));
        append(NewFlareEvent.severityUpdate(6), Duration.ofDays(5));
        flare.append(NewFlareEvent.resolved(START.plus(Duration.ofDays(10)), "gone"), NOW);

        FlareTimeline timeline = FlareTimeline.of(flare, log);
        assertThat(flare.getCurrentSeverity()).isEqualTo(6);
        assertThat(timeline.peakSeverity()).isEqualTo(8);
        assertThat(timeline.durationDays(NOW)).isEqualTo(10);
        assertThat(flare.getStatus()).isEqualTo(FlareStatus.RESOLVED);
        assertThat(flare.getEndDate()).isEqualTo(START.plus(Duration.ofDays(10)));
        assertThat(flare.getCurrentLifecycleStage()).isNull();
    }

    // ==================== Validation ====================

    @Test
    void append_rejectsOutOfRangeSeverity() {
        assertThatThrownBy(() -> flare.append(NewFlareEvent.severityUpdate(0), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.severityUpdate(11), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThat(flare.getEventCount()).isEqualTo(1);
    }

    @Test
    void append_rejectsSecondCreatedEvent() {
        NewFlareEvent created = new NewFlareEvent(EventType.CREATED, null, 5,
                null, null, null, null, null, null, null);
        assertThatThrownBy(() -> flare.append(created, NOW))
                .isInstanceOf(FlareValidationException.class);
    }

    @Test
    void append_requiresPayloadFields() {
        assertThatThrownBy(() -> flare.append(NewFlareEvent.trendChange(null), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.intervention(null, "x"), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.stageChange(null, null, null), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.resolved(null, null), NOW))
                .isInstanceOf(FlareValidationException.class);
    }

    @Test
    void append_rejectsFieldsOwnedByOtherEventTypes() {
        NewFlareEvent trendWithSeverity = new NewFlareEvent(EventType.TREND_CHANGE, null, 7,
                FlareTrend.WORSENING, null, null, null, null, null, null);
        NewFlareEvent severityWithStage = new NewFlareEvent(EventType.SEVERITY_UPDATE, null, 4,
                null, null, null, null, null, LifecycleStage.GROWTH, null);
        NewFlareEvent interventionWithResolution = new NewFlareEvent(EventType.INTERVENTION, null, null,
                null, InterventionType.ICE, null, NOW, null, null, null);
        FlareProjection before = flare.projection();

        assertThatThrownBy(() -> flare.append(trendWithSeverity, NOW))
                .isInstanceOf(FlareValidationException.class)
                .hasMessageContaining("Severity");
        assertThatThrownBy(() -> flare.append(severityWithStage, NOW))
                .isInstanceOf(FlareValidationException.class)
                .hasMessageContaining("Target stage");
        assertThatThrownBy(() -> flare.append(interventionWithResolution, NOW))
                .isInstanceOf(FlareValidationException.class)
                .hasMessageContaining("Resolution date");
        assertThat(flare.projection()).isEqualTo(before);
        assertThat(flare.getEventCount()).isEqualTo(1);
    }

    @Test
    void append_rejectsTimestampsOutsideTheFlare() {
        assertThatThrownBy(() -> flare.append(NewFlareEvent.severityUpdate(4).at(START.minusSeconds(1)), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.severityUpdate(4).at(NOW.plusSeconds(1)), NOW))
                .isInstanceOf(FlareValidationException.class);
    }

    @Test
    void resolve_rejectsDatesOutsideTheFlare() {
        assertThatThrownBy(() -> flare.append(NewFlareEvent.resolved(START.minusSeconds(1), null), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.resolved(NOW.plusSeconds(1), null), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThat(flare.isResolved()).isFalse();
    }

    @Test
    void resolvedFlareAcceptsNoFurtherEvents() {
        flare.append(NewFlareEvent.resolved(NOW, null), NOW);
        FlareProjection before = flare.projection();

        assertThatThrownBy(() -> flare.append(NewFlareEvent.severityUpdate(3), NOW))
                .isInstanceOf(InvalidFlareStateException.class);
        assertThatThrownBy(() -> flare.append(NewFlareEvent.resolved(NOW, null), NOW))
                .isInstanceOf(InvalidFlareStateException.class);
        assertThat(flare.projection()).isEqualTo(before);
    }

    // ==================== Stages ====================

    @Test
    void stageChange_untrackedFlareStartsFromOnset() {
        assertThatThrownBy(() -> flare.append(
                NewFlareEvent.stageChange(null, LifecycleStage.RUPTURE, null), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThat(flare.getEventCount()).isEqualTo(1);
        assertThat(flare.getCurrentLifecycleStage()).isNull();

        append(NewFlareEvent.stageChange(LifecycleStage.ONSET, LifecycleStage.GROWTH, null), Duration.ofDays(1));
        assertThat(flare.getCurrentLifecycleStage()).isEqualTo(LifecycleStage.GROWTH);

        Flare other = Flare.create("user-1", "neck", 3, START, NOW);
        other.recordCreated(null, NOW);
        other.append(NewFlareEvent.stageChange(null, LifecycleStage.RESOLVED, null).at(START.plus(Duration.ofDays(3))), NOW);
        assertThat(other.getCurrentLifecycleStage()).isEqualTo(LifecycleStage.RESOLVED);
        assertThat(other.isResolved()).isTrue();
    }

    @Test
    void stageChange_rejectsSkipsAndBackwardMoves() {
        append(NewFlareEvent.stageChange(null, LifecycleStage.ONSET, null), Duration.ofDays(1));

        assertThatThrownBy(() -> flare.append(
                NewFlareEvent.stageChange(LifecycleStage.ONSET, LifecycleStage.DRAINING, null), NOW))
                .isInstanceOf(FlareValidationException.class);
        append(NewFlareEvent.stageChange(LifecycleStage.ONSET, LifecycleStage.GROWTH, null), Duration.ofDays(2));
        assertThatThrownBy(() -> flare.append(
                NewFlareEvent.stageChange(LifecycleStage.GROWTH, LifecycleStage.ONSET, null), NOW))
                .isInstanceOf(FlareValidationException.class);
        assertThat(flare.getCurrentLifecycleStage()).isEqualTo(LifecycleStage.GROWTH);
    }

    @Test
    void stageChange_rejectsMismatchedFromStage() {
        append(NewFlareEvent.stageChange(null, LifecycleStage.ONSET, null), Duration.ofDays(1));

        assertThatThrownBy(() -> flare.append(
                NewFlareEvent.stageChange(LifecycleStage.GROWTH, LifecycleStage.RUPTURE, null), NOW))
                .isInstanceOf(InvalidFlareStateException.class);
    }

    @Test
    void stageChange_intoResolvedResolvesTheFlare() {
        append(NewFlareEvent.stageChange(null, LifecycleStage.GROWTH, null), Duration.ofDays(1));
        FlareEvent resolution = append(
                NewFlareEvent.stageChange(LifecycleStage.GROWTH, LifecycleStage.RESOLVED, null), Duration.ofDays(4));

        assertThat(flare.isResolved()).isTrue();
        assertThat(flare.getStatus()).isEqualTo(FlareStatus.RESOLVED);
        assertThat(flare.getEndDate()).isEqualTo(START.plus(Duration.ofDays(4)));
        assertThat(resolution.getResolutionDate()).isEqualTo(START.plus(Duration.ofDays(4)));
        assertThat(FlareTimeline.of(flare, log).durationDays(NOW)).isEqualTo(4);
    }

    @Test
    void stageChange_intoResolvedKeepsGivenResolutionDate() {
        append(NewFlareEvent.stageChange(null, LifecycleStage.GROWTH, null), Duration.ofDays(1));
        Instant healed = START.plus(Duration.ofDays(6));
        flare.append(new NewFlareEvent(EventType.STAGE_CHANGE, START.plus(Duration.ofDays(9)), null,
                null, null, null, healed, LifecycleStage.GROWTH, LifecycleStage.RESOLVED, null), NOW);

        assertThat(flare.getEndDate()).isEqualTo(healed);
        assertThat(flare.getStatus()).isEqualTo(FlareStatus.RESOLVED);
    }

    @Test
    void stageChange_outOfTerminalStageIsInvalidState() {
        append(NewFlareEvent.stageChange(null, LifecycleStage.GROWTH, null), Duration.ofDays(1));
        append(NewFlareEvent.stageChange(LifecycleStage.GROWTH, LifecycleStage.RESOLVED, null), Duration.ofDays(2));
        FlareProjection before = flare.projection();

        assertThatThrownBy(() -> flare.append(
                NewFlareEvent.stageChange(LifecycleStage.RESOLVED, LifecycleStage.HEALING, null), NOW))
                .isInstanceOf(InvalidFlareStateException.class)
                .satisfies(e -> assertThat(((InvalidFlareStateException) e).getFlareId()).isEqualTo(flare.getId()));
        assertThatThrownBy(() -> flare.append(NewFlareEvent.severityUpdate(3), NOW))
                .isInstanceOf(InvalidFlareStateException.class);
        assertThat(flare.projection()).isEqualTo(before);
        assertThat(flare.isResolved()).isTrue();
    }

    @Test
    void resolution_movesTrackedStageToResolved() {
        append(NewFlareEvent.stageChange(null, LifecycleStage.GROWTH, null), Duration.ofDays(1));
        flare.append(NewFlareEvent.resolved(NOW, null), NOW);

        assertThat(flare.getCurrentLifecycleStage()).isEqualTo(LifecycleStage.RESOLVED);
    }

    // ==================== Trend and status ====================

    @Test
    void trendChangeDoesNotTouchStatus() {
        append(NewFlareEvent.trendChange(FlareTrend.WORSENING), Duration.ofDays(1));

        assertThat(flare.getTrend()).isEqualTo(FlareTrend.WORSENING);
        assertThat(flare.getStatus()).isEqualTo(FlareStatus.ACTIVE);
    }

    @Test
    void interventionLeavesProjectionExceptCount() {
        FlareProjection before = flare.projection();
        append(NewFlareEvent.intervention(InterventionType.ICE, "15 minutes"), Duration.ofDays(1));

        FlareProjection after = flare.projection();
        assertThat(after.currentSeverity()).isEqualTo(before.currentSeverity());
        assertThat(after.trend()).isEqualTo(before.trend());
        assertThat(after.lifecycleStage()).isEqualTo(before.lifecycleStage());
        assertThat(after.eventCount()).isEqualTo(before.eventCount() + 1);
    }

    @Test
    void updateStatus_rules() {
        flare.updateStatus(FlareStatus.IMPROVING, NOW);
        assertThat(flare.getStatus()).isEqualTo(FlareStatus.IMPROVING);

        assertThatThrownBy(() -> flare.updateStatus(FlareStatus.RESOLVED, NOW))
                .isInstanceOf(FlareValidationException.class);

        flare.append(NewFlareEvent.resolved(NOW, null), NOW);
        assertThatThrownBy(() -> flare.updateStatus(FlareStatus.ACTIVE, NOW))
                .isInstanceOf(InvalidFlareStateException.class);
    }

    // ==================== Replay ====================

    @Test
    void replay_rejectsForeignEvents() {
        Flare other = Flare.create("user-1", "neck", 3, START, NOW);
        FlareEvent foreign = other.recordCreated(null, NOW);

        assertThatThrownBy(() -> flare.replay(List.of(foreign), NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replay_reproducesStoredProjection() {
        append(NewFlareEvent.severityUpdate(7), Duration.ofDays(1));
        append(NewFlareEvent.trendChange(FlareTrend.IMPROVING), Duration.ofDays(2));
        FlareProjection stored = flare.projection();

        assertThat(flare.replay(log, NOW)).isEqualTo(stored);
        assertThat(flare.projection()).isEqualTo(stored);
    }
}
