package com.flaretrack.api.flare;

import com.flaretrack.core.domain.Flare;
import com.flaretrack.core.domain.Flare.FlareStatus;
import com.flaretrack.core.domain.FlareEvent;
import com.flaretrack.core.domain.FlareLifecycle;
import com.flaretrack.core.domain.FlareProjection;
import com.flaretrack.core.domain.FlareTimeline;
import com.flaretrack.core.domain.FlareTrend;
import com.flaretrack.core.domain.FlareValidationException;
import com.flaretrack.core.domain.InvalidFlareStateException;
import com.flaretrack.core.domain.LifecycleStage;
import com.flaretrack.core.domain.NewFlareEvent;
import com.flaretrack.core.repository.FlareEventRepository;
import com.flaretrack.core.repository.FlareRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Flare Event Store - the only write path for flares.
 *
 * Each mutation appends to the flare's log and stores the refolded projection
 * in the same transaction, so a failed append leaves both untouched.
 * Every call is scoped by an explicit user ID; flares of other users are
 * reported as not found.
 */
@Service
public class FlareEventStoreService {

    private static final Logger log = LoggerFactory.getLogger(FlareEventStoreService.class);

    private final FlareRepository flareRepository;
    private final FlareEventRepository eventRepository;
    private final Clock clock;

    public FlareEventStoreService(
            FlareRepository flareRepository,
            FlareEventRepository eventRepository,
            Clock clock) {
        this.flareRepository = flareRepository;
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    // ==================== Writes ====================

    /**
     * Opens a flare starting now and records its created event.
     */
    @Transactional
    public Flare createFlare(String userId, String bodyRegionId, int initialSeverity, String notes) {
        return createFlare(userId, bodyRegionId, initialSeverity, notes, null);
    }

    /**
     * Opens a flare, optionally backdated, and records its created event.
     */
    @Transactional
    public Flare createFlare(
            String userId,
            String bodyRegionId,
            int initialSeverity,
            String notes,
            Instant startDate) {

        Instant now = clock.instant();
        Flare flare = Flare.create(userId, bodyRegionId, initialSeverity, startDate, now);
        FlareEvent created = flare.recordCreated(notes, now);

        flare = flareRepository.save(flare);
        eventRepository.save(created);

        log.info("Created flare {} for user {} in region {} with severity {}",
                flare.getId(), userId, bodyRegionId, initialSeverity);
        return flare;
    }

    /**
     * Appends an event and folds it into the flare's projection.
     */
    @Transactional
    public FlareEvent appendEvent(String userId, UUID flareId, NewFlareEvent event) {
        Flare flare = loadOwned(userId, flareId);
        Instant now = clock.instant();

        FlareEvent recorded;
        try {
            recorded = flare.append(event, now);
        } catch (FlareValidationException | InvalidFlareStateException e) {
            log.warn("Rejected {} event for flare {}: {}",
                    event != null ? event.eventType() : null, flareId, e.getMessage());
            throw e;
        }

        eventRepository.save(recorded);
        flareRepository.save(flare);

        log.info("Appended {} event #{} to flare {}",
                recorded.getEventType(), recorded.getSequenceNumber(), flareId);
        return recorded;
    }

    /**
     * Resolves a flare: a resolved event that also sets its end date and status.
     */
    @Transactional
    public Flare resolveFlare(String userId, UUID flareId, Instant resolutionDate, String notes) {
        appendEvent(userId, flareId, NewFlareEvent.resolved(resolutionDate, notes));
        return loadOwned(userId, flareId);
    }

    /**
     * Sets the caller-maintained status (active, improving, worsening).
     * Not an event and not derived from trend changes.
     */
    @Transactional
    public Flare updateStatus(String userId, UUID flareId, FlareStatus status) {
        Flare flare = loadOwned(userId, flareId);
        try {
            flare.updateStatus(status, clock.instant());
        } catch (FlareValidationException | InvalidFlareStateException e) {
            log.warn("Rejected status update to {} for flare {}: {}", status, flareId, e.getMessage());
            throw e;
        }
        log.info("Flare {} status set to {}", flareId, status);
        return flareRepository.save(flare);
    }

    /**
     * Replays the full log from scratch and stores the result.
     * Running it again on an unchanged log changes nothing.
     */
    @Transactional
    public FlareProjection rebuildProjection(String userId, UUID flareId) {
        Flare flare = loadOwned(userId, flareId);
        FlareProjection before = flare.projection();
        List<FlareEvent> events = eventRepository.findByFlareIdAndUserIdOrderBySequenceNumberAsc(flareId, userId);

        FlareProjection replayed = flare.replay(events, clock.instant());
        if (!replayed.equals(before)) {
            log.warn("Projection of flare {} drifted from its log: stored {} replayed {}",
                    flareId, before, replayed);
            flareRepository.save(flare);
        }
        return replayed;
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public Flare getFlare(String userId, UUID flareId) {
        return loadOwned(userId, flareId);
    }

    @Transactional(readOnly = true)
    public Optional<Flare> findFlare(String userId, UUID flareId) {
        if (userId == null || flareId == null) {
            return Optional.empty();
        }
        return flareRepository.findByIdAndUserId(flareId, userId);
    }

    /**
     * Active, improving and worsening flares, newest first.
     */
    @Transactional(readOnly = true)
    public List<Flare> getActiveFlares(String userId) {
        return flareRepository.findByUserIdAndStatusNotOrderByStartDateDesc(userId, FlareStatus.RESOLVED);
    }

    /**
     * Resolved flares, most recently resolved first.
     */
    @Transactional(readOnly = true)
    public List<Flare> getResolvedFlares(String userId) {
        return flareRepository.findByUserIdAndStatusOrderByEndDateDesc(userId, FlareStatus.RESOLVED);
    }

    /**
     * The event log in chronological order.
     */
    @Transactional(readOnly = true)
    public List<FlareEvent> getFlareHistory(String userId, UUID flareId) {
        return getTimeline(userId, flareId).events();
    }

    @Transactional(readOnly = true)
    public FlareTimeline getTimeline(String userId, UUID flareId) {
        Flare flare = loadOwned(userId, flareId);
        return FlareTimeline.of(flare,
                eventRepository.findByFlareIdAndUserIdOrderBySequenceNumberAsc(flareId, userId));
    }

    /**
     * Highest severity the flare ever reached. Scans the log on every call.
     */
    @Transactional(readOnly = true)
    public int getPeakSeverity(String userId, UUID flareId) {
        return getTimeline(userId, flareId).peakSeverity();
    }

    @Transactional(readOnly = true)
    public Optional<FlareTrend> getTrendOutcome(String userId, UUID flareId) {
        return getTimeline(userId, flareId).trendOutcome();
    }

    @Transactional(readOnly = true)
    public long getDaysInCurrentStage(String userId, UUID flareId) {
        return getTimeline(userId, flareId).daysInCurrentStage(clock.instant());
    }

    /**
     * Derived per-flare figures in one read.
     */
    @Transactional(readOnly = true)
    public FlareInsights getInsights(String userId, UUID flareId) {
        FlareTimeline timeline = getTimeline(userId, flareId);
        LifecycleStage stage = timeline.flare().getCurrentLifecycleStage();
        return new FlareInsights(
                flareId,
                timeline.peakSeverity(),
                timeline.trendOutcome().orElse(null),
                stage,
                stage != null ? FlareLifecycle.getNextLifecycleStage(stage).orElse(null) : null,
                timeline.daysInCurrentStage(clock.instant()),
                timeline.durationDays(clock.instant()));
    }

    private Flare loadOwned(String userId, UUID flareId) {
        if (userId == null || userId.isBlank()) {
            throw new FlareValidationException("User ID is required");
        }
        if (flareId == null) {
            throw new FlareValidationException("Flare ID is required");
        }
        return flareRepository.findByIdAndUserId(flareId, userId)
                .orElseThrow(() -> new FlareNotFoundException(flareId));
    }

    // ==================== Types ====================

    public record FlareInsights(
            UUID flareId,
            int peakSeverity,
            FlareTrend trendOutcome,
            LifecycleStage currentStage,
            LifecycleStage nextStage,
            long daysInCurrentStage,
            long durationDays
    ) {}

    public static class FlareNotFoundException extends RuntimeException {
        public FlareNotFoundException(UUID flareId) {
            super("Flare not found: " + flareId);
        }
    }
}
