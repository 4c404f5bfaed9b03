package com.flaretrack.api.analytics;

import com.flaretrack.core.domain.Flare;
import com.flaretrack.core.domain.FlareEvent;
import com.flaretrack.core.domain.FlareTimeline;
import com.flaretrack.core.domain.FlareValidationException;
import com.flaretrack.core.repository.FlareEventRepository;
import com.flaretrack.core.repository.FlareRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only analytics over one user's flares.
 * Loads only the requesting user's data and delegates the math to
 * {@link FlareAnalyticsEngine}. Nothing is cached; every call recomputes.
 */
@Service
@Transactional(readOnly = true)
public class FlareAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(FlareAnalyticsService.class);

    private final FlareRepository flareRepository;
    private final FlareEventRepository eventRepository;
    private final FlareAnalyticsEngine engine;
    private final Clock clock;

    public FlareAnalyticsService(
            FlareRepository flareRepository,
            FlareEventRepository eventRepository,
            FlareAnalyticsEngine engine,
            Clock clock) {
        this.flareRepository = flareRepository;
        this.eventRepository = eventRepository;
        this.engine = engine;
        this.clock = clock;
    }

    public List<ProblemArea> getProblemAreas(String userId, TimeRange range) {
        requireUser(userId);
        Instant now = clock.instant();
        TimeRange window = rangeOrAll(range);
        List<ProblemArea> areas = engine.problemAreas(userId, flaresIn(userId, window, now), window, now);
        log.debug("Computed {} problem areas for user {} over {}", areas.size(), userId, window);
        return areas;
    }

    public List<RegionFlareSummary> getFlaresByRegion(String userId, String bodyRegionId) {
        requireUser(userId);
        requireRegion(bodyRegionId);
        List<Flare> flares = flareRepository.findByUserIdAndBodyRegionIdOrderByStartDateDesc(userId, bodyRegionId);
        return engine.flaresByRegion(userId, timelines(userId, flares), bodyRegionId, clock.instant());
    }

    public RegionStatistics getRegionStatistics(String userId, String bodyRegionId) {
        requireUser(userId);
        requireRegion(bodyRegionId);
        List<Flare> flares = flareRepository.findByUserIdAndBodyRegionIdOrderByStartDateDesc(userId, bodyRegionId);
        return engine.regionStatistics(userId, timelines(userId, flares), bodyRegionId, clock.instant())
                .orElseThrow(() -> new RegionNotFoundException(bodyRegionId));
    }

    public List<InterventionEffectiveness> getInterventionEffectiveness(String userId, TimeRange range) {
        requireUser(userId);
        List<Flare> flares = flareRepository.findByUserIdOrderByStartDateDesc(userId);
        return engine.interventionEffectiveness(userId, timelines(userId, flares), rangeOrAll(range), clock.instant());
    }

    public MonthlyTrend getMonthlyTrend(String userId, TimeRange range) {
        requireUser(userId);
        Instant now = clock.instant();
        TimeRange window = rangeOrAll(range);
        return engine.monthlyTrend(userId, timelines(userId, flaresIn(userId, window, now)), window, now);
    }

    private List<Flare> flaresIn(String userId, TimeRange window, Instant now) {
        return window.since(now)
                .map(since -> flareRepository.findStartedBetween(userId, since, now))
                .orElseGet(() -> flareRepository.findByUserIdOrderByStartDateDesc(userId));
    }

    private List<FlareTimeline> timelines(String userId, List<Flare> flares) {
        if (flares.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = flares.stream().map(Flare::getId).toList();
        Map<UUID, List<FlareEvent>> eventsByFlare = eventRepository.findByUserIdAndFlareIdIn(userId, ids).stream()
                .collect(Collectors.groupingBy(FlareEvent::getFlareId));
        return flares.stream()
                .map(f -> FlareTimeline.of(f, eventsByFlare.getOrDefault(f.getId(), List.of())))
                .toList();
    }

    private static TimeRange rangeOrAll(TimeRange range) {
        return range != null ? range : TimeRange.ALL_TIME;
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new FlareValidationException("User ID is required");
        }
    }

    private static void requireRegion(String bodyRegionId) {
        if (bodyRegionId == null || bodyRegionId.isBlank()) {
            throw new FlareValidationException("Body region ID is required");
        }
    }

    public static class RegionNotFoundException extends RuntimeException {
        public RegionNotFoundException(String bodyRegionId) {
            super("No flares recorded for region: " + bodyRegionId);
        }
    }
}
