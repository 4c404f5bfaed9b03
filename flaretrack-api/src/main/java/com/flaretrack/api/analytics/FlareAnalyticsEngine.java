package com.flaretrack.api.analytics;

import com.flaretrack.api.analytics.MonthlyTrend.DataPoint;
import com.flaretrack.api.analytics.MonthlyTrend.TrendDirection;
import com.flaretrack.api.analytics.MonthlyTrend.TrendLine;
import com.flaretrack.core.domain.Flare;
import com.flaretrack.core.domain.FlareEvent;
import com.flaretrack.core.domain.FlareEvent.EventType;
import com.flaretrack.core.domain.FlareEvent.InterventionType;
import com.flaretrack.core.domain.FlareTimeline;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derived analytics over a user's flares.
 *
 * Stateless and side-effect free: every figure is recomputed from the timelines
 * passed in. Inputs belonging to other users are ignored, so callers cannot leak
 * another user's data into a result by mistake.
 */
public class FlareAnalyticsEngine {

    public static final int DEFAULT_PROBLEM_AREA_THRESHOLD = 3;
    public static final int DEFAULT_RECURRENCE_PERIOD_DAYS = 90;
    public static final Duration DEFAULT_FOLLOW_UP_OFFSET = Duration.ofHours(48);
    public static final Duration DEFAULT_FOLLOW_UP_TOLERANCE = Duration.ofHours(24);
    public static final int DEFAULT_SUFFICIENT_USAGE_COUNT = 5;
    public static final double DEFAULT_TREND_SLOPE_THRESHOLD = 0.3;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final int MIN_TREND_POINTS = 3;

    private final int problemAreaThreshold;
    private final int recurrencePeriodDays;
    private final Duration followUpOffset;
    private final Duration followUpTolerance;
    private final int sufficientUsageCount;
    private final double trendSlopeThreshold;

    public FlareAnalyticsEngine() {
        this(DEFAULT_PROBLEM_AREA_THRESHOLD, DEFAULT_RECURRENCE_PERIOD_DAYS, DEFAULT_FOLLOW_UP_OFFSET,
                DEFAULT_FOLLOW_UP_TOLERANCE, DEFAULT_SUFFICIENT_USAGE_COUNT, DEFAULT_TREND_SLOPE_THRESHOLD);
    }

    public FlareAnalyticsEngine(
            int problemAreaThreshold,
            int recurrencePeriodDays,
            Duration followUpOffset,
            Duration followUpTolerance,
            int sufficientUsageCount,
            double trendSlopeThreshold) {
        if (problemAreaThreshold < 1) {
            throw new IllegalArgumentException("Problem area threshold must be at least 1");
        }
        if (recurrencePeriodDays < 1) {
            throw new IllegalArgumentException("Recurrence period must be at least one day");
        }
        Objects.requireNonNull(followUpOffset, "followUpOffset");
        Objects.requireNonNull(followUpTolerance, "followUpTolerance");
        if (followUpTolerance.isNegative()) {
            throw new IllegalArgumentException("Follow-up tolerance cannot be negative");
        }
        if (trendSlopeThreshold < 0) {
            throw new IllegalArgumentException("Trend slope threshold cannot be negative");
        }
        this.problemAreaThreshold = problemAreaThreshold;
        this.recurrencePeriodDays = recurrencePeriodDays;
        this.followUpOffset = followUpOffset;
        this.followUpTolerance = followUpTolerance;
        this.sufficientUsageCount = sufficientUsageCount;
        this.trendSlopeThreshold = trendSlopeThreshold;
    }

    // ==================== Problem areas ====================

    /**
     * Regions with at least the threshold number of flares started inside the
     * window, most affected first. Percentages are relative to the reported
     * regions and sum to 100.
     */
    public List<ProblemArea> problemAreas(String userId, Collection<Flare> flares, TimeRange range, Instant now) {
        Map<String, Long> counts = flares.stream()
                .filter(f -> userId.equals(f.getUserId()))
                .filter(f -> range.contains(f.getStartDate(), now))
                .collect(Collectors.groupingBy(Flare::getBodyRegionId, Collectors.counting()));

        Map<String, Long> included = counts.entrySet().stream()
                .filter(e -> e.getValue() >= problemAreaThreshold)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        long total = included.values().stream().mapToLong(Long::longValue).sum();
        if (total == 0) {
            return List.of();
        }

        return included.entrySet().stream()
                .map(e -> new ProblemArea(e.getKey(), e.getValue(), 100.0 * e.getValue() / total))
                .sorted(Comparator.comparingLong(ProblemArea::flareCount).reversed()
                        .thenComparing(ProblemArea::bodyRegionId))
                .toList();
    }

    // ==================== Regions ====================

    /**
     * Every flare of the region, newest first. Empty when the region has none.
     */
    public List<RegionFlareSummary> flaresByRegion(
            String userId, Collection<FlareTimeline> timelines, String bodyRegionId, Instant now) {
        return inRegion(userId, timelines, bodyRegionId).stream()
                .sorted(Comparator.comparing((FlareTimeline t) -> t.flare().getStartDate()).reversed())
                .map(t -> new RegionFlareSummary(
                        t.flare().getId(),
                        t.flare().getStartDate(),
                        t.flare().getEndDate(),
                        t.flare().getStatus(),
                        t.durationDays(now),
                        t.peakSeverity(),
                        t.trendOutcome().orElse(null)))
                .toList();
    }

    /**
     * All-time statistics of a region, or empty when the user has no flares there.
     */
    public Optional<RegionStatistics> regionStatistics(
            String userId, Collection<FlareTimeline> timelines, String bodyRegionId, Instant now) {
        List<FlareTimeline> region = inRegion(userId, timelines, bodyRegionId);
        if (region.isEmpty()) {
            return Optional.empty();
        }

        long total = region.size();
        OptionalDouble resolvedDuration = region.stream()
                .filter(t -> t.flare().isResolved())
                .mapToLong(t -> t.durationDays(now))
                .average();
        Double averageDuration = resolvedDuration.isPresent() ? Double.valueOf(resolvedDuration.getAsDouble()) : null;
        double averageSeverity = region.stream()
                .mapToInt(FlareTimeline::peakSeverity)
                .average()
                .orElseThrow();

        return Optional.of(new RegionStatistics(
                bodyRegionId, total, averageDuration, averageSeverity, recurrenceRate(region, now)));
    }

    private RecurrenceRate recurrenceRate(List<FlareTimeline> region, Instant now) {
        if (region.size() < 2) {
            return RecurrenceRate.insufficientData();
        }
        Instant earliest = region.stream()
                .map(t -> t.flare().getStartDate())
                .min(Comparator.naturalOrder())
                .orElseThrow();
        double spanDays = Math.max(1.0, Duration.between(earliest, now).toMillis() / MILLIS_PER_DAY);
        return RecurrenceRate.of(region.size() / (spanDays / recurrencePeriodDays));
    }

    private static List<FlareTimeline> inRegion(
            String userId, Collection<FlareTimeline> timelines, String bodyRegionId) {
        return timelines.stream()
                .filter(t -> userId.equals(t.flare().getUserId()))
                .filter(t -> bodyRegionId.equals(t.flare().getBodyRegionId()))
                .toList();
    }

    // ==================== Interventions ====================

    /**
     * Effectiveness per intervention type, best success rate first. Types never
     * used in the window are omitted.
     */
    public List<InterventionEffectiveness> interventionEffectiveness(
            String userId, Collection<FlareTimeline> timelines, TimeRange range, Instant now) {

        Map<InterventionType, List<Integer>> changes = new EnumMap<>(InterventionType.class);
        Map<InterventionType, Integer> usage = new EnumMap<>(InterventionType.class);

        for (FlareTimeline timeline : owned(userId, timelines)) {
            List<FlareEvent> severityUpdates = timeline.eventsOfType(EventType.SEVERITY_UPDATE);
            for (FlareEvent intervention : timeline.eventsOfType(EventType.INTERVENTION)) {
                if (intervention.getInterventionType() == null
                        || !range.contains(intervention.getTimestamp(), now)) {
                    continue;
                }
                InterventionType type = intervention.getInterventionType();
                usage.merge(type, 1, Integer::sum);
                List<Integer> measured = changes.computeIfAbsent(type, k -> new ArrayList<>());
                followUp(intervention, severityUpdates).ifPresent(followUp -> measured.add(
                        timeline.severityAt(intervention.getTimestamp()) - followUp.getSeverity()));
            }
        }

        Comparator<InterventionEffectiveness> bySuccess = Comparator.comparing(
                InterventionEffectiveness::successRate, Comparator.nullsLast(Comparator.<Double>reverseOrder()));
        return usage.entrySet().stream()
                .map(e -> summarize(e.getKey(), e.getValue(), changes.getOrDefault(e.getKey(), List.of())))
                .sorted(bySuccess.thenComparing(i -> i.interventionType().name()))
                .toList();
    }

    private InterventionEffectiveness summarize(InterventionType type, int usageCount, List<Integer> changes) {
        Double averageChange = null;
        Double successRate = null;
        if (!changes.isEmpty()) {
            averageChange = changes.stream().mapToInt(Integer::intValue).average().orElseThrow();
            long improved = changes.stream().filter(c -> c > 0).count();
            successRate = 100.0 * improved / changes.size();
        }
        return new InterventionEffectiveness(type, type.displayName(), usageCount, changes.size(),
                averageChange, successRate, usageCount >= sufficientUsageCount);
    }

    /**
     * The severity update closest to the follow-up target, ties going to the earlier one.
     */
    private Optional<FlareEvent> followUp(FlareEvent intervention, List<FlareEvent> severityUpdates) {
        Instant target = intervention.getTimestamp().plus(followUpOffset);
        Function<FlareEvent, Duration> distance = e -> Duration.between(target, e.getTimestamp()).abs();
        return severityUpdates.stream()
                .filter(e -> e.getSeverity() != null)
                .filter(e -> e.getTimestamp().isAfter(intervention.getTimestamp()))
                .filter(e -> distance.apply(e).compareTo(followUpTolerance) <= 0)
                .min(Comparator.comparing(distance).thenComparing(FlareEvent.CHRONOLOGICAL));
    }

    // ==================== Monthly trend ====================

    /**
     * Flares started in the window, bucketed by UTC calendar month, with a
     * least-squares line over the month index.
     */
    public MonthlyTrend monthlyTrend(
            String userId, Collection<FlareTimeline> timelines, TimeRange range, Instant now) {
        Map<YearMonth, List<FlareTimeline>> byMonth = new TreeMap<>();
        for (FlareTimeline timeline : owned(userId, timelines)) {
            Instant start = timeline.flare().getStartDate();
            if (range.contains(start, now)) {
                byMonth.computeIfAbsent(YearMonth.from(start.atZone(ZoneOffset.UTC)), k -> new ArrayList<>())
                        .add(timeline);
            }
        }

        List<DataPoint> points = new ArrayList<>();
        byMonth.forEach((month, flares) -> points.add(new DataPoint(
                month.toString(),
                month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                flares.size(),
                flares.stream().mapToInt(FlareTimeline::peakSeverity).average().orElse(0))));

        TrendLine line = fit(points);
        return new MonthlyTrend(List.copyOf(points), line, direction(points.size(), line.slope()));
    }

    private static TrendLine fit(List<DataPoint> points) {
        int n = points.size();
        if (n == 0) {
            return new TrendLine(0, 0);
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            double y = points.get(i).flareCount();
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        double slope = denominator == 0 ? 0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new TrendLine(slope, intercept);
    }

    private TrendDirection direction(int pointCount, double slope) {
        if (pointCount < MIN_TREND_POINTS) {
            return TrendDirection.INSUFFICIENT_DATA;
        }
        if (slope < -trendSlopeThreshold) {
            return TrendDirection.IMPROVING;
        }
        if (slope > trendSlopeThreshold) {
            return TrendDirection.DECLINING;
        }
        return TrendDirection.STABLE;
    }

    private static List<FlareTimeline> owned(String userId, Collection<FlareTimeline> timelines) {
        return timelines.stream()
                .filter(t -> userId.equals(t.flare().getUserId()))
                .toList();
    }
}
