package com.flaretrack.api.analytics;

import com.flaretrack.core.domain.Flare;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.flaretrack.api.analytics.FlareFixtures.NOW;
import static com.flaretrack.api.analytics.FlareFixtures.flare;
import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for problem-area ranking.
 *
 * For any distribution of flares over regions, the reported regions all meet
 * the threshold, are ordered by count, and their percentages sum to 100.
 */
class FlareAnalyticsEnginePropertyTest {

    private final FlareAnalyticsEngine engine = new FlareAnalyticsEngine();

    @Property(tries = 100)
    void percentagesSumToOneHundred(
            @ForAll("regionCounts") Map<String, Integer> counts,
            @ForAll TimeRange range) {

        List<ProblemArea> areas = engine.problemAreas("user-1", flares(counts, 5), range, NOW);

        Assume.that(!areas.isEmpty());
        assertThat(areas.stream().mapToDouble(ProblemArea::percentage).sum())
                .isCloseTo(100.0, within(0.1));
    }

    @Property(tries = 100)
    void exactlyTheRegionsAtOrAboveThresholdAreReported(
            @ForAll("regionCounts") Map<String, Integer> counts) {

        List<ProblemArea> areas = engine.problemAreas("user-1", flares(counts, 5), TimeRange.ALL_TIME, NOW);

        long expected = counts.values().stream()
                .filter(c -> c >= FlareAnalyticsEngine.DEFAULT_PROBLEM_AREA_THRESHOLD)
                .count();
        assertThat(areas).hasSize((int) expected);
        assertThat(areas).allSatisfy(a ->
                assertThat(a.flareCount()).isEqualTo(counts.get(a.bodyRegionId()).longValue()));
    }

    @Property(tries = 100)
    void areasAreSortedByCountThenRegion(
            @ForAll("regionCounts") Map<String, Integer> counts) {

        List<ProblemArea> areas = engine.problemAreas("user-1", flares(counts, 5), TimeRange.ALL_TIME, NOW);

        for (int i = 1; i < areas.size(); i++) {
            ProblemArea previous = areas.get(i - 1);
            ProblemArea current = areas.get(i);
            assertThat(previous.flareCount()).isGreaterThanOrEqualTo(current.flareCount());
            if (previous.flareCount() == current.flareCount()) {
                assertThat(previous.bodyRegionId()).isLessThan(current.bodyRegionId());
            }
        }
    }

    @Property(tries = 50)
    void flaresOutsideTheWindowAreNotCounted(
            @ForAll("regionCounts") Map<String, Integer> counts,
            @ForAll @IntRange(min = 31, max = 89) int daysAgo) {

        assertThat(engine.problemAreas("user-1", flares(counts, daysAgo), TimeRange.LAST_30D, NOW)).isEmpty();
        assertThat(engine.problemAreas("user-1", flares(counts, daysAgo), TimeRange.LAST_90D, NOW))
                .hasSameSizeAs(engine.problemAreas("user-1", flares(counts, daysAgo), TimeRange.ALL_TIME, NOW));
    }

    @Provide
    Arbitrary<Map<String, Integer>> regionCounts() {
        return Arbitraries.maps(
                Arbitraries.of("left-knee", "right-knee", "left-armpit", "right-armpit", "groin", "neck", "back"),
                Arbitraries.integers().between(1, 8)
        ).ofMinSize(1).ofMaxSize(7);
    }

    private static List<Flare> flares(Map<String, Integer> counts, int daysAgo) {
        List<Flare> flares = new ArrayList<>();
        counts.forEach((region, count) -> {
            for (int i = 0; i < count; i++) {
                flares.add(flare("user-1", region, 5, daysAgo).flare());
            }
        });
        return flares;
    }
}
