package com.flaretrack.api.analytics;

import com.flaretrack.core.domain.FlareValidationException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final FlareAnalyticsService analyticsService;

    public AnalyticsController(FlareAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/problem-areas")
    public ResponseEntity<List<ProblemArea>> problemAreas(
            @RequestHeader("X-User-ID") String userId,
            @RequestParam(defaultValue = "last90d") String range) {
        return ResponseEntity.ok(analyticsService.getProblemAreas(userId, TimeRange.fromKey(range)));
    }

    @GetMapping("/regions/{regionId}/flares")
    public ResponseEntity<List<RegionFlareSummary>> regionFlares(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable String regionId) {
        return ResponseEntity.ok(analyticsService.getFlaresByRegion(userId, regionId));
    }

    @GetMapping("/regions/{regionId}/statistics")
    public ResponseEntity<RegionStatisticsResponse> regionStatistics(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable String regionId) {
        return ResponseEntity.ok(RegionStatisticsResponse.from(
                analyticsService.getRegionStatistics(userId, regionId)));
    }

    @GetMapping("/interventions")
    public ResponseEntity<List<InterventionEffectiveness>> interventions(
            @RequestHeader("X-User-ID") String userId,
            @RequestParam(defaultValue = "allTime") String range) {
        return ResponseEntity.ok(analyticsService.getInterventionEffectiveness(userId, TimeRange.fromKey(range)));
    }

    @GetMapping("/trend")
    public ResponseEntity<MonthlyTrend> trend(
            @RequestHeader("X-User-ID") String userId,
            @RequestParam(defaultValue = "lastYear") String range) {
        return ResponseEntity.ok(analyticsService.getMonthlyTrend(userId, TimeRange.fromKey(range)));
    }

    /**
     * Region statistics as displayed: average severity rounded to one decimal.
     */
    public record RegionStatisticsResponse(
            String bodyRegionId,
            long totalCount,
            Double averageDuration,
            BigDecimal averageSeverity,
            RecurrenceRate recurrenceRate
    ) {
        static RegionStatisticsResponse from(RegionStatistics stats) {
            return new RegionStatisticsResponse(
                    stats.bodyRegionId(),
                    stats.totalCount(),
                    stats.averageDuration(),
                    stats.averageSeverityRounded(),
                    stats.recurrenceRate());
        }
    }

    @ExceptionHandler(FlareAnalyticsService.RegionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRegionNotFound(FlareAnalyticsService.RegionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("ANALYTICS_001", e.getMessage()));
    }

    @ExceptionHandler({FlareValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleInvalid(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse("ANALYTICS_002", e.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStorage(DataAccessException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("ANALYTICS_003", "Flare storage is unavailable"));
    }

    public record ErrorResponse(String code, String message) {}
}
