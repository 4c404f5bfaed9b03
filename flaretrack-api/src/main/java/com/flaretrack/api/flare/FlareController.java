package com.flaretrack.api.flare;

import com.flaretrack.core.domain.Flare;
import com.flaretrack.core.domain.Flare.FlareStatus;
import com.flaretrack.core.domain.FlareEvent;
import com.flaretrack.core.domain.FlareEvent.EventType;
import com.flaretrack.core.domain.FlareEvent.InterventionType;
import com.flaretrack.core.domain.FlareProjection;
import com.flaretrack.core.domain.FlareTrend;
import com.flaretrack.core.domain.FlareValidationException;
import com.flaretrack.core.domain.InvalidFlareStateException;
import com.flaretrack.core.domain.LifecycleStage;
import com.flaretrack.core.domain.NewFlareEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/flares")
public class FlareController {

    private static final Logger log = LoggerFactory.getLogger(FlareController.class);

    private final FlareEventStoreService eventStore;

    public FlareController(FlareEventStoreService eventStore) {
        this.eventStore = eventStore;
    }

    @PostMapping
    public ResponseEntity<Flare> create(
            @RequestHeader("X-User-ID") String userId,
            @RequestBody CreateFlareRequest request) {
        if (request.initialSeverity() == null) {
            throw new FlareValidationException("Initial severity is required");
        }
        Flare flare = eventStore.createFlare(
                userId, request.bodyRegionId(), request.initialSeverity(), request.notes(), request.startDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(flare);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Flare> get(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(eventStore.getFlare(userId, id));
    }

    @GetMapping
    public ResponseEntity<List<Flare>> list(
            @RequestHeader("X-User-ID") String userId,
            @RequestParam(defaultValue = "active") String state) {
        return switch (state.toLowerCase()) {
            case "active" -> ResponseEntity.ok(eventStore.getActiveFlares(userId));
            case "resolved" -> ResponseEntity.ok(eventStore.getResolvedFlares(userId));
            default -> throw new FlareValidationException("Unknown flare state filter: " + state);
        };
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<FlareEvent> appendEvent(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id,
            @RequestBody AppendEventRequest request) {
        FlareEvent recorded = eventStore.appendEvent(userId, id, request.toNewFlareEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(recorded);
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<List<FlareEvent>> history(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(eventStore.getFlareHistory(userId, id));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Flare> resolve(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id,
            @RequestBody ResolveFlareRequest request) {
        return ResponseEntity.ok(eventStore.resolveFlare(userId, id, request.resolutionDate(), request.notes()));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<Flare> updateStatus(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id,
            @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(eventStore.updateStatus(userId, id, request.status()));
    }

    @GetMapping("/{id}/insights")
    public ResponseEntity<FlareEventStoreService.FlareInsights> insights(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(eventStore.getInsights(userId, id));
    }

    @PostMapping("/{id}/replay")
    public ResponseEntity<FlareProjection> replay(
            @RequestHeader("X-User-ID") String userId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(eventStore.rebuildProjection(userId, id));
    }

    public record CreateFlareRequest(
            String bodyRegionId,
            Integer initialSeverity,
            String notes,
            Instant startDate
    ) {}

    public record AppendEventRequest(
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
        NewFlareEvent toNewFlareEvent() {
            return new NewFlareEvent(eventType, timestamp, severity, trend, interventionType,
                    interventionDetails, resolutionDate, fromStage, toStage, notes);
        }
    }

    public record ResolveFlareRequest(Instant resolutionDate, String notes) {}

    public record UpdateStatusRequest(FlareStatus status) {}

    @ExceptionHandler(FlareEventStoreService.FlareNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(FlareEventStoreService.FlareNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("FLARE_001", e.getMessage()));
    }

    @ExceptionHandler(FlareValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(FlareValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse("FLARE_002", e.getMessage()));
    }

    @ExceptionHandler(InvalidFlareStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidFlareStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse("FLARE_003", e.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStorage(DataAccessException e) {
        log.error("Flare storage failure", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("FLARE_004", "Flare storage is unavailable"));
    }

    public record ErrorResponse(String code, String message) {}
}
