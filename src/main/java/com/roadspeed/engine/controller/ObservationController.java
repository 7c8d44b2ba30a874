package com.roadspeed.engine.controller;

import com.roadspeed.engine.dto.BatchIngestResult;
import com.roadspeed.engine.dto.ObservationRequest;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import com.roadspeed.engine.dto.TimeRange;
import com.roadspeed.engine.service.ObservationStoreService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * REST endpoints for observation ingestion and history.
 *
 * Example request:
 * POST /api/observations
 * {
 *   "segmentId": 1,
 *   "observedAt": "2024-05-01T10:05:00-05:00",
 *   "speedKmh": 35.0,
 *   "provider": "google_routes"
 * }
 */
@RestController
@RequestMapping("/api/observations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Observations", description = "Append-only speed observation log")
public class ObservationController {

    private final ObservationStoreService observationStoreService;

    @Operation(
        summary = "Record an observation",
        description = "Validates and appends one observation. Rejected with 404 if the segment is unknown, " +
            "400 if a measurement is negative or observedAt is missing."
    )
    @PostMapping
    public ResponseEntity<?> recordObservation(
        @io.swagger.v3.oas.annotations.parameters.RequestBody(
            description = "Observation pushed by a provider",
            required = true,
            content = @Content(
                schema = @Schema(implementation = ObservationRequest.class),
                examples = @ExampleObject(
                    value = "{\"segmentId\":1,\"observedAt\":\"2024-05-01T10:05:00-05:00\",\"speedKmh\":35.0,\"provider\":\"google_routes\"}"
                )
            )
        )
        @Valid @RequestBody ObservationRequest request) {
        log.debug("Received observation: {}", request.toLogString());

        Long obsId = observationStoreService.recordObservation(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "status", "ACCEPTED",
            "obsId", obsId,
            "segmentId", request.segmentId()
        ));
    }

    @Operation(
        summary = "Record a batch of observations",
        description = "Each item is stored independently; the response reports an outcome per item. " +
            "Rejected items never undo accepted ones."
    )
    @PostMapping("/batch")
    public ResponseEntity<BatchIngestResult> recordBatch(@RequestBody List<ObservationRequest> requests) {
        log.info("Received batch of {} observations", requests.size());
        return ResponseEntity.ok(observationStoreService.recordBatch(requests));
    }

    @Operation(
        summary = "Observation history of a segment",
        description = "Ordered by observedAt ascending. The range is [from, to); both bounds are optional."
    )
    @GetMapping
    public ResponseEntity<List<SpeedObservationRecord>> queryObservations(
        @Parameter(description = "Segment id", example = "1") @RequestParam Long segmentId,
        @Parameter(description = "Inclusive start", example = "2024-05-01T00:00:00Z")
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
        @Parameter(description = "Exclusive end", example = "2024-05-02T00:00:00Z")
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to
    ) {
        TimeRange range = TimeRange.of(
            from == null ? null : from.toInstant(),
            to == null ? null : to.toInstant());

        try (Stream<SpeedObservationRecord> observations = observationStoreService.queryObservations(segmentId, range)) {
            return ResponseEntity.ok(observations.toList());
        }
    }

    @GetMapping("/count")
    public ResponseEntity<?> countObservations() {
        return ResponseEntity.ok(Map.of("count", observationStoreService.countObservations()));
    }
}
