package com.roadspeed.engine.controller;

import com.roadspeed.engine.dto.SegmentImportRequest;
import com.roadspeed.engine.dto.SegmentRecord;
import com.roadspeed.engine.dto.SegmentRequest;
import com.roadspeed.engine.service.SegmentRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for the segment registry.
 *
 * Example:
 * POST /api/segments
 * {"name":"Calle 3","source":"OSM","refCode":"way/123","lengthM":310.5}
 */
@RestController
@RequestMapping("/api/segments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Segments", description = "Road segment registry")
public class SegmentController {

    private final SegmentRegistryService segmentRegistryService;

    @Operation(summary = "Register a segment", description = "Assigns a new, permanent segment id.")
    @PostMapping
    public ResponseEntity<?> createSegment(@Valid @RequestBody SegmentRequest request) {
        Long segmentId = segmentRegistryService.createSegment(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "status", "CREATED",
            "segmentId", segmentId
        ));
    }

    @Operation(
        summary = "List segments",
        description = "All segments ordered by id, or those matching source and refCode when both are given."
    )
    @GetMapping
    public ResponseEntity<List<SegmentRecord>> listSegments(
        @Parameter(description = "Provenance tag", example = "OSM") @RequestParam(required = false) String source,
        @Parameter(description = "External id", example = "way/123") @RequestParam(required = false) String refCode
    ) {
        if (source != null && refCode != null) {
            return ResponseEntity.ok(segmentRegistryService.findByReference(source, refCode));
        }
        return ResponseEntity.ok(segmentRegistryService.listSegments());
    }

    @GetMapping("/{segmentId}")
    public ResponseEntity<SegmentRecord> getSegment(@PathVariable Long segmentId) {
        return ResponseEntity.of(segmentRegistryService.getSegment(segmentId));
    }

    @Operation(summary = "Update segment metadata", description = "The segment id never changes.")
    @PutMapping("/{segmentId}")
    public ResponseEntity<SegmentRecord> updateSegment(@PathVariable Long segmentId,
                                                       @Valid @RequestBody SegmentRequest request) {
        return ResponseEntity.of(segmentRegistryService.updateSegment(segmentId, request));
    }

    @Operation(
        summary = "Import a road network",
        description = "Creates one segment per GeoJSON feature. Properties name, ref, length_m and source are read; " +
            "the geometry is stored as-is. All-or-nothing."
    )
    @PostMapping("/import")
    public ResponseEntity<?> importSegments(
        @Parameter(description = "Source for features without a source property", example = "OSM")
        @RequestParam(required = false) String source,
        @Valid @RequestBody SegmentImportRequest collection
    ) {
        List<Long> segmentIds = segmentRegistryService.importSegments(collection, source);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "status", "IMPORTED",
            "imported", segmentIds.size(),
            "segmentIds", segmentIds
        ));
    }
}
