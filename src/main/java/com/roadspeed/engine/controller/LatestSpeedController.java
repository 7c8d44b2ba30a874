package com.roadspeed.engine.controller;

import com.roadspeed.engine.config.RoadSpeedProperties;
import com.roadspeed.engine.dto.LatestSpeedRecord;
import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.dto.NetworkSpeedSummary;
import com.roadspeed.engine.service.LatestSpeedMaterializer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for the latest-speed view.
 *
 * Everything served here is as of the last refresh, not the live store.
 * GET /api/latest/status tells how old that is.
 */
@RestController
@RequestMapping("/api/latest")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Latest speed", description = "Latest observation per segment, refreshed explicitly or by policy")
public class LatestSpeedController {

    private final LatestSpeedMaterializer materializer;
    private final RoadSpeedProperties properties;

    @Operation(
        summary = "Latest speed of every segment",
        description = "As of the last refresh. Segments without observations are absent."
    )
    @GetMapping
    public ResponseEntity<List<LatestSpeedRecord>> getAllLatest() {
        return ResponseEntity.ok(materializer.getAllLatest().values().stream()
            .map(LatestSpeedRecord::from)
            .toList());
    }

    @Operation(summary = "Latest speed of one segment", description = "404 if the last refresh saw no observation for it.")
    @GetMapping("/{segmentId}")
    public ResponseEntity<LatestSpeedRecord> getLatest(@PathVariable Long segmentId) {
        return ResponseEntity.of(materializer.getLatest(segmentId).map(LatestSpeedRecord::from));
    }

    @Operation(
        summary = "Refresh the latest-speed view",
        description = "Recomputes the view from the observation log and publishes it atomically. " +
            "Writes committed after the refresh started may not be included."
    )
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh() {
        LatestSpeedSnapshot snapshot = materializer.refresh();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "version", snapshot.version(),
            "segments", snapshot.size(),
            "refreshedAt", snapshot.refreshedAt()
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        LatestSpeedSnapshot snapshot = materializer.currentSnapshot();

        // refreshedAt is null before the first refresh, Map.of rejects nulls
        Map<String, Object> body = new HashMap<>();
        body.put("state", materializer.state());
        body.put("version", snapshot.version());
        body.put("segments", snapshot.size());
        body.put("refreshedAt", snapshot.refreshedAt());
        body.put("refreshPolicy", properties.getMaterializer().getRefreshPolicy());
        return ResponseEntity.ok(body);
    }

    @Operation(
        summary = "Network speed indicators",
        description = "Average speed over segments with data, plus the number of segments below 15 and 10 km/h."
    )
    @GetMapping("/summary")
    public ResponseEntity<NetworkSpeedSummary> summary() {
        return ResponseEntity.ok(materializer.summary());
    }
}
