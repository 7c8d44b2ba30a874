package com.roadspeed.engine.service;

import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.dto.ObservationRequest;
import com.roadspeed.engine.dto.SegmentRequest;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the max-per-segment query against H2 rather than a mocked repository.
 */
@SpringBootTest
@ActiveProfiles("test")
class LatestSpeedMaterializerDatabaseTest {

    private static final OffsetDateTime TEN_O_CLOCK = OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.ofHours(-5));

    @Autowired
    private LatestSpeedMaterializer materializer;

    @Autowired
    private ObservationStoreService observationStoreService;

    @Autowired
    private SegmentRegistryService segmentRegistryService;

    @Test
    void shouldPickHighestObsIdAmongTimestampTiesOnEveryRefresh() {
        Long segmentId = newSegment("Tie");
        observationStoreService.recordObservation(observation(segmentId, TEN_O_CLOCK.minusHours(1), 60.0, "A"));
        Long fromA = observationStoreService.recordObservation(observation(segmentId, TEN_O_CLOCK, 40.0, "A"));
        Long fromB = observationStoreService.recordObservation(observation(segmentId, TEN_O_CLOCK, 20.0, "B"));

        LatestSpeedSnapshot first = materializer.refresh();
        LatestSpeedSnapshot second = materializer.refresh();

        SpeedObservationRecord latest = first.get(segmentId).orElseThrow();
        assertThat(fromB).isGreaterThan(fromA);
        assertThat(latest.obsId()).isEqualTo(fromB);
        assertThat(latest.provider()).isEqualTo("B");
        assertThat(second.get(segmentId)).contains(latest);
        assertThat(second.latestBySegment()).isEqualTo(first.latestBySegment());
    }

    @Test
    void shouldTakeLaterTimestampOverHigherObsId() {
        Long segmentId = newSegment("Out of order");
        Long later = observationStoreService.recordObservation(observation(segmentId, TEN_O_CLOCK.plusMinutes(5), 35.0, "A"));
        observationStoreService.recordObservation(observation(segmentId, TEN_O_CLOCK, 20.0, "A"));

        materializer.refresh();

        assertThat(materializer.getLatest(segmentId).orElseThrow().obsId()).isEqualTo(later);
    }

    @Test
    void shouldLeaveSegmentWithoutObservationsOutOfView() {
        Long silent = newSegment("Silent");

        materializer.refresh();

        assertThat(materializer.getLatest(silent)).isEmpty();
    }

    private Long newSegment(String name) {
        return segmentRegistryService.createSegment(new SegmentRequest(name, "OSM", null, 100.0, null));
    }

    private static ObservationRequest observation(Long segmentId, OffsetDateTime observedAt, double speed, String provider) {
        return new ObservationRequest(segmentId, observedAt, speed, null, null, provider, null);
    }
}
