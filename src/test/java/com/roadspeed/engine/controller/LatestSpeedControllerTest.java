package com.roadspeed.engine.controller;

import com.roadspeed.engine.config.RoadSpeedProperties;
import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import com.roadspeed.engine.exception.RefreshCancelledException;
import com.roadspeed.engine.exception.StoreUnavailableException;
import com.roadspeed.engine.service.LatestSpeedMaterializer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LatestSpeedController.class)
class LatestSpeedControllerTest {

    private static final Instant OBSERVED_AT = Instant.parse("2024-05-01T10:05:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LatestSpeedMaterializer materializer;

    @MockBean
    private RoadSpeedProperties properties;

    @Test
    void shouldReportPublishedSnapshotOnRefresh() throws Exception {
        SpeedObservationRecord latest = new SpeedObservationRecord(
            7L, 3L, OBSERVED_AT, 8.0, null, null, "google_routes", null, null);
        when(materializer.refresh()).thenReturn(new LatestSpeedSnapshot(4L, OBSERVED_AT, Map.of(3L, latest)));

        mockMvc.perform(post("/api/latest/refresh"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.version").value(4))
            .andExpect(jsonPath("$.segments").value(1));
    }

    @Test
    void shouldMapCancelledRefreshToConflict() throws Exception {
        when(materializer.refresh()).thenThrow(new RefreshCancelledException("Latest-speed refresh #2 was cancelled"));

        mockMvc.perform(post("/api/latest/refresh"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value("CANCELLED"))
            .andExpect(jsonPath("$.error").value("REFRESH_CANCELLED"));
    }

    @Test
    void shouldMapUnreachableStoreToServiceUnavailable() throws Exception {
        when(materializer.refresh()).thenThrow(new StoreUnavailableException("Observation store unavailable", null));

        mockMvc.perform(post("/api/latest/refresh"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("UNAVAILABLE"))
            .andExpect(jsonPath("$.error").value("STORE_UNAVAILABLE"));
    }

    @Test
    void shouldServeCongestionBandForSegment() throws Exception {
        when(materializer.getLatest(3L)).thenReturn(Optional.of(new SpeedObservationRecord(
            7L, 3L, OBSERVED_AT, 8.0, null, null, "google_routes", null, null)));

        mockMvc.perform(get("/api/latest/3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.obsId").value(7))
            .andExpect(jsonPath("$.congestion").value("CONGESTED"));
    }

    @Test
    void shouldReturnNotFoundForSegmentWithoutObservations() throws Exception {
        when(materializer.getLatest(99L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/latest/99"))
            .andExpect(status().isNotFound());
    }
}
