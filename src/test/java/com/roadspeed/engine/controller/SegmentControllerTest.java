package com.roadspeed.engine.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadspeed.engine.dto.SegmentRequest;
import com.roadspeed.engine.service.SegmentRegistryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SegmentController.class)
class SegmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private SegmentRegistryService segmentRegistryService;

    @Test
    void shouldRejectOverlongNameBeforeReachingService() throws Exception {
        SegmentRequest request = new SegmentRequest("x".repeat(300), "OSM", "r".repeat(300), 1.0, null);

        mockMvc.perform(post("/api/segments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.length()").value(2));

        verify(segmentRegistryService, never()).createSegment(any());
    }

    @Test
    void shouldMapDatabaseConstraintViolationToBadRequest() throws Exception {
        when(segmentRegistryService.createSegment(any()))
            .thenThrow(new DataIntegrityViolationException("Value too long for column \"NAME\""));

        mockMvc.perform(post("/api/segments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new SegmentRequest("Calle 5", "OSM", null, 1.0, null))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("REJECTED"))
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void shouldReturnCreatedSegmentId() throws Exception {
        when(segmentRegistryService.createSegment(any())).thenReturn(12L);

        mockMvc.perform(post("/api/segments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new SegmentRequest("Calle 5", "OSM", "way/5", 80.0, null))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.segmentId").value(12));
    }
}
