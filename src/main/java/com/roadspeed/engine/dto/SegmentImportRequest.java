package com.roadspeed.engine.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * A GeoJSON FeatureCollection describing a road network.
 *
 * Recognised feature properties: {@code name}, {@code ref}, {@code length_m},
 * {@code source}. The geometry object is stored without being read.
 */
public record SegmentImportRequest(
    String type,

    @NotNull(message = "features is required")
    List<Feature> features
) {

    public record Feature(
        String type,
        Map<String, Object> properties,
        Map<String, Object> geometry
    ) {
    }
}
