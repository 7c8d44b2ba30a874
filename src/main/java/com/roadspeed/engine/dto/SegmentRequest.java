package com.roadspeed.engine.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Segment metadata for create and update calls.
 *
 * @param name     Optional display label
 * @param source   Provenance tag such as "OSM"
 * @param refCode  Optional external id
 * @param lengthM  Optional length in meters, never negative
 * @param geometry Optional GeoJSON geometry object, stored opaquely
 */
public record SegmentRequest(
    @Size(max = 255, message = "name must be at most 255 characters")
    String name,

    @Size(max = 64, message = "source must be at most 64 characters")
    String source,

    @Size(max = 255, message = "refCode must be at most 255 characters")
    String refCode,

    @PositiveOrZero(message = "lengthM must be >= 0")
    Double lengthM,

    Map<String, Object> geometry
) {
}
