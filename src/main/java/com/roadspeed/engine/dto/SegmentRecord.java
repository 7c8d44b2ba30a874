package com.roadspeed.engine.dto;

import com.roadspeed.engine.entity.RoadSegment;

import java.time.Instant;
import java.util.Map;

/**
 * Read model of a road segment.
 */
public record SegmentRecord(
    Long segmentId,
    String name,
    String source,
    String refCode,
    Double lengthM,
    Map<String, Object> geometry,
    Instant createdAt,
    Instant updatedAt
) {

    public static SegmentRecord fromEntity(RoadSegment segment) {
        return new SegmentRecord(
            segment.getId(),
            segment.getName(),
            segment.getSource(),
            segment.getRefCode(),
            segment.getLengthM(),
            segment.getGeometry(),
            segment.getCreatedAt(),
            segment.getUpdatedAt()
        );
    }
}
