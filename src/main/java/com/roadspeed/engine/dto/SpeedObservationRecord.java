package com.roadspeed.engine.dto;

import com.roadspeed.engine.entity.SpeedObservation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable copy of a stored observation.
 *
 * Snapshots and query results hold these rather than JPA entities, so they stay
 * valid after the persistence context that loaded them is gone.
 */
public record SpeedObservationRecord(
    Long obsId,
    Long segmentId,
    Instant observedAt,
    Double speedKmh,
    Double durationS,
    Double distanceM,
    String provider,
    Map<String, Object> raw,
    Instant ingestedAt
) {

    public SpeedObservationRecord {
        raw = raw == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    public static SpeedObservationRecord fromEntity(SpeedObservation observation) {
        return new SpeedObservationRecord(
            observation.getId(),
            observation.getSegmentId(),
            observation.getObservedAt(),
            observation.getSpeedKmh(),
            observation.getDurationS(),
            observation.getDistanceM(),
            observation.getProvider(),
            observation.getRaw(),
            observation.getIngestedAt()
        );
    }

    public boolean hasSpeed() {
        return speedKmh != null;
    }
}
