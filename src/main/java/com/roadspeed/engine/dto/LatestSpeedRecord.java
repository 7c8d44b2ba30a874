package com.roadspeed.engine.dto;

import java.time.Instant;

/**
 * The latest observation of one segment as served to map clients, with its
 * congestion band.
 */
public record LatestSpeedRecord(
    Long segmentId,
    Long obsId,
    Instant observedAt,
    Double speedKmh,
    Double durationS,
    Double distanceM,
    String provider,
    CongestionLevel congestion,
    String color
) {

    public static LatestSpeedRecord from(SpeedObservationRecord observation) {
        CongestionLevel level = CongestionLevel.classify(observation.speedKmh());
        return new LatestSpeedRecord(
            observation.segmentId(),
            observation.obsId(),
            observation.observedAt(),
            observation.speedKmh(),
            observation.durationS(),
            observation.distanceM(),
            observation.provider(),
            level,
            level.color()
        );
    }
}
