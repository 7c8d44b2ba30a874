package com.roadspeed.engine.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One immutable publication of the latest-speed view.
 *
 * @param version         Refresh ticket that produced it; 0 for the initial empty snapshot
 * @param refreshedAt     When the refresh that produced it started, null for the initial snapshot
 * @param latestBySegment Latest observation per segment id, ordered by segment id
 */
public record LatestSpeedSnapshot(
    long version,
    Instant refreshedAt,
    Map<Long, SpeedObservationRecord> latestBySegment
) {

    public static final LatestSpeedSnapshot EMPTY = new LatestSpeedSnapshot(0L, null, Map.of());

    public LatestSpeedSnapshot {
        latestBySegment = Collections.unmodifiableMap(new TreeMap<>(latestBySegment));
    }

    public Optional<SpeedObservationRecord> get(Long segmentId) {
        return Optional.ofNullable(latestBySegment.get(segmentId));
    }

    public int size() {
        return latestBySegment.size();
    }

    public boolean isInitial() {
        return version == 0L;
    }
}
