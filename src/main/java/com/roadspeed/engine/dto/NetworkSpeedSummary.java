package com.roadspeed.engine.dto;

import java.time.Instant;

/**
 * Network-wide indicators over one latest-speed snapshot.
 *
 * @param segmentsWithSpeed Segments whose latest observation carries a speed
 * @param averageSpeedKmh   Mean of those speeds, null when there are none
 * @param slowCount         Segments below 15 km/h
 * @param verySlowCount     Segments below 10 km/h
 * @param snapshotVersion   Version of the snapshot summarised
 * @param refreshedAt       When that snapshot's refresh started
 */
public record NetworkSpeedSummary(
    int segmentsWithSpeed,
    Double averageSpeedKmh,
    int slowCount,
    int verySlowCount,
    long snapshotVersion,
    Instant refreshedAt
) {

    public static final double SLOW_THRESHOLD_KMH = 15.0;
    public static final double VERY_SLOW_THRESHOLD_KMH = 10.0;

    public static NetworkSpeedSummary of(LatestSpeedSnapshot snapshot) {
        int withSpeed = 0;
        int slow = 0;
        int verySlow = 0;
        double total = 0.0;

        for (SpeedObservationRecord observation : snapshot.latestBySegment().values()) {
            if (!observation.hasSpeed()) {
                continue;
            }
            double speed = observation.speedKmh();
            withSpeed++;
            total += speed;
            if (speed < SLOW_THRESHOLD_KMH) slow++;
            if (speed < VERY_SLOW_THRESHOLD_KMH) verySlow++;
        }

        Double average = withSpeed == 0 ? null : total / withSpeed;
        return new NetworkSpeedSummary(withSpeed, average, slow, verySlow,
            snapshot.version(), snapshot.refreshedAt());
    }
}
