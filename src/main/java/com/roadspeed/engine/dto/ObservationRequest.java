package com.roadspeed.engine.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One observation as pushed by a provider.
 *
 * The timestamp must carry an offset (ISO-8601, e.g. "2024-05-01T10:05:00-05:00").
 * Any of the three measurements may be absent. The raw payload is stored as-is
 * for audit.
 *
 * Bean Validation covers the REST edge; {@code ObservationStoreService} repeats the
 * checks so direct callers get the same guarantees.
 *
 * @param segmentId  Segment the measurement belongs to
 * @param observedAt When the provider measured it
 * @param speedKmh   Optional speed in km/h
 * @param durationS  Optional traversal time in seconds
 * @param distanceM  Optional traversed distance in meters
 * @param provider   Optional provider name, defaults to the configured provider
 * @param raw        Optional provider response for audit
 */
public record ObservationRequest(
    @NotNull(message = "Segment id is required")
    Long segmentId,

    @NotNull(message = "observedAt is required")
    OffsetDateTime observedAt,

    @PositiveOrZero(message = "speedKmh must be >= 0")
    Double speedKmh,

    @PositiveOrZero(message = "durationS must be >= 0")
    Double durationS,

    @PositiveOrZero(message = "distanceM must be >= 0")
    Double distanceM,

    @Size(max = 128, message = "provider must be at most 128 characters")
    String provider,

    Map<String, Object> raw
) {

    /**
     * Compact string for logging; leaves out the raw payload.
     */
    public String toLogString() {
        return String.format(
            "Observation[segment=%s, at=%s, speed=%s, provider=%s]",
            segmentId, observedAt, speedKmh, provider
        );
    }
}
