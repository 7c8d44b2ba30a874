package com.roadspeed.engine.dto;

import com.roadspeed.engine.exception.ValidationFailedException;

import java.time.Instant;

/**
 * Half-open time interval [from, to) on observed_at.
 *
 * Missing bounds are replaced by fixed far-past / far-future instants that every
 * supported database can store.
 */
public record TimeRange(Instant from, Instant to) {

    public static final Instant EARLIEST = Instant.parse("1900-01-01T00:00:00Z");
    public static final Instant LATEST = Instant.parse("9999-12-31T00:00:00Z");

    public TimeRange {
        if (from == null) from = EARLIEST;
        if (to == null) to = LATEST;
        if (!from.isBefore(to)) {
            throw new ValidationFailedException("Time range start must be before its end: " + from + " .. " + to);
        }
    }

    public static TimeRange all() {
        return new TimeRange(null, null);
    }

    public static TimeRange of(Instant from, Instant to) {
        return new TimeRange(from, to);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }
}
