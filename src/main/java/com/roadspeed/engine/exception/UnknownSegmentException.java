package com.roadspeed.engine.exception;

import lombok.Getter;

/**
 * Thrown when an observation references a segment that does not exist.
 *
 * Whether to register the segment upstream or drop the observation is the
 * caller's decision.
 */
@Getter
public class UnknownSegmentException extends RuntimeException {

    private final Long segmentId;

    public UnknownSegmentException(Long segmentId) {
        super("Unknown segment: " + segmentId);
        this.segmentId = segmentId;
    }
}
