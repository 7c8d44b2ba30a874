package com.roadspeed.engine.service;

import java.time.Instant;

/**
 * Published after an observation has been committed.
 */
public record ObservationRecordedEvent(Long obsId, Long segmentId, Instant observedAt) {
}
