package com.roadspeed.engine.repository;

import com.roadspeed.engine.entity.SpeedObservation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the append-only speed observation log.
 *
 * Only inserts and reads are used. There are no update or delete queries here
 * and callers must not invoke the inherited delete methods.
 */
@Repository
public interface SpeedObservationRepository extends JpaRepository<SpeedObservation, Long> {

    /**
     * Fetches one page of a segment's observations inside [from, to), strictly
     * after the keyset cursor (afterObservedAt, afterId).
     *
     * Keyset pagination instead of offsets: rows inserted while a caller is
     * paging cannot shift rows between pages, and each page is an index range
     * scan on (segment_id, observed_at).
     *
     * To start from the beginning pass afterObservedAt = from and afterId = 0.
     *
     * @param segmentId       segment to read
     * @param from            inclusive lower bound on observed_at
     * @param to              exclusive upper bound on observed_at
     * @param afterObservedAt observed_at of the last row already returned
     * @param afterId         obs_id of the last row already returned
     * @param page            page size (only the size is used)
     */
    @Query("""
        SELECT o FROM SpeedObservation o
        WHERE o.segmentId = :segmentId
        AND o.observedAt >= :from
        AND o.observedAt < :to
        AND (o.observedAt > :afterObservedAt
             OR (o.observedAt = :afterObservedAt AND o.id > :afterId))
        ORDER BY o.observedAt ASC, o.id ASC
        """)
    List<SpeedObservation> findPageAfter(
        @Param("segmentId") Long segmentId,
        @Param("from") Instant from,
        @Param("to") Instant to,
        @Param("afterObservedAt") Instant afterObservedAt,
        @Param("afterId") Long afterId,
        Pageable page
    );

    /**
     * Returns every observation whose observed_at equals the maximum observed_at
     * of its segment. Ties are all returned; the caller resolves them.
     *
     * This is the group-by-max join of the latest_speed view. Served by the
     * (segment_id, observed_at) index.
     */
    @Query("""
        SELECT o FROM SpeedObservation o
        WHERE o.observedAt = (
            SELECT MAX(m.observedAt) FROM SpeedObservation m
            WHERE m.segmentId = o.segmentId
        )
        ORDER BY o.segmentId ASC, o.id ASC
        """)
    List<SpeedObservation> findLatestCandidatesPerSegment();

    long countBySegmentId(Long segmentId);
}
