package com.roadspeed.engine.repository;

import com.roadspeed.engine.entity.RoadSegment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for road segments.
 */
@Repository
public interface RoadSegmentRepository extends JpaRepository<RoadSegment, Long> {

    /**
     * All segments in id order (stable listing order).
     */
    List<RoadSegment> findAllByOrderByIdAsc();

    /**
     * Segments imported from a given source with a given external id.
     * Use case: correlating a provider's segment reference with ours.
     */
    List<RoadSegment> findBySourceAndRefCode(String source, String refCode);
}
