package com.roadspeed.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Entity representing one speed measurement for a road segment.
 *
 * Rows are append-only: Hibernate treats the entity as {@link Immutable}, so
 * updates to a loaded instance are never flushed. The audit trail only grows.
 *
 * Indexes:
 * - (segment_id, observed_at) serves both the time-range query and the
 *   max-per-segment query used by the latest-speed refresh
 * - observed_at alone serves cross-segment time scans
 */
@Entity
@Immutable
@Table(
    name = "speed_observations",
    indexes = {
        @Index(name = "idx_obs_segment_time", columnList = "segment_id, observed_at"),
        @Index(name = "idx_obs_observed_at", columnList = "observed_at")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpeedObservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "obs_id")
    private Long id;

    @Column(name = "segment_id", nullable = false)
    private Long segmentId;

    /**
     * Measurement time as reported by the provider (not insertion time)
     */
    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(name = "speed_kmh")
    private Double speedKmh;

    @Column(name = "duration_s")
    private Double durationS;

    @Column(name = "distance_m")
    private Double distanceM;

    @Column(length = 128)
    private String provider;

    /**
     * Untouched provider response, kept for audit
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw")
    private Map<String, Object> raw;

    @CreationTimestamp
    @Column(name = "ingested_at", nullable = false, updatable = false)
    private Instant ingestedAt;

    /**
     * Read-only link to the segment; the foreign key lives on segment_id.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "segment_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private RoadSegment segment;
}
