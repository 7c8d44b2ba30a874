package com.roadspeed.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Entity representing a road segment (a centre line or a sub-stretch of one).
 *
 * Lifecycle:
 * - Created by an administrative or import process
 * - Metadata may be updated, the id never changes
 * - Never deleted: observations reference segments through a foreign key
 *
 * The geometry is kept as an opaque GeoJSON object. Nothing in this service
 * reads coordinates out of it.
 */
@Entity
@Table(name = "segments", indexes = {
    @Index(name = "idx_segment_source_ref", columnList = "source, ref_code")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoadSegment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "segment_id")
    private Long id;

    /**
     * Optional display label (e.g., "Calle 3 - Carrera 6")
     */
    @Column(length = 255)
    private String name;

    /**
     * Provenance tag, e.g. the map provider the segment was imported from ("OSM")
     */
    @Column(length = 64)
    private String source;

    /**
     * Optional external correlation id
     */
    @Column(name = "ref_code", length = 255)
    private String refCode;

    /**
     * Length in meters. Null when unknown, never negative.
     */
    @Column(name = "length_m")
    private Double lengthM;

    /**
     * GeoJSON geometry, stored as jsonb on PostgreSQL.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "geom_geojson")
    private Map<String, Object> geometry;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
