package com.roadspeed.engine.service;

import com.roadspeed.engine.dto.SegmentImportRequest;
import com.roadspeed.engine.dto.SegmentRecord;
import com.roadspeed.engine.dto.SegmentRequest;
import com.roadspeed.engine.entity.RoadSegment;
import com.roadspeed.engine.exception.ValidationFailedException;
import com.roadspeed.engine.repository.RoadSegmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the set of known road segments.
 *
 * Ids come from the database identity column and never change. There is no
 * delete operation: observations reference segments for as long as the audit
 * trail exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentRegistryService {

    static final String DEFAULT_IMPORT_SOURCE = "geojson";
    static final int MAX_SOURCE_LENGTH = 64;
    static final int MAX_LABEL_LENGTH = 255;

    private final RoadSegmentRepository segmentRepository;

    /**
     * Registers a new segment.
     *
     * @return the assigned segment id
     * @throws ValidationFailedException if the length is negative or not finite, or a text field is too long
     */
    @Transactional
    public Long createSegment(SegmentRequest request) {
        validate(request);

        RoadSegment saved = segmentRepository.save(RoadSegment.builder()
            .name(request.name())
            .source(request.source())
            .refCode(request.refCode())
            .lengthM(request.lengthM())
            .geometry(request.geometry())
            .build());

        log.info("Segment created: id={}, name={}, source={}", saved.getId(), saved.getName(), saved.getSource());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Optional<SegmentRecord> getSegment(Long segmentId) {
        if (segmentId == null) {
            return Optional.empty();
        }
        return segmentRepository.findById(segmentId).map(SegmentRecord::fromEntity);
    }

    /**
     * All segments ordered by id.
     */
    @Transactional(readOnly = true)
    public List<SegmentRecord> listSegments() {
        return segmentRepository.findAllByOrderByIdAsc().stream()
            .map(SegmentRecord::fromEntity)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<SegmentRecord> findByReference(String source, String refCode) {
        return segmentRepository.findBySourceAndRefCode(source, refCode).stream()
            .map(SegmentRecord::fromEntity)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean exists(Long segmentId) {
        return segmentId != null && segmentRepository.existsById(segmentId);
    }

    /**
     * Replaces a segment's metadata. The id is kept.
     *
     * @return the updated segment, or empty if no segment has this id
     */
    @Transactional
    public Optional<SegmentRecord> updateSegment(Long segmentId, SegmentRequest request) {
        validate(request);

        return segmentRepository.findById(segmentId).map(segment -> {
            segment.setName(request.name());
            segment.setSource(request.source());
            segment.setRefCode(request.refCode());
            segment.setLengthM(request.lengthM());
            segment.setGeometry(request.geometry());
            RoadSegment saved = segmentRepository.saveAndFlush(segment);

            log.info("Segment updated: id={}", segmentId);
            return SegmentRecord.fromEntity(saved);
        });
    }

    /**
     * Registers one segment per feature of a GeoJSON FeatureCollection.
     *
     * Features without a geometry object are skipped. A feature with an invalid
     * length fails the whole import, nothing is stored.
     *
     * @param defaultSource source recorded for features that carry no "source" property
     * @return ids of the created segments, in feature order
     */
    @Transactional
    public List<Long> importSegments(SegmentImportRequest collection, String defaultSource) {
        if (collection == null || collection.features() == null) {
            throw new ValidationFailedException("A FeatureCollection with a features array is required");
        }
        if (collection.type() != null && !"FeatureCollection".equals(collection.type())) {
            throw new ValidationFailedException("Expected a FeatureCollection but got " + collection.type());
        }

        String fallbackSource = defaultSource == null || defaultSource.isBlank()
            ? DEFAULT_IMPORT_SOURCE
            : defaultSource;

        List<RoadSegment> segments = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < collection.features().size(); i++) {
            SegmentImportRequest.Feature feature = collection.features().get(i);
            if (feature == null || feature.geometry() == null) {
                skipped++;
                continue;
            }
            Map<String, Object> props = feature.properties() == null ? Map.of() : feature.properties();

            SegmentRequest request = new SegmentRequest(
                stringProperty(props, "name"),
                Optional.ofNullable(stringProperty(props, "source")).orElse(fallbackSource),
                stringProperty(props, "ref"),
                lengthProperty(props, i),
                feature.geometry()
            );
            validate(request);

            segments.add(RoadSegment.builder()
                .name(request.name())
                .source(request.source())
                .refCode(request.refCode())
                .lengthM(request.lengthM())
                .geometry(request.geometry())
                .build());
        }

        List<Long> ids = segmentRepository.saveAll(segments).stream()
            .map(RoadSegment::getId)
            .toList();

        log.info("Imported {} segments from FeatureCollection ({} features skipped)", ids.size(), skipped);
        return ids;
    }

    private void validate(SegmentRequest request) {
        if (request == null) {
            throw new ValidationFailedException("Segment metadata is required");
        }
        Double length = request.lengthM();
        if (length != null && (length.isNaN() || length.isInfinite() || length < 0)) {
            throw new ValidationFailedException("lengthM must be a non-negative number, got " + length);
        }
        requireMaxLength("source", request.source(), MAX_SOURCE_LENGTH);
        requireMaxLength("name", request.name(), MAX_LABEL_LENGTH);
        requireMaxLength("refCode", request.refCode(), MAX_LABEL_LENGTH);
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationFailedException(field + " must be at most " + max + " characters, got " + value.length());
        }
    }

    private static String stringProperty(Map<String, Object> props, String key) {
        Object value = props.get(key);
        return value == null ? null : value.toString();
    }

    private static Double lengthProperty(Map<String, Object> props, int featureIndex) {
        Object value = props.get("length_m");
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ValidationFailedException(
                "Feature " + featureIndex + ": length_m is not a number: " + value);
        }
    }
}
