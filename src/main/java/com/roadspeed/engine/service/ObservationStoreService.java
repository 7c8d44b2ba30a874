package com.roadspeed.engine.service;

import com.roadspeed.engine.config.RoadSpeedProperties;
import com.roadspeed.engine.dto.BatchIngestResult;
import com.roadspeed.engine.dto.BatchIngestResult.ItemResult;
import com.roadspeed.engine.dto.BatchIngestResult.Outcome;
import com.roadspeed.engine.dto.ObservationRequest;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import com.roadspeed.engine.dto.TimeRange;
import com.roadspeed.engine.entity.SpeedObservation;
import com.roadspeed.engine.exception.StoreUnavailableException;
import com.roadspeed.engine.exception.UnknownSegmentException;
import com.roadspeed.engine.exception.ValidationFailedException;
import com.roadspeed.engine.repository.RoadSegmentRepository;
import com.roadspeed.engine.repository.SpeedObservationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Append-only store of speed observations.
 *
 * Flow for one observation:
 * 1. Validate (timestamp present and within the queryable window, measurements
 *    non-negative and finite)
 * 2. Derive speed from distance and duration when the provider sent none
 * 3. In one transaction: check the segment exists, insert the row
 * 4. After commit: publish {@link ObservationRecordedEvent}
 *
 * Every observation is its own transaction, so a batch never loses rows that
 * were already accepted when a later item fails. Rows are never updated or
 * deleted.
 */
@Service
@Slf4j
public class ObservationStoreService {

    static final int MAX_PROVIDER_LENGTH = 128;

    private final SpeedObservationRepository observationRepository;
    private final RoadSegmentRepository segmentRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final RoadSpeedProperties properties;
    private final TransactionTemplate insertTx;

    public ObservationStoreService(SpeedObservationRepository observationRepository,
                                   RoadSegmentRepository segmentRepository,
                                   ApplicationEventPublisher eventPublisher,
                                   RoadSpeedProperties properties,
                                   PlatformTransactionManager txManager) {
        this.observationRepository = observationRepository;
        this.segmentRepository = segmentRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.insertTx = new TransactionTemplate(txManager);
    }

    /**
     * Validates and appends one observation.
     *
     * The row is committed when this method returns, and visible to every
     * subsequent read.
     *
     * @return the assigned obs_id, greater than every id assigned before it
     * @throws ValidationFailedException  malformed input
     * @throws UnknownSegmentException    the segment does not exist; nothing is written
     * @throws StoreUnavailableException  the database cannot be reached
     */
    public Long recordObservation(ObservationRequest request) {
        validate(request);
        SpeedObservation row = toEntity(request);

        Long obsId;
        try {
            obsId = insertTx.execute(status -> {
                if (!segmentRepository.existsById(row.getSegmentId())) {
                    throw new UnknownSegmentException(row.getSegmentId());
                }
                return observationRepository.save(row).getId();
            });
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Observation store unavailable", e);
        }

        log.debug("Observation recorded: obsId={}, {}", obsId, request.toLogString());
        eventPublisher.publishEvent(new ObservationRecordedEvent(obsId, row.getSegmentId(), row.getObservedAt()));
        return obsId;
    }

    /**
     * Records each item independently and reports one outcome per item.
     *
     * Validation and unknown-segment rejections are reported and the batch goes
     * on. Once the store is unavailable the remaining items are reported as
     * STORE_UNAVAILABLE without being attempted.
     */
    public BatchIngestResult recordBatch(List<ObservationRequest> requests) {
        if (requests == null) {
            throw new ValidationFailedException("Batch must not be null");
        }
        int maxBatchSize = properties.getIngestion().getMaxBatchSize();
        if (requests.size() > maxBatchSize) {
            throw new ValidationFailedException(
                "Batch of " + requests.size() + " exceeds the maximum of " + maxBatchSize);
        }

        List<ItemResult> results = new ArrayList<>(requests.size());
        StoreUnavailableException storeFailure = null;

        for (int i = 0; i < requests.size(); i++) {
            if (storeFailure != null) {
                results.add(ItemResult.rejected(i, Outcome.STORE_UNAVAILABLE, "Not attempted: " + storeFailure.getMessage()));
                continue;
            }
            try {
                results.add(ItemResult.accepted(i, recordObservation(requests.get(i))));
            } catch (ValidationFailedException e) {
                results.add(ItemResult.rejected(i, Outcome.VALIDATION_FAILED, e.getMessage()));
            } catch (UnknownSegmentException e) {
                results.add(ItemResult.rejected(i, Outcome.UNKNOWN_SEGMENT, e.getMessage()));
            } catch (StoreUnavailableException e) {
                log.error("Store unavailable at batch item {}, skipping the remaining {} items",
                    i, requests.size() - i - 1, e);
                storeFailure = e;
                results.add(ItemResult.rejected(i, Outcome.STORE_UNAVAILABLE, e.getMessage()));
            }
        }

        BatchIngestResult result = BatchIngestResult.of(results);
        if (result.rejected() > 0) {
            log.warn("Batch ingest: {} accepted, {} rejected", result.accepted(), result.rejected());
        } else {
            log.info("Batch ingest: {} accepted", result.accepted());
        }
        return result;
    }

    /**
     * Streams a segment's observations inside the range, ordered by observed_at
     * (then obs_id).
     *
     * Rows are fetched page by page as the stream is consumed. Each call runs a
     * new query, so calling again on unchanged data yields the same sequence.
     */
    public Stream<SpeedObservationRecord> queryObservations(Long segmentId, TimeRange range) {
        if (segmentId == null) {
            throw new ValidationFailedException("segmentId is required");
        }
        TimeRange effective = range == null ? TimeRange.all() : range;

        ObservationPageIterator iterator = new ObservationPageIterator(
            observationRepository, segmentId, effective, properties.getQuery().getPageSize());

        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    public long countObservations() {
        try {
            return observationRepository.count();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Observation store unavailable", e);
        }
    }

    private void validate(ObservationRequest request) {
        if (request == null) {
            throw new ValidationFailedException("Observation is required");
        }
        if (request.segmentId() == null) {
            throw new ValidationFailedException("segmentId is required");
        }
        if (request.observedAt() == null) {
            throw new ValidationFailedException("observedAt is required");
        }
        Instant observedAt = request.observedAt().toInstant();
        if (observedAt.isBefore(TimeRange.EARLIEST) || !observedAt.isBefore(TimeRange.LATEST)) {
            // Unbounded queries are clipped to this window
            throw new ValidationFailedException("observedAt must be within ["
                + TimeRange.EARLIEST + ", " + TimeRange.LATEST + "), got " + observedAt);
        }
        requireNonNegative("speedKmh", request.speedKmh());
        requireNonNegative("durationS", request.durationS());
        requireNonNegative("distanceM", request.distanceM());
        if (request.provider() != null && request.provider().length() > MAX_PROVIDER_LENGTH) {
            throw new ValidationFailedException("provider must be at most " + MAX_PROVIDER_LENGTH + " characters");
        }
    }

    private static void requireNonNegative(String field, Double value) {
        if (value == null) {
            return;
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new ValidationFailedException(field + " must be a finite number, got " + value);
        }
        if (value < 0) {
            throw new ValidationFailedException(field + " must be >= 0, got " + value);
        }
    }

    private SpeedObservation toEntity(ObservationRequest request) {
        String provider = request.provider() == null || request.provider().isBlank()
            ? properties.getIngestion().getDefaultProvider()
            : request.provider();

        return SpeedObservation.builder()
            .segmentId(request.segmentId())
            .observedAt(request.observedAt().toInstant())
            .speedKmh(deriveSpeed(request))
            .durationS(request.durationS())
            .distanceM(request.distanceM())
            .provider(provider)
            .raw(request.raw())
            .build();
    }

    /**
     * Speed as sent, or distance / duration in km/h when the provider only sent
     * those two. Null when neither is possible.
     */
    static Double deriveSpeed(ObservationRequest request) {
        if (request.speedKmh() != null) {
            return request.speedKmh();
        }
        Double distance = request.distanceM();
        Double duration = request.durationS();
        if (distance == null || duration == null || duration <= 0) {
            return null;
        }
        return distance / duration * 3.6;
    }
}
