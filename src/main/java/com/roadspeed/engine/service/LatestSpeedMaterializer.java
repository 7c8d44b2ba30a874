package com.roadspeed.engine.service;

import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.dto.NetworkSpeedSummary;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import com.roadspeed.engine.entity.SpeedObservation;
import com.roadspeed.engine.exception.RefreshCancelledException;
import com.roadspeed.engine.exception.StoreUnavailableException;
import com.roadspeed.engine.repository.SpeedObservationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BinaryOperator;

/**
 * Serves the latest observation of every segment from an in-memory snapshot.
 *
 * Staleness contract:
 * The view is NOT updated when observations are written. It reflects the store
 * as of the last successful {@link #refresh()}, and is only as fresh as the
 * configured refresh policy makes it (see {@code roadspeed.materializer.refresh-policy}).
 * A refresh running concurrently with an insert may or may not include that
 * insert; the next refresh will.
 *
 * Refresh:
 * 1. Take a ticket (strictly increasing)
 * 2. One query in a read-only transaction returns every observation sitting at
 *    its segment's maximum observed_at, ties included. The sweep below runs
 *    after that transaction has ended.
 * 3. Sweep the rows into a new map; among ties the highest obs_id wins
 * 4. Publish the map as an immutable snapshot with one atomic swap, unless a
 *    refresh holding a newer ticket already published
 *
 * Readers always get a complete snapshot. An interrupted refresh throws
 * {@link RefreshCancelledException} and leaves the published snapshot alone.
 */
@Service
@Slf4j
public class LatestSpeedMaterializer {

    /**
     * Later observed_at wins; equal observed_at falls back to the higher obs_id.
     */
    static final Comparator<SpeedObservationRecord> RECENCY =
        Comparator.comparing(SpeedObservationRecord::observedAt)
            .thenComparing(SpeedObservationRecord::obsId);

    private static final BinaryOperator<SpeedObservationRecord> MOST_RECENT = BinaryOperator.maxBy(RECENCY);

    public enum State {
        /** No refresh has completed yet */
        EMPTY,
        /** At least one refresh is running; readers get the previous snapshot */
        REFRESHING,
        /** A snapshot is published and no refresh is running */
        READY
    }

    private final SpeedObservationRepository observationRepository;
    private final ObjectProvider<LatestSpeedListener> listeners;
    private final TransactionTemplate readTx;

    private final AtomicReference<LatestSpeedSnapshot> published = new AtomicReference<>(LatestSpeedSnapshot.EMPTY);
    private final AtomicLong tickets = new AtomicLong();
    private final AtomicInteger refreshesInFlight = new AtomicInteger();

    public LatestSpeedMaterializer(SpeedObservationRepository observationRepository,
                                   ObjectProvider<LatestSpeedListener> listeners,
                                   PlatformTransactionManager txManager) {
        this.observationRepository = observationRepository;
        this.listeners = listeners;
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
    }

    /**
     * Recomputes the latest observation of every segment and publishes the result.
     *
     * @return the snapshot readers see after this call: the one just built, or a
     *         newer one published by a refresh that started later
     * @throws RefreshCancelledException if the calling thread is interrupted during the sweep
     * @throws StoreUnavailableException if the database cannot be reached
     */
    public LatestSpeedSnapshot refresh() {
        long ticket = tickets.incrementAndGet();
        refreshesInFlight.incrementAndGet();
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();

        try {
            List<SpeedObservation> candidates = loadCandidates();

            Map<Long, SpeedObservationRecord> staged = new HashMap<>();
            for (SpeedObservation candidate : candidates) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Latest-speed refresh #{} cancelled after {} of {} rows; keeping snapshot #{}",
                        ticket, staged.size(), candidates.size(), published.get().version());
                    throw new RefreshCancelledException("Latest-speed refresh #" + ticket + " was cancelled");
                }
                staged.merge(candidate.getSegmentId(), SpeedObservationRecord.fromEntity(candidate), MOST_RECENT);
            }

            LatestSpeedSnapshot built = new LatestSpeedSnapshot(ticket, startedAt, staged);
            LatestSpeedSnapshot current = published.accumulateAndGet(built,
                (existing, proposed) -> proposed.version() > existing.version() ? proposed : existing);

            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            if (current != built) {
                log.info("Latest-speed refresh #{} superseded by #{} ({}ms)", ticket, current.version(), elapsedMs);
                return current;
            }

            log.info("Latest-speed refresh #{} published: {} segments from {} candidate rows in {}ms",
                ticket, built.size(), candidates.size(), elapsedMs);
            notifyListeners(built);
            return built;
        } finally {
            refreshesInFlight.decrementAndGet();
        }
    }

    /**
     * Latest observation of a segment as of the last refresh.
     */
    public Optional<SpeedObservationRecord> getLatest(Long segmentId) {
        if (segmentId == null) {
            return Optional.empty();
        }
        return published.get().get(segmentId);
    }

    /**
     * Latest observation per segment as of the last refresh, ordered by segment id.
     */
    public Map<Long, SpeedObservationRecord> getAllLatest() {
        return published.get().latestBySegment();
    }

    public LatestSpeedSnapshot currentSnapshot() {
        return published.get();
    }

    public NetworkSpeedSummary summary() {
        return NetworkSpeedSummary.of(published.get());
    }

    public State state() {
        if (refreshesInFlight.get() > 0) {
            return State.REFRESHING;
        }
        return published.get().isInitial() ? State.EMPTY : State.READY;
    }

    private List<SpeedObservation> loadCandidates() {
        try {
            return readTx.execute(status -> observationRepository.findLatestCandidatesPerSegment());
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Observation store unavailable during latest-speed refresh", e);
        }
    }

    private void notifyListeners(LatestSpeedSnapshot snapshot) {
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onSnapshotPublished(snapshot);
            } catch (RuntimeException e) {
                // The snapshot stays published; listeners are downstream copies
                log.error("Latest-speed listener {} failed for snapshot #{}",
                    listener.getClass().getSimpleName(), snapshot.version(), e);
            }
        });
    }
}
