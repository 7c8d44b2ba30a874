package com.roadspeed.engine.service;

import com.roadspeed.engine.dto.SpeedObservationRecord;
import com.roadspeed.engine.dto.TimeRange;
import com.roadspeed.engine.entity.SpeedObservation;
import com.roadspeed.engine.exception.StoreUnavailableException;
import com.roadspeed.engine.repository.SpeedObservationRepository;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks one segment's observations in (observed_at, obs_id) order, fetching a
 * page only when the previous one is used up.
 *
 * Not thread-safe; one iterator per consumer.
 */
class ObservationPageIterator implements Iterator<SpeedObservationRecord> {

    private final SpeedObservationRepository repository;
    private final Long segmentId;
    private final TimeRange range;
    private final int pageSize;

    private Instant cursorObservedAt;
    private long cursorId = 0L;
    private Iterator<SpeedObservation> page = Collections.emptyIterator();
    private boolean exhausted = false;

    ObservationPageIterator(SpeedObservationRepository repository, Long segmentId, TimeRange range, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        this.repository = repository;
        this.segmentId = segmentId;
        this.range = range;
        this.pageSize = pageSize;
        this.cursorObservedAt = range.from();
    }

    @Override
    public boolean hasNext() {
        while (!page.hasNext() && !exhausted) {
            fetchNextPage();
        }
        return page.hasNext();
    }

    @Override
    public SpeedObservationRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return SpeedObservationRecord.fromEntity(page.next());
    }

    private void fetchNextPage() {
        List<SpeedObservation> rows;
        try {
            rows = repository.findPageAfter(
                segmentId, range.from(), range.to(), cursorObservedAt, cursorId, PageRequest.of(0, pageSize));
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Observation store unavailable while reading segment " + segmentId, e);
        }

        if (rows.size() < pageSize) {
            exhausted = true;
        }
        if (!rows.isEmpty()) {
            SpeedObservation last = rows.get(rows.size() - 1);
            cursorObservedAt = last.getObservedAt();
            cursorId = last.getId();
        }
        page = rows.iterator();
    }
}
