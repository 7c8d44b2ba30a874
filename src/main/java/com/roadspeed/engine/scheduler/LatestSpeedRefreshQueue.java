package com.roadspeed.engine.scheduler;

import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.service.LatestSpeedMaterializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * At most one pending background refresh of the latest-speed view.
 *
 * A writer calls {@link #offer()} and, only if it returns true, {@link #drain()}.
 * The drain clears the flag right before it reads the store, so a writer that
 * finds the flag set is already covered by the pending refresh.
 *
 * {@link #drain()} runs on the Spring async executor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LatestSpeedRefreshQueue {

    private final LatestSpeedMaterializer materializer;
    private final AtomicBoolean queued = new AtomicBoolean(false);

    /**
     * @return true if the caller must submit the refresh, false if one is already pending
     */
    public boolean offer() {
        return queued.compareAndSet(false, true);
    }

    @Async
    public CompletableFuture<LatestSpeedSnapshot> drain() {
        queued.set(false);
        try {
            return CompletableFuture.completedFuture(materializer.refresh());
        } catch (RuntimeException e) {
            log.error("Background latest-speed refresh failed", e);
            throw e;
        }
    }

    public boolean isQueued() {
        return queued.get();
    }
}
