package com.roadspeed.engine.scheduler;

import com.roadspeed.engine.config.RoadSpeedProperties;
import com.roadspeed.engine.config.RoadSpeedProperties.Materializer.RefreshPolicy;
import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.service.LatestSpeedMaterializer;
import com.roadspeed.engine.service.ObservationRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Decides when the latest-speed view is refreshed.
 *
 * Policies (roadspeed.materializer.refresh-policy):
 * - MANUAL: nothing here refreshes; callers use the API or the materializer directly
 * - SCHEDULED: fixed-rate refresh every refresh-interval-seconds
 * - ON_WRITE: every committed observation queues a background refresh, bursts
 *   coalesced by {@link LatestSpeedRefreshQueue}
 *
 * Independently of the policy, the view can be warmed once the application is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LatestSpeedRefreshScheduler {

    private final LatestSpeedMaterializer materializer;
    private final LatestSpeedRefreshQueue refreshQueue;
    private final RoadSpeedProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        RefreshPolicy policy = policy();
        if (!properties.getMaterializer().isRefreshOnStartup()) {
            log.info("Latest-speed view starts empty (refresh policy {})", policy);
            return;
        }

        log.info("Warming latest-speed view (refresh policy {})", policy);
        try {
            LatestSpeedSnapshot snapshot = materializer.refresh();
            log.info("Latest-speed view warmed: {} segments", snapshot.size());
        } catch (Exception e) {
            // Keep running; the view stays EMPTY until the next refresh succeeds
            log.error("Latest-speed warm-up failed", e);
        }
    }

    @Scheduled(fixedRateString = "${roadspeed.materializer.refresh-interval-seconds:60}",
               initialDelayString = "${roadspeed.materializer.refresh-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS)
    public void scheduledRefresh() {
        if (policy() != RefreshPolicy.SCHEDULED) {
            return;
        }
        try {
            materializer.refresh();
        } catch (Exception e) {
            log.error("Scheduled latest-speed refresh failed", e);
        }
    }

    @EventListener
    public void onObservationRecorded(ObservationRecordedEvent event) {
        if (policy() != RefreshPolicy.ON_WRITE) {
            return;
        }
        if (!refreshQueue.offer()) {
            log.debug("Refresh already queued, covers obsId={}", event.obsId());
            return;
        }
        refreshQueue.drain();
    }

    private RefreshPolicy policy() {
        return properties.getMaterializer().getRefreshPolicy();
    }
}
