package com.roadspeed.engine.service;

import com.roadspeed.engine.dto.LatestSpeedSnapshot;

/**
 * Notified after a new latest-speed snapshot has been published.
 *
 * Called on the refreshing thread. Implementations may see snapshots from
 * concurrent refreshes out of version order and must ignore older ones.
 */
public interface LatestSpeedListener {

    void onSnapshotPublished(LatestSpeedSnapshot snapshot);
}
