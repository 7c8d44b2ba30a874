package com.roadspeed.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadspeed.engine.config.RoadSpeedProperties;
import com.roadspeed.engine.dto.LatestSpeedRecord;
import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import com.roadspeed.engine.service.LatestSpeedListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Copies every published latest-speed snapshot into Redis, so map clients and
 * other instances can read it without going through this service.
 *
 * Redis layout (prefix defaults to "latest-speed"):
 * - {prefix}:segment:{segmentId} -> JSON of {@link LatestSpeedRecord}
 * - {prefix}:segments            -> set of segment ids in the snapshot
 * - {prefix}:version             -> snapshot version
 * All keys expire after roadspeed.cache.redis.ttl-minutes.
 *
 * The id set is built under {prefix}:segments:staging and renamed over the live
 * key, so readers never see it half-written. Snapshots older than the last one
 * written are ignored.
 */
@Component
@ConditionalOnProperty(prefix = "roadspeed.cache.redis", name = "enabled", havingValue = "true")
@Slf4j
public class RedisLatestSpeedMirror implements LatestSpeedListener {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final long ttlMinutes;

    private long lastWrittenVersion = 0L;

    public RedisLatestSpeedMirror(StringRedisTemplate stringRedisTemplate,
                                  ObjectMapper objectMapper,
                                  RoadSpeedProperties properties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getCache().getRedis().getKeyPrefix();
        this.ttlMinutes = properties.getCache().getRedis().getTtlMinutes();
    }

    @Override
    public synchronized void onSnapshotPublished(LatestSpeedSnapshot snapshot) {
        if (snapshot.version() <= lastWrittenVersion) {
            log.debug("Skipping snapshot #{}, #{} already mirrored", snapshot.version(), lastWrittenVersion);
            return;
        }

        List<String> segmentIds = new ArrayList<>();
        for (Map.Entry<Long, SpeedObservationRecord> entry : snapshot.latestBySegment().entrySet()) {
            try {
                String json = objectMapper.writeValueAsString(LatestSpeedRecord.from(entry.getValue()));
                stringRedisTemplate.opsForValue().set(segmentKey(entry.getKey()), json, ttlMinutes, TimeUnit.MINUTES);
                segmentIds.add(String.valueOf(entry.getKey()));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialise latest speed of segment {}", entry.getKey(), e);
            }
        }

        if (segmentIds.isEmpty()) {
            stringRedisTemplate.delete(segmentsKey());
        } else {
            // RENAME replaces the live set in one step and carries the staging key's TTL over
            String staging = stagingSegmentsKey();
            stringRedisTemplate.delete(staging);
            stringRedisTemplate.opsForSet().add(staging, segmentIds.toArray(new String[0]));
            stringRedisTemplate.expire(staging, ttlMinutes, TimeUnit.MINUTES);
            stringRedisTemplate.rename(staging, segmentsKey());
        }
        stringRedisTemplate.opsForValue().set(versionKey(), String.valueOf(snapshot.version()), ttlMinutes, TimeUnit.MINUTES);

        lastWrittenVersion = snapshot.version();
        log.info("Mirrored latest-speed snapshot #{} to Redis ({} segments)", snapshot.version(), segmentIds.size());
    }

    String segmentKey(Long segmentId) {
        return keyPrefix + ":segment:" + segmentId;
    }

    String segmentsKey() {
        return keyPrefix + ":segments";
    }

    String stagingSegmentsKey() {
        return keyPrefix + ":segments:staging";
    }

    String versionKey() {
        return keyPrefix + ":version";
    }
}
