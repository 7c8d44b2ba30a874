package com.roadspeed.engine.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.roadspeed.engine.config.RoadSpeedProperties;
import com.roadspeed.engine.dto.LatestSpeedSnapshot;
import com.roadspeed.engine.dto.SpeedObservationRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisLatestSpeedMirrorTest {

    private static final Instant OBSERVED_AT = Instant.parse("2024-05-01T10:05:00Z");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    @Mock
    private SetOperations<String, String> setOps;

    private RedisLatestSpeedMirror mirror;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOps);

        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        mirror = new RedisLatestSpeedMirror(redisTemplate, objectMapper, new RoadSpeedProperties());
    }

    @Test
    void shouldWriteEverySegmentWithTtl() {
        mirror.onSnapshotPublished(snapshot(1L, 35.0));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("latest-speed:segment:1"), json.capture(), eq(60L), eq(TimeUnit.MINUTES));
        verify(valueOps).set(eq("latest-speed:segment:2"), anyString(), eq(60L), eq(TimeUnit.MINUTES));
        verify(valueOps).set("latest-speed:version", "1", 60L, TimeUnit.MINUTES);

        assertThat(json.getValue())
            .contains("\"segmentId\":1")
            .contains("\"congestion\":\"MODERATE\"")
            .contains("\"color\":\"#F9A825\"");
    }

    @Test
    void shouldSwapSegmentSetInThroughStagingKey() {
        mirror.onSnapshotPublished(snapshot(1L, 35.0));

        InOrder inOrder = inOrder(redisTemplate, setOps);
        inOrder.verify(redisTemplate).delete("latest-speed:segments:staging");
        inOrder.verify(setOps).add("latest-speed:segments:staging", "1", "2");
        inOrder.verify(redisTemplate).expire("latest-speed:segments:staging", 60L, TimeUnit.MINUTES);
        inOrder.verify(redisTemplate).rename("latest-speed:segments:staging", "latest-speed:segments");
        verify(redisTemplate, never()).delete("latest-speed:segments");
        verify(setOps, never()).add(eq("latest-speed:segments"), any(String[].class));
    }

    @Test
    void shouldDropSegmentSetForEmptySnapshot() {
        mirror.onSnapshotPublished(new LatestSpeedSnapshot(3L, OBSERVED_AT, Map.of()));

        verify(redisTemplate).delete("latest-speed:segments");
        verify(redisTemplate, never()).rename(anyString(), anyString());
        verify(valueOps).set("latest-speed:version", "3", 60L, TimeUnit.MINUTES);
    }

    @Test
    void shouldIgnoreSnapshotOlderThanLastWritten() {
        mirror.onSnapshotPublished(snapshot(2L, 35.0));
        mirror.onSnapshotPublished(snapshot(1L, 10.0));

        verify(valueOps).set("latest-speed:version", "2", 60L, TimeUnit.MINUTES);
        verify(valueOps, never()).set("latest-speed:version", "1", 60L, TimeUnit.MINUTES);
    }

    @Test
    void shouldBuildKeysFromConfiguredPrefix() {
        RoadSpeedProperties properties = new RoadSpeedProperties();
        properties.getCache().getRedis().setKeyPrefix("cali");
        RedisLatestSpeedMirror prefixed = new RedisLatestSpeedMirror(redisTemplate, new ObjectMapper(), properties);

        assertThat(prefixed.segmentKey(9L)).isEqualTo("cali:segment:9");
        assertThat(prefixed.segmentsKey()).isEqualTo("cali:segments");
        assertThat(prefixed.stagingSegmentsKey()).isEqualTo("cali:segments:staging");
        assertThat(prefixed.versionKey()).isEqualTo("cali:version");
    }

    private static LatestSpeedSnapshot snapshot(long version, double firstSegmentSpeed) {
        return new LatestSpeedSnapshot(version, OBSERVED_AT, Map.of(
            1L, record(10L, 1L, firstSegmentSpeed),
            2L, record(11L, 2L, 50.0)
        ));
    }

    private static SpeedObservationRecord record(Long obsId, Long segmentId, double speed) {
        return new SpeedObservationRecord(obsId, segmentId, OBSERVED_AT, speed, null, null, "google_routes", null, null);
    }
}
