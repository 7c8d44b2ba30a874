package com.roadspeed.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Externalised settings under the {@code roadspeed} prefix.
 */
@Component
@ConfigurationProperties(prefix = "roadspeed")
@Data
public class RoadSpeedProperties {

    private Ingestion ingestion = new Ingestion();
    private Query query = new Query();
    private Materializer materializer = new Materializer();
    private Cache cache = new Cache();

    @Data
    public static class Ingestion {
        /** Provider recorded when an observation does not name one */
        private String defaultProvider = "google_routes";
        private int maxBatchSize = 500;
    }

    @Data
    public static class Query {
        /** Rows fetched per round trip when streaming observations */
        private int pageSize = 200;
    }

    @Data
    public static class Materializer {
        private RefreshPolicy refreshPolicy = RefreshPolicy.MANUAL;
        private long refreshIntervalSeconds = 60;
        private boolean refreshOnStartup = true;

        public enum RefreshPolicy {
            /** Only explicit refresh calls */
            MANUAL,
            /** Fixed-rate refresh every refreshIntervalSeconds */
            SCHEDULED,
            /** Asynchronous refresh after each committed observation, bursts coalesced */
            ON_WRITE
        }
    }

    @Data
    public static class Cache {
        private Redis redis = new Redis();

        @Data
        public static class Redis {
            private boolean enabled = false;
            private String keyPrefix = "latest-speed";
            private long ttlMinutes = 60;
        }
    }
}
