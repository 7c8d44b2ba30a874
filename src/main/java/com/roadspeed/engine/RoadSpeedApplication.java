package com.roadspeed.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Road Speed Engine.
 *
 * Flow:
 * 1. Segments are registered or imported from GeoJSON
 * 2. Providers push speed observations, validated and appended to the log
 * 3. The latest-speed view is recomputed from the log on refresh
 * 4. Clients read the view; it is optionally mirrored to Redis
 *
 * {@code @EnableScheduling} drives the SCHEDULED refresh policy and
 * {@code @EnableAsync} the background refreshes of the ON_WRITE policy.
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class RoadSpeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoadSpeedApplication.class, args);
    }
}
