package com.roadspeed.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI roadSpeedOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Road Speed Engine API")
                        .description("Ingestion of road-segment speed observations and a latest-speed-per-segment view.\n\n" +
                                "## Flow\n\n" +
                                "1. Register segments (`/api/segments`, or import a GeoJSON FeatureCollection)\n" +
                                "2. Providers push observations (`/api/observations`, `/api/observations/batch`)\n" +
                                "3. The latest-speed view is refreshed (`POST /api/latest/refresh`, or by policy)\n" +
                                "4. Clients read `/api/latest`\n\n" +
                                "## Staleness\n\n" +
                                "The latest-speed view is a materialized snapshot. It only changes when a refresh runs. " +
                                "The refresh policy is set with `roadspeed.materializer.refresh-policy` " +
                                "(MANUAL, SCHEDULED or ON_WRITE); `GET /api/latest/status` reports the snapshot age.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
