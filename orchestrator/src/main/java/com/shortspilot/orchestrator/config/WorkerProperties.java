package com.shortspilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Media worker sidecar that implements discovery, fetch, transform and publish.
 *
 * @param baseUrl        e.g. http://media-worker:8000
 * @param connectTimeout TCP connect timeout
 * @param requestTimeout per-call deadline; transcoding a long source can take minutes
 */
@ConfigurationProperties(prefix = "shortspilot.worker")
public record WorkerProperties(String baseUrl, Duration connectTimeout, Duration requestTimeout) {

    public WorkerProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8000";
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (requestTimeout == null) requestTimeout = Duration.ofMinutes(15);
    }
}
