package com.shortspilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/** Location of the tracking document ({@code shortspilot.store.path}). */
@ConfigurationProperties(prefix = "shortspilot.store")
public record StoreProperties(Path path) {

    public StoreProperties {
        if (path == null) path = Path.of("data", "tracking.json");
    }
}
