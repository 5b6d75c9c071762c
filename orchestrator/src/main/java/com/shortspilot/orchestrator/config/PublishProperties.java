package com.shortspilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Metadata attached to every published segment ({@code shortspilot.publish.*}).
 *
 * The description template may use {title}, {part}, {total} and {url}.
 */
@ConfigurationProperties(prefix = "shortspilot.publish")
public record PublishProperties(List<String> hashtags, List<String> tags, String descriptionTemplate) {

    public PublishProperties {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
        tags     = tags == null ? List.of() : List.copyOf(tags);
        if (descriptionTemplate == null) descriptionTemplate = "{title} - Part {part}/{total}";
    }
}
