package com.shortspilot.orchestrator.stage;

import java.util.List;

/** Title, description and tags sent along with one published segment. */
public record PublishMetadata(String title, String description, List<String> tags) {

    public PublishMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
