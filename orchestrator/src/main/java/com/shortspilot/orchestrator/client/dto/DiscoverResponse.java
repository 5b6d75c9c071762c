package com.shortspilot.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from GET /discover.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoverResponse(List<Entry> items) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String id, long priority, String title, String source_url) {}
}
