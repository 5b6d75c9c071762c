package com.shortspilot.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /fetch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchResponse(
        String artifact_ref,
        double duration_seconds
) {}
