package com.shortspilot.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /publish.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublishResponse(String remote_id) {}
