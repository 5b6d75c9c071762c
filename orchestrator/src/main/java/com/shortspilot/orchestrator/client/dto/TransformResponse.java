package com.shortspilot.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST /transform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransformResponse(List<SegmentResult> segments) {}
