package com.shortspilot.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One rendered segment inside a {@link TransformResponse}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SegmentResult(
        int    index,
        double start_seconds,
        double duration_seconds,
        String artifact_ref
) {}
