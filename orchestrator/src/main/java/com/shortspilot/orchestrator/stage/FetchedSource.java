package com.shortspilot.orchestrator.stage;

/**
 * Result of the fetch stage.
 *
 * @param artifactRef     handle of the downloaded source, owned by the media worker
 * @param durationSeconds length of the source, used to plan segments
 */
public record FetchedSource(String artifactRef, double durationSeconds) {}
