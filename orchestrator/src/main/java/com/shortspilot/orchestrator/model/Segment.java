package com.shortspilot.orchestrator.model;

/**
 * One output unit derived from a WorkItem by the transform stage.
 *
 * @param index            1-based position; publish order follows it
 * @param sourceRange      slice of the source this segment covers
 * @param localArtifactRef opaque handle to the rendered file, owned by the media worker
 */
public record Segment(int index, SourceRange sourceRange, String localArtifactRef) {

    public Segment {
        if (index < 1) throw new IllegalArgumentException("segment index is 1-based, got " + index);
        if (sourceRange == null) throw new IllegalArgumentException("sourceRange is required");
    }
}
