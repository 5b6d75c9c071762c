package com.shortspilot.orchestrator.model;

/**
 * Slice of the source video that a {@link Segment} was cut from, in seconds.
 */
public record SourceRange(double startSeconds, double durationSeconds) {

    public SourceRange {
        if (startSeconds < 0) throw new IllegalArgumentException("startSeconds must be >= 0");
        if (durationSeconds <= 0) throw new IllegalArgumentException("durationSeconds must be > 0");
    }

    public double endSeconds() { return startSeconds + durationSeconds; }
}
