package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.model.SourceRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a source of known duration into consecutive segment ranges.
 *
 * Every segment is {@code segmentSeconds} long except possibly the last one.
 * A trailing remainder shorter than {@code minTailSeconds} is dropped rather
 * than published as a stub. The plan never exceeds {@code maxSegments}.
 */
public class SegmentPlanner {

    private final int segmentSeconds;
    private final int minTailSeconds;
    private final int maxSegments;

    public SegmentPlanner(int segmentSeconds, int minTailSeconds, int maxSegments) {
        this.segmentSeconds = segmentSeconds;
        this.minTailSeconds = minTailSeconds;
        this.maxSegments    = maxSegments;
    }

    public List<SourceRange> plan(double durationSeconds) {
        List<SourceRange> ranges = new ArrayList<>();
        if (!(durationSeconds > 0)) return ranges;

        int fullSegments = (int) Math.floor(durationSeconds / segmentSeconds);
        double remainder = durationSeconds - (double) fullSegments * segmentSeconds;

        for (int i = 0; i < fullSegments && ranges.size() < maxSegments; i++) {
            ranges.add(new SourceRange((double) i * segmentSeconds, segmentSeconds));
        }
        if (remainder > 0 && remainder >= minTailSeconds && ranges.size() < maxSegments) {
            ranges.add(new SourceRange((double) fullSegments * segmentSeconds, remainder));
        }
        return ranges;
    }
}
