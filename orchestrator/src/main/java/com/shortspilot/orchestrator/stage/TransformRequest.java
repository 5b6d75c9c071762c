package com.shortspilot.orchestrator.stage;

import com.shortspilot.orchestrator.model.SourceRange;
import com.shortspilot.orchestrator.model.WorkItem;

import java.util.List;

/**
 * Input of the transform stage: the fetched item plus the planned ranges.
 * Range {@code i} of the list becomes segment index {@code i + 1}.
 */
public record TransformRequest(WorkItem item, List<SourceRange> plannedRanges) {

    public TransformRequest {
        plannedRanges = List.copyOf(plannedRanges);
    }
}
