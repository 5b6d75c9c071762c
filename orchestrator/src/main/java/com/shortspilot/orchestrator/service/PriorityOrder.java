package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.model.WorkItem;

import java.time.Instant;
import java.util.Comparator;

/**
 * Scheduling order for work items: highest priority first, then oldest
 * discovered first, then id so that equal records still sort the same way
 * on every run regardless of how the store iterates.
 */
public final class PriorityOrder {

    public static final Comparator<WorkItem> COMPARATOR =
            Comparator.comparingLong(WorkItem::getPriority).reversed()
                    .thenComparing(WorkItem::getCreatedAt,
                            Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                    .thenComparing(WorkItem::getId);

    private PriorityOrder() {}
}
