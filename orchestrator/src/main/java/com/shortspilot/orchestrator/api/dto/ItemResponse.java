package com.shortspilot.orchestrator.api.dto;

import com.shortspilot.orchestrator.model.WorkItem;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for GET /items and GET /items/{id}.
 */
public record ItemResponse(
        String               id,
        String               title,
        String               status,
        long                 priority,
        int                  segments,
        Map<Integer, String> publishedRefs,
        int                  retryCount,
        String               lastError,
        Instant              createdAt,
        Instant              updatedAt
) {
    public static ItemResponse from(WorkItem item) {
        return new ItemResponse(
                item.getId(),
                item.getTitle(),
                item.getStatus().name(),
                item.getPriority(),
                item.getSegments().size(),
                item.getPublishedRefs(),
                item.getRetryCount(),
                item.getLastError(),
                item.getCreatedAt(),
                item.getUpdatedAt()
        );
    }
}
