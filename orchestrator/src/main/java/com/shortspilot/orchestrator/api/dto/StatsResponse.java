package com.shortspilot.orchestrator.api.dto;

import java.util.Map;

/**
 * Response body for GET /items/stats: item count per status.
 *
 * @param unreadable records present in the store that could not be parsed
 */
public record StatsResponse(int total, Map<String, Long> byStatus, int unreadable) {}
