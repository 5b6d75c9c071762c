package com.shortspilot.orchestrator.api.dto;

import com.shortspilot.orchestrator.service.RunSummary;

/**
 * Response body for POST /runs.
 */
public record RunResponse(
        String  outcome,
        int     eligible,
        int     advanced,
        int     failed,
        int     skipped,
        boolean quotaExhausted
) {
    public static RunResponse from(RunSummary summary) {
        return new RunResponse(
                summary.outcome().name(),
                summary.eligible(),
                summary.advanced(),
                summary.failed(),
                summary.skipped(),
                summary.quotaExhausted()
        );
    }
}
