package com.shortspilot.orchestrator.api.dto;

import com.shortspilot.orchestrator.quota.QuotaUsage;

import java.time.LocalDate;

/**
 * Response body for GET /quota.
 */
public record QuotaResponse(LocalDate date, long consumedUnits, long dailyBudget, long remainingUnits) {

    public static QuotaResponse from(QuotaUsage usage) {
        return new QuotaResponse(usage.date(), usage.consumedUnits(),
                usage.dailyBudget(), usage.remainingUnits());
    }
}
