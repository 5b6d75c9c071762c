package com.shortspilot.orchestrator.quota;

import java.time.LocalDate;

/** Snapshot of today's quota consumption, for status endpoints and logs. */
public record QuotaUsage(long consumedUnits, long dailyBudget, LocalDate date) {

    public long remainingUnits() { return dailyBudget - consumedUnits; }
}
