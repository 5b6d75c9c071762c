package com.shortspilot.orchestrator.model;

import java.time.LocalDate;

/**
 * Quota consumption for one reference-zone calendar day.
 *
 * A new day always starts a new entry; entries for past days are kept as-is.
 * {@code version} is the persisted version stamp used for stale-write detection.
 */
public record QuotaLedgerEntry(LocalDate date, long consumedUnits, long dailyBudget, long version) {

    public QuotaLedgerEntry {
        if (date == null) throw new IllegalArgumentException("date is required");
        if (consumedUnits < 0) throw new IllegalArgumentException("consumedUnits must be >= 0");
        if (consumedUnits > dailyBudget) {
            throw new IllegalArgumentException(
                    "consumedUnits " + consumedUnits + " exceeds dailyBudget " + dailyBudget);
        }
    }

    public static QuotaLedgerEntry fresh(LocalDate date, long dailyBudget) {
        return new QuotaLedgerEntry(date, 0, dailyBudget, 0);
    }

    public long remainingUnits()                { return dailyBudget - consumedUnits; }
    public QuotaLedgerEntry withConsumed(long c) { return new QuotaLedgerEntry(date, c, dailyBudget, version); }
    public QuotaLedgerEntry withVersion(long v)  { return new QuotaLedgerEntry(date, consumedUnits, dailyBudget, v); }
}
