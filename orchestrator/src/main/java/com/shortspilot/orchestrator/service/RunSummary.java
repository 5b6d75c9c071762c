package com.shortspilot.orchestrator.service;

/**
 * What one {@code runOnce} did.
 *
 * @param eligible       items that needed a stage when the run started
 * @param advanced       successful stage advancements (each published segment counts once)
 * @param failed         failed stage attempts that were recorded
 * @param skipped        items skipped because another writer changed them
 * @param quotaExhausted true if a publish reservation was denied
 * @param outcome        overall result, drives the exit status
 */
public record RunSummary(int eligible,
                         int advanced,
                         int failed,
                         int skipped,
                         boolean quotaExhausted,
                         RunOutcome outcome) {

    public static RunSummary fatal() {
        return new RunSummary(0, 0, 0, 0, false, RunOutcome.FATAL_STORE_ERROR);
    }

    public static RunSummary nothingEligible() {
        return new RunSummary(0, 0, 0, 0, false, RunOutcome.NOTHING_ELIGIBLE);
    }
}
