package com.shortspilot.orchestrator.store;

import com.shortspilot.orchestrator.model.QuotaLedgerEntry;
import com.shortspilot.orchestrator.model.WorkItem;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable mapping from item id to its lifecycle record, plus the quota ledger.
 *
 * Writes are two-phase: {@link #upsert} and {@link #stageLedgerDelta} stage
 * changes, {@link #commit} makes all staged changes durable in one atomic unit.
 * A successful commit is the only checkpoint the scheduler relies on when it
 * resumes after a crash or a new invocation.
 */
public interface TrackingStore {

    /**
     * Read every parseable item from durable storage.
     *
     * @throws StoreCorruptException     if the document itself cannot be parsed
     * @throws StoreUnavailableException if the document cannot be read
     */
    Map<String, WorkItem> load();

    Optional<WorkItem> find(String id);

    /** Ids of records that were present but unreadable at the last {@link #load}. */
    Set<String> corruptRecordIds();

    /**
     * Stage an item for the next commit after checking that the persisted
     * record still carries {@code item.getVersion()} (absent for version 0).
     *
     * @throws StaleWriteException if another writer advanced the record
     */
    void upsert(WorkItem item);

    /**
     * Read-only version check used before an irreversible external call.
     *
     * @throws StaleWriteException if the persisted record no longer matches
     */
    void verifyCurrent(WorkItem item);

    /** The committed ledger entry for {@code date}; staged deltas are not included. */
    Optional<QuotaLedgerEntry> ledgerEntry(LocalDate date);

    /** Net units staged for {@code date} and not yet committed. */
    long stagedLedgerDelta(LocalDate date);

    /**
     * Stage a change of {@code units} (negative to credit) to the ledger entry
     * for {@code date}. The ledger is a counter: commit adds the delta to
     * whatever is persisted at that moment, so concurrent debits never make
     * it stale.
     */
    void stageLedgerDelta(LocalDate date, long dailyBudget, long units);

    /**
     * Atomically persist all staged changes. Either every staged record is
     * written or none is.
     *
     * @throws StaleWriteException       if any staged item was changed concurrently
     * @throws StoreUnavailableException if the write fails
     */
    void commit();

    /** Drop all staged changes without writing. */
    void discard();
}
