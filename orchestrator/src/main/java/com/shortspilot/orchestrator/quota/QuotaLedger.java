package com.shortspilot.orchestrator.quota;

import com.shortspilot.orchestrator.model.QuotaLedgerEntry;
import com.shortspilot.orchestrator.store.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Daily budget of publish cost units.
 *
 * The ledger keeps no state of its own: today's entry lives in the
 * {@link TrackingStore} and reservations are staged there as deltas, so a debit
 * becomes durable in the same commit as the publish record it pays for.
 * Reservations count staged deltas; {@link #currentUsage()} reports committed
 * units only.
 *
 * "Today" is the calendar day in the reference zone (the platform resets its
 * quota at midnight there). Rollover is lazy: the first access on a new day
 * starts a fresh entry; entries of earlier days are never touched again.
 */
public class QuotaLedger {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private final TrackingStore store;
    private final Clock         clock;
    private final ZoneId        referenceZone;
    private final long          dailyBudget;

    // Day of the last granted reservation; release() credits that day even
    // if midnight passed while the publish call was running.
    private LocalDate lastReservedOn;

    public QuotaLedger(TrackingStore store, Clock clock, ZoneId referenceZone, long dailyBudget) {
        if (dailyBudget <= 0) throw new IllegalArgumentException("dailyBudget must be > 0");
        this.store         = store;
        this.clock         = clock;
        this.referenceZone = referenceZone;
        this.dailyBudget   = dailyBudget;
    }

    /**
     * Reserve {@code cost} units for one publish attempt.
     *
     * @return true if granted (the debit is staged in the store); false if it
     *         would exceed today's budget, in which case nothing changes
     */
    public synchronized boolean tryReserve(long cost) {
        if (cost <= 0) throw new IllegalArgumentException("cost must be > 0, got " + cost);

        QuotaLedgerEntry today = today();
        long consumed = today.consumedUnits() + store.stagedLedgerDelta(today.date());
        if (consumed + cost > today.dailyBudget()) {
            log.info("Quota denied: {} + {} > {} for {}",
                    consumed, cost, today.dailyBudget(), today.date());
            return false;
        }
        store.stageLedgerDelta(today.date(), today.dailyBudget(), cost);
        lastReservedOn = today.date();
        return true;
    }

    /**
     * Compensate a granted reservation whose publish attempt failed.
     * The store never lets the entry drop below zero.
     */
    public synchronized void release(long cost) {
        LocalDate day = lastReservedOn != null ? lastReservedOn : currentDate();
        store.stageLedgerDelta(day, entryFor(day).dailyBudget(), -cost);
    }

    public synchronized QuotaUsage currentUsage() {
        QuotaLedgerEntry today = today();
        return new QuotaUsage(today.consumedUnits(), today.dailyBudget(), today.date());
    }

    public LocalDate currentDate() {
        return LocalDate.now(clock.withZone(referenceZone));
    }

    private QuotaLedgerEntry today() {
        return entryFor(currentDate());
    }

    private QuotaLedgerEntry entryFor(LocalDate date) {
        return store.ledgerEntry(date).orElseGet(() -> {
            log.debug("Starting quota ledger entry for {}", date);
            return QuotaLedgerEntry.fresh(date, dailyBudget);
        });
    }
}
