package com.shortspilot.orchestrator.quota;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortspilot.orchestrator.MutableClock;
import com.shortspilot.orchestrator.store.JsonFileTrackingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaLedgerTest {

    private static final ZoneId LA   = ZoneId.of("America/Los_Angeles");
    // 05:00 in Los Angeles on 2026-10-19 (PDT, UTC-7)
    private static final Instant T0  = Instant.parse("2026-10-19T12:00:00Z");
    private static final long BUDGET = 10_000;
    private static final long COST   = 1_600;

    @TempDir Path dir;

    MutableClock          clock;
    JsonFileTrackingStore store;
    QuotaLedger           ledger;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock(T0);
        store  = new JsonFileTrackingStore(dir.resolve("tracking.json"), new ObjectMapper(), clock);
        ledger = new QuotaLedger(store, clock, LA, BUDGET);
    }

    @Test
    void tryReserve_untilBudget_grantsSixThenDenies() {
        for (int i = 0; i < 6; i++) {
            assertThat(ledger.tryReserve(COST)).as("reservation %d", i + 1).isTrue();
            store.commit();
        }

        assertThat(ledger.tryReserve(COST)).isFalse();
        assertThat(ledger.currentUsage().consumedUnits()).isEqualTo(9_600);
        assertThat(ledger.currentUsage().remainingUnits()).isEqualTo(400);
    }

    @Test
    void tryReserve_denied_changesNothing() {
        for (int i = 0; i < 6; i++) {
            ledger.tryReserve(COST);
        }
        store.commit();

        ledger.tryReserve(COST);
        ledger.tryReserve(COST);

        assertThat(ledger.currentUsage().consumedUnits()).isEqualTo(9_600);
    }

    @Test
    void consumption_isVisibleToANewLedgerAfterCommit() {
        ledger.tryReserve(COST);
        store.commit();

        JsonFileTrackingStore reopened =
                new JsonFileTrackingStore(dir.resolve("tracking.json"), new ObjectMapper(), clock);
        QuotaLedger fresh = new QuotaLedger(reopened, clock, LA, BUDGET);

        assertThat(fresh.currentUsage().consumedUnits()).isEqualTo(COST);
    }

    @Test
    void uncommittedReservation_isLostOnDiscard() {
        ledger.tryReserve(COST);
        store.discard();

        assertThat(ledger.currentUsage().consumedUnits()).isZero();
    }

    @Test
    void currentUsage_reportsCommittedUnitsOnly() {
        ledger.tryReserve(COST);
        store.commit();
        ledger.tryReserve(COST);

        assertThat(ledger.currentUsage().consumedUnits()).isEqualTo(COST);

        store.discard();
        assertThat(ledger.currentUsage().consumedUnits()).isEqualTo(COST);
    }

    @Test
    void tryReserve_countsStagedReservationsAgainstTheBudget() {
        for (int i = 0; i < 6; i++) {
            assertThat(ledger.tryReserve(COST)).isTrue();
        }

        assertThat(ledger.tryReserve(COST)).isFalse();
    }

    @Test
    void commit_addsToDebitsCommittedByAnotherWriterMeanwhile() {
        JsonFileTrackingStore otherStore =
                new JsonFileTrackingStore(dir.resolve("tracking.json"), new ObjectMapper(), clock);
        QuotaLedger other = new QuotaLedger(otherStore, clock, LA, BUDGET);

        ledger.tryReserve(COST);
        other.tryReserve(COST);
        otherStore.commit();
        store.commit();

        assertThat(ledger.currentUsage().consumedUnits()).isEqualTo(2 * COST);
    }

    // ------------------------------------------------------------------
    // Day rollover
    // ------------------------------------------------------------------

    @Test
    void rollover_happensAtReferenceZoneMidnight() {
        for (int i = 0; i < 6; i++) {
            ledger.tryReserve(COST);
            store.commit();
        }

        // 23:59 in Los Angeles, already the next day in UTC
        clock.set(Instant.parse("2026-10-20T06:59:00Z"));
        assertThat(ledger.currentDate()).isEqualTo(LocalDate.of(2026, 10, 19));
        assertThat(ledger.tryReserve(COST)).isFalse();

        // 00:01 in Los Angeles
        clock.set(Instant.parse("2026-10-20T07:01:00Z"));
        assertThat(ledger.tryReserve(COST)).isTrue();
        store.commit();

        QuotaUsage usage = ledger.currentUsage();
        assertThat(usage.date()).isEqualTo(LocalDate.of(2026, 10, 20));
        assertThat(usage.consumedUnits()).isEqualTo(COST);
        assertThat(store.ledgerEntry(LocalDate.of(2026, 10, 19)).orElseThrow().consumedUnits())
                .isEqualTo(9_600);
    }

    // ------------------------------------------------------------------
    // release()
    // ------------------------------------------------------------------

    @Test
    void release_afterFailedPublish_restoresUnits() {
        ledger.tryReserve(COST);
        store.commit();
        ledger.tryReserve(COST);

        ledger.release(COST);
        store.commit();

        assertThat(ledger.currentUsage().consumedUnits()).isEqualTo(COST);
    }

    @Test
    void release_creditsTheDayOfTheReservation() {
        ledger.tryReserve(COST);
        store.commit();

        clock.set(Instant.parse("2026-10-20T08:00:00Z"));
        ledger.release(COST);
        store.commit();

        assertThat(store.ledgerEntry(LocalDate.of(2026, 10, 19)).orElseThrow().consumedUnits()).isZero();
        assertThat(ledger.currentUsage().consumedUnits()).isZero();
    }

    @Test
    void release_neverGoesBelowZero() {
        ledger.release(COST);
        store.commit();

        assertThat(ledger.currentUsage().consumedUnits()).isZero();
    }

    @Test
    void tryReserve_nonPositiveCost_throws() {
        assertThatThrownBy(() -> ledger.tryReserve(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
