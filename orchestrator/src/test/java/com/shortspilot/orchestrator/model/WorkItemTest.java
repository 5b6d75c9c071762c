package com.shortspilot.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkItemTest {

    private static final Instant T0 = Instant.parse("2026-10-19T12:00:00Z");

    // ------------------------------------------------------------------
    // ItemStatus
    // ------------------------------------------------------------------

    @Test
    void canAdvanceTo_onlyNextStateOrFailed() {
        assertThat(ItemStatus.DISCOVERED.canAdvanceTo(ItemStatus.FETCHED)).isTrue();
        assertThat(ItemStatus.DISCOVERED.canAdvanceTo(ItemStatus.TRANSFORMED)).isFalse();
        assertThat(ItemStatus.FETCHED.canAdvanceTo(ItemStatus.DISCOVERED)).isFalse();
        assertThat(ItemStatus.TRANSFORMED.canAdvanceTo(ItemStatus.COMPLETED)).isTrue();
        assertThat(ItemStatus.TRANSFORMED.canAdvanceTo(ItemStatus.FAILED)).isTrue();
    }

    @Test
    void terminalStates_acceptNoTransition() {
        for (ItemStatus next : ItemStatus.values()) {
            assertThat(ItemStatus.COMPLETED.canAdvanceTo(next)).isFalse();
            assertThat(ItemStatus.FAILED.canAdvanceTo(next)).isFalse();
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void happyPath_discoveredToCompleted() {
        WorkItem item = new WorkItem("v1", "Title", "https://example.com/v1", 100, T0);

        item.markFetched("src/v1.mp4", 130);
        item.markTransformed(List.of(segment(2), segment(1)));
        item.recordPublished(1, "r1");
        item.recordPublished(2, "r2");
        item.advanceTo(ItemStatus.COMPLETED);

        assertThat(item.getStatus()).isEqualTo(ItemStatus.COMPLETED);
        assertThat(item.getSegments()).extracting(Segment::index).containsExactly(1, 2);
        assertThat(item.getPublishedRefs()).containsEntry(1, "r1").containsEntry(2, "r2");
        assertThat(item.allSegmentsPublished()).isTrue();
    }

    @Test
    void advanceTo_skippingAState_throwsAndKeepsStatus() {
        WorkItem item = new WorkItem("v1", "Title", null, 0, T0);

        assertThatThrownBy(() -> item.advanceTo(ItemStatus.TRANSFORMED))
                .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(item.getStatus()).isEqualTo(ItemStatus.DISCOVERED);
    }

    @Test
    void recordPublished_sameIndexTwice_throws() {
        WorkItem item = transformed(2);
        item.recordPublished(1, "r1");

        assertThatThrownBy(() -> item.recordPublished(1, "other"))
                .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(item.getPublishedRefs()).containsEntry(1, "r1");
    }

    @Test
    void recordPublished_unknownIndex_throws() {
        WorkItem item = transformed(2);

        assertThatThrownBy(() -> item.recordPublished(3, "r3"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pendingSegments_excludesPublishedInIndexOrder() {
        WorkItem item = transformed(3);
        item.recordPublished(2, "r2");

        assertThat(item.pendingSegments()).extracting(Segment::index).containsExactly(1, 3);
        assertThat(item.allSegmentsPublished()).isFalse();
    }

    @Test
    void markTransformed_twice_throws() {
        WorkItem item = transformed(1);

        assertThatThrownBy(() -> item.markTransformed(List.of(segment(1))))
                .isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    void fail_fromCompleted_throwsAndLeavesErrorUntouched() {
        WorkItem item = transformed(1);
        item.recordPublished(1, "r1");
        item.advanceTo(ItemStatus.COMPLETED);

        assertThatThrownBy(() -> item.fail("late error"))
                .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(item.getLastError()).isNull();
        assertThat(item.getStatus()).isEqualTo(ItemStatus.COMPLETED);
    }

    @Test
    void recordFailure_countsWithoutStatusChange() {
        WorkItem item = new WorkItem("v1", "Title", null, 0, T0);

        item.recordFailure("timeout");
        item.recordFailure("timeout again");

        assertThat(item.getStatus()).isEqualTo(ItemStatus.DISCOVERED);
        assertThat(item.getRetryCount()).isEqualTo(2);
        assertThat(item.getLastError()).isEqualTo("timeout again");

        item.resetRetries();
        assertThat(item.getRetryCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WorkItem transformed(int segments) {
        WorkItem item = new WorkItem("v1", "Title", null, 0, T0);
        item.markFetched("src/v1.mp4", segments * 60.0);
        List<Segment> list = new ArrayList<>();
        for (int i = 1; i <= segments; i++) list.add(segment(i));
        item.markTransformed(list);
        return item;
    }

    private static Segment segment(int index) {
        return new Segment(index, new SourceRange((index - 1) * 60.0, 60), "seg/" + index + ".mp4");
    }
}
