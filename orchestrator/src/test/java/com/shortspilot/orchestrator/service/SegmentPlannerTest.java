package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.model.SourceRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentPlannerTest {

    private final SegmentPlanner planner = new SegmentPlanner(60, 10, 10);

    @Test
    void plan_exactMultiple_givesFullSegmentsOnly() {
        List<SourceRange> plan = planner.plan(180);

        assertThat(plan).hasSize(3);
        assertThat(plan).extracting(SourceRange::startSeconds).containsExactly(0.0, 60.0, 120.0);
        assertThat(plan).allMatch(r -> r.durationSeconds() == 60);
    }

    @Test
    void plan_tailOfAtLeastTenSeconds_isKept() {
        List<SourceRange> plan = planner.plan(130);

        assertThat(plan).hasSize(3);
        assertThat(plan.get(2)).isEqualTo(new SourceRange(120, 10));
    }

    @Test
    void plan_shortTail_isDropped() {
        assertThat(planner.plan(129.5)).hasSize(2);
    }

    @Test
    void plan_sourceShorterThanOneSegment_usesWholeSourceIfLongEnough() {
        assertThat(planner.plan(45)).containsExactly(new SourceRange(0, 45));
        assertThat(planner.plan(9)).isEmpty();
    }

    @Test
    void plan_longSource_isCappedAtMaxSegments() {
        List<SourceRange> plan = planner.plan(3600);

        assertThat(plan).hasSize(10);
        assertThat(plan.get(9).endSeconds()).isEqualTo(600.0);
    }

    @Test
    void plan_nonPositiveDuration_isEmpty() {
        assertThat(planner.plan(0)).isEmpty();
        assertThat(planner.plan(-5)).isEmpty();
    }
}
