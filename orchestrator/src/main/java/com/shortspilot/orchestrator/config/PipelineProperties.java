package com.shortspilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Scheduler, quota and segmentation settings ({@code shortspilot.pipeline.*}).
 *
 * <pre>
 * shortspilot:
 *   pipeline:
 *     daily-budget: 10000          # quota units per reference day
 *     publish-cost: 1600           # units charged per published segment
 *     max-items-per-run: 5         # stage advancements per invocation
 *     retry-ceiling: 3             # transient failures tolerated before FAILED
 *     reference-zone: America/Los_Angeles
 *     segment-seconds: 60
 *     min-tail-seconds: 10
 *     max-segments-per-item: 10
 * </pre>
 */
@ConfigurationProperties(prefix = "shortspilot.pipeline")
public record PipelineProperties(
        long   dailyBudget,
        long   publishCost,
        int    maxItemsPerRun,
        int    retryCeiling,
        ZoneId referenceZone,
        int    segmentSeconds,
        int    minTailSeconds,
        int    maxSegmentsPerItem
) {
    public PipelineProperties {
        if (dailyBudget <= 0)        throw new IllegalArgumentException("daily-budget must be > 0");
        if (publishCost <= 0)        throw new IllegalArgumentException("publish-cost must be > 0");
        if (publishCost > dailyBudget) {
            throw new IllegalArgumentException("publish-cost must not exceed daily-budget");
        }
        if (maxItemsPerRun <= 0)     throw new IllegalArgumentException("max-items-per-run must be > 0");
        if (retryCeiling < 0)        throw new IllegalArgumentException("retry-ceiling must be >= 0");
        if (segmentSeconds <= 0)     throw new IllegalArgumentException("segment-seconds must be > 0");
        if (minTailSeconds < 0)      throw new IllegalArgumentException("min-tail-seconds must be >= 0");
        if (maxSegmentsPerItem <= 0) throw new IllegalArgumentException("max-segments-per-item must be > 0");
        if (referenceZone == null)   referenceZone = ZoneId.of("America/Los_Angeles");
    }
}
