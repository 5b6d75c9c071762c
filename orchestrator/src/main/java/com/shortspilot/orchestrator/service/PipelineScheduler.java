package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.config.PipelineProperties;
import com.shortspilot.orchestrator.model.ItemStatus;
import com.shortspilot.orchestrator.model.Segment;
import com.shortspilot.orchestrator.model.SourceRange;
import com.shortspilot.orchestrator.model.WorkItem;
import com.shortspilot.orchestrator.notify.PipelineNotifier;
import com.shortspilot.orchestrator.quota.QuotaLedger;
import com.shortspilot.orchestrator.stage.FetchStage;
import com.shortspilot.orchestrator.stage.FetchedSource;
import com.shortspilot.orchestrator.stage.PublishMetadata;
import com.shortspilot.orchestrator.stage.PublishRequest;
import com.shortspilot.orchestrator.stage.PublishStage;
import com.shortspilot.orchestrator.stage.Stage;
import com.shortspilot.orchestrator.stage.StageException;
import com.shortspilot.orchestrator.stage.StageInvoker;
import com.shortspilot.orchestrator.stage.TransformRequest;
import com.shortspilot.orchestrator.stage.TransformStage;
import com.shortspilot.orchestrator.store.StaleWriteException;
import com.shortspilot.orchestrator.store.StoreCorruptException;
import com.shortspilot.orchestrator.store.StoreUnavailableException;
import com.shortspilot.orchestrator.store.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Decides which work item to advance on each invocation and drives it
 * through the stage executors.
 *
 * One run:
 *   1. Load every item from the tracking store.
 *   2. Partition into fetch (DISCOVERED), transform (FETCHED) and publish
 *      (TRANSFORMED) sets, each ordered by {@link PriorityOrder}.
 *   3. Fetch, then transform, one item at a time. These stages cost no quota.
 *   4. Publish pending segments in index order. Each segment needs a quota
 *      reservation first; the first denial ends all publish work for the run
 *      so a large high-priority item is never overtaken by cheaper ones.
 *   5. Commit after every single change. A published segment is committed
 *      together with its quota debit, and with the COMPLETED transition
 *      when it was the last one.
 *
 * At most {@code maxItems} stage attempts are made per run. Items are
 * processed strictly one after another; no lock is held while a stage runs.
 *
 * The run has no "first run" or "resume" mode: whatever the store says is
 * the starting point, which is also how a crashed run is recovered.
 */
@Service
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    // Allowed drift between a planned range and the one the transform stage reports.
    private static final double RANGE_TOLERANCE_SECONDS = 0.5;

    private final TrackingStore            store;
    private final QuotaLedger              ledger;
    private final StageInvoker             invoker;
    private final FetchStage               fetchStage;
    private final TransformStage           transformStage;
    private final PublishStage             publishStage;
    private final SegmentPlanner           planner;
    private final PublishMetadataFormatter metadataFormatter;
    private final PipelineNotifier         notifier;
    private final long                     publishCost;
    private final int                      retryCeiling;

    public PipelineScheduler(TrackingStore store,
                             QuotaLedger ledger,
                             StageInvoker invoker,
                             FetchStage fetchStage,
                             TransformStage transformStage,
                             PublishStage publishStage,
                             SegmentPlanner planner,
                             PublishMetadataFormatter metadataFormatter,
                             PipelineNotifier notifier,
                             PipelineProperties props) {
        this.store             = store;
        this.ledger            = ledger;
        this.invoker           = invoker;
        this.fetchStage        = fetchStage;
        this.transformStage    = transformStage;
        this.publishStage      = publishStage;
        this.planner           = planner;
        this.metadataFormatter = metadataFormatter;
        this.notifier          = notifier;
        this.publishCost       = props.publishCost();
        this.retryCeiling      = props.retryCeiling();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public RunSummary runOnce(int maxItems) {
        if (maxItems <= 0) throw new IllegalArgumentException("maxItems must be > 0");

        MDC.put("runId", UUID.randomUUID().toString().substring(0, 8));
        try {
            Map<String, WorkItem> items;
            try {
                items = store.load();
            } catch (StoreCorruptException | StoreUnavailableException e) {
                log.error("Cannot load tracking store, aborting run: {}", e.getMessage(), e);
                return RunSummary.fatal();
            }
            if (!store.corruptRecordIds().isEmpty()) {
                log.warn("Skipping {} unreadable record(s): {}",
                        store.corruptRecordIds().size(), store.corruptRecordIds());
            }

            List<WorkItem> toFetch     = eligible(items, ItemStatus.DISCOVERED);
            List<WorkItem> toTransform = eligible(items, ItemStatus.FETCHED);
            List<WorkItem> toPublish   = eligible(items, ItemStatus.TRANSFORMED);

            RunState run = new RunState(maxItems,
                    toFetch.size() + toTransform.size() + toPublish.size());
            if (run.eligible == 0) {
                log.info("Nothing eligible ({} item(s) tracked)", items.size());
                return RunSummary.nothingEligible();
            }
            log.info("Run started: fetch={} transform={} publish={} maxItems={}",
                    toFetch.size(), toTransform.size(), toPublish.size(), maxItems);

            try {
                for (WorkItem item : toFetch) {
                    if (!run.hasBudget()) break;
                    withItemContext(item, Stage.FETCH, () -> fetch(run, item));
                }
                for (WorkItem item : toTransform) {
                    if (!run.hasBudget()) break;
                    withItemContext(item, Stage.TRANSFORM, () -> transform(run, item));
                }
                for (WorkItem item : toPublish) {
                    if (!run.hasBudget() || run.quotaExhausted) break;
                    withItemContext(item, Stage.PUBLISH, () -> publish(run, item));
                }
            } catch (StoreCorruptException | StoreUnavailableException e) {
                store.discard();
                log.error("Tracking store failed mid-run, aborting: {}", e.getMessage(), e);
                return RunSummary.fatal();
            }

            RunSummary summary = run.summary();
            log.info("Run finished: advanced={} failed={} skipped={} quotaExhausted={} quota={}",
                    summary.advanced(), summary.failed(), summary.skipped(),
                    summary.quotaExhausted(), ledger.currentUsage());
            return summary;
        } finally {
            MDC.remove("runId");
        }
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private void fetch(RunState run, WorkItem item) {
        run.attempts++;
        try {
            FetchedSource source = invoker.invoke(fetchStage, item);
            if (source.artifactRef() == null || source.artifactRef().isBlank()) {
                throw StageException.permanentFailure("fetch returned no artifact");
            }
            if (!(source.durationSeconds() > 0)) {
                throw StageException.permanentFailure(
                        "source has no playable duration (" + source.durationSeconds() + "s)");
            }
            item.markFetched(source.artifactRef(), source.durationSeconds());
            item.resetRetries();
            if (commit(run, item)) {
                run.advanced++;
                log.info("Fetched item {} ({}s)", item.getId(), source.durationSeconds());
            }
        } catch (StageException e) {
            recordFailure(run, item, Stage.FETCH, e);
        }
    }

    private void transform(RunState run, WorkItem item) {
        run.attempts++;
        try {
            List<SourceRange> plan = planner.plan(item.getSourceDurationSeconds());
            if (plan.isEmpty()) {
                throw StageException.permanentFailure(
                        "source of " + item.getSourceDurationSeconds() + "s is too short for one segment");
            }
            List<Segment> produced = invoker.invoke(transformStage, new TransformRequest(item, plan));
            validateSegments(plan, produced);

            item.markTransformed(produced);
            item.resetRetries();
            if (commit(run, item)) {
                run.advanced++;
                log.info("Transformed item {} into {} segment(s)", item.getId(), produced.size());
            }
        } catch (StageException e) {
            recordFailure(run, item, Stage.TRANSFORM, e);
        }
    }

    private void publish(RunState run, WorkItem item) {
        if (item.getSegments().isEmpty()) {
            recordFailure(run, item, Stage.PUBLISH,
                    StageException.permanentFailure("item is TRANSFORMED but has no segments"));
            return;
        }
        if (item.allSegmentsPublished()) {
            // Only reachable for records written before completion was committed atomically.
            item.advanceTo(ItemStatus.COMPLETED);
            if (commit(run, item)) notifier.itemCompleted(item);
            return;
        }

        for (Segment segment : item.pendingSegments()) {
            if (!run.hasBudget()) return;

            if (!ledger.tryReserve(publishCost)) {
                run.quotaExhausted = true;
                log.info("Daily quota exhausted at item {} segment {}; publish work stops for this run",
                        item.getId(), segment.index());
                return;
            }
            try {
                store.verifyCurrent(item);
            } catch (StaleWriteException e) {
                skipStale(run, item, e);
                return;
            }

            run.attempts++;
            String remoteId;
            try {
                PublishMetadata metadata = metadataFormatter.format(item, segment);
                remoteId = invoker.invoke(publishStage, new PublishRequest(item, segment, metadata));
            } catch (StageException e) {
                ledger.release(publishCost);
                recordFailure(run, item, Stage.PUBLISH, e);
                return;
            }

            item.recordPublished(segment.index(), remoteId);
            item.resetRetries();
            boolean completed = item.allSegmentsPublished();
            if (completed) {
                item.advanceTo(ItemStatus.COMPLETED);
            }
            if (!commit(run, item)) {
                log.error("Item {} segment {} was published as {} but the record changed underneath; "
                        + "reconcile manually", item.getId(), segment.index(), remoteId);
                return;
            }

            run.advanced++;
            log.info("Published item {} segment {}/{} as {}",
                    item.getId(), segment.index(), item.getSegments().size(), remoteId);
            notifier.segmentPublished(item, segment.index(), remoteId);
            if (completed) {
                notifier.itemCompleted(item);
            }
        }
    }

    // ------------------------------------------------------------------
    // Failure handling and commits
    // ------------------------------------------------------------------

    /**
     * PERMANENT → FAILED now. TRANSIENT → count it; FAILED once the count
     * goes past the retry ceiling, otherwise the item stays where it is and
     * is retried on a later invocation.
     */
    private void recordFailure(RunState run, WorkItem item, Stage stage, StageException e) {
        run.failed++;
        String error = stage + ": " + e.getMessage();
        if (e.isPermanent()) {
            item.fail(error);
        } else {
            item.recordFailure(error);
            if (item.getRetryCount() > retryCeiling) {
                item.fail(error + " (gave up after " + item.getRetryCount() + " attempts)");
            }
        }

        if (item.getStatus() == ItemStatus.FAILED) {
            log.error("Item {} FAILED in {}: {}", item.getId(), stage, e.getMessage());
        } else {
            log.warn("Item {} {} failed (attempt {}/{}), will retry next run: {}",
                    item.getId(), stage, item.getRetryCount(), retryCeiling + 1, e.getMessage());
        }

        if (commit(run, item) && item.getStatus() == ItemStatus.FAILED) {
            notifier.itemFailed(item);
        }
    }

    /** Upsert and commit one item. False if another writer got there first. */
    private boolean commit(RunState run, WorkItem item) {
        try {
            store.upsert(item);
            store.commit();
            return true;
        } catch (StaleWriteException e) {
            skipStale(run, item, e);
            return false;
        }
    }

    private void skipStale(RunState run, WorkItem item, StaleWriteException e) {
        store.discard();
        run.skipped++;
        log.warn("Item {} was changed by another invocation, skipping it for this run: {}",
                item.getId(), e.getMessage());
    }

    /**
     * The transform stage must return exactly one segment per planned range,
     * indexed 1..n, each covering its planned range and carrying an artifact handle.
     */
    private static void validateSegments(List<SourceRange> plan, List<Segment> produced) {
        if (produced.size() != plan.size()) {
            throw StageException.permanentFailure(
                    "transform returned " + produced.size() + " segment(s) for " + plan.size() + " planned");
        }
        List<Segment> ordered = produced.stream()
                .sorted(Comparator.comparingInt(Segment::index))
                .toList();
        for (int i = 0; i < ordered.size(); i++) {
            Segment s = ordered.get(i);
            if (s.index() != i + 1) {
                throw StageException.permanentFailure(
                        "transform returned non-contiguous segment index " + s.index());
            }
            if (s.localArtifactRef() == null || s.localArtifactRef().isBlank()) {
                throw StageException.permanentFailure("segment " + s.index() + " has no artifact");
            }
            SourceRange planned = plan.get(i);
            SourceRange actual  = s.sourceRange();
            if (Math.abs(actual.startSeconds() - planned.startSeconds()) > RANGE_TOLERANCE_SECONDS
                    || Math.abs(actual.durationSeconds() - planned.durationSeconds()) > RANGE_TOLERANCE_SECONDS) {
                throw StageException.permanentFailure(String.format(
                        "segment %d covers %.1fs+%.1fs but %.1fs+%.1fs was planned", s.index(),
                        actual.startSeconds(), actual.durationSeconds(),
                        planned.startSeconds(), planned.durationSeconds()));
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<WorkItem> eligible(Map<String, WorkItem> items, ItemStatus status) {
        return items.values().stream()
                .filter(i -> i.getStatus() == status)
                .sorted(PriorityOrder.COMPARATOR)
                .toList();
    }

    private static void withItemContext(WorkItem item, Stage stage, Runnable action) {
        MDC.put("itemId", item.getId());
        MDC.put("stage",  stage.name());
        try {
            action.run();
        } finally {
            MDC.remove("itemId");
            MDC.remove("stage");
        }
    }

    /** Counters for one run. */
    private static final class RunState {
        final int maxItems;
        final int eligible;
        int       attempts;
        int       advanced;
        int       failed;
        int       skipped;
        boolean   quotaExhausted;

        RunState(int maxItems, int eligible) {
            this.maxItems = maxItems;
            this.eligible = eligible;
        }

        boolean hasBudget() { return attempts < maxItems; }

        RunSummary summary() {
            RunOutcome outcome = (advanced + failed) > 0
                    ? RunOutcome.WORK_ADVANCED
                    : RunOutcome.NOTHING_ELIGIBLE;
            return new RunSummary(eligible, advanced, failed, skipped, quotaExhausted, outcome);
        }
    }
}
