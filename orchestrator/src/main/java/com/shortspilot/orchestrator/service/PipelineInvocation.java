package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.config.PipelineProperties;
import com.shortspilot.orchestrator.discovery.DiscoveryService;
import com.shortspilot.orchestrator.notify.PipelineNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One pipeline invocation: discovery (optional), then a scheduler run.
 *
 * Every trigger goes through here: the one-shot runner, the fixed-delay
 * timer and {@code POST /runs}. Overlapping calls inside this process are
 * turned away instead of queued; overlaps with other processes are handled
 * by the tracking store's version checks.
 */
@Service
public class PipelineInvocation {

    private static final Logger log = LoggerFactory.getLogger(PipelineInvocation.class);

    private final ReentrantLock running = new ReentrantLock();

    private final DiscoveryService  discovery;
    private final PipelineScheduler scheduler;
    private final PipelineNotifier  notifier;
    private final int               maxItemsPerRun;
    private final boolean           discoveryEnabled;

    public PipelineInvocation(DiscoveryService discovery,
                              PipelineScheduler scheduler,
                              PipelineNotifier notifier,
                              PipelineProperties props,
                              @Value("${shortspilot.discovery.enabled:true}") boolean discoveryEnabled) {
        this.discovery        = discovery;
        this.scheduler        = scheduler;
        this.notifier         = notifier;
        this.maxItemsPerRun   = props.maxItemsPerRun();
        this.discoveryEnabled = discoveryEnabled;
    }

    public RunSummary invoke() {
        if (!running.tryLock()) {
            log.info("Previous invocation still running, skipped");
            return RunSummary.nothingEligible();
        }
        try {
            if (discoveryEnabled) {
                try {
                    discovery.ingest();
                } catch (RuntimeException e) {
                    // Known items can still make progress.
                    log.warn("Discovery failed, continuing with tracked items: {}", e.getMessage(), e);
                }
            }

            RunSummary summary = scheduler.runOnce(maxItemsPerRun);
            if (summary.outcome() == RunOutcome.NOTHING_ELIGIBLE && summary.eligible() == 0) {
                notifier.queueDrained();
            }
            return summary;
        } finally {
            running.unlock();
        }
    }
}
