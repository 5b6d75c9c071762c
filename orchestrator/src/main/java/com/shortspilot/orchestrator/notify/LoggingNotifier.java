package com.shortspilot.orchestrator.notify;

import com.shortspilot.orchestrator.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default notifier: events go to the application log only. */
public class LoggingNotifier implements PipelineNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void segmentPublished(WorkItem item, int segmentIndex, String remoteId) {
        log.info("Published '{}' part {}/{} as {}",
                item.getTitle(), segmentIndex, item.getSegments().size(), remoteId);
    }

    @Override
    public void itemCompleted(WorkItem item) {
        log.info("Item {} completed: {} segment(s) published", item.getId(), item.getPublishedRefs().size());
    }

    @Override
    public void itemFailed(WorkItem item) {
        log.warn("Item {} failed: {}", item.getId(), item.getLastError());
    }

    @Override
    public void queueDrained() {
        log.info("No eligible work left");
    }
}
