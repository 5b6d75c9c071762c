package com.shortspilot.orchestrator.notify;

import com.shortspilot.orchestrator.model.WorkItem;

/**
 * Operator-facing pipeline events.
 *
 * Implementations must not throw: a notification problem never fails a run.
 */
public interface PipelineNotifier {

    void segmentPublished(WorkItem item, int segmentIndex, String remoteId);

    void itemCompleted(WorkItem item);

    void itemFailed(WorkItem item);

    /** Nothing was eligible for any stage on this invocation. */
    void queueDrained();
}
